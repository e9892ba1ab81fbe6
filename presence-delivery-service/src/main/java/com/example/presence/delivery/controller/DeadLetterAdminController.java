package com.example.presence.delivery.controller;

import com.example.presence.delivery.deadletter.DeadLetterService;
import com.example.presence.shared.dto.admin.RedriveAllResult;
import com.example.presence.shared.model.NotificationDeliveryRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/dead-letters")
@Slf4j
public class DeadLetterAdminController {

    private final DeadLetterService deadLetterService;
    private final Scheduler jdbcScheduler;

    public DeadLetterAdminController(DeadLetterService deadLetterService,
                                     @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.deadLetterService = deadLetterService;
        this.jdbcScheduler = jdbcScheduler;
    }

    @GetMapping
    public Mono<ResponseEntity<List<NotificationDeliveryRecord>>> getDeadLetters() {
        return Mono.fromCallable(deadLetterService::getDeadLetters)
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/redrive/{id}")
    public Mono<ResponseEntity<Void>> redrive(@PathVariable String id) {
        return Mono.fromRunnable(() -> deadLetterService.redrive(id))
                .subscribeOn(jdbcScheduler)
                .onErrorMap(IllegalArgumentException.class, e -> new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e))
                .then(Mono.just(ResponseEntity.ok().<Void>build()));
    }

    @PostMapping("/redrive-all")
    public Mono<ResponseEntity<RedriveAllResult>> redriveAll() {
        return Mono.fromCallable(deadLetterService::redriveAll)
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/purge/{id}")
    public Mono<ResponseEntity<Void>> purge(@PathVariable String id) {
        return Mono.fromRunnable(() -> deadLetterService.purge(id))
                .subscribeOn(jdbcScheduler)
                .onErrorMap(IllegalArgumentException.class, e -> new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @DeleteMapping("/purge-all")
    public Mono<ResponseEntity<Map<String, Integer>>> purgeAll() {
        return Mono.fromCallable(deadLetterService::purgeAll)
                .subscribeOn(jdbcScheduler)
                .map(purged -> {
                    log.info("Admin purge-all removed {} dead-lettered deliveries", purged);
                    return ResponseEntity.ok(Map.of("purged", purged));
                });
    }
}
