package com.example.presence.delivery.controller;

import com.example.presence.delivery.dispatch.DispatchRequest;
import com.example.presence.delivery.dispatch.DispatchResponse;
import com.example.presence.delivery.dispatch.NotificationDispatchService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private final NotificationDispatchService dispatchService;
    private final Scheduler jdbcScheduler;

    public NotificationController(NotificationDispatchService dispatchService,
                                  @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.dispatchService = dispatchService;
        this.jdbcScheduler = jdbcScheduler;
    }

    /**
     * 201 for a new notification, 200 when the id was already dispatched.
     */
    @PostMapping("/dispatch")
    public Mono<ResponseEntity<DispatchResponse>> dispatch(@Valid @RequestBody DispatchRequest request) {
        return Mono.fromCallable(() -> dispatchService.dispatch(request))
                .subscribeOn(jdbcScheduler)
                .map(response -> ResponseEntity.status(response.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED).body(response));
    }
}
