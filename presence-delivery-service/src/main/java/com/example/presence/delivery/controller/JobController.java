package com.example.presence.delivery.controller;

import com.example.presence.delivery.cleanup.CleanupService;
import com.example.presence.delivery.cleanup.CleanupTask;
import com.example.presence.delivery.retry.RetrySchedulerService;
import com.example.presence.shared.dto.JobRunResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Set;

/**
 * Manual triggers for the scheduled jobs. The status code mirrors the run outcome.
 */
@RestController
@RequestMapping("/api/jobs")
@Slf4j
public class JobController {

    private final RetrySchedulerService retrySchedulerService;
    private final CleanupService cleanupService;
    private final Scheduler jdbcScheduler;

    public JobController(RetrySchedulerService retrySchedulerService,
                         CleanupService cleanupService,
                         @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.retrySchedulerService = retrySchedulerService;
        this.cleanupService = cleanupService;
        this.jdbcScheduler = jdbcScheduler;
    }

    @PostMapping("/retry")
    public Mono<ResponseEntity<JobRunResult>> runRetry() {
        log.info("Manual retry run requested");
        return Mono.fromCallable(retrySchedulerService::run)
                .subscribeOn(jdbcScheduler)
                .map(result -> ResponseEntity.status(result.httpStatus()).body(result));
    }

    @PostMapping("/cleanup")
    public Mono<ResponseEntity<JobRunResult>> runCleanup(@RequestParam(defaultValue = "false") boolean dryRun,
                                                         @RequestParam(required = false) List<String> tasks) {
        Set<CleanupTask> selected = CleanupTask.parse(tasks);
        log.info("Manual cleanup run requested [dryRun={}, tasks={}]", dryRun, selected);
        return Mono.fromCallable(() -> cleanupService.run(dryRun, selected))
                .subscribeOn(jdbcScheduler)
                .map(result -> ResponseEntity.status(result.httpStatus()).body(result));
    }
}
