package com.example.presence.delivery.retry;

import com.example.presence.shared.aspect.Monitored;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.dto.JobRunResult;
import com.example.presence.shared.model.NotificationDeliveryRecord;
import com.example.presence.shared.repository.NotificationDeliveryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Periodic redelivery of due pending records. One record's failure never aborts the run;
 * at the run deadline no new records are picked and the rest stay due for the next run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("retry-scheduler")
public class RetrySchedulerService {

    static final String JOB_NAME = "notification-retry";

    private final NotificationDeliveryRepository deliveryRepository;
    private final DeliveryAttemptExecutor attemptExecutor;
    private final AppProperties appProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${presence.retry.interval-ms:1800000}", initialDelay = 60000)
    @SchedulerLock(name = "notificationRetry", lockAtMostFor = "PT5M")
    public void scheduledRun() {
        JobRunResult result = run();
        log.info("Retry run finished with status {}: processed={}, succeeded={}, failed={}, errors={}",
                result.httpStatus().value(), result.getProcessed(), result.getSucceeded(), result.getFailed(), result.getErrors().size());
    }

    public JobRunResult run() {
        AppProperties.Retry retry = appProperties.getRetry();
        log.info("Starting retry run [memoryClass={}, timeout={}]", retry.getMemoryClass(), retry.getRunTimeout());
        Instant deadline = clock.instant().plus(retry.getRunTimeout());
        JobRunResult result = JobRunResult.builder().job(JOB_NAME).build();
        int retried = 0;
        int deadLettered = 0;
        int skipped = 0;
        boolean deadlineReached = false;
        Set<String> seen = new HashSet<>();

        try {
            while (!deadlineReached) {
                List<NotificationDeliveryRecord> due = deliveryRepository.findDue(OffsetDateTime.now(clock), retry.getBatchSize());
                List<NotificationDeliveryRecord> fresh = due.stream()
                        .filter(record -> seen.add(record.getNotificationId()))
                        .toList();
                if (fresh.isEmpty()) {
                    break;
                }
                for (NotificationDeliveryRecord record : fresh) {
                    if (!clock.instant().isBefore(deadline)) {
                        deadlineReached = true;
                        break;
                    }
                    result.setProcessed(result.getProcessed() + 1);
                    try {
                        Transition transition = attemptExecutor.attempt(record);
                        if (transition == null) {
                            skipped++;
                            continue;
                        }
                        switch (transition.kind()) {
                            case DELIVERED:
                                result.setSucceeded(result.getSucceeded() + 1);
                                break;
                            case RETRY:
                                retried++;
                                result.setFailed(result.getFailed() + 1);
                                break;
                            case DEAD_LETTER:
                                deadLettered++;
                                result.setFailed(result.getFailed() + 1);
                                break;
                            default:
                                result.setFailed(result.getFailed() + 1);
                        }
                    } catch (Exception e) {
                        log.error("Retry of delivery {} failed unexpectedly: {}", record.getNotificationId(), e.getMessage(), e);
                        result.setFailed(result.getFailed() + 1);
                        result.getErrors().add(record.getNotificationId() + ": " + e.getMessage());
                    }
                }
                if (due.size() < retry.getBatchSize()) {
                    break;
                }
            }
        } catch (Exception e) {
            log.error("Retry run aborted: {}", e.getMessage(), e);
            result.setFatal(true);
            result.getErrors().add("run aborted: " + e.getMessage());
        }

        result.getDetails().put("retried", retried);
        result.getDetails().put("deadLettered", deadLettered);
        result.getDetails().put("skipped", skipped);
        result.getDetails().put("deadlineReached", deadlineReached);
        if (deadlineReached) {
            log.warn("Retry run hit its {} deadline; remaining records stay due", retry.getRunTimeout());
        }
        return result;
    }
}
