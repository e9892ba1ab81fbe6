package com.example.presence.delivery.cleanup;

import com.example.presence.shared.aspect.Monitored;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.dto.JobRunResult;
import com.example.presence.shared.model.DailyDeliveryMetrics;
import com.example.presence.shared.model.NotificationDeliveryRecord;
import com.example.presence.shared.repository.DailyDeliveryMetricsRepository;
import com.example.presence.shared.repository.NotificationDeliveryRepository;
import com.example.presence.shared.repository.NotificationRepository;
import com.example.presence.shared.util.Batches;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.IntSupplier;

/**
 * Daily notification housekeeping and delivery rollups. Each task runs in isolation;
 * destructive writes go out in batches of {@code presence.cleanup.batch-size}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("cleanup")
public class CleanupService {

    static final String JOB_NAME = "notification-cleanup";

    private final NotificationRepository notificationRepository;
    private final NotificationDeliveryRepository deliveryRepository;
    private final DailyDeliveryMetricsRepository metricsRepository;
    private final AppProperties appProperties;
    private final Clock clock;

    @Scheduled(cron = "${presence.cleanup.cron:0 0 3 * * *}", zone = "UTC")
    @SchedulerLock(name = "notificationCleanup", lockAtMostFor = "PT15M")
    public void scheduledRun() {
        JobRunResult result = run(false, EnumSet.allOf(CleanupTask.class));
        log.info("Cleanup run finished with status {}: {}", result.httpStatus().value(), result.getDetails());
    }

    public JobRunResult run(boolean dryRun, Set<CleanupTask> tasks) {
        AppProperties.Cleanup cleanup = appProperties.getCleanup();
        log.info("Starting cleanup run [memoryClass={}, timeout={}, dryRun={}, tasks={}]",
                cleanup.getMemoryClass(), cleanup.getRunTimeout(), dryRun, tasks);
        Instant deadline = clock.instant().plus(cleanup.getRunTimeout());
        OffsetDateTime now = OffsetDateTime.now(clock);
        JobRunResult result = JobRunResult.builder().job(JOB_NAME).dryRun(dryRun).build();

        for (CleanupTask task : CleanupTask.values()) {
            if (!tasks.contains(task)) {
                continue;
            }
            if (!clock.instant().isBefore(deadline)) {
                log.warn("Cleanup run hit its {} deadline before {}", cleanup.getRunTimeout(), task);
                result.getDetails().put("deadlineReached", true);
                break;
            }
            switch (task) {
                case EXPIRE_NOTIFICATIONS:
                    runTask(result, task, () -> expireNotifications(now, dryRun));
                    break;
                case CLEANUP_OLD_NOTIFICATIONS:
                    runTask(result, task, () -> cleanupOldNotifications(now, dryRun));
                    break;
                case CLEANUP_DELIVERY_RECORDS:
                    runTask(result, task, () -> deleteDeliveryRecords(
                            deliveryRepository.findIdsLastActiveBefore(now.minus(cleanup.getDeliveryRecordRetention())), dryRun));
                    break;
                case AGGREGATE_METRICS:
                    runTask(result, task, () -> aggregateMetrics(now, dryRun));
                    break;
                case CLEANUP_ORPHANED_RECORDS:
                    runTask(result, task, () -> deleteDeliveryRecords(deliveryRepository.findOrphanedIds(), dryRun));
                    break;
            }
        }
        return result;
    }

    private int expireNotifications(OffsetDateTime now, boolean dryRun) {
        List<String> ids = notificationRepository.findIdsToExpire(now);
        if (!dryRun) {
            inBatches(ids, batch -> notificationRepository.markExpired(batch, now));
        }
        return ids.size();
    }

    private int cleanupOldNotifications(OffsetDateTime now, boolean dryRun) {
        AppProperties.Cleanup cleanup = appProperties.getCleanup();
        Set<String> ids = new LinkedHashSet<>(
                notificationRepository.findExpiredIdsBefore(now.minus(cleanup.getExpiredNotificationGrace())));
        ids.addAll(notificationRepository.findReadOrDismissedIdsBefore(now.minus(cleanup.getNotificationRetention())));
        if (!dryRun) {
            inBatches(new ArrayList<>(ids), notificationRepository::deleteAllById);
        }
        return ids.size();
    }

    private int deleteDeliveryRecords(List<String> ids, boolean dryRun) {
        if (!dryRun) {
            inBatches(ids, deliveryRepository::deleteAllById);
        }
        return ids.size();
    }

    /**
     * Rolls up the previous UTC day.
     */
    private int aggregateMetrics(OffsetDateTime now, boolean dryRun) {
        LocalDate day = now.withOffsetSameInstant(ZoneOffset.UTC).toLocalDate().minusDays(1);
        OffsetDateTime from = day.atStartOfDay().atOffset(ZoneOffset.UTC);
        List<NotificationDeliveryRecord> records = deliveryRepository.findActiveBetween(from, from.plusDays(1));
        DailyDeliveryMetrics metrics = DeliveryMetricsAggregator.aggregate(
                day, records, appProperties.getCleanup().getTopFailureReasons(), now);
        if (dryRun) {
            log.info("Dry run: metrics for {} computed but not stored: {}", day, metrics.getChannelStats());
        } else {
            metricsRepository.upsert(metrics.getMetricsDate(), metrics.getTotalNotifications(), metrics.getChannelStats(),
                    metrics.getAverageLatencyMs(), metrics.getTopFailureReasons(), metrics.getCalculatedAt());
        }
        return metrics.getTotalNotifications();
    }

    private void inBatches(List<String> ids, Consumer<List<String>> batchOperation) {
        for (List<String> batch : Batches.partition(ids, appProperties.getCleanup().getBatchSize())) {
            batchOperation.accept(batch);
        }
    }

    private void runTask(JobRunResult result, CleanupTask task, IntSupplier body) {
        try {
            int count = body.getAsInt();
            result.getDetails().put(task.name(), count);
            result.setProcessed(result.getProcessed() + count);
            result.setSucceeded(result.getSucceeded() + count);
            log.debug("Cleanup task {} handled {} records", task, count);
        } catch (Exception e) {
            log.error("Cleanup task {} failed: {}", task, e.getMessage(), e);
            result.setFailed(result.getFailed() + 1);
            result.getErrors().add(task.name() + ": " + e.getMessage());
        }
    }
}
