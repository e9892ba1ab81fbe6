package com.example.presence.realtime.retention;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.dto.JobRunResult;
import com.example.presence.shared.repository.ChatMessageRepository;
import com.example.presence.shared.repository.LiveStatusRepository;
import com.example.presence.shared.service.registry.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.function.IntSupplier;

/**
 * Hourly housekeeping of the realtime tables: passive connection expiry, then chat
 * and live status past their retention. A failing task does not stop the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetentionService {

    public static final String EXPIRE_CONNECTIONS = "EXPIRE_CONNECTIONS";
    static final String PURGE_CHAT_MESSAGES = "PURGE_CHAT_MESSAGES";
    static final String PURGE_LIVE_STATUS = "PURGE_LIVE_STATUS";

    private final ConnectionRegistry connectionRegistry;
    private final ChatMessageRepository chatMessageRepository;
    private final LiveStatusRepository liveStatusRepository;
    private final AppProperties appProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${presence.retention.interval-ms:3600000}", initialDelay = 60000)
    @SchedulerLock(name = "realtimeRetention", lockAtLeastFor = "PT1M", lockAtMostFor = "PT15M")
    public void scheduledRun() {
        JobRunResult result = run();
        log.info("Retention run finished with status {}: {}", result.httpStatus().value(), result.getDetails());
    }

    public JobRunResult run() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int batchSize = appProperties.getRetention().getBatchSize();
        JobRunResult result = JobRunResult.builder().job("retention").build();

        runTask(result, EXPIRE_CONNECTIONS, () -> drain(() -> connectionRegistry.expireStale(now, batchSize), batchSize));
        runTask(result, PURGE_CHAT_MESSAGES, () -> drain(() -> {
            List<String> ids = chatMessageRepository.findExpiredIds(now, batchSize);
            chatMessageRepository.deleteAllById(ids);
            return ids.size();
        }, batchSize));
        runTask(result, PURGE_LIVE_STATUS, () -> drain(() -> {
            List<String> keys = liveStatusRepository.findExpiredKeys(now, batchSize);
            liveStatusRepository.deleteAllById(keys);
            return keys.size();
        }, batchSize));
        return result;
    }

    private void runTask(JobRunResult result, String task, IntSupplier body) {
        try {
            int count = body.getAsInt();
            result.getDetails().put(task, count);
            result.setProcessed(result.getProcessed() + count);
            result.setSucceeded(result.getSucceeded() + count);
        } catch (Exception e) {
            log.error("Retention task {} failed: {}", task, e.getMessage(), e);
            result.getErrors().add(task + ": " + e.getMessage());
        }
    }

    /**
     * Repeats one batch until a batch comes back short.
     */
    private static int drain(IntSupplier batch, int batchSize) {
        int total = 0;
        int removed;
        do {
            removed = batch.getAsInt();
            total += removed;
        } while (removed >= batchSize);
        return total;
    }
}
