package com.example.presence.shared.service.outbox;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.dto.RegistryMutationEvent;
import com.example.presence.shared.model.RegistryOutboxEvent;
import com.example.presence.shared.repository.RegistryOutboxRepository;
import com.example.presence.shared.util.JsonUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;

/**
 * Publishes queued registry mutations to the mutation feed, keyed by user id.
 * Runs in whichever service instance holds the lock; a single publisher keeps the feed in commit order.
 */
@Service
@Slf4j
public class RegistryOutboxPoller {

    private final RegistryOutboxRepository outboxRepository;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final AppProperties appProperties;
    private final Counter publishedCounter;

    public RegistryOutboxPoller(RegistryOutboxRepository outboxRepository,
                                KafkaTemplate<String, Object> kafkaTemplate,
                                AppProperties appProperties,
                                MeterRegistry meterRegistry) {
        this.outboxRepository = outboxRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.appProperties = appProperties;
        this.publishedCounter = meterRegistry.counter("presence.outbox.published.total");
    }

    @Scheduled(fixedDelayString = "${presence.outbox.poll-interval-ms:1000}")
    @SchedulerLock(name = "registryOutboxPoller", lockAtMostFor = "PT1M")
    @Transactional
    public void pollAndPublishEvents() {
        List<RegistryOutboxEvent> events = outboxRepository.findAndLockUnprocessedEvents(appProperties.getOutbox().getPollBatchSize());
        if (events.isEmpty()) {
            return;
        }
        log.trace("Found {} registry mutations in outbox to publish.", events.size());

        for (RegistryOutboxEvent event : events) {
            RegistryMutationEvent payload = JsonUtils.fromJson(event.getPayload(), RegistryMutationEvent.class);
            try {
                // Synchronous send: a failure rolls the batch back and it is retried on the next poll
                kafkaTemplate.send(event.getTopic(), event.getAggregateId(), payload).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while publishing outbox event " + event.getId(), e);
            } catch (ExecutionException e) {
                log.error("Failed to send outbox event {} to Kafka. The transaction will be rolled back.", event.getId(), e);
                throw new IllegalStateException("Kafka send failed for outbox event " + event.getId(), e);
            }
        }

        List<UUID> processedIds = events.stream().map(RegistryOutboxEvent::getId).toList();
        outboxRepository.deleteAllById(processedIds);
        publishedCounter.increment(processedIds.size());
        log.trace("Published and deleted {} registry mutations from outbox.", processedIds.size());
    }
}
