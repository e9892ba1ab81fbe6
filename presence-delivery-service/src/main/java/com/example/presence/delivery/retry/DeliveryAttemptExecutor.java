package com.example.presence.delivery.retry;

import com.example.presence.delivery.channel.ChannelSenderRegistry;
import com.example.presence.delivery.channel.NotificationChannelSender;
import com.example.presence.delivery.channel.SendResult;
import com.example.presence.delivery.deadletter.DeadLetterService;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.config.MonitoringConfig.PresenceMetricsCollector;
import com.example.presence.shared.model.NotificationDeliveryRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Makes one delivery attempt for a pending record and writes the resulting transition.
 */
@Component
@Slf4j
public class DeliveryAttemptExecutor {

    private final ChannelSenderRegistry channelSenderRegistry;
    private final DeliveryStateMachine stateMachine;
    private final DeliveryRecordWriter recordWriter;
    private final DeadLetterService deadLetterService;
    private final AppProperties appProperties;
    private final PresenceMetricsCollector metricsCollector;
    private final Clock clock;

    public DeliveryAttemptExecutor(ChannelSenderRegistry channelSenderRegistry,
                                   DeliveryStateMachine stateMachine,
                                   DeliveryRecordWriter recordWriter,
                                   DeadLetterService deadLetterService,
                                   AppProperties appProperties,
                                   PresenceMetricsCollector metricsCollector,
                                   Clock clock) {
        this.channelSenderRegistry = channelSenderRegistry;
        this.stateMachine = stateMachine;
        this.recordWriter = recordWriter;
        this.deadLetterService = deadLetterService;
        this.appProperties = appProperties;
        this.metricsCollector = metricsCollector;
        this.clock = clock;
    }

    /**
     * Blocks until the attempt settles or its timeout elapses.
     *
     * @return the transition that was applied, or null if the record had moved on in the meantime
     */
    public Transition attempt(NotificationDeliveryRecord record) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Transition transition = stateMachine.beforeAttempt(record, now);
        if (transition == null) {
            transition = send(record);
        }
        return applyAndPublish(record, transition);
    }

    private Transition send(NotificationDeliveryRecord record) {
        Optional<NotificationChannelSender> sender = channelSenderRegistry.senderFor(record.getChannel());
        if (sender.isEmpty()) {
            log.warn("No sender for channel {} of delivery {}", record.getChannel(), record.getNotificationId());
            return stateMachine.onMissingSender(record);
        }

        Duration timeout = appProperties.getRetry().getAttemptTimeout();
        SendResult result;
        try {
            result = sender.get().send(record)
                    .timeout(timeout)
                    .onErrorResume(e -> Mono.just(SendResult.failed(describe(e, timeout))))
                    .block();
        } catch (RuntimeException e) {
            result = SendResult.failed(describe(e, timeout));
        }
        if (result == null) {
            result = SendResult.failed("sender completed without a result");
        }

        OffsetDateTime completedAt = OffsetDateTime.now(clock);
        if (result.delivered()) {
            return stateMachine.onSuccess(record);
        }
        log.info("Delivery {} attempt {} over {} failed: {}", record.getNotificationId(), record.getAttemptCount(),
                record.getChannel(), result.error());
        return stateMachine.onFailure(record, result.error(), completedAt);
    }

    private Transition applyAndPublish(NotificationDeliveryRecord record, Transition transition) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!recordWriter.apply(record, transition, now)) {
            return null;
        }
        metricsCollector.incrementCounter("presence.delivery.transitions", "kind", transition.kind().name().toLowerCase(),
                "channel", String.valueOf(record.getChannel()));
        if (transition.kind() == Transition.Kind.DEAD_LETTER) {
            log.warn("Delivery {} dead-lettered after {} attempts: {}", record.getNotificationId(),
                    transition.newAttemptCount(), transition.reason());
            deadLetterService.publish(record, transition, now);
        }
        return transition;
    }

    private static String describe(Throwable e, Duration timeout) {
        if (e instanceof TimeoutException) {
            return "attempt timed out after " + timeout.toMillis() + " ms";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
