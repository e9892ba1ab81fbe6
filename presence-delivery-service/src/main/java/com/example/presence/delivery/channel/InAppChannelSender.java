package com.example.presence.delivery.channel;

import com.example.presence.shared.dto.OutboundMessage;
import com.example.presence.shared.model.ChannelConnection;
import com.example.presence.shared.model.NotificationDeliveryRecord;
import com.example.presence.shared.service.broadcast.MessageBroadcaster;
import com.example.presence.shared.service.registry.ConnectionRegistry;
import com.example.presence.shared.util.Constants.NotificationChannel;
import com.example.presence.shared.util.Constants.OutboundType;
import com.example.presence.shared.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-app delivery to every live connection of the recipient. Delivered when at least one connection took it.
 */
@Component
@Slf4j
public class InAppChannelSender implements NotificationChannelSender {

    static final String NO_CONNECTION = "recipient has no live connection";
    static final String NOT_ACCEPTED = "no live connection accepted the notification";

    private final ConnectionRegistry connectionRegistry;
    private final MessageBroadcaster messageBroadcaster;
    private final Scheduler jdbcScheduler;

    public InAppChannelSender(ConnectionRegistry connectionRegistry,
                              MessageBroadcaster messageBroadcaster,
                              @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.connectionRegistry = connectionRegistry;
        this.messageBroadcaster = messageBroadcaster;
        this.jdbcScheduler = jdbcScheduler;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.IN_APP;
    }

    @Override
    public Mono<SendResult> send(NotificationDeliveryRecord record) {
        return Mono.fromCallable(() -> connectionRegistry.queryByUser(record.getRecipient()).stream()
                        .map(ChannelConnection::getId)
                        .toList())
                .subscribeOn(jdbcScheduler)
                .flatMap(targets -> {
                    if (targets.isEmpty()) {
                        return Mono.just(SendResult.failed(NO_CONNECTION));
                    }
                    return messageBroadcaster.broadcast(targets, OutboundMessage.of(OutboundType.NOTIFICATION, toPayload(record)))
                            .map(result -> {
                                log.debug("In-app notification {} reached {} of {} connections",
                                        record.getNotificationId(), result.deliveredCount(), result.size());
                                return result.deliveredCount() > 0 ? SendResult.ok() : SendResult.failed(NOT_ACCEPTED);
                            });
                });
    }

    private static Map<String, Object> toPayload(NotificationDeliveryRecord record) {
        Map<String, Object> data = new LinkedHashMap<>(JsonUtils.parseJsonObject(record.getPayload()));
        data.put("notificationId", record.getNotificationId());
        data.put("attempt", record.getAttemptCount());
        return data;
    }
}
