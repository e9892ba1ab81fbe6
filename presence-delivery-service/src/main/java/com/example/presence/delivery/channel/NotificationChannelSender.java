package com.example.presence.delivery.channel;

import com.example.presence.shared.model.NotificationDeliveryRecord;
import com.example.presence.shared.util.Constants.NotificationChannel;
import reactor.core.publisher.Mono;

/**
 * Delivers a notification over one channel. Implementations report a failed send
 * as {@link SendResult#failed(String)}; an error signal is treated the same way.
 */
public interface NotificationChannelSender {

    NotificationChannel channel();

    Mono<SendResult> send(NotificationDeliveryRecord record);
}
