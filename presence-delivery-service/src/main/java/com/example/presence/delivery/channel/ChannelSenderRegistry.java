package com.example.presence.delivery.channel;

import com.example.presence.shared.util.Constants.NotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class ChannelSenderRegistry {

    private final Map<NotificationChannel, NotificationChannelSender> senders = new EnumMap<>(NotificationChannel.class);

    public ChannelSenderRegistry(List<NotificationChannelSender> senders) {
        for (NotificationChannelSender sender : senders) {
            NotificationChannelSender previous = this.senders.put(sender.channel(), sender);
            if (previous != null) {
                throw new IllegalStateException("Two senders registered for channel " + sender.channel());
            }
        }
        log.info("Notification channel senders: {}", this.senders.keySet());
    }

    /**
     * Unknown channel names resolve to no sender.
     */
    public Optional<NotificationChannelSender> senderFor(String channel) {
        try {
            return Optional.ofNullable(senders.get(NotificationChannel.valueOf(channel)));
        } catch (IllegalArgumentException | NullPointerException e) {
            return Optional.empty();
        }
    }
}
