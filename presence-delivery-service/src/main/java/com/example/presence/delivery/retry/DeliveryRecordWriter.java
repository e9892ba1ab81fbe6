package com.example.presence.delivery.retry;

import com.example.presence.shared.model.NotificationDeliveryRecord;
import com.example.presence.shared.repository.NotificationDeliveryRepository;
import com.example.presence.shared.repository.NotificationRepository;
import com.example.presence.shared.util.Constants.NotificationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;

/**
 * Writes delivery transitions together with the parent notification's status.
 * Every write is conditional, so a stale or repeated transition changes nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryRecordWriter {

    private final NotificationDeliveryRepository deliveryRepository;
    private final NotificationRepository notificationRepository;

    /**
     * @return true if the record was still in the expected state and the transition was applied
     */
    @Transactional
    public boolean apply(NotificationDeliveryRecord record, Transition transition, OffsetDateTime now) {
        String id = record.getNotificationId();
        int updated;
        switch (transition.kind()) {
            case DELIVERED:
                updated = deliveryRepository.markDelivered(id, transition.expectedAttempts(), now);
                if (updated > 0) {
                    notificationRepository.updateStatusIfOpen(id, NotificationStatus.DELIVERED.name(), now);
                }
                break;
            case RETRY:
                updated = deliveryRepository.markRetry(id, transition.expectedAttempts(), transition.nextRetryAt(), transition.reason(), now);
                break;
            case DEAD_LETTER:
                updated = deliveryRepository.markDeadLettered(id, transition.expectedAttempts(), transition.newAttemptCount(), transition.reason(), now);
                if (updated > 0) {
                    notificationRepository.updateStatusIfOpen(id, NotificationStatus.FAILED.name(), now);
                }
                break;
            case FAILED:
                updated = deliveryRepository.markFailed(id, transition.expectedAttempts(), transition.reason(), now);
                if (updated > 0) {
                    notificationRepository.updateStatusIfOpen(id, NotificationStatus.FAILED.name(), now);
                }
                break;
            default:
                throw new IllegalStateException("Unhandled transition " + transition.kind());
        }
        if (updated == 0) {
            log.info("Skipped {} for delivery {}: record no longer PENDING at attempt {}",
                    transition.kind(), id, transition.expectedAttempts());
            return false;
        }
        return true;
    }

    /**
     * Creates the notification and its delivery record. Returns false if the delivery record already existed.
     */
    @Transactional
    public boolean create(String notificationId, String userId, String title, String body, String type,
                          OffsetDateTime expiresAt, String channel, String payload, OffsetDateTime now) {
        notificationRepository.insertIfAbsent(notificationId, userId, title, body, type, expiresAt, now);
        return deliveryRepository.insertIfAbsent(notificationId, channel, userId, payload, now) > 0;
    }
}
