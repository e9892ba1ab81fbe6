package com.example.presence.delivery.dispatch;

import com.example.presence.delivery.retry.DeliveryAttemptExecutor;
import com.example.presence.delivery.retry.DeliveryRecordWriter;
import com.example.presence.shared.aspect.Monitored;
import com.example.presence.shared.exception.ResourceNotFoundException;
import com.example.presence.shared.model.NotificationDeliveryRecord;
import com.example.presence.shared.repository.NotificationDeliveryRepository;
import com.example.presence.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * First dispatch of a notification: creates the delivery record and makes attempt 0 right away.
 * Dispatching an id that already has a delivery record returns its current state and sends nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("dispatch")
public class NotificationDispatchService {

    private final DeliveryRecordWriter recordWriter;
    private final NotificationDeliveryRepository deliveryRepository;
    private final DeliveryAttemptExecutor attemptExecutor;
    private final Clock clock;

    /**
     * Blocking; call from a thread that may block.
     */
    public DispatchResponse dispatch(DispatchRequest request) {
        String notificationId = request.getNotificationId() == null || request.getNotificationId().isBlank()
                ? UUID.randomUUID().toString()
                : request.getNotificationId();
        OffsetDateTime now = OffsetDateTime.now(clock);

        boolean created = recordWriter.create(notificationId, request.getUserId(), request.getTitle(), request.getBody(),
                request.getType(), request.getExpiresAt(), request.getChannel().name(), JsonUtils.toJson(payloadOf(request)), now);
        if (!created) {
            log.info("Notification {} was already dispatched; returning its current state", notificationId);
            return toResponse(load(notificationId), true);
        }

        log.info("Dispatching notification {} to user {} over {}", notificationId, request.getUserId(), request.getChannel());
        attemptExecutor.attempt(load(notificationId));
        return toResponse(load(notificationId), false);
    }

    private NotificationDeliveryRecord load(String notificationId) {
        return deliveryRepository.findById(notificationId)
                .orElseThrow(() -> new ResourceNotFoundException("Delivery record not found for notification: " + notificationId));
    }

    private static Map<String, Object> payloadOf(DispatchRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", request.getTitle());
        payload.put("body", request.getBody());
        payload.put("type", request.getType());
        if (request.getData() != null) {
            payload.put("data", request.getData());
        }
        return payload;
    }

    private static DispatchResponse toResponse(NotificationDeliveryRecord record, boolean duplicate) {
        return DispatchResponse.builder()
                .notificationId(record.getNotificationId())
                .duplicate(duplicate)
                .state(record.getState())
                .attemptCount(record.getAttemptCount())
                .nextRetryAt(record.getNextRetryAt())
                .lastError(record.getLastError())
                .build();
    }
}
