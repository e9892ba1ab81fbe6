package com.example.presence.delivery.deadletter;

import com.example.presence.delivery.retry.Transition;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.dto.DeadLetteredDelivery;
import com.example.presence.shared.dto.admin.RedriveAllResult;
import com.example.presence.shared.dto.admin.RedriveFailureDetail;
import com.example.presence.shared.model.NotificationDeliveryRecord;
import com.example.presence.shared.repository.NotificationDeliveryRepository;
import com.example.presence.shared.repository.NotificationRepository;
import com.example.presence.shared.util.Constants.DeliveryState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Dead-lettered delivery records: publication to the dead-letter topic and the admin
 * operations over them. The table is the source of truth; the topic is a notification feed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeadLetterService {

    private final NotificationDeliveryRepository deliveryRepository;
    private final NotificationRepository notificationRepository;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final AppProperties appProperties;
    private final Clock clock;

    /**
     * Fire-and-forget: a failed publish is logged, the record stays dead-lettered in the table.
     */
    public void publish(NotificationDeliveryRecord record, Transition transition, OffsetDateTime deadLetteredAt) {
        DeadLetteredDelivery event = DeadLetteredDelivery.builder()
                .notificationId(record.getNotificationId())
                .channel(record.getChannel())
                .recipient(record.getRecipient())
                .attemptCount(transition.newAttemptCount())
                .reason(transition.reason())
                .firstDispatchedAt(record.getFirstDispatchedAt())
                .deadLetteredAt(deadLetteredAt)
                .payload(record.getPayload())
                .build();
        String topic = appProperties.getKafka().getTopic().getNameDeliveryDeadLetter();
        kafkaTemplate.send(topic, record.getNotificationId(), event)
                .whenComplete((result, e) -> {
                    if (e != null) {
                        log.error("Failed to publish dead-lettered delivery {} to {}: {}", record.getNotificationId(), topic, e.getMessage());
                    } else {
                        log.debug("Published dead-lettered delivery {} to {}", record.getNotificationId(), topic);
                    }
                });
    }

    public List<NotificationDeliveryRecord> getDeadLetters() {
        return deliveryRepository.findByState(DeliveryState.DEAD_LETTERED.name());
    }

    /**
     * Back to PENDING at attempt 0 with a fresh delivery window; the next retry run picks it up.
     *
     * @throws IllegalArgumentException if no dead-lettered record has this id
     */
    @Transactional
    public void redrive(String notificationId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (deliveryRepository.redrive(notificationId, now) == 0) {
            throw new IllegalArgumentException("No dead-lettered delivery found with ID: " + notificationId);
        }
        notificationRepository.reopenFailed(notificationId, now);
        log.info("Redriven dead-lettered delivery {}", notificationId);
    }

    public RedriveAllResult redriveAll() {
        List<NotificationDeliveryRecord> deadLetters = getDeadLetters();
        if (deadLetters.isEmpty()) {
            log.info("No dead-lettered deliveries to redrive.");
            return RedriveAllResult.builder().totalRecords(0).successCount(0).failureCount(0).failures(new ArrayList<>()).build();
        }

        log.info("Attempting to redrive all {} dead-lettered deliveries.", deadLetters.size());
        int successCount = 0;
        List<RedriveFailureDetail> failures = new ArrayList<>();
        for (NotificationDeliveryRecord record : deadLetters) {
            try {
                redrive(record.getNotificationId());
                successCount++;
            } catch (Exception e) {
                failures.add(new RedriveFailureDetail(record.getNotificationId(), e.getMessage()));
                log.error("Failed to redrive delivery {}. Reason: {}", record.getNotificationId(), e.getMessage());
            }
        }
        log.info("Finished redriving dead-lettered deliveries. Success: {}, Failures: {}", successCount, failures.size());

        return RedriveAllResult.builder()
                .totalRecords(deadLetters.size())
                .successCount(successCount)
                .failureCount(failures.size())
                .failures(failures)
                .build();
    }

    /**
     * @throws IllegalArgumentException if no dead-lettered record has this id
     */
    public void purge(String notificationId) {
        if (deliveryRepository.deleteDeadLettered(notificationId) == 0) {
            throw new IllegalArgumentException("No dead-lettered delivery found with ID: " + notificationId);
        }
        log.info("Purged dead-lettered delivery {}", notificationId);
    }

    public int purgeAll() {
        int purged = 0;
        for (NotificationDeliveryRecord record : getDeadLetters()) {
            purged += deliveryRepository.deleteDeadLettered(record.getNotificationId());
        }
        log.info("Purged {} dead-lettered deliveries.", purged);
        return purged;
    }
}
