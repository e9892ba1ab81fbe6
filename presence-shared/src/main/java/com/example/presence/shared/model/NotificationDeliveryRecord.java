package com.example.presence.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Delivery attempt tracking for one dispatched notification.
 * Terminal at DELIVERED, FAILED and DEAD_LETTERED.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("notification_deliveries")
public class NotificationDeliveryRecord {
    @Id
    private String notificationId;
    private String channel; // IN_APP, EMAIL, PUSH
    private String recipient;
    private int attemptCount;
    private String state; // PENDING, DELIVERED, FAILED, DEAD_LETTERED
    private OffsetDateTime nextRetryAt;
    private String lastError;
    private OffsetDateTime firstDispatchedAt;
    private OffsetDateTime lastAttemptAt;
    private OffsetDateTime deliveredAt;
    private OffsetDateTime deadLetteredAt;
    private String payload; // JSON
}
