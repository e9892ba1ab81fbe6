package com.example.presence.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Published once per delivery record that exhausted its retries or outlived its window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetteredDelivery {
    private String notificationId;
    private String channel;
    private String recipient;
    private int attemptCount;
    private String reason;
    private OffsetDateTime firstDispatchedAt;
    private OffsetDateTime deadLetteredAt;
    private String payload;
}
