package com.example.presence.delivery.dispatch;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchResponse {
    private String notificationId;
    private boolean duplicate;
    private String state;
    private int attemptCount;
    private OffsetDateTime nextRetryAt;
    private String lastError;
}
