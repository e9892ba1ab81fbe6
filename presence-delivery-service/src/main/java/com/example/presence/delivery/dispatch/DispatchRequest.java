package com.example.presence.delivery.dispatch;

import com.example.presence.shared.util.Constants.NotificationChannel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchRequest {
    // Generated when absent; a repeated id is treated as the same notification
    private String notificationId;
    @NotBlank(message = "userId is required")
    private String userId;
    @NotNull(message = "channel is required")
    private NotificationChannel channel;
    private String title;
    @NotBlank(message = "body is required")
    private String body;
    private String type;
    private OffsetDateTime expiresAt;
    private Map<String, Object> data;
}
