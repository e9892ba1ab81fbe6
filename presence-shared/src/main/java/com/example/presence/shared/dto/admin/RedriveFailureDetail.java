package com.example.presence.shared.dto.admin;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class RedriveFailureDetail {
    private String notificationId;
    private String reason;
}
