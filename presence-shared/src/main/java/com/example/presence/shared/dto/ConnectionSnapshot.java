package com.example.presence.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Image of a channel connection row carried on the mutation feed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionSnapshot {
    private String connectionId;
    private String userId;
    private String roomId;
    private String roomType;
    private String podName;
    private OffsetDateTime connectedAt;
    private OffsetDateTime roomJoinedAt;
}
