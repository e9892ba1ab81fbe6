package com.example.presence.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * A payload handed to the pod that holds the target socket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelayEnvelope {
    private String connectionId;
    private OutboundMessage payload;
    private String sourcePod;
    private OffsetDateTime sentAt;
}
