package com.example.presence.shared.dto;

import com.example.presence.shared.util.Constants.MutationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * One entry of the registry mutation feed. CREATED carries only {@code newImage},
 * REMOVED only {@code oldImage}, MODIFIED both.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistryMutationEvent {
    private String eventId;
    private MutationType type;
    private String connectionId;
    private String userId;
    private ConnectionSnapshot oldImage;
    private ConnectionSnapshot newImage;
    private OffsetDateTime occurredAt;
}
