package com.example.presence.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Latest status of a long-running resource. Identity is (resourceType, resourceId),
 * flattened into {@code statusKey} for the primary key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("live_status_records")
public class LiveStatusRecord {
    @Id
    private String statusKey;
    private String resourceType;
    private String resourceId;
    private String status;
    private Integer progress;
    private String metadata; // JSON
    private String updatedBy;
    private OffsetDateTime updatedAt;
    private OffsetDateTime expiresAt;

    public static String keyOf(String resourceType, String resourceId) {
        return resourceType + ":" + resourceId;
    }
}
