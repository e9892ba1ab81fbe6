package com.example.presence.shared.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Table;

/**
 * A registry mutation waiting to be published to the mutation feed.
 * Written in the same transaction as the registry change itself.
 */
@Data
@Builder
@Table("registry_outbox")
public class RegistryOutboxEvent implements Persistable<UUID> {
    @Id
    private UUID id;
    private String aggregateType;
    private String aggregateId; // user id, used as the Kafka key
    private String eventType; // CREATED, REMOVED, MODIFIED
    private String payload;
    private String topic;
    private OffsetDateTime createdAt;

    @Override
    @Transient
    public boolean isNew() {
        return true;
    }
}
