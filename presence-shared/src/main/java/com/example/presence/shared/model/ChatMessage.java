package com.example.presence.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Table;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("chat_messages")
public class ChatMessage implements Persistable<String> {
    @Id
    private String id;
    private String roomId;
    private String senderId;
    private String body;
    private String messageType;
    private String metadata; // JSON
    private OffsetDateTime createdAt;
    private OffsetDateTime expiresAt;

    @Override
    @Transient
    public boolean isNew() {
        // Messages are immutable, so every save is an insert
        return true;
    }
}
