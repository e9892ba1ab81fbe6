package com.example.presence.shared.model;

import com.example.presence.shared.dto.ConnectionSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * One live real-time session. Room membership is the set of rows sharing a room id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("channel_connections")
public class ChannelConnection {
    @Id
    private String id;
    private String userId;
    private String roomId;
    private String roomType;
    private String podName; // instance holding the socket
    private String status; // CONNECTED, DISCONNECTING
    private OffsetDateTime connectedAt;
    private OffsetDateTime lastActivityAt;
    private OffsetDateTime expiresAt;
    private OffsetDateTime roomJoinedAt;
    private String metadata; // JSON

    public ConnectionSnapshot toSnapshot() {
        return ConnectionSnapshot.builder()
                .connectionId(id)
                .userId(userId)
                .roomId(roomId)
                .roomType(roomType)
                .podName(podName)
                .connectedAt(connectedAt)
                .roomJoinedAt(roomJoinedAt)
                .build();
    }
}
