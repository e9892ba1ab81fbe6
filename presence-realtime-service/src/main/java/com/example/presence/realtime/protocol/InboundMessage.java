package com.example.presence.realtime.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Client-to-server frame. Which fields matter depends on {@code action}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundMessage {
    private String action;

    // joinRoom / sendMessage
    private String roomId;
    private String roomType;
    private String message;
    private String messageType;
    private Map<String, Object> metadata;

    // updateStatus
    private String resourceType;
    private String resourceId;
    private String status;
    private Integer progress;
    private List<String> recipientUserIds;
    private List<String> roomIds;
}
