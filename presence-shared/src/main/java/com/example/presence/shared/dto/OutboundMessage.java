package com.example.presence.shared.dto;

import com.example.presence.shared.util.Constants.OutboundType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * The {@code {type, data}} envelope every client receives.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OutboundMessage {
    private String type;
    private Map<String, Object> data;

    public static OutboundMessage of(OutboundType type, Map<String, Object> data) {
        return new OutboundMessage(type.wireName(), data);
    }
}
