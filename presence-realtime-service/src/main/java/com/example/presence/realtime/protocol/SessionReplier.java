package com.example.presence.realtime.protocol;

import com.example.presence.shared.dto.OutboundMessage;
import com.example.presence.shared.service.broadcast.DeliveryOutcome;
import com.example.presence.shared.service.broadcast.LocalSessionSinks;
import com.example.presence.shared.util.Constants.OutboundType;
import com.example.presence.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Direct replies to the socket that sent a frame. That socket is always attached to this pod.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionReplier {

    private final LocalSessionSinks localSessionSinks;

    public void reply(String connectionId, OutboundType type, Map<String, Object> data) {
        DeliveryOutcome outcome = localSessionSinks.emit(connectionId, JsonUtils.toJson(OutboundMessage.of(type, data)));
        if (outcome != DeliveryOutcome.DELIVERED) {
            log.debug("Reply {} to connection {} not delivered: {}", type.wireName(), connectionId, outcome);
        }
    }

    public void error(String connectionId, ProtocolException e) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", e.getStatus());
        data.put("error", e.getError());
        data.put("message", e.getMessage());
        if (e.getValidActions() != null) {
            data.put("validActions", e.getValidActions());
        }
        reply(connectionId, OutboundType.ERROR, data);
    }
}
