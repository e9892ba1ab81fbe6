package com.example.presence.realtime.protocol;

import com.example.presence.realtime.chat.ChatService;
import com.example.presence.realtime.room.RoomCoordinator;
import com.example.presence.realtime.status.LiveStatusService;
import com.example.presence.shared.exception.ConnectionNotFoundException;
import com.example.presence.shared.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Routes one inbound frame to its handler. Every failure is answered on the socket;
 * nothing here ever terminates the session.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProtocolDispatcher {

    private final ChatService chatService;
    private final RoomCoordinator roomCoordinator;
    private final LiveStatusService liveStatusService;
    private final SessionReplier sessionReplier;

    public Mono<Void> dispatch(SessionContext session, String frame) {
        return Mono.defer(() -> route(session, parse(frame)))
                .onErrorResume(ProtocolException.class, e -> {
                    log.debug("Rejected frame from connection {}: {}", session.connectionId(), e.getMessage());
                    sessionReplier.error(session.connectionId(), e);
                    return Mono.empty();
                })
                .onErrorResume(ConnectionNotFoundException.class, e -> {
                    log.warn("Frame from connection {} which is no longer registered", session.connectionId());
                    sessionReplier.error(session.connectionId(), new ProtocolException(404, "Not Found", e.getMessage()));
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    log.error("Failed to process frame from connection {}", session.connectionId(), e);
                    sessionReplier.error(session.connectionId(),
                            new ProtocolException(500, "Internal Server Error", "Failed to process message"));
                    return Mono.empty();
                });
    }

    private Mono<Void> route(SessionContext session, InboundMessage message) {
        InboundAction action = InboundAction.fromWire(message.getAction())
                .orElseThrow(() -> new ProtocolException(400, "Bad Request",
                        "Unknown action: " + message.getAction(), InboundAction.validActions()));

        log.debug("Connection {} -> {}", session.connectionId(), action.wireName());
        switch (action) {
            case SEND_MESSAGE:
                return chatService.send(session, message);
            case JOIN_ROOM:
                return roomCoordinator.join(session, message.getRoomId(), message.getRoomType());
            case LEAVE_ROOM:
                return roomCoordinator.leave(session);
            case UPDATE_STATUS:
                return liveStatusService.update(session, message);
            default:
                throw new IllegalStateException("Unhandled action " + action);
        }
    }

    private InboundMessage parse(String frame) {
        try {
            InboundMessage message = JsonUtils.mapper().readValue(frame, InboundMessage.class);
            if (message == null) {
                throw ProtocolException.badRequest("Empty message");
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new ProtocolException(400, "Bad Request", "Malformed message: expected a JSON object",
                    InboundAction.validActions());
        }
    }
}
