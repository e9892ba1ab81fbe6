package com.example.presence.realtime.room;

import com.example.presence.realtime.protocol.ProtocolException;
import com.example.presence.realtime.protocol.SessionContext;
import com.example.presence.realtime.protocol.SessionReplier;
import com.example.presence.shared.model.ChannelConnection;
import com.example.presence.shared.service.registry.ConnectionRegistry;
import com.example.presence.shared.util.Constants.OutboundType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Join and leave over the registry. The requester is answered directly; the other
 * members hear about it from the change reactor once the mutation reaches the feed.
 */
@Service
@Slf4j
public class RoomCoordinator {

    private static final String DEFAULT_ROOM_TYPE = "general";

    private final ConnectionRegistry connectionRegistry;
    private final SessionReplier sessionReplier;
    private final Scheduler jdbcScheduler;

    public RoomCoordinator(ConnectionRegistry connectionRegistry,
                           SessionReplier sessionReplier,
                           @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.connectionRegistry = connectionRegistry;
        this.sessionReplier = sessionReplier;
        this.jdbcScheduler = jdbcScheduler;
    }

    /**
     * Joining while in another room switches rooms; rejoining the current room is allowed.
     */
    public Mono<Void> join(SessionContext session, String roomId, String roomType) {
        if (roomId == null || roomId.isBlank()) {
            return Mono.error(ProtocolException.badRequest("roomId is required for joinRoom"));
        }
        String effectiveType = roomType == null || roomType.isBlank() ? DEFAULT_ROOM_TYPE : roomType;
        return Mono.fromCallable(() -> connectionRegistry.setRoom(session.connectionId(), roomId, effectiveType))
                .subscribeOn(jdbcScheduler)
                .doOnNext(change -> {
                    if (change.roomChanged() && change.previousRoomId() != null) {
                        log.info("Connection {} switched from room {} to {}", session.connectionId(), change.previousRoomId(), roomId);
                    } else {
                        log.info("Connection {} joined room {}", session.connectionId(), roomId);
                    }
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("roomId", roomId);
                    data.put("roomType", effectiveType);
                    data.put("previousRoomId", change.roomChanged() ? change.previousRoomId() : null);
                    data.put("joinedAt", change.after().getRoomJoinedAt());
                    sessionReplier.reply(session.connectionId(), OutboundType.ROOM_JOINED, data);
                })
                .then();
    }

    /**
     * No-op when the connection is in no room.
     */
    public Mono<Void> leave(SessionContext session) {
        return Mono.fromCallable(() -> connectionRegistry.clearRoom(session.connectionId()))
                .subscribeOn(jdbcScheduler)
                .doOnNext(change -> {
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("roomId", change.previousRoomId());
                    data.put("left", !change.isNoOp());
                    if (!change.isNoOp()) {
                        log.info("Connection {} left room {}", session.connectionId(), change.previousRoomId());
                    }
                    sessionReplier.reply(session.connectionId(), OutboundType.ROOM_LEFT, data);
                })
                .then();
    }

    public List<ChannelConnection> members(String roomId) {
        return connectionRegistry.queryByRoom(roomId);
    }
}
