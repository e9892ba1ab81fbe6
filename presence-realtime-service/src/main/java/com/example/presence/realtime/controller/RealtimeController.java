package com.example.presence.realtime.controller;

import com.example.presence.realtime.room.RoomCoordinator;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.model.ChannelConnection;
import com.example.presence.shared.service.broadcast.LocalSessionSinks;
import com.example.presence.shared.service.registry.ConnectionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/realtime")
@Slf4j
public class RealtimeController {

    private final ConnectionRegistry connectionRegistry;
    private final LocalSessionSinks localSessionSinks;
    private final RoomCoordinator roomCoordinator;
    private final AppProperties appProperties;
    private final Clock clock;
    private final Scheduler jdbcScheduler;

    public RealtimeController(ConnectionRegistry connectionRegistry,
                              LocalSessionSinks localSessionSinks,
                              RoomCoordinator roomCoordinator,
                              AppProperties appProperties,
                              Clock clock,
                              @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.connectionRegistry = connectionRegistry;
        this.localSessionSinks = localSessionSinks;
        this.roomCoordinator = roomCoordinator;
        this.appProperties = appProperties;
        this.clock = clock;
        this.jdbcScheduler = jdbcScheduler;
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<Map<String, Object>>> getStats() {
        return Mono.fromCallable(() -> {
                    Map<String, Object> stats = new LinkedHashMap<>(connectionRegistry.stats());
                    stats.put("localSockets", localSessionSinks.size());
                    stats.put("podId", appProperties.getPodName());
                    stats.put("timestamp", OffsetDateTime.now(clock));
                    return ResponseEntity.ok(stats);
                })
                .subscribeOn(jdbcScheduler);
    }

    @GetMapping("/presence/{userId}")
    public Mono<ResponseEntity<Map<String, Object>>> getPresence(@PathVariable String userId) {
        return Mono.fromCallable(() -> {
                    List<ChannelConnection> connections = connectionRegistry.queryByUser(userId);
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("userId", userId);
                    body.put("online", !connections.isEmpty());
                    body.put("connections", connections.stream().map(ChannelConnection::toSnapshot).toList());
                    return ResponseEntity.ok(body);
                })
                .subscribeOn(jdbcScheduler);
    }

    @GetMapping("/rooms/{roomId}/members")
    public Mono<ResponseEntity<Map<String, Object>>> getRoomMembers(@PathVariable String roomId) {
        return Mono.fromCallable(() -> {
                    List<ChannelConnection> members = roomCoordinator.members(roomId);
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("roomId", roomId);
                    body.put("memberCount", members.size());
                    body.put("members", members.stream().map(ChannelConnection::toSnapshot).toList());
                    return ResponseEntity.ok(body);
                })
                .subscribeOn(jdbcScheduler);
    }

    /**
     * Always answers 200; cleanup problems are logged only.
     */
    @PostMapping("/disconnect")
    public Mono<ResponseEntity<String>> disconnect(@RequestParam String connectionId) {
        log.info("Disconnect request for connection: {}", connectionId);
        localSessionSinks.close(connectionId);
        return Mono.fromRunnable(() -> connectionRegistry.deregister(connectionId))
                .subscribeOn(jdbcScheduler)
                .onErrorResume(e -> {
                    log.error("Deregistration of connection {} failed: {}", connectionId, e.getMessage());
                    return Mono.empty();
                })
                .thenReturn(ResponseEntity.ok("Disconnected successfully"));
    }
}
