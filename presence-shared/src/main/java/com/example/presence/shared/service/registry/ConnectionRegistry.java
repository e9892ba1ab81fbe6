package com.example.presence.shared.service.registry;

import com.example.presence.shared.aspect.Monitored;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.exception.ConnectionNotFoundException;
import com.example.presence.shared.model.ChannelConnection;
import com.example.presence.shared.repository.ChannelConnectionRepository;
import com.example.presence.shared.service.broadcast.LocalSessionSinks;
import com.example.presence.shared.util.Constants.ConnectionStatus;
import com.example.presence.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable store of live sessions. Every write that changes a row also appends a
 * registry mutation in the same transaction.
 * <p>
 * Reads are snapshot reads and may race with concurrent joins and leaves.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("registry")
public class ConnectionRegistry {

    private final ChannelConnectionRepository connectionRepository;
    private final RegistryMutationPublisher mutationPublisher;
    private final LocalSessionSinks localSessionSinks;
    private final AppProperties appProperties;
    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;
    private final Clock clock;

    @Transactional
    public RegistrationOutcome register(String connectionId, String userId, Map<String, Object> metadata) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = now.plus(appProperties.getConnection().getTtl());
        String metadataJson = metadata == null || metadata.isEmpty() ? null : JsonUtils.toJson(metadata);

        int inserted = connectionRepository.insertIfAbsent(
                connectionId, userId, appProperties.getPodName(), now, expiresAt, metadataJson);
        if (inserted == 0) {
            log.warn("Connection {} is already registered; keeping the existing record", connectionId);
            return RegistrationOutcome.ALREADY_EXISTS;
        }

        ChannelConnection created = ChannelConnection.builder()
                .id(connectionId)
                .userId(userId)
                .podName(appProperties.getPodName())
                .status(ConnectionStatus.CONNECTED.name())
                .connectedAt(now)
                .lastActivityAt(now)
                .expiresAt(expiresAt)
                .metadata(metadataJson)
                .build();
        mutationPublisher.created(created);
        metricsCollector.incrementCounter("presence.connections.registered");
        log.info("Registered connection {} for user {} on pod {}", connectionId, userId, appProperties.getPodName());
        return RegistrationOutcome.REGISTERED;
    }

    /**
     * Idempotent: an absent id is a successful no-op.
     */
    @Transactional
    public void deregister(String connectionId) {
        if (removeIfPresent(connectionId)) {
            log.info("Deregistered connection {}", connectionId);
        } else {
            log.debug("Deregister of unknown connection {} ignored", connectionId);
        }
    }

    /**
     * Refreshes activity and pushes the expiry out by one TTL. No-op if absent.
     */
    @Transactional
    public void touch(String connectionId) {
        Optional<ChannelConnection> existing = connectionRepository.findByIdForUpdate(connectionId);
        if (existing.isEmpty()) {
            return;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = now.plus(appProperties.getConnection().getTtl());
        if (connectionRepository.touch(connectionId, now, expiresAt) == 1) {
            ChannelConnection before = existing.get();
            mutationPublisher.modified(before, before.toBuilder().lastActivityAt(now).expiresAt(expiresAt).build());
        }
    }

    /**
     * Refreshes every given connection that is still registered in one update.
     *
     * @return the ids that were found and refreshed
     */
    @Transactional
    public Set<String> heartbeat(Collection<String> connectionIds) {
        if (connectionIds.isEmpty()) {
            return Set.of();
        }
        List<ChannelConnection> existing = new ArrayList<>();
        connectionRepository.findAllById(connectionIds).forEach(existing::add);
        if (existing.isEmpty()) {
            return Set.of();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = now.plus(appProperties.getConnection().getTtl());
        Set<String> refreshed = new HashSet<>();
        existing.forEach(connection -> refreshed.add(connection.getId()));
        connectionRepository.touchAll(refreshed, now, expiresAt);
        for (ChannelConnection before : existing) {
            mutationPublisher.modified(before, before.toBuilder().lastActivityAt(now).expiresAt(expiresAt).build());
        }
        return refreshed;
    }

    public ChannelConnection lookup(String connectionId) {
        return connectionRepository.findById(connectionId)
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
    }

    public Optional<ChannelConnection> find(String connectionId) {
        return connectionRepository.findById(connectionId);
    }

    public List<ChannelConnection> queryByUser(String userId) {
        return connectionRepository.findByUserId(userId);
    }

    public List<ChannelConnection> queryByRoom(String roomId) {
        return connectionRepository.findByRoomId(roomId);
    }

    /**
     * Sets the room fields. Writing the same room again still counts as a change
     * because {@code roomJoinedAt} moves.
     *
     * @throws ConnectionNotFoundException if the connection is not registered
     */
    @Transactional
    public RoomChange setRoom(String connectionId, String roomId, String roomType) {
        ChannelConnection before = connectionRepository.findByIdForUpdate(connectionId)
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
        OffsetDateTime now = OffsetDateTime.now(clock);
        connectionRepository.updateRoom(connectionId, roomId, roomType, now);

        ChannelConnection after = before.toBuilder()
                .roomId(roomId)
                .roomType(roomType)
                .roomJoinedAt(now)
                .lastActivityAt(now)
                .build();
        mutationPublisher.modified(before, after);
        return new RoomChange(before, after);
    }

    /**
     * Clears the room fields; returns a no-op change when the connection is in no room.
     *
     * @throws ConnectionNotFoundException if the connection is not registered
     */
    @Transactional
    public RoomChange clearRoom(String connectionId) {
        ChannelConnection before = connectionRepository.findByIdForUpdate(connectionId)
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
        if (before.getRoomId() == null) {
            return new RoomChange(before, before);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        connectionRepository.clearRoom(connectionId, now);

        ChannelConnection after = before.toBuilder()
                .roomId(null)
                .roomType(null)
                .roomJoinedAt(null)
                .lastActivityAt(now)
                .build();
        mutationPublisher.modified(before, after);
        return new RoomChange(before, after);
    }

    /**
     * Removes up to {@code limit} connections whose expiry has passed, through the
     * same path as an explicit deregistration. A removed socket held by this pod is closed;
     * sockets on other pods are closed by their own heartbeat.
     *
     * @return number of connections removed
     */
    @Transactional
    public int expireStale(OffsetDateTime now, int limit) {
        List<String> expiredIds = connectionRepository.findExpiredIds(now, limit);
        int removed = 0;
        for (String connectionId : expiredIds) {
            if (removeIfPresent(connectionId)) {
                localSessionSinks.close(connectionId);
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Passively expired {} connections", removed);
        }
        return removed;
    }

    public Map<String, Long> stats() {
        return Map.of(
                "totalConnections", connectionRepository.count(),
                "distinctUsers", connectionRepository.countDistinctUsers(),
                "activeRooms", connectionRepository.countActiveRooms(),
                "podConnections", connectionRepository.countByPodName(appProperties.getPodName()));
    }

    private boolean removeIfPresent(String connectionId) {
        Optional<ChannelConnection> existing = connectionRepository.findByIdForUpdate(connectionId);
        if (existing.isEmpty() || connectionRepository.deleteConnection(connectionId) == 0) {
            return false;
        }
        mutationPublisher.removed(existing.get());
        metricsCollector.incrementCounter("presence.connections.deregistered");
        return true;
    }
}
