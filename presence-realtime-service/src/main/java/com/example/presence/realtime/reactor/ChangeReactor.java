package com.example.presence.realtime.reactor;

import com.example.presence.shared.dto.ConnectionSnapshot;
import com.example.presence.shared.dto.OutboundMessage;
import com.example.presence.shared.dto.RegistryMutationEvent;
import com.example.presence.shared.model.ChannelConnection;
import com.example.presence.shared.service.broadcast.MessageBroadcaster;
import com.example.presence.shared.service.registry.ConnectionRegistry;
import com.example.presence.shared.util.Constants.OutboundType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Turns registry mutations into presence notifications: online/offline for collaborators,
 * joined/left for room members. Reads the registry only; a redelivered mutation may repeat
 * a notification but never changes state.
 */
@Service
@Slf4j
public class ChangeReactor {

    private static final Duration PROCESS_TIMEOUT = Duration.ofSeconds(30);

    private final ConnectionRegistry connectionRegistry;
    private final MessageBroadcaster messageBroadcaster;
    private final CollaboratorResolver collaboratorResolver;
    private final Scheduler jdbcScheduler;

    public ChangeReactor(ConnectionRegistry connectionRegistry,
                         MessageBroadcaster messageBroadcaster,
                         CollaboratorResolver collaboratorResolver,
                         @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.connectionRegistry = connectionRegistry;
        this.messageBroadcaster = messageBroadcaster;
        this.collaboratorResolver = collaboratorResolver;
        this.jdbcScheduler = jdbcScheduler;
    }

    @KafkaListener(
        topics = "#{@kafkaListenerHelper.getRegistryMutationTopic()}",
        groupId = "#{@kafkaListenerHelper.getChangeReactorGroupId()}",
        containerFactory = "#{@kafkaListenerHelper.getRegistryMutationContainerFactory()}"
    )
    public void onMutation(@Payload RegistryMutationEvent event,
                           Acknowledgment acknowledgment,
                           @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
                           @Header(KafkaHeaders.OFFSET) long offset) {
        log.debug("Mutation received. [Partition: {}, Offset: {}] {} {}", partition, offset, event.getType(), event.getConnectionId());
        try {
            process(event).block(PROCESS_TIMEOUT);
        } catch (Exception e) {
            log.error("Failed to react to {} mutation {} for connection {}: {}",
                    event.getType(), event.getEventId(), event.getConnectionId(), e.getMessage(), e);
        }
        acknowledgment.acknowledge();
    }

    public Mono<Void> process(RegistryMutationEvent event) {
        if (event.getType() == null) {
            log.warn("Ignoring mutation {} without a type", event.getEventId());
            return Mono.empty();
        }
        switch (event.getType()) {
            case CREATED:
                return onCreated(event.getNewImage());
            case REMOVED:
                return onRemoved(event.getOldImage());
            case MODIFIED:
                return onModified(event.getOldImage(), event.getNewImage());
            default:
                log.warn("Unhandled mutation type: {}", event.getType());
                return Mono.empty();
        }
    }

    private Mono<Void> onCreated(ConnectionSnapshot created) {
        if (created == null) {
            return Mono.empty();
        }
        return read(() -> otherConnectionsOf(created.getUserId(), created.getConnectionId()))
                .flatMap(others -> {
                    if (!others.isEmpty()) {
                        log.debug("User {} already had {} connections; no online notification", created.getUserId(), others.size());
                        return Mono.empty();
                    }
                    return notifyCollaborators(created.getUserId(), OutboundType.USER_ONLINE, presenceData(created));
                });
    }

    private Mono<Void> onRemoved(ConnectionSnapshot removed) {
        if (removed == null) {
            return Mono.empty();
        }
        Mono<Void> leftRoom = removed.getRoomId() == null
                ? Mono.empty()
                : notifyRoom(removed.getRoomId(), removed.getConnectionId(), OutboundType.USER_LEFT, roomData(removed, removed.getRoomId()));

        Mono<Void> offline = read(() -> otherConnectionsOf(removed.getUserId(), removed.getConnectionId()))
                .flatMap(others -> {
                    if (!others.isEmpty()) {
                        log.debug("User {} still has {} connections; staying online", removed.getUserId(), others.size());
                        return Mono.empty();
                    }
                    return notifyCollaborators(removed.getUserId(), OutboundType.USER_OFFLINE, presenceData(removed));
                });
        return leftRoom.then(offline);
    }

    /**
     * A room switch is a leave of the old room followed by a join of the new one.
     * Same room with a new join time is a rejoin and only announces the join.
     */
    private Mono<Void> onModified(ConnectionSnapshot before, ConnectionSnapshot after) {
        if (before == null || after == null) {
            return Mono.empty();
        }
        String connectionId = after.getConnectionId();
        if (!Objects.equals(before.getRoomId(), after.getRoomId())) {
            Mono<Void> leave = before.getRoomId() == null
                    ? Mono.empty()
                    : notifyRoom(before.getRoomId(), connectionId, OutboundType.USER_LEFT, roomData(before, before.getRoomId()));
            Mono<Void> join = after.getRoomId() == null
                    ? Mono.empty()
                    : notifyRoom(after.getRoomId(), connectionId, OutboundType.USER_JOINED, roomData(after, after.getRoomId()));
            return leave.then(join);
        }
        if (after.getRoomId() != null && !Objects.equals(before.getRoomJoinedAt(), after.getRoomJoinedAt())) {
            return notifyRoom(after.getRoomId(), connectionId, OutboundType.USER_JOINED, roomData(after, after.getRoomId()));
        }
        // touch or metadata only
        return Mono.empty();
    }

    private Mono<Void> notifyRoom(String roomId, String excludedConnectionId, OutboundType type, Map<String, Object> data) {
        return read(() -> connectionRegistry.queryByRoom(roomId).stream()
                        .map(ChannelConnection::getId)
                        .filter(id -> !id.equals(excludedConnectionId))
                        .toList())
                .flatMap(targets -> send(targets, type, data));
    }

    private Mono<Void> notifyCollaborators(String userId, OutboundType type, Map<String, Object> data) {
        return read(() -> {
                    Set<String> targets = new LinkedHashSet<>();
                    for (String collaborator : collaboratorResolver.collaboratorsOf(userId)) {
                        if (collaborator.equals(userId)) {
                            continue;
                        }
                        connectionRegistry.queryByUser(collaborator).forEach(c -> targets.add(c.getId()));
                    }
                    return List.copyOf(targets);
                })
                .flatMap(targets -> send(targets, type, data));
    }

    private Mono<Void> send(List<String> targets, OutboundType type, Map<String, Object> data) {
        if (targets.isEmpty()) {
            return Mono.empty();
        }
        return messageBroadcaster.broadcast(targets, OutboundMessage.of(type, data))
                .doOnNext(result -> log.debug("{} fanned out: {}", type.wireName(), result))
                .then();
    }

    private List<String> otherConnectionsOf(String userId, String connectionId) {
        return connectionRegistry.queryByUser(userId).stream()
                .map(ChannelConnection::getId)
                .filter(id -> !id.equals(connectionId))
                .toList();
    }

    private <T> Mono<T> read(Callable<T> query) {
        return Mono.fromCallable(query).subscribeOn(jdbcScheduler);
    }

    private static Map<String, Object> presenceData(ConnectionSnapshot snapshot) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("userId", snapshot.getUserId());
        data.put("connectionId", snapshot.getConnectionId());
        return data;
    }

    private static Map<String, Object> roomData(ConnectionSnapshot snapshot, String roomId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("userId", snapshot.getUserId());
        data.put("connectionId", snapshot.getConnectionId());
        data.put("roomId", roomId);
        data.put("roomType", snapshot.getRoomType());
        data.put("joinedAt", snapshot.getRoomJoinedAt());
        return data;
    }
}
