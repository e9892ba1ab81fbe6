package com.example.presence.realtime.status;

import com.example.presence.realtime.protocol.InboundMessage;
import com.example.presence.realtime.protocol.ProtocolException;
import com.example.presence.realtime.protocol.SessionContext;
import com.example.presence.realtime.protocol.SessionReplier;
import com.example.presence.shared.aspect.Monitored;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.dto.OutboundMessage;
import com.example.presence.shared.model.ChannelConnection;
import com.example.presence.shared.model.LiveStatusRecord;
import com.example.presence.shared.repository.LiveStatusRepository;
import com.example.presence.shared.service.broadcast.MessageBroadcaster;
import com.example.presence.shared.service.registry.ConnectionRegistry;
import com.example.presence.shared.util.Constants.OutboundType;
import com.example.presence.shared.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Live status of long-running resources. The record is written first and kept
 * whatever happens to the fan-out.
 * <p>
 * Targets: explicit recipient users, else explicit rooms, else the updater's own connections.
 */
@Service
@Slf4j
@Monitored("live-status")
public class LiveStatusService {

    private final LiveStatusRepository liveStatusRepository;
    private final ConnectionRegistry connectionRegistry;
    private final MessageBroadcaster messageBroadcaster;
    private final SessionReplier sessionReplier;
    private final AppProperties appProperties;
    private final Clock clock;
    private final Scheduler jdbcScheduler;

    public LiveStatusService(LiveStatusRepository liveStatusRepository,
                             ConnectionRegistry connectionRegistry,
                             MessageBroadcaster messageBroadcaster,
                             SessionReplier sessionReplier,
                             AppProperties appProperties,
                             Clock clock,
                             @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.liveStatusRepository = liveStatusRepository;
        this.connectionRegistry = connectionRegistry;
        this.messageBroadcaster = messageBroadcaster;
        this.sessionReplier = sessionReplier;
        this.appProperties = appProperties;
        this.clock = clock;
        this.jdbcScheduler = jdbcScheduler;
    }

    public Mono<Void> update(SessionContext session, InboundMessage inbound) {
        if (isBlank(inbound.getResourceType()) || isBlank(inbound.getResourceId()) || isBlank(inbound.getStatus())) {
            return Mono.error(ProtocolException.badRequest("resourceType, resourceId and status are required for updateStatus"));
        }
        if (inbound.getProgress() != null && (inbound.getProgress() < 0 || inbound.getProgress() > 100)) {
            return Mono.error(ProtocolException.badRequest("progress must be between 0 and 100"));
        }
        return Mono.fromCallable(() -> {
                    LiveStatusRecord record = persist(session, inbound);
                    return new PreparedUpdate(record, resolveTargets(session, inbound));
                })
                .subscribeOn(jdbcScheduler)
                .flatMap(prepared -> messageBroadcaster
                        .broadcast(prepared.targets(), OutboundMessage.of(OutboundType.LIVE_UPDATE, toPayload(prepared.record())))
                        .doOnNext(result -> {
                            Map<String, Object> confirmation = new LinkedHashMap<>();
                            confirmation.put("resourceType", prepared.record().getResourceType());
                            confirmation.put("resourceId", prepared.record().getResourceId());
                            confirmation.put("status", prepared.record().getStatus());
                            confirmation.put("targets", result.size());
                            confirmation.put("delivered", result.deliveredCount());
                            sessionReplier.reply(session.connectionId(), OutboundType.UPDATE_CONFIRMATION, confirmation);
                        }))
                .then();
    }

    public LiveStatusRecord persist(SessionContext session, InboundMessage inbound) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        LiveStatusRecord record = LiveStatusRecord.builder()
                .statusKey(LiveStatusRecord.keyOf(inbound.getResourceType(), inbound.getResourceId()))
                .resourceType(inbound.getResourceType())
                .resourceId(inbound.getResourceId())
                .status(inbound.getStatus())
                .progress(inbound.getProgress())
                .metadata(inbound.getMetadata() == null ? null : JsonUtils.toJson(inbound.getMetadata()))
                .updatedBy(session.userId())
                .updatedAt(now)
                .expiresAt(now.plus(appProperties.getStatus().getTtl()))
                .build();
        liveStatusRepository.upsert(record.getStatusKey(), record.getResourceType(), record.getResourceId(),
                record.getStatus(), record.getProgress(), record.getMetadata(), record.getUpdatedBy(),
                record.getUpdatedAt(), record.getExpiresAt());
        return record;
    }

    Set<String> resolveTargets(SessionContext session, InboundMessage inbound) {
        Set<String> targets;
        if (inbound.getRecipientUserIds() != null && !inbound.getRecipientUserIds().isEmpty()) {
            targets = connectionsOf(inbound.getRecipientUserIds(), connectionRegistry::queryByUser);
        } else if (inbound.getRoomIds() != null && !inbound.getRoomIds().isEmpty()) {
            targets = connectionsOf(inbound.getRoomIds(), connectionRegistry::queryByRoom);
        } else {
            targets = connectionsOf(List.of(session.userId()), connectionRegistry::queryByUser);
        }
        if (targets.isEmpty()) {
            log.debug("Status {}:{} persisted with no live targets", inbound.getResourceType(), inbound.getResourceId());
        }
        return targets;
    }

    private static Set<String> connectionsOf(Collection<String> keys, Function<String, List<ChannelConnection>> query) {
        Set<String> connectionIds = new LinkedHashSet<>();
        for (String key : keys) {
            query.apply(key).forEach(connection -> connectionIds.add(connection.getId()));
        }
        return connectionIds;
    }

    private Map<String, Object> toPayload(LiveStatusRecord record) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("resourceType", record.getResourceType());
        data.put("resourceId", record.getResourceId());
        data.put("status", record.getStatus());
        data.put("progress", record.getProgress());
        data.put("metadata", JsonUtils.parseJsonObject(record.getMetadata()));
        data.put("updatedBy", record.getUpdatedBy());
        data.put("updatedAt", record.getUpdatedAt());
        return data;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record PreparedUpdate(LiveStatusRecord record, Set<String> targets) {
    }
}
