package com.example.presence.shared.service.registry;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.dto.RegistryMutationEvent;
import com.example.presence.shared.model.ChannelConnection;
import com.example.presence.shared.model.RegistryOutboxEvent;
import com.example.presence.shared.repository.RegistryOutboxRepository;
import com.example.presence.shared.util.Constants;
import com.example.presence.shared.util.Constants.MutationType;
import com.example.presence.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Appends registry mutations to the outbox inside the caller's transaction, so a
 * mutation is on the feed if and only if the registry change committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegistryMutationPublisher {

    private final RegistryOutboxRepository outboxRepository;
    private final AppProperties appProperties;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public void created(ChannelConnection connection) {
        publish(MutationType.CREATED, connection.getId(), connection.getUserId(), null, connection);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void removed(ChannelConnection connection) {
        publish(MutationType.REMOVED, connection.getId(), connection.getUserId(), connection, null);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void modified(ChannelConnection before, ChannelConnection after) {
        publish(MutationType.MODIFIED, after.getId(), after.getUserId(), before, after);
    }

    private void publish(MutationType type, String connectionId, String userId,
                         ChannelConnection oldImage, ChannelConnection newImage) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        RegistryMutationEvent event = RegistryMutationEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .connectionId(connectionId)
                .userId(userId)
                .oldImage(oldImage != null ? oldImage.toSnapshot() : null)
                .newImage(newImage != null ? newImage.toSnapshot() : null)
                .occurredAt(now)
                .build();

        RegistryOutboxEvent outboxEvent = RegistryOutboxEvent.builder()
                .id(UUID.randomUUID())
                .aggregateType(Constants.REGISTRY_AGGREGATE)
                .aggregateId(userId)
                .eventType(type.name())
                .payload(JsonUtils.toJson(event))
                .topic(appProperties.getKafka().getTopic().getNameRegistryMutations())
                .createdAt(now)
                .build();
        outboxRepository.save(outboxEvent);
        log.debug("Queued {} mutation for connection {} (user {})", type, connectionId, userId);
    }
}
