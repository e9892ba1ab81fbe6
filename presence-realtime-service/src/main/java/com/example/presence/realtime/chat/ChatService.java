package com.example.presence.realtime.chat;

import com.example.presence.realtime.protocol.InboundMessage;
import com.example.presence.realtime.protocol.ProtocolException;
import com.example.presence.realtime.protocol.SessionContext;
import com.example.presence.realtime.protocol.SessionReplier;
import com.example.presence.shared.aspect.Monitored;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.dto.OutboundMessage;
import com.example.presence.shared.model.ChannelConnection;
import com.example.presence.shared.model.ChatMessage;
import com.example.presence.shared.repository.ChatMessageRepository;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Room chat: persist, fan out to the other members, confirm to the sender.
 */
@Service
@Slf4j
@Monitored("chat")
public class ChatService {

    private static final String DEFAULT_MESSAGE_TYPE = "text";

    private final ChatMessageRepository chatMessageRepository;
    private final ConnectionRegistry connectionRegistry;
    private final MessageBroadcaster messageBroadcaster;
    private final SessionReplier sessionReplier;
    private final AppProperties appProperties;
    private final Clock clock;
    private final Scheduler jdbcScheduler;

    public ChatService(ChatMessageRepository chatMessageRepository,
                       ConnectionRegistry connectionRegistry,
                       MessageBroadcaster messageBroadcaster,
                       SessionReplier sessionReplier,
                       AppProperties appProperties,
                       Clock clock,
                       @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.chatMessageRepository = chatMessageRepository;
        this.connectionRegistry = connectionRegistry;
        this.messageBroadcaster = messageBroadcaster;
        this.sessionReplier = sessionReplier;
        this.appProperties = appProperties;
        this.clock = clock;
        this.jdbcScheduler = jdbcScheduler;
    }

    public Mono<Void> send(SessionContext session, InboundMessage inbound) {
        if (inbound.getMessage() == null || inbound.getMessage().isBlank()) {
            return Mono.error(ProtocolException.badRequest("message is required for sendMessage"));
        }
        return Mono.fromCallable(() -> persist(session, inbound))
                .subscribeOn(jdbcScheduler)
                .flatMap(prepared -> messageBroadcaster
                        .broadcast(prepared.targets(), OutboundMessage.of(OutboundType.CHAT_MESSAGE, toPayload(prepared.message())))
                        .doOnNext(result -> {
                            Map<String, Object> confirmation = new LinkedHashMap<>();
                            confirmation.put("messageId", prepared.message().getId());
                            confirmation.put("roomId", prepared.message().getRoomId());
                            confirmation.put("timestamp", prepared.message().getCreatedAt());
                            confirmation.put("recipients", result.size());
                            confirmation.put("delivered", result.deliveredCount());
                            sessionReplier.reply(session.connectionId(), OutboundType.MESSAGE_CONFIRMATION, confirmation);
                        }))
                .then();
    }

    private PreparedMessage persist(SessionContext session, InboundMessage inbound) {
        String roomId = resolveRoom(session, inbound);
        OffsetDateTime now = OffsetDateTime.now(clock);
        ChatMessage message = ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .roomId(roomId)
                .senderId(session.userId())
                .body(inbound.getMessage())
                .messageType(inbound.getMessageType() == null ? DEFAULT_MESSAGE_TYPE : inbound.getMessageType())
                .metadata(inbound.getMetadata() == null ? null : JsonUtils.toJson(inbound.getMetadata()))
                .createdAt(now)
                .expiresAt(now.plus(appProperties.getChat().getRetention()))
                .build();
        chatMessageRepository.save(message);

        List<String> targets = connectionRegistry.queryByRoom(roomId).stream()
                .map(ChannelConnection::getId)
                .filter(id -> !id.equals(session.connectionId()))
                .toList();
        log.debug("Chat message {} in room {} fans out to {} connections", message.getId(), roomId, targets.size());
        return new PreparedMessage(message, targets);
    }

    private String resolveRoom(SessionContext session, InboundMessage inbound) {
        if (inbound.getRoomId() != null && !inbound.getRoomId().isBlank()) {
            return inbound.getRoomId();
        }
        String currentRoom = connectionRegistry.lookup(session.connectionId()).getRoomId();
        if (currentRoom == null) {
            throw ProtocolException.badRequest("roomId is required when not in a room");
        }
        return currentRoom;
    }

    private Map<String, Object> toPayload(ChatMessage message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("messageId", message.getId());
        data.put("roomId", message.getRoomId());
        data.put("senderId", message.getSenderId());
        data.put("message", message.getBody());
        data.put("messageType", message.getMessageType());
        data.put("metadata", JsonUtils.parseJsonObject(message.getMetadata()));
        data.put("timestamp", message.getCreatedAt());
        return data;
    }

    private record PreparedMessage(ChatMessage message, List<String> targets) {
    }
}
