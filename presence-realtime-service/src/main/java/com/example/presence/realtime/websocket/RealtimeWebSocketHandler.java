package com.example.presence.realtime.websocket;

import com.example.presence.realtime.auth.CredentialValidator;
import com.example.presence.realtime.auth.InvalidCredentialException;
import com.example.presence.realtime.protocol.ProtocolDispatcher;
import com.example.presence.realtime.protocol.SessionContext;
import com.example.presence.realtime.protocol.SessionReplier;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.service.broadcast.LocalSessionSinks;
import com.example.presence.shared.service.registry.ConnectionRegistry;
import com.example.presence.shared.service.registry.RegistrationOutcome;
import com.example.presence.shared.util.Constants.OutboundType;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Scheduler;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One WebSocket session: handshake, registration, frame loop and disconnect.
 */
@Component
@Slf4j
public class RealtimeWebSocketHandler implements WebSocketHandler {

    static final int ALREADY_CONNECTED = 4409;
    static final int RATE_LIMITED = 4429;

    private final ConnectionRegistry connectionRegistry;
    private final LocalSessionSinks localSessionSinks;
    private final ProtocolDispatcher protocolDispatcher;
    private final SessionReplier sessionReplier;
    private final CredentialValidator credentialValidator;
    private final AppProperties appProperties;
    private final Clock clock;
    private final Scheduler jdbcScheduler;

    public RealtimeWebSocketHandler(ConnectionRegistry connectionRegistry,
                                    LocalSessionSinks localSessionSinks,
                                    ProtocolDispatcher protocolDispatcher,
                                    SessionReplier sessionReplier,
                                    CredentialValidator credentialValidator,
                                    AppProperties appProperties,
                                    Clock clock,
                                    @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.connectionRegistry = connectionRegistry;
        this.localSessionSinks = localSessionSinks;
        this.protocolDispatcher = protocolDispatcher;
        this.sessionReplier = sessionReplier;
        this.credentialValidator = credentialValidator;
        this.appProperties = appProperties;
        this.clock = clock;
        this.jdbcScheduler = jdbcScheduler;
    }

    @Override
    @RateLimiter(name = "realtimeConnectLimiter", fallbackMethod = "connectFallback")
    public Mono<Void> handle(WebSocketSession session) {
        String userId;
        try {
            userId = authenticate(session.getHandshakeInfo());
        } catch (InvalidCredentialException e) {
            log.warn("[CONNECT_REJECTED] {} (code {}) from {}", e.getMessage(), e.getCloseCode(), remoteAddress(session.getHandshakeInfo()));
            return session.close(new CloseStatus(e.getCloseCode(), e.getMessage()));
        }

        String connectionId = UUID.randomUUID().toString();
        log.info("[CONNECT_START] WebSocket connection request for userId='{}', connectionId='{}', IP='{}'",
                userId, connectionId, remoteAddress(session.getHandshakeInfo()));

        // The sink exists before the row does, so a fan-out that finds the new row never sees GONE
        Flux<String> frames = localSessionSinks.open(connectionId);
        return Mono.fromCallable(() -> connectionRegistry.register(connectionId, userId, handshakeMetadata(session.getHandshakeInfo())))
                .subscribeOn(jdbcScheduler)
                .doOnError(e -> {
                    log.error("Registration of connection {} failed: {}", connectionId, e.getMessage());
                    localSessionSinks.close(connectionId);
                })
                .flatMap(outcome -> {
                    if (outcome == RegistrationOutcome.ALREADY_EXISTS) {
                        log.warn("Connection {} is already registered; closing duplicate socket", connectionId);
                        localSessionSinks.close(connectionId);
                        return session.close(new CloseStatus(ALREADY_CONNECTED, "Connection already registered"));
                    }
                    return serve(session, new SessionContext(connectionId, userId), frames);
                });
    }

    public Mono<Void> connectFallback(WebSocketSession session, RequestNotPermitted ex) {
        log.warn("Connection rate limit exceeded. IP: {}. Details: {}", remoteAddress(session.getHandshakeInfo()), ex.getMessage());
        return session.close(new CloseStatus(RATE_LIMITED, "Connection rate limit exceeded"));
    }

    private Mono<Void> serve(WebSocketSession session, SessionContext context, Flux<String> frames) {
        String connectionId = context.connectionId();

        Map<String, Object> confirmation = new LinkedHashMap<>();
        confirmation.put("connectionId", connectionId);
        confirmation.put("userId", context.userId());
        confirmation.put("podName", appProperties.getPodName());
        confirmation.put("timestamp", OffsetDateTime.now(clock));
        sessionReplier.reply(connectionId, OutboundType.CONNECTION_CONFIRMED, confirmation);
        log.info("[CONNECT_SUCCESS] Connection {} established for user {}", connectionId, context.userId());

        Mono<Void> inbound = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(frame -> touch(connectionId).then(Mono.defer(() -> protocolDispatcher.dispatch(context, frame))))
                .then()
                // the outbound stream ends with the sink
                .doFinally(signal -> localSessionSinks.close(connectionId));

        // a sink closed from outside (expiry, REST disconnect, heartbeat) closes the socket
        Mono<Void> outbound = session.send(frames.map(session::textMessage))
                .then(Mono.defer(() -> session.close(CloseStatus.NORMAL)));

        return Mono.when(inbound, outbound)
                .doOnError(e -> log.warn("Connection {} terminated with error: {}", connectionId, e.getMessage()))
                .doFinally(signal -> disconnect(connectionId, signal));
    }

    private Mono<Void> touch(String connectionId) {
        return Mono.fromRunnable(() -> connectionRegistry.touch(connectionId))
                .subscribeOn(jdbcScheduler)
                .onErrorResume(e -> {
                    log.warn("Failed to refresh activity of connection {}: {}", connectionId, e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    private void disconnect(String connectionId, SignalType signal) {
        localSessionSinks.close(connectionId);
        Mono.fromRunnable(() -> connectionRegistry.deregister(connectionId))
                .subscribeOn(jdbcScheduler)
                .subscribe(
                        ignored -> { },
                        e -> log.error("Deregistration of connection {} failed after {}: {}", connectionId, signal, e.getMessage()),
                        () -> log.info("[DISCONNECT] Connection {} closed ({})", connectionId, signal));
    }

    private String authenticate(HandshakeInfo handshakeInfo) {
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(handshakeInfo.getUri()).build().getQueryParams();
        String userId = decode(params.getFirst("userId"));
        if (userId == null || userId.isBlank()) {
            throw new InvalidCredentialException(InvalidCredentialException.MISSING_USER, "userId is required");
        }
        String token = decode(params.getFirst("token"));
        if (!credentialValidator.isValid(userId, token)) {
            throw new InvalidCredentialException(InvalidCredentialException.INVALID_TOKEN, "Invalid credentials for user " + userId);
        }
        return userId;
    }

    private static String decode(String value) {
        return value == null ? null : UriUtils.decode(value, StandardCharsets.UTF_8);
    }

    private static Map<String, Object> handshakeMetadata(HandshakeInfo handshakeInfo) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("remoteAddress", remoteAddress(handshakeInfo));
        String userAgent = handshakeInfo.getHeaders().getFirst(HttpHeaders.USER_AGENT);
        if (userAgent != null) {
            metadata.put("userAgent", userAgent);
        }
        return metadata;
    }

    private static String remoteAddress(HandshakeInfo handshakeInfo) {
        return handshakeInfo.getRemoteAddress() != null && handshakeInfo.getRemoteAddress().getAddress() != null
                ? handshakeInfo.getRemoteAddress().getAddress().getHostAddress()
                : "unknown";
    }
}
