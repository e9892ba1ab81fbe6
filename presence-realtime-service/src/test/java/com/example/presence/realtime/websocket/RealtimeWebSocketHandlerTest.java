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
import com.example.presence.shared.util.JsonUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.reactivestreams.Publisher;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RealtimeWebSocketHandlerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String FRAME = "{\"action\":\"joinRoom\",\"roomId\":\"room-42\"}";

    @Mock
    private ConnectionRegistry connectionRegistry;
    @Mock
    private ProtocolDispatcher protocolDispatcher;
    @Mock
    private CredentialValidator credentialValidator;
    @Mock
    private WebSocketSession session;

    private LocalSessionSinks localSessionSinks;
    private RealtimeWebSocketHandler handler;
    private final List<String> sent = new ArrayList<>();
    private final Sinks.Many<WebSocketMessage> inbound = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicReference<String> registeredId = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.setPodName("pod-a");
        localSessionSinks = new LocalSessionSinks();
        handler = new RealtimeWebSocketHandler(connectionRegistry, localSessionSinks, protocolDispatcher,
                new SessionReplier(localSessionSinks), credentialValidator, properties,
                Clock.fixed(NOW, ZoneOffset.UTC), Schedulers.immediate());
    }

    @Test
    void missingUserIdClosesWith4400WithoutRegistering() {
        handshake("");
        when(session.close(any(CloseStatus.class))).thenReturn(Mono.empty());

        StepVerifier.create(handler.handle(session)).verifyComplete();

        assertThat(closeCode()).isEqualTo(InvalidCredentialException.MISSING_USER);
        verifyNoInteractions(connectionRegistry, credentialValidator);
        assertThat(localSessionSinks.size()).isZero();
    }

    @Test
    void invalidTokenClosesWith4401WithoutRegistering() {
        handshake("?userId=alice&token=forged");
        when(credentialValidator.isValid("alice", "forged")).thenReturn(false);
        when(session.close(any(CloseStatus.class))).thenReturn(Mono.empty());

        StepVerifier.create(handler.handle(session)).verifyComplete();

        assertThat(closeCode()).isEqualTo(InvalidCredentialException.INVALID_TOKEN);
        verifyNoInteractions(connectionRegistry);
        assertThat(localSessionSinks.size()).isZero();
    }

    @Test
    void duplicateConnectionIdClosesWith4409AndReleasesTheSink() {
        handshake("?userId=alice&token=good");
        when(credentialValidator.isValid("alice", "good")).thenReturn(true);
        when(connectionRegistry.register(anyString(), eq("alice"), anyMap())).thenReturn(RegistrationOutcome.ALREADY_EXISTS);
        when(session.close(any(CloseStatus.class))).thenReturn(Mono.empty());

        StepVerifier.create(handler.handle(session)).verifyComplete();

        assertThat(closeCode()).isEqualTo(RealtimeWebSocketHandler.ALREADY_CONNECTED);
        assertThat(localSessionSinks.size()).isZero();
        verify(connectionRegistry, never()).deregister(anyString());
    }

    @Test
    void failedRegistrationReleasesTheSink() {
        handshake("?userId=alice&token=good");
        when(credentialValidator.isValid("alice", "good")).thenReturn(true);
        when(connectionRegistry.register(anyString(), eq("alice"), anyMap())).thenThrow(new IllegalStateException("database unavailable"));

        StepVerifier.create(handler.handle(session)).verifyError(IllegalStateException.class);

        assertThat(localSessionSinks.size()).isZero();
    }

    @Test
    void sinkIsOpenBeforeTheConnectionIsRegistered() {
        AtomicBoolean sinkOpenAtRegistration = new AtomicBoolean();
        acceptSocket(sinkOpenAtRegistration);
        when(protocolDispatcher.dispatch(any(SessionContext.class), eq(FRAME))).thenReturn(Mono.empty());
        inbound.tryEmitNext(text(FRAME));

        StepVerifier.create(handler.handle(session))
                .then(inbound::tryEmitComplete)
                .verifyComplete();

        assertThat(sinkOpenAtRegistration).isTrue();
        String connectionId = registeredId.get();
        Map<String, Object> confirmation = JsonUtils.parseJsonObject(sent.get(0));
        assertThat(confirmation).containsEntry("type", "connectionConfirmed");
        assertThat((Map<String, Object>) confirmation.get("data"))
                .containsEntry("connectionId", connectionId)
                .containsEntry("userId", "alice")
                .containsEntry("podName", "pod-a");

        InOrder order = inOrder(connectionRegistry, protocolDispatcher);
        order.verify(connectionRegistry).touch(connectionId);
        order.verify(protocolDispatcher).dispatch(new SessionContext(connectionId, "alice"), FRAME);
        order.verify(connectionRegistry).deregister(connectionId);
        assertThat(localSessionSinks.size()).isZero();
    }

    @Test
    void sinkClosedFromOutsideClosesTheSocket() {
        acceptSocket(new AtomicBoolean());

        StepVerifier.create(handler.handle(session))
                .then(() -> localSessionSinks.close(registeredId.get()))
                .then(() -> verify(session).close(CloseStatus.NORMAL))
                .then(inbound::tryEmitComplete)
                .verifyComplete();

        verify(connectionRegistry).deregister(registeredId.get());
    }

    @Test
    void socketCloseCompletesEvenWhenDeregistrationFails() {
        acceptSocket(new AtomicBoolean());
        doThrow(new IllegalStateException("database unavailable")).when(connectionRegistry).deregister(anyString());

        StepVerifier.create(handler.handle(session))
                .then(inbound::tryEmitComplete)
                .verifyComplete();

        verify(connectionRegistry).deregister(registeredId.get());
        assertThat(localSessionSinks.size()).isZero();
    }

    private void acceptSocket(AtomicBoolean sinkOpenAtRegistration) {
        handshake("?userId=alice&token=good");
        when(credentialValidator.isValid("alice", "good")).thenReturn(true);
        when(connectionRegistry.register(anyString(), eq("alice"), anyMap())).thenAnswer(inv -> {
            String connectionId = inv.getArgument(0);
            registeredId.set(connectionId);
            sinkOpenAtRegistration.set(localSessionSinks.isOpen(connectionId));
            return RegistrationOutcome.REGISTERED;
        });
        when(session.receive()).thenReturn(inbound.asFlux());
        when(session.textMessage(anyString())).thenAnswer(inv -> text(inv.getArgument(0)));
        when(session.send(any())).thenAnswer(inv -> {
            Publisher<WebSocketMessage> outbound = inv.getArgument(0);
            return Flux.from(outbound).doOnNext(message -> sent.add(message.getPayloadAsText())).then();
        });
        when(session.close(CloseStatus.NORMAL)).thenReturn(Mono.empty());
    }

    private void handshake(String query) {
        when(session.getHandshakeInfo()).thenReturn(
                new HandshakeInfo(URI.create("ws://localhost/ws/realtime" + query), new HttpHeaders(), Mono.empty(), null));
    }

    private int closeCode() {
        ArgumentCaptor<CloseStatus> status = ArgumentCaptor.forClass(CloseStatus.class);
        verify(session).close(status.capture());
        return status.getValue().getCode();
    }

    private static WebSocketMessage text(String payload) {
        return new WebSocketMessage(WebSocketMessage.Type.TEXT,
                DefaultDataBufferFactory.sharedInstance.wrap(payload.getBytes(StandardCharsets.UTF_8)));
    }
}
