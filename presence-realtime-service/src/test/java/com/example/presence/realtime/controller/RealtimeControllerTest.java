package com.example.presence.realtime.controller;

import com.example.presence.realtime.room.RoomCoordinator;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.exception.GlobalExceptionHandler;
import com.example.presence.shared.model.ChannelConnection;
import com.example.presence.shared.service.broadcast.LocalSessionSinks;
import com.example.presence.shared.service.registry.ConnectionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RealtimeControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ConnectionRegistry connectionRegistry;
    @Mock
    private RoomCoordinator roomCoordinator;

    private LocalSessionSinks localSessionSinks;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.setPodName("pod-a");
        localSessionSinks = new LocalSessionSinks();
        client = WebTestClient
                .bindToController(new RealtimeController(connectionRegistry, localSessionSinks, roomCoordinator,
                        properties, Clock.fixed(NOW, ZoneOffset.UTC), Schedulers.immediate()))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void disconnectAnswersOkEvenWhenDeregistrationFails() {
        localSessionSinks.open("c-1").subscribe();
        doThrow(new IllegalStateException("database unavailable")).when(connectionRegistry).deregister("c-1");

        client.post().uri("/api/realtime/disconnect?connectionId=c-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("Disconnected successfully");

        verify(connectionRegistry).deregister("c-1");
        assertThat(localSessionSinks.isOpen("c-1")).isFalse();
    }

    @Test
    void disconnectOfUnknownConnectionIsOk() {
        client.post().uri("/api/realtime/disconnect?connectionId=c-unknown")
                .exchange()
                .expectStatus().isOk();

        verify(connectionRegistry).deregister("c-unknown");
    }

    @Test
    void presenceReportsTheUsersLiveConnections() {
        when(connectionRegistry.queryByUser("alice")).thenReturn(List.of(connection("c-1", "room-42")));

        client.get().uri("/api/realtime/presence/alice")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.online").isEqualTo(true)
                .jsonPath("$.connections[0].connectionId").isEqualTo("c-1")
                .jsonPath("$.connections[0].roomId").isEqualTo("room-42");
    }

    @Test
    void userWithoutConnectionsIsOffline() {
        when(connectionRegistry.queryByUser("bob")).thenReturn(List.of());

        client.get().uri("/api/realtime/presence/bob")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.online").isEqualTo(false)
                .jsonPath("$.connections").isEmpty();
    }

    @Test
    void roomMembersAreListed() {
        when(roomCoordinator.members("room-42")).thenReturn(List.of(connection("c-1", "room-42"), connection("c-2", "room-42")));

        client.get().uri("/api/realtime/rooms/room-42/members")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.memberCount").isEqualTo(2)
                .jsonPath("$.members[1].connectionId").isEqualTo("c-2");
    }

    @Test
    void statsIncludeLocalSocketsAndPod() {
        localSessionSinks.open("c-1").subscribe();
        when(connectionRegistry.stats()).thenReturn(Map.of("totalConnections", 3L));

        client.get().uri("/api/realtime/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalConnections").isEqualTo(3)
                .jsonPath("$.localSockets").isEqualTo(1)
                .jsonPath("$.podId").isEqualTo("pod-a")
                .jsonPath("$.timestamp").isEqualTo("2024-05-01T10:00:00Z");
    }

    private static ChannelConnection connection(String id, String roomId) {
        OffsetDateTime now = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);
        return ChannelConnection.builder()
                .id(id)
                .userId("alice")
                .podName("pod-a")
                .status("CONNECTED")
                .roomId(roomId)
                .connectedAt(now)
                .lastActivityAt(now)
                .expiresAt(now.plusHours(2))
                .build();
    }
}
