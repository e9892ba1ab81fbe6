package com.example.presence.realtime.websocket;

import com.example.presence.realtime.retention.RetentionService;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.dto.JobRunResult;
import com.example.presence.shared.model.ChannelConnection;
import com.example.presence.shared.repository.ChannelConnectionRepository;
import com.example.presence.shared.repository.ChatMessageRepository;
import com.example.presence.shared.repository.LiveStatusRepository;
import com.example.presence.shared.service.broadcast.LocalSessionSinks;
import com.example.presence.shared.service.registry.ConnectionRegistry;
import com.example.presence.shared.service.registry.RegistryMutationPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionHeartbeatServiceTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ChannelConnectionRepository connectionRepository;
    @Mock
    private RegistryMutationPublisher mutationPublisher;
    @Mock
    private ChatMessageRepository chatMessageRepository;
    @Mock
    private LiveStatusRepository liveStatusRepository;

    private final Map<String, ChannelConnection> rows = new ConcurrentHashMap<>();
    private final SteppedClock clock = new SteppedClock(START);
    private LocalSessionSinks localSessionSinks;
    private SessionHeartbeatService heartbeatService;
    private RetentionService retentionService;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.setPodName("pod-a");
        localSessionSinks = new LocalSessionSinks();
        ConnectionRegistry registry = new ConnectionRegistry(connectionRepository, mutationPublisher, localSessionSinks,
                properties, new MonitoringConfig.PresenceMetricsCollector(new SimpleMeterRegistry()), clock);
        heartbeatService = new SessionHeartbeatService(registry, localSessionSinks);
        retentionService = new RetentionService(registry, chatMessageRepository, liveStatusRepository, properties, clock);
    }

    @Test
    void silentJoinedConnectionSurvivesRetentionAcrossATtlWhileHeartbeatsRun() {
        openJoinedConnection("c-1");
        storeBackedHeartbeat();
        storeBackedExpiryQuery();
        noRetentionBacklog();

        clock.advance(Duration.ofMinutes(90));
        assertThat(heartbeatService.run()).isEqualTo(1);
        clock.advance(Duration.ofMinutes(40));
        JobRunResult result = retentionService.run();

        assertThat(result.getDetails()).containsEntry(RetentionService.EXPIRE_CONNECTIONS, 0);
        assertThat(rows).containsKey("c-1");
        assertThat(rows.get("c-1").getExpiresAt()).isEqualTo(OffsetDateTime.ofInstant(START, ZoneOffset.UTC).plusMinutes(210));
        assertThat(localSessionSinks.isOpen("c-1")).isTrue();
        verify(mutationPublisher, never()).removed(any());
    }

    @Test
    void withoutHeartbeatsTheSilentConnectionExpiresAndItsSocketIsClosed() {
        openJoinedConnection("c-1");
        storeBackedExpiryQuery();
        when(connectionRepository.findByIdForUpdate(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(rows.get(inv.<String>getArgument(0))));
        when(connectionRepository.deleteConnection(anyString()))
                .thenAnswer(inv -> rows.remove(inv.<String>getArgument(0)) == null ? 0 : 1);
        noRetentionBacklog();

        clock.advance(Duration.ofMinutes(130));
        JobRunResult result = retentionService.run();

        assertThat(result.getDetails()).containsEntry(RetentionService.EXPIRE_CONNECTIONS, 1);
        assertThat(rows).isEmpty();
        assertThat(localSessionSinks.isOpen("c-1")).isFalse();
    }

    @Test
    void socketWhoseRowIsMissingOnTwoRunsIsClosed() {
        localSessionSinks.open("c-orphan").subscribe();
        storeBackedLookup();

        assertThat(heartbeatService.run()).isZero();
        // one run of grace for a socket still registering
        assertThat(localSessionSinks.isOpen("c-orphan")).isTrue();

        heartbeatService.run();
        assertThat(localSessionSinks.isOpen("c-orphan")).isFalse();
    }

    @Test
    void socketThatRegistersWithinTheGraceRunStaysOpen() {
        localSessionSinks.open("c-new").subscribe();
        storeBackedHeartbeat();

        heartbeatService.run();
        rows.put("c-new", connection("c-new", null));
        assertThat(heartbeatService.run()).isEqualTo(1);

        assertThat(localSessionSinks.isOpen("c-new")).isTrue();
    }

    @Test
    void failedHeartbeatNeverClosesSockets() {
        localSessionSinks.open("c-1").subscribe();
        when(connectionRepository.findAllById(anyIterable())).thenThrow(new IllegalStateException("database unavailable"));

        assertThat(heartbeatService.run()).isZero();
        assertThat(heartbeatService.run()).isZero();

        assertThat(localSessionSinks.isOpen("c-1")).isTrue();
    }

    private void openJoinedConnection(String connectionId) {
        rows.put(connectionId, connection(connectionId, "room-42"));
        localSessionSinks.open(connectionId).subscribe();
    }

    private void storeBackedHeartbeat() {
        storeBackedLookup();
        when(connectionRepository.touchAll(anyCollection(), any(), any())).thenAnswer(inv -> {
            Collection<String> ids = inv.getArgument(0);
            OffsetDateTime now = inv.getArgument(1);
            OffsetDateTime expiresAt = inv.getArgument(2);
            ids.forEach(id -> rows.computeIfPresent(id,
                    (key, row) -> row.toBuilder().lastActivityAt(now).expiresAt(expiresAt).build()));
            return ids.size();
        });
    }

    private void storeBackedLookup() {
        when(connectionRepository.findAllById(anyIterable())).thenAnswer(inv -> {
            List<ChannelConnection> found = new ArrayList<>();
            for (String id : inv.<Iterable<String>>getArgument(0)) {
                ChannelConnection row = rows.get(id);
                if (row != null) {
                    found.add(row);
                }
            }
            return found;
        });
    }

    private void storeBackedExpiryQuery() {
        when(connectionRepository.findExpiredIds(any(), anyInt())).thenAnswer(inv -> {
            OffsetDateTime now = inv.getArgument(0);
            int limit = inv.getArgument(1);
            return rows.values().stream()
                    .filter(row -> !row.getExpiresAt().isAfter(now))
                    .map(ChannelConnection::getId)
                    .limit(limit)
                    .toList();
        });
    }

    private void noRetentionBacklog() {
        when(chatMessageRepository.findExpiredIds(any(), anyInt())).thenReturn(List.of());
        when(liveStatusRepository.findExpiredKeys(any(), anyInt())).thenReturn(List.of());
    }

    private ChannelConnection connection(String id, String roomId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return ChannelConnection.builder()
                .id(id)
                .userId("alice")
                .podName("pod-a")
                .status("CONNECTED")
                .roomId(roomId)
                .roomJoinedAt(roomId == null ? null : now)
                .connectedAt(now)
                .lastActivityAt(now)
                .expiresAt(now.plusHours(2))
                .build();
    }

    private static final class SteppedClock extends Clock {

        private Instant instant;

        SteppedClock(Instant start) {
            this.instant = start;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
