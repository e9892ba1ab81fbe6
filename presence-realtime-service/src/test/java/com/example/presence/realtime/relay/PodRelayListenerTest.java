package com.example.presence.realtime.relay;

import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.dto.OutboundMessage;
import com.example.presence.shared.dto.RelayEnvelope;
import com.example.presence.shared.service.broadcast.LocalSessionSinks;
import com.example.presence.shared.service.registry.ConnectionRegistry;
import com.example.presence.shared.util.Constants.OutboundType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PodRelayListenerTest {

    @Mock
    private ConnectionRegistry connectionRegistry;
    @Mock
    private Acknowledgment acknowledgment;

    private LocalSessionSinks localSessionSinks;
    private PodRelayListener listener;

    @BeforeEach
    void setUp() {
        localSessionSinks = new LocalSessionSinks();
        listener = new PodRelayListener(localSessionSinks, connectionRegistry,
                new MonitoringConfig.PresenceMetricsCollector(new SimpleMeterRegistry()));
    }

    @Test
    void deliversToTheLocalSocket() {
        List<String> frames = new ArrayList<>();
        localSessionSinks.open("c-1").subscribe(frames::add);

        listener.onRelay(envelope("c-1"), acknowledgment);

        assertThat(frames).singleElement().asString().contains("\"type\":\"chatMessage\"");
        verify(connectionRegistry, never()).deregister(any());
        verify(acknowledgment).acknowledge();
    }

    @Test
    void missingSocketIsDeregisteredHere() {
        listener.onRelay(envelope("c-gone"), acknowledgment);

        verify(connectionRegistry).deregister("c-gone");
        verify(acknowledgment).acknowledge();
    }

    @Test
    void failedSelfHealingStillAcknowledges() {
        doThrow(new IllegalStateException("db down")).when(connectionRegistry).deregister("c-gone");

        listener.onRelay(envelope("c-gone"), acknowledgment);

        verify(acknowledgment).acknowledge();
    }

    private static RelayEnvelope envelope(String connectionId) {
        return RelayEnvelope.builder()
                .connectionId(connectionId)
                .payload(OutboundMessage.of(OutboundType.CHAT_MESSAGE, Map.of("message", "hello")))
                .sourcePod("pod-b")
                .build();
    }
}
