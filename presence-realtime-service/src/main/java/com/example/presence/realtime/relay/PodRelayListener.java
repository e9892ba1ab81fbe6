package com.example.presence.realtime.relay;

import com.example.presence.shared.config.MonitoringConfig.PresenceMetricsCollector;
import com.example.presence.shared.dto.RelayEnvelope;
import com.example.presence.shared.service.broadcast.DeliveryOutcome;
import com.example.presence.shared.service.broadcast.LocalSessionSinks;
import com.example.presence.shared.service.registry.ConnectionRegistry;
import com.example.presence.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

/**
 * Delivers frames relayed by other pods to the sockets held here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PodRelayListener {

    private final LocalSessionSinks localSessionSinks;
    private final ConnectionRegistry connectionRegistry;
    private final PresenceMetricsCollector metricsCollector;

    @KafkaListener(
        topics = "#{@kafkaListenerHelper.getRelayTopic()}",
        groupId = "#{@kafkaListenerHelper.getRelayGroupId()}",
        containerFactory = "#{@kafkaListenerHelper.getRelayContainerFactory()}"
    )
    public void onRelay(@Payload RelayEnvelope envelope, Acknowledgment acknowledgment) {
        String connectionId = envelope.getConnectionId();
        DeliveryOutcome outcome = localSessionSinks.emit(connectionId, JsonUtils.toJson(envelope.getPayload()));
        metricsCollector.incrementCounter("presence.relay.received", "outcome", outcome.name());

        if (outcome == DeliveryOutcome.GONE) {
            log.warn("Relayed {} from pod {} found no socket for connection {}; deregistering",
                    envelope.getPayload() == null ? null : envelope.getPayload().getType(), envelope.getSourcePod(), connectionId);
            try {
                connectionRegistry.deregister(connectionId);
            } catch (Exception e) {
                log.error("Self-healing deregistration of {} failed: {}", connectionId, e.getMessage());
            }
        } else if (outcome == DeliveryOutcome.TRANSIENT_ERROR) {
            log.warn("Relayed frame for connection {} could not be emitted locally", connectionId);
        }
        acknowledgment.acknowledge();
    }
}
