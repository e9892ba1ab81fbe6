package com.example.presence.shared.service.broadcast;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.dto.OutboundMessage;
import com.example.presence.shared.dto.RelayEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Hands a frame to the pod that holds the target socket, via that pod's relay topic.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PodRelayPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final AppProperties appProperties;
    private final Clock clock;

    public String topicFor(String podName) {
        return appProperties.getKafka().getTopic().getNameRelayPrefix() + podName;
    }

    /**
     * DELIVERED once the broker acknowledges the relay, TRANSIENT_ERROR if the send fails.
     */
    public Mono<DeliveryOutcome> relay(String podName, String connectionId, OutboundMessage payload) {
        RelayEnvelope envelope = RelayEnvelope.builder()
                .connectionId(connectionId)
                .payload(payload)
                .sourcePod(appProperties.getPodName())
                .sentAt(OffsetDateTime.now(clock))
                .build();
        String topic = topicFor(podName);
        return Mono.fromFuture(() -> kafkaTemplate.send(topic, connectionId, envelope))
                .map(sendResult -> DeliveryOutcome.DELIVERED)
                .onErrorResume(e -> {
                    log.warn("Relay of {} to pod {} for connection {} failed: {}",
                            payload.getType(), podName, connectionId, e.getMessage());
                    return Mono.just(DeliveryOutcome.TRANSIENT_ERROR);
                });
    }
}
