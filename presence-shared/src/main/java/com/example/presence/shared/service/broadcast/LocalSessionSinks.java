package com.example.presence.shared.service.broadcast;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Outbound frame sinks for the sockets physically attached to this pod.
 * Only a delivery channel: presence questions always go to the registry.
 */
@Component
@Slf4j
public class LocalSessionSinks {

    private final Map<String, Sinks.Many<String>> sinks = new ConcurrentHashMap<>();

    @PreDestroy
    public void cleanup() {
        if (!sinks.isEmpty()) {
            log.info("Completing {} local session sinks on shutdown", sinks.size());
            new ArrayList<>(sinks.keySet()).forEach(this::close);
        }
    }

    /**
     * Opens the sink for a newly accepted socket and returns the frames to write to it.
     */
    public Flux<String> open(String connectionId) {
        Sinks.Many<String> sink = Sinks.many().multicast().onBackpressureBuffer();
        Sinks.Many<String> previous = sinks.put(connectionId, sink);
        if (previous != null) {
            log.warn("Replacing existing local sink for connection {}", connectionId);
            previous.tryEmitComplete();
        }
        return sink.asFlux();
    }

    public DeliveryOutcome emit(String connectionId, String frame) {
        Sinks.Many<String> sink = sinks.get(connectionId);
        if (sink == null) {
            return DeliveryOutcome.GONE;
        }
        Sinks.EmitResult result = sink.tryEmitNext(frame);
        switch (result) {
            case OK:
                return DeliveryOutcome.DELIVERED;
            case FAIL_TERMINATED:
            case FAIL_CANCELLED:
                sinks.remove(connectionId, sink);
                return DeliveryOutcome.GONE;
            default:
                // FAIL_OVERFLOW, FAIL_NON_SERIALIZED, FAIL_ZERO_SUBSCRIBER
                log.warn("Failed to emit frame to connection {}. Result: {}", connectionId, result);
                return DeliveryOutcome.TRANSIENT_ERROR;
        }
    }

    public void close(String connectionId) {
        Sinks.Many<String> sink = sinks.remove(connectionId);
        if (sink != null) {
            sink.tryEmitComplete();
        }
    }

    public boolean isOpen(String connectionId) {
        return sinks.containsKey(connectionId);
    }

    public int size() {
        return sinks.size();
    }

    public Set<String> connectionIds() {
        return Set.copyOf(sinks.keySet());
    }
}
