package com.example.presence.shared.service.broadcast;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.dto.OutboundMessage;
import com.example.presence.shared.model.ChannelConnection;
import com.example.presence.shared.service.registry.ConnectionRegistry;
import com.example.presence.shared.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Concurrent fan-out of one payload to a set of connections.
 * <p>
 * Every target is attempted, the returned result settles only after all attempts
 * have, and a failing target never holds up its siblings. Targets that turn out to be
 * gone are deregistered before the result is emitted.
 */
@Service
@Slf4j
public class MessageBroadcaster {

    private final ConnectionRegistry connectionRegistry;
    private final LocalSessionSinks localSessionSinks;
    private final PodRelayPublisher podRelayPublisher;
    private final AppProperties appProperties;
    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;
    private final Scheduler jdbcScheduler;

    public MessageBroadcaster(ConnectionRegistry connectionRegistry,
                              LocalSessionSinks localSessionSinks,
                              PodRelayPublisher podRelayPublisher,
                              AppProperties appProperties,
                              MonitoringConfig.PresenceMetricsCollector metricsCollector,
                              @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.connectionRegistry = connectionRegistry;
        this.localSessionSinks = localSessionSinks;
        this.podRelayPublisher = podRelayPublisher;
        this.appProperties = appProperties;
        this.metricsCollector = metricsCollector;
        this.jdbcScheduler = jdbcScheduler;
    }

    public Mono<BroadcastResult> broadcast(Collection<String> targets, OutboundMessage payload) {
        Set<String> distinctTargets = new LinkedHashSet<>(targets);
        if (distinctTargets.isEmpty()) {
            return Mono.just(BroadcastResult.empty());
        }
        String frame = JsonUtils.toJson(payload);
        Duration attemptTimeout = appProperties.getBroadcast().getAttemptTimeout();
        long startTime = System.currentTimeMillis();

        return Flux.fromIterable(distinctTargets)
                .flatMap(connectionId -> attempt(connectionId, frame, payload, attemptTimeout),
                        appProperties.getBroadcast().getMaxConcurrency())
                .collectMap(Tuple2::getT1, Tuple2::getT2)
                .flatMap(outcomes -> selfHeal(outcomes).thenReturn(new BroadcastResult(outcomes)))
                .doOnNext(result -> {
                    recordMetrics(result, System.currentTimeMillis() - startTime);
                    log.debug("Broadcast of {} settled: {}", payload.getType(), result);
                });
    }

    private Mono<Tuple2<String, DeliveryOutcome>> attempt(String connectionId, String frame,
                                                          OutboundMessage payload, Duration timeout) {
        return Mono.fromCallable(() -> connectionRegistry.find(connectionId))
                .subscribeOn(jdbcScheduler)
                .flatMap(record -> deliver(connectionId, record, frame, payload))
                .timeout(timeout)
                .onErrorResume(e -> {
                    if (e instanceof TimeoutException) {
                        log.warn("Delivery to connection {} timed out after {}", connectionId, timeout);
                    } else {
                        log.warn("Delivery to connection {} failed: {}", connectionId, e.getMessage());
                    }
                    return Mono.just(DeliveryOutcome.TRANSIENT_ERROR);
                })
                .map(outcome -> Tuples.of(connectionId, outcome));
    }

    private Mono<DeliveryOutcome> deliver(String connectionId, Optional<ChannelConnection> record,
                                          String frame, OutboundMessage payload) {
        if (record.isEmpty()) {
            return Mono.just(DeliveryOutcome.GONE);
        }
        String podName = record.get().getPodName();
        if (appProperties.getPodName().equals(podName)) {
            return Mono.fromSupplier(() -> localSessionSinks.emit(connectionId, frame));
        }
        return podRelayPublisher.relay(podName, connectionId, payload);
    }

    private Mono<Void> selfHeal(Map<String, DeliveryOutcome> outcomes) {
        return Flux.fromIterable(outcomes.entrySet())
                .filter(e -> e.getValue() == DeliveryOutcome.GONE)
                .map(Map.Entry::getKey)
                .flatMap(connectionId -> Mono.fromRunnable(() -> deregisterGone(connectionId))
                        .subscribeOn(jdbcScheduler))
                .then();
    }

    private void deregisterGone(String connectionId) {
        try {
            connectionRegistry.deregister(connectionId);
            log.warn("Removed stale connection {} after a gone delivery", connectionId);
        } catch (Exception e) {
            log.error("Failed to deregister stale connection {}: {}", connectionId, e.getMessage());
        }
    }

    private void recordMetrics(BroadcastResult result, long durationMillis) {
        metricsCollector.recordTimer("presence.broadcast.latency", durationMillis);
        for (DeliveryOutcome outcome : DeliveryOutcome.values()) {
            long count = result.count(outcome);
            if (count > 0) {
                metricsCollector.incrementCounter("presence.broadcast.outcomes", count, "outcome", outcome.name().toLowerCase());
            }
        }
    }
}
