package com.example.presence.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the presence and delivery services.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    @Bean
    public MeterBinder presenceMetrics() {
        return registry -> {
            registry.counter("presence.connections.registered");
            registry.counter("presence.connections.deregistered");

            registry.counter("presence.broadcast.outcomes", "outcome", "delivered");
            registry.counter("presence.broadcast.outcomes", "outcome", "gone");
            registry.counter("presence.broadcast.outcomes", "outcome", "transient_error");

            Timer.builder("presence.broadcast.latency")
                    .description("Time taken to fan a payload out to every target connection")
                    .register(registry);

            registry.counter("presence.delivery.attempts", "status", "success");
            registry.counter("presence.delivery.attempts", "status", "failed");
            registry.counter("presence.delivery.dead_lettered");

            registry.counter("presence.errors", "type", "database");
            registry.counter("presence.errors", "type", "kafka");
            registry.counter("presence.errors", "type", "websocket");
        };
    }

    @Bean
    public PresenceMetricsCollector presenceMetricsCollector(MeterRegistry registry) {
        return new PresenceMetricsCollector(registry);
    }

    /**
     * Caches meters by name and tags so hot paths don't go through the registry lookup.
     */
    public static class PresenceMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

        public PresenceMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            incrementCounter(name, 1, tags);
        }

        public void incrementCounter(String name, double amount, String... tags) {
            counters.computeIfAbsent(key(name, tags), k -> registry.counter(name, tags)).increment(amount);
        }

        public void recordTimer(String name, long durationMillis, String... tags) {
            timers.computeIfAbsent(key(name, tags), k -> Timer.builder(name).tags(tags).register(registry))
                    .record(durationMillis, TimeUnit.MILLISECONDS);
        }

        public void setGauge(String name, long value, String... tags) {
            AtomicLong gauge = gauges.computeIfAbsent(key(name, tags), k -> {
                AtomicLong newGauge = new AtomicLong();
                registry.gauge(name, Tags.of(tags), newGauge);
                return newGauge;
            });
            gauge.set(value);
        }

        private static String key(String name, String... tags) {
            return name + "_" + String.join("_", tags);
        }
    }
}
