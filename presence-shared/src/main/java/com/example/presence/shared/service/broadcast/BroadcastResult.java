package com.example.presence.shared.service.broadcast;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-target outcomes of one broadcast. Always holds exactly one entry per distinct target.
 */
public class BroadcastResult {

    private static final BroadcastResult EMPTY = new BroadcastResult(Map.of());

    private final Map<String, DeliveryOutcome> outcomes;

    public BroadcastResult(Map<String, DeliveryOutcome> outcomes) {
        this.outcomes = Collections.unmodifiableMap(outcomes);
    }

    public static BroadcastResult empty() {
        return EMPTY;
    }

    public Map<String, DeliveryOutcome> getOutcomes() {
        return outcomes;
    }

    public DeliveryOutcome outcomeOf(String connectionId) {
        return outcomes.get(connectionId);
    }

    public int size() {
        return outcomes.size();
    }

    public long count(DeliveryOutcome outcome) {
        return outcomes.values().stream().filter(outcome::equals).count();
    }

    public long deliveredCount() {
        return count(DeliveryOutcome.DELIVERED);
    }

    public Set<String> targetsWith(DeliveryOutcome outcome) {
        return outcomes.entrySet().stream()
                .filter(e -> e.getValue() == outcome)
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());
    }

    @Override
    public String toString() {
        return "BroadcastResult{targets=" + outcomes.size()
                + ", delivered=" + count(DeliveryOutcome.DELIVERED)
                + ", gone=" + count(DeliveryOutcome.GONE)
                + ", transientError=" + count(DeliveryOutcome.TRANSIENT_ERROR) + "}";
    }
}
