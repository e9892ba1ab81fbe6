package com.example.presence.delivery.cleanup;

import com.example.presence.shared.model.DailyDeliveryMetrics;
import com.example.presence.shared.model.NotificationDeliveryRecord;
import com.example.presence.shared.util.Constants.DeliveryState;
import com.example.presence.shared.util.JsonUtils;

import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Rolls one day's delivery records up into per-channel figures.
 */
public final class DeliveryMetricsAggregator {

    private DeliveryMetricsAggregator() {}

    public static DailyDeliveryMetrics aggregate(LocalDate day, List<NotificationDeliveryRecord> records,
                                                 int topFailureReasons, OffsetDateTime calculatedAt) {
        Map<String, List<NotificationDeliveryRecord>> byChannel = records.stream()
                .collect(Collectors.groupingBy(NotificationDeliveryRecord::getChannel, TreeMap::new, Collectors.toList()));

        Map<String, Object> channelStats = new LinkedHashMap<>();
        Map<String, Object> averageLatency = new LinkedHashMap<>();
        byChannel.forEach((channel, channelRecords) -> {
            long sent = channelRecords.size();
            long delivered = channelRecords.stream().filter(DeliveryMetricsAggregator::isDelivered).count();
            long failed = channelRecords.stream().filter(DeliveryMetricsAggregator::isFailure).count();

            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("sent", sent);
            stats.put("delivered", delivered);
            stats.put("failed", failed);
            stats.put("deliveryRate", deliveryRate(delivered, sent));
            channelStats.put(channel, stats);
            averageLatency.put(channel, averageLatencyMs(channelRecords));
        });

        List<Map<String, Object>> failureReasons = records.stream()
                .filter(DeliveryMetricsAggregator::isFailure)
                .map(NotificationDeliveryRecord::getLastError)
                .filter(reason -> reason != null && !reason.isBlank())
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()))
                .entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()).thenComparing(Map.Entry.comparingByKey()))
                .limit(topFailureReasons)
                .map(e -> {
                    Map<String, Object> reason = new LinkedHashMap<>();
                    reason.put("reason", e.getKey());
                    reason.put("count", e.getValue());
                    return reason;
                })
                .toList();

        return DailyDeliveryMetrics.builder()
                .metricsDate(day)
                .totalNotifications(records.size())
                .channelStats(JsonUtils.toJson(channelStats))
                .averageLatencyMs(JsonUtils.toJson(averageLatency))
                .topFailureReasons(JsonUtils.toJson(failureReasons))
                .calculatedAt(calculatedAt)
                .build();
    }

    /**
     * delivered / sent * 100, rounded to two decimals; 0 when nothing was sent.
     */
    static double deliveryRate(long delivered, long sent) {
        if (sent == 0) {
            return 0.0;
        }
        return Math.round(delivered * 10_000.0 / sent) / 100.0;
    }

    private static double averageLatencyMs(List<NotificationDeliveryRecord> records) {
        return records.stream()
                .filter(DeliveryMetricsAggregator::isDelivered)
                .filter(r -> r.getDeliveredAt() != null && r.getFirstDispatchedAt() != null)
                .mapToLong(r -> Duration.between(r.getFirstDispatchedAt(), r.getDeliveredAt()).toMillis())
                .average()
                .orElse(0.0);
    }

    private static boolean isDelivered(NotificationDeliveryRecord record) {
        return DeliveryState.DELIVERED.name().equals(record.getState());
    }

    private static boolean isFailure(NotificationDeliveryRecord record) {
        String state = record.getState();
        return DeliveryState.DEAD_LETTERED.name().equals(state)
                || DeliveryState.FAILED.name().equals(state)
                || (DeliveryState.PENDING.name().equals(state) && record.getLastError() != null);
    }
}
