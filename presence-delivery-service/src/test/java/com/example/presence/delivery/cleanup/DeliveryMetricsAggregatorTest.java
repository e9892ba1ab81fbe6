package com.example.presence.delivery.cleanup;

import com.example.presence.shared.model.DailyDeliveryMetrics;
import com.example.presence.shared.model.NotificationDeliveryRecord;
import com.example.presence.shared.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryMetricsAggregatorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 5, 1);
    private static final OffsetDateTime START = DAY.atStartOfDay().atOffset(ZoneOffset.UTC);

    private static NotificationDeliveryRecord record(String id, String channel, String state, String lastError, long latencyMs) {
        NotificationDeliveryRecord.NotificationDeliveryRecordBuilder builder = NotificationDeliveryRecord.builder()
                .notificationId(id).channel(channel).state(state).lastError(lastError)
                .firstDispatchedAt(START.plusHours(1));
        if ("DELIVERED".equals(state)) {
            builder.deliveredAt(START.plusHours(1).plusNanos(latencyMs * 1_000_000));
        }
        return builder.build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void aggregatesRatesLatencyAndFailureReasonsPerChannel() {
        List<NotificationDeliveryRecord> records = List.of(
                record("n-1", "IN_APP", "DELIVERED", null, 1000),
                record("n-2", "IN_APP", "DELIVERED", null, 2000),
                record("n-3", "IN_APP", "DELIVERED", null, 3000),
                record("n-4", "IN_APP", "DEAD_LETTERED", "max attempts exceeded: offline", 0),
                record("n-5", "IN_APP", "PENDING", "recipient has no live connection", 0),
                record("n-6", "IN_APP", "PENDING", null, 0),
                record("n-7", "EMAIL", "FAILED", "no sender for channel", 0),
                record("n-8", "EMAIL", "FAILED", "no sender for channel", 0));

        DailyDeliveryMetrics metrics = DeliveryMetricsAggregator.aggregate(DAY, records, 10, START.plusDays(1));

        assertThat(metrics.getMetricsDate()).isEqualTo(DAY);
        assertThat(metrics.getTotalNotifications()).isEqualTo(8);

        Map<String, Object> channelStats = JsonUtils.parseJsonObject(metrics.getChannelStats());
        Map<String, Object> inApp = (Map<String, Object>) channelStats.get("IN_APP");
        assertThat(inApp).containsEntry("sent", 6).containsEntry("delivered", 3).containsEntry("failed", 2)
                .containsEntry("deliveryRate", 50.0);
        Map<String, Object> email = (Map<String, Object>) channelStats.get("EMAIL");
        assertThat(email).containsEntry("delivered", 0).containsEntry("failed", 2).containsEntry("deliveryRate", 0.0);

        assertThat(JsonUtils.parseJsonObject(metrics.getAverageLatencyMs()))
                .containsEntry("IN_APP", 2000.0)
                .containsEntry("EMAIL", 0.0);

        List<Map<String, Object>> reasons = JsonUtils.parseJsonArray(metrics.getTopFailureReasons());
        assertThat(reasons).hasSize(3);
        assertThat(reasons.get(0)).containsEntry("reason", "no sender for channel").containsEntry("count", 2);
    }

    @Test
    void failureReasonsAreCappedAtTheConfiguredTop() {
        List<NotificationDeliveryRecord> records = List.of(
                record("n-1", "IN_APP", "FAILED", "a", 0),
                record("n-2", "IN_APP", "FAILED", "b", 0),
                record("n-3", "IN_APP", "FAILED", "b", 0),
                record("n-4", "IN_APP", "FAILED", "c", 0));

        DailyDeliveryMetrics metrics = DeliveryMetricsAggregator.aggregate(DAY, records, 2, START);

        assertThat(JsonUtils.parseJsonArray(metrics.getTopFailureReasons()))
                .extracting(reason -> reason.get("reason"))
                .containsExactly("b", "a");
    }

    @Test
    void deliveryRateIsZeroWhenNothingWasSent() {
        assertThat(DeliveryMetricsAggregator.deliveryRate(0, 0)).isZero();
        assertThat(DeliveryMetricsAggregator.deliveryRate(1, 3)).isEqualTo(33.33);
    }
}
