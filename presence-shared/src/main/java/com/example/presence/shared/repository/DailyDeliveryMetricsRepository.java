package com.example.presence.shared.repository;

import com.example.presence.shared.model.DailyDeliveryMetrics;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Repository
public interface DailyDeliveryMetricsRepository extends CrudRepository<DailyDeliveryMetrics, LocalDate> {

    @Modifying
    @Query("""
        INSERT INTO delivery_metrics_daily
            (metrics_date, total_notifications, channel_stats, average_latency_ms, top_failure_reasons, calculated_at)
        VALUES
            (:metricsDate, :totalNotifications, :channelStats, :averageLatencyMs, :topFailureReasons, :calculatedAt)
        ON CONFLICT (metrics_date) DO UPDATE SET
            total_notifications = EXCLUDED.total_notifications,
            channel_stats = EXCLUDED.channel_stats,
            average_latency_ms = EXCLUDED.average_latency_ms,
            top_failure_reasons = EXCLUDED.top_failure_reasons,
            calculated_at = EXCLUDED.calculated_at
    """)
    int upsert(@Param("metricsDate") LocalDate metricsDate,
               @Param("totalNotifications") int totalNotifications,
               @Param("channelStats") String channelStats,
               @Param("averageLatencyMs") String averageLatencyMs,
               @Param("topFailureReasons") String topFailureReasons,
               @Param("calculatedAt") OffsetDateTime calculatedAt);
}
