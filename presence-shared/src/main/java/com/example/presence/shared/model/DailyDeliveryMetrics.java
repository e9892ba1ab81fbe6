package com.example.presence.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Per-day delivery rollup. Per-channel figures are stored as JSON objects keyed by channel name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("delivery_metrics_daily")
public class DailyDeliveryMetrics {
    @Id
    private LocalDate metricsDate;
    private int totalNotifications;
    private String channelStats; // JSON: {"IN_APP": {"sent":..,"delivered":..,"failed":..,"deliveryRate":..}}
    private String averageLatencyMs; // JSON: {"IN_APP": 1234.5}
    private String topFailureReasons; // JSON: [{"reason":..,"count":..}]
    private OffsetDateTime calculatedAt;
}
