package com.example.presence.delivery.controller;

import com.example.presence.shared.exception.ResourceNotFoundException;
import com.example.presence.shared.model.DailyDeliveryMetrics;
import com.example.presence.shared.repository.DailyDeliveryMetricsRepository;
import com.example.presence.shared.util.JsonUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/metrics")
public class MetricsController {

    private final DailyDeliveryMetricsRepository metricsRepository;
    private final Scheduler jdbcScheduler;

    public MetricsController(DailyDeliveryMetricsRepository metricsRepository,
                             @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.metricsRepository = metricsRepository;
        this.jdbcScheduler = jdbcScheduler;
    }

    @GetMapping("/{date}")
    public Mono<ResponseEntity<Map<String, Object>>> getDailyMetrics(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return Mono.fromCallable(() -> metricsRepository.findById(date)
                        .orElseThrow(() -> new ResourceNotFoundException("No delivery metrics for " + date)))
                .subscribeOn(jdbcScheduler)
                .map(metrics -> ResponseEntity.ok(toBody(metrics)));
    }

    private static Map<String, Object> toBody(DailyDeliveryMetrics metrics) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("metricsDate", metrics.getMetricsDate());
        body.put("totalNotifications", metrics.getTotalNotifications());
        body.put("channelStats", JsonUtils.parseJsonObject(metrics.getChannelStats()));
        body.put("averageLatencyMs", JsonUtils.parseJsonObject(metrics.getAverageLatencyMs()));
        body.put("topFailureReasons", JsonUtils.parseJsonArray(metrics.getTopFailureReasons()));
        body.put("calculatedAt", metrics.getCalculatedAt());
        return body;
    }
}
