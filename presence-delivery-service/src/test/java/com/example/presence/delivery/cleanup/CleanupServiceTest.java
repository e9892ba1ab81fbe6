package com.example.presence.delivery.cleanup;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.dto.JobRunResult;
import com.example.presence.shared.model.NotificationDeliveryRecord;
import com.example.presence.shared.repository.DailyDeliveryMetricsRepository;
import com.example.presence.shared.repository.NotificationDeliveryRepository;
import com.example.presence.shared.repository.NotificationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CleanupServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-02T03:00:00Z");
    private static final OffsetDateTime NOW_UTC = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private NotificationRepository notificationRepository;
    @Mock
    private NotificationDeliveryRepository deliveryRepository;
    @Mock
    private DailyDeliveryMetricsRepository metricsRepository;

    private CleanupService cleanupService;

    @BeforeEach
    void setUp() {
        cleanupService = new CleanupService(notificationRepository, deliveryRepository, metricsRepository,
                new AppProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static List<String> ids(String prefix, int count) {
        return IntStream.range(0, count).mapToObj(i -> prefix + i).collect(Collectors.toList());
    }

    @Test
    void deletingSixtyDeliveryRecordsTakesThreeBatches() {
        when(deliveryRepository.findIdsLastActiveBefore(NOW_UTC.minusDays(30))).thenReturn(ids("d-", 60));

        JobRunResult result = cleanupService.run(false, EnumSet.of(CleanupTask.CLEANUP_DELIVERY_RECORDS));

        verify(deliveryRepository, times(3)).deleteAllById(any());
        assertThat(result.getDetails()).containsEntry("CLEANUP_DELIVERY_RECORDS", 60);
        assertThat(result.httpStatus()).isEqualTo(HttpStatus.OK);
    }

    @Test
    void expiryMarksInBatchesOfTwentyFive() {
        when(notificationRepository.findIdsToExpire(NOW_UTC)).thenReturn(ids("n-", 26));

        JobRunResult result = cleanupService.run(false, EnumSet.of(CleanupTask.EXPIRE_NOTIFICATIONS));

        verify(notificationRepository, times(2)).markExpired(any(), eq(NOW_UTC));
        assertThat(result.getDetails()).containsEntry("EXPIRE_NOTIFICATIONS", 26);
    }

    @Test
    void oldNotificationsCombineExpiredGraceAndReadRetention() {
        when(notificationRepository.findExpiredIdsBefore(NOW_UTC.minusDays(7))).thenReturn(List.of("n-1", "n-2"));
        when(notificationRepository.findReadOrDismissedIdsBefore(NOW_UTC.minusDays(90))).thenReturn(List.of("n-2", "n-3"));

        JobRunResult result = cleanupService.run(false, EnumSet.of(CleanupTask.CLEANUP_OLD_NOTIFICATIONS));

        verify(notificationRepository).deleteAllById(List.of("n-1", "n-2", "n-3"));
        assertThat(result.getDetails()).containsEntry("CLEANUP_OLD_NOTIFICATIONS", 3);
    }

    @Test
    void dryRunReportsTheSameCountsWithoutWriting() {
        when(notificationRepository.findIdsToExpire(NOW_UTC)).thenReturn(ids("n-", 30));
        when(notificationRepository.findExpiredIdsBefore(any())).thenReturn(ids("e-", 4));
        when(notificationRepository.findReadOrDismissedIdsBefore(any())).thenReturn(List.of());
        when(deliveryRepository.findIdsLastActiveBefore(any())).thenReturn(ids("d-", 51));
        when(deliveryRepository.findActiveBetween(any(), any())).thenReturn(List.of());
        when(deliveryRepository.findOrphanedIds()).thenReturn(ids("o-", 2));

        JobRunResult result = cleanupService.run(true, EnumSet.allOf(CleanupTask.class));

        verify(notificationRepository, never()).markExpired(any(), any());
        verify(notificationRepository, never()).deleteAllById(any());
        verify(deliveryRepository, never()).deleteAllById(any());
        verify(metricsRepository, never()).upsert(any(), anyInt(), anyString(), anyString(), anyString(), any());
        assertThat(result.isDryRun()).isTrue();
        assertThat(result.getDetails())
                .containsEntry("EXPIRE_NOTIFICATIONS", 30)
                .containsEntry("CLEANUP_OLD_NOTIFICATIONS", 4)
                .containsEntry("CLEANUP_DELIVERY_RECORDS", 51)
                .containsEntry("AGGREGATE_METRICS", 0)
                .containsEntry("CLEANUP_ORPHANED_RECORDS", 2);
    }

    @Test
    void oneFailingTaskDoesNotStopTheOthers() {
        when(notificationRepository.findIdsToExpire(NOW_UTC)).thenThrow(new IllegalStateException("statement timeout"));
        when(notificationRepository.findExpiredIdsBefore(any())).thenReturn(List.of());
        when(notificationRepository.findReadOrDismissedIdsBefore(any())).thenReturn(List.of());
        when(deliveryRepository.findIdsLastActiveBefore(any())).thenReturn(List.of());
        when(deliveryRepository.findActiveBetween(any(), any())).thenReturn(List.of());
        when(deliveryRepository.findOrphanedIds()).thenReturn(List.of("o-1"));

        JobRunResult result = cleanupService.run(false, EnumSet.allOf(CleanupTask.class));

        verify(deliveryRepository).deleteAllById(List.of("o-1"));
        assertThat(result.getErrors()).singleElement().asString().startsWith("EXPIRE_NOTIFICATIONS");
        assertThat(result.getDetails()).containsEntry("CLEANUP_ORPHANED_RECORDS", 1).doesNotContainKey("EXPIRE_NOTIFICATIONS");
        assertThat(result.httpStatus()).isEqualTo(HttpStatus.MULTI_STATUS);
    }

    @Test
    void metricsCoverThePreviousUtcDay() {
        OffsetDateTime dayStart = OffsetDateTime.of(2024, 5, 1, 0, 0, 0, 0, ZoneOffset.UTC);
        NotificationDeliveryRecord delivered = NotificationDeliveryRecord.builder()
                .notificationId("n-1").channel("IN_APP").state("DELIVERED")
                .firstDispatchedAt(dayStart.plusHours(1)).deliveredAt(dayStart.plusHours(1).plusSeconds(2))
                .build();
        when(deliveryRepository.findActiveBetween(dayStart, dayStart.plusDays(1))).thenReturn(List.of(delivered));

        JobRunResult result = cleanupService.run(false, EnumSet.of(CleanupTask.AGGREGATE_METRICS));

        verify(metricsRepository).upsert(eq(LocalDate.of(2024, 5, 1)), eq(1), anyString(), anyString(), anyString(), eq(NOW_UTC));
        assertThat(result.getDetails()).containsEntry("AGGREGATE_METRICS", 1);
    }
}
