package com.example.presence.delivery.retry;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.dto.JobRunResult;
import com.example.presence.shared.model.NotificationDeliveryRecord;
import com.example.presence.shared.repository.NotificationDeliveryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetrySchedulerServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final OffsetDateTime NOW_UTC = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private NotificationDeliveryRepository deliveryRepository;
    @Mock
    private DeliveryAttemptExecutor attemptExecutor;

    private AppProperties properties;
    private RetrySchedulerService retrySchedulerService;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        retrySchedulerService = new RetrySchedulerService(deliveryRepository, attemptExecutor, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static NotificationDeliveryRecord due(String id, int attemptCount) {
        return NotificationDeliveryRecord.builder()
                .notificationId(id).channel("IN_APP").recipient("alice").state("PENDING").attemptCount(attemptCount)
                .firstDispatchedAt(NOW_UTC.minusHours(1)).nextRetryAt(NOW_UTC.minusMinutes(1))
                .build();
    }

    @Test
    void oneRecordsFailureDoesNotAbortTheRun() {
        NotificationDeliveryRecord broken = due("n-1", 1);
        NotificationDeliveryRecord healthy = due("n-2", 0);
        when(deliveryRepository.findDue(NOW_UTC, 200)).thenReturn(List.of(broken, healthy));
        when(attemptExecutor.attempt(broken)).thenThrow(new IllegalStateException("connection refused"));
        when(attemptExecutor.attempt(healthy)).thenReturn(Transition.delivered(0));

        JobRunResult result = retrySchedulerService.run();

        assertThat(result.getProcessed()).isEqualTo(2);
        assertThat(result.getSucceeded()).isEqualTo(1);
        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getErrors()).singleElement().asString().startsWith("n-1");
        assertThat(result.httpStatus()).isEqualTo(HttpStatus.MULTI_STATUS);
    }

    @Test
    void deadLetteredRecordIsNotPickedUpByTheNextRun() {
        NotificationDeliveryRecord lastChance = due("n-1", 5);
        when(deliveryRepository.findDue(NOW_UTC, 200)).thenReturn(List.of(lastChance), List.of());
        when(attemptExecutor.attempt(lastChance)).thenReturn(Transition.deadLetter(5, 6, "max attempts exceeded: timeout"));

        JobRunResult first = retrySchedulerService.run();
        JobRunResult second = retrySchedulerService.run();

        assertThat(first.getDetails()).containsEntry("deadLettered", 1);
        assertThat(second.getProcessed()).isZero();
        assertThat(second.httpStatus()).isEqualTo(HttpStatus.OK);
        verify(attemptExecutor, times(1)).attempt(any());
    }

    @Test
    void fullBatchesArePagedUntilAShortOne() {
        properties.getRetry().setBatchSize(2);
        NotificationDeliveryRecord a = due("n-1", 0);
        NotificationDeliveryRecord b = due("n-2", 0);
        NotificationDeliveryRecord c = due("n-3", 0);
        when(deliveryRepository.findDue(NOW_UTC, 2)).thenReturn(List.of(a, b), List.of(c));
        when(attemptExecutor.attempt(any())).thenReturn(Transition.retry(0, NOW_UTC.plusMinutes(1), "offline"));

        JobRunResult result = retrySchedulerService.run();

        assertThat(result.getProcessed()).isEqualTo(3);
        assertThat(result.getDetails()).containsEntry("retried", 3);
    }

    @Test
    void staleRecordsAreCountedAsSkipped() {
        NotificationDeliveryRecord raced = due("n-1", 0);
        when(deliveryRepository.findDue(NOW_UTC, 200)).thenReturn(List.of(raced));
        when(attemptExecutor.attempt(raced)).thenReturn(null);

        JobRunResult result = retrySchedulerService.run();

        assertThat(result.getDetails()).containsEntry("skipped", 1);
        assertThat(result.httpStatus()).isEqualTo(HttpStatus.OK);
    }

    @Test
    void runPastItsDeadlinePicksNoRecords() {
        properties.getRetry().setRunTimeout(Duration.ZERO);
        when(deliveryRepository.findDue(NOW_UTC, 200)).thenReturn(List.of(due("n-1", 0)));

        JobRunResult result = retrySchedulerService.run();

        verify(attemptExecutor, never()).attempt(any());
        assertThat(result.getDetails()).containsEntry("deadlineReached", true);
    }

    @Test
    void repositoryFailureMarksTheRunFatal() {
        when(deliveryRepository.findDue(NOW_UTC, 200)).thenThrow(new IllegalStateException("database down"));

        JobRunResult result = retrySchedulerService.run();

        assertThat(result.isFatal()).isTrue();
        assertThat(result.httpStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
