package com.example.presence.delivery.dispatch;

import com.example.presence.delivery.retry.DeliveryAttemptExecutor;
import com.example.presence.delivery.retry.DeliveryRecordWriter;
import com.example.presence.delivery.retry.Transition;
import com.example.presence.shared.model.NotificationDeliveryRecord;
import com.example.presence.shared.repository.NotificationDeliveryRepository;
import com.example.presence.shared.util.Constants.NotificationChannel;
import com.example.presence.shared.util.JsonUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationDispatchServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final OffsetDateTime NOW_UTC = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private DeliveryRecordWriter recordWriter;
    @Mock
    private NotificationDeliveryRepository deliveryRepository;
    @Mock
    private DeliveryAttemptExecutor attemptExecutor;

    private NotificationDispatchService dispatchService;

    @BeforeEach
    void setUp() {
        dispatchService = new NotificationDispatchService(recordWriter, deliveryRepository, attemptExecutor,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static DispatchRequest request(String notificationId) {
        return DispatchRequest.builder()
                .notificationId(notificationId)
                .userId("alice")
                .channel(NotificationChannel.IN_APP)
                .title("Build finished")
                .body("Your export is ready")
                .type("export")
                .data(Map.of("exportId", "e-7"))
                .build();
    }

    private static NotificationDeliveryRecord record(String state, int attemptCount) {
        return NotificationDeliveryRecord.builder()
                .notificationId("n-1").channel("IN_APP").recipient("alice").state(state).attemptCount(attemptCount)
                .firstDispatchedAt(NOW_UTC)
                .build();
    }

    @Test
    void newNotificationIsAttemptedImmediatelyAtAttemptZero() {
        NotificationDeliveryRecord pending = record("PENDING", 0);
        when(recordWriter.create(eq("n-1"), eq("alice"), eq("Build finished"), eq("Your export is ready"), eq("export"),
                isNull(), eq("IN_APP"), anyString(), eq(NOW_UTC))).thenReturn(true);
        when(deliveryRepository.findById("n-1")).thenReturn(Optional.of(pending), Optional.of(record("DELIVERED", 1)));
        when(attemptExecutor.attempt(pending)).thenReturn(Transition.delivered(0));

        DispatchResponse response = dispatchService.dispatch(request("n-1"));

        verify(attemptExecutor).attempt(pending);
        assertThat(response.isDuplicate()).isFalse();
        assertThat(response.getState()).isEqualTo("DELIVERED");
        assertThat(response.getAttemptCount()).isEqualTo(1);
    }

    @Test
    void payloadCarriesTitleBodyTypeAndData() {
        when(recordWriter.create(any(), any(), any(), any(), any(), any(), any(), anyString(), any())).thenReturn(true);
        when(deliveryRepository.findById("n-1")).thenReturn(Optional.of(record("PENDING", 0)));

        dispatchService.dispatch(request("n-1"));

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(recordWriter).create(any(), any(), any(), any(), any(), any(), any(), payload.capture(), any());
        assertThat(JsonUtils.parseJsonObject(payload.getValue()))
                .containsEntry("title", "Build finished")
                .containsEntry("body", "Your export is ready")
                .containsEntry("type", "export")
                .containsEntry("data", Map.of("exportId", "e-7"));
    }

    @Test
    void repeatedDispatchReturnsCurrentStateWithoutSending() {
        when(recordWriter.create(any(), any(), any(), any(), any(), any(), any(), anyString(), any())).thenReturn(false);
        when(deliveryRepository.findById("n-1")).thenReturn(Optional.of(record("PENDING", 2)));

        DispatchResponse response = dispatchService.dispatch(request("n-1"));

        verify(attemptExecutor, never()).attempt(any());
        assertThat(response.isDuplicate()).isTrue();
        assertThat(response.getAttemptCount()).isEqualTo(2);
    }

    @Test
    void missingIdIsGenerated() {
        ArgumentCaptor<String> id = ArgumentCaptor.forClass(String.class);
        when(recordWriter.create(id.capture(), any(), any(), any(), any(), any(), any(), anyString(), any())).thenReturn(false);
        when(deliveryRepository.findById(anyString())).thenReturn(Optional.of(record("PENDING", 0)));

        dispatchService.dispatch(request(null));

        assertThat(id.getValue()).isNotBlank();
    }
}
