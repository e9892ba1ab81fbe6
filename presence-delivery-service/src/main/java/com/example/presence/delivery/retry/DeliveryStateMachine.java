package com.example.presence.delivery.retry;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.model.NotificationDeliveryRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Transitions of a pending delivery record. Pure: no I/O, time comes in as an argument.
 * <pre>
 * PENDING --success--------------------------------> DELIVERED
 * PENDING --failure, attempts &lt; max, age &lt; max----> PENDING (next retry = now + delay)
 * PENDING --failure, attempts &gt;= max or age &gt;= max-> DEAD_LETTERED
 * PENDING --no sender for channel-----------------> FAILED
 * </pre>
 */
@Component
public class DeliveryStateMachine {

    static final String MAX_ATTEMPTS_REASON = "max attempts exceeded";
    static final String MAX_AGE_REASON = "max age exceeded";
    static final String NO_SENDER_REASON = "no sender for channel";

    private final RetryPolicy retryPolicy;
    private final int maxAttempts;
    private final Duration maxAge;

    @Autowired
    public DeliveryStateMachine(RetryPolicy retryPolicy, AppProperties appProperties) {
        this(retryPolicy, appProperties.getRetry().getMaxAttempts(), appProperties.getRetry().getMaxAge());
    }

    DeliveryStateMachine(RetryPolicy retryPolicy, int maxAttempts, Duration maxAge) {
        this.retryPolicy = retryPolicy;
        this.maxAttempts = maxAttempts;
        this.maxAge = maxAge;
    }

    /**
     * A due record that must not be attempted again: out of attempts or past its delivery window.
     * Returns null when the record may be attempted.
     */
    public Transition beforeAttempt(NotificationDeliveryRecord record, OffsetDateTime now) {
        if (record.getAttemptCount() >= maxAttempts) {
            return Transition.deadLetter(record.getAttemptCount(), record.getAttemptCount(), MAX_ATTEMPTS_REASON);
        }
        if (isTooOld(record, now)) {
            return Transition.deadLetter(record.getAttemptCount(), record.getAttemptCount(), MAX_AGE_REASON);
        }
        return null;
    }

    public Transition onSuccess(NotificationDeliveryRecord record) {
        return Transition.delivered(record.getAttemptCount());
    }

    public Transition onFailure(NotificationDeliveryRecord record, String error, OffsetDateTime now) {
        int attemptIndex = record.getAttemptCount();
        int attemptsMade = attemptIndex + 1;
        if (attemptsMade >= maxAttempts) {
            return Transition.deadLetter(attemptIndex, attemptsMade, MAX_ATTEMPTS_REASON + ": " + error);
        }
        if (isTooOld(record, now)) {
            return Transition.deadLetter(attemptIndex, attemptsMade, MAX_AGE_REASON + ": " + error);
        }
        return Transition.retry(attemptIndex, now.plus(retryPolicy.delay(attemptIndex)), error);
    }

    public Transition onMissingSender(NotificationDeliveryRecord record) {
        return Transition.failed(record.getAttemptCount(), NO_SENDER_REASON);
    }

    private boolean isTooOld(NotificationDeliveryRecord record, OffsetDateTime now) {
        return record.getFirstDispatchedAt() != null
                && Duration.between(record.getFirstDispatchedAt(), now).compareTo(maxAge) >= 0;
    }
}
