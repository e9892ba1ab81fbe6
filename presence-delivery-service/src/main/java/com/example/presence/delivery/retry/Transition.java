package com.example.presence.delivery.retry;

import java.time.OffsetDateTime;

/**
 * The state change one attempt (or skipped attempt) produces for a pending delivery record.
 *
 * @param expectedAttempts attempt count the record must still have for the write to apply
 */
public record Transition(Kind kind, int expectedAttempts, int newAttemptCount, OffsetDateTime nextRetryAt, String reason) {

    public enum Kind {
        DELIVERED,
        RETRY,
        DEAD_LETTER,
        FAILED
    }

    public static Transition delivered(int expectedAttempts) {
        return new Transition(Kind.DELIVERED, expectedAttempts, expectedAttempts + 1, null, null);
    }

    public static Transition retry(int expectedAttempts, OffsetDateTime nextRetryAt, String reason) {
        return new Transition(Kind.RETRY, expectedAttempts, expectedAttempts + 1, nextRetryAt, reason);
    }

    public static Transition deadLetter(int expectedAttempts, int newAttemptCount, String reason) {
        return new Transition(Kind.DEAD_LETTER, expectedAttempts, newAttemptCount, null, reason);
    }

    public static Transition failed(int expectedAttempts, String reason) {
        return new Transition(Kind.FAILED, expectedAttempts, expectedAttempts, null, reason);
    }
}
