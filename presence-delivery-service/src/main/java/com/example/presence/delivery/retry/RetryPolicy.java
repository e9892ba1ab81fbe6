package com.example.presence.delivery.retry;

import com.example.presence.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exponential backoff: {@code delay(k) = baseDelay * 2^k} for the 0-based index of the failed attempt.
 */
@Component
public class RetryPolicy {

    private final Duration baseDelay;

    @Autowired
    public RetryPolicy(AppProperties appProperties) {
        this(appProperties.getRetry().getBaseDelay());
    }

    RetryPolicy(Duration baseDelay) {
        this.baseDelay = baseDelay;
    }

    public Duration delay(int attemptIndex) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be >= 0, was " + attemptIndex);
        }
        return baseDelay.multipliedBy(1L << Math.min(attemptIndex, 30));
    }
}
