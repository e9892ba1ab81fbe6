package com.example.presence.delivery.retry;

import com.example.presence.shared.config.AppProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final RetryPolicy retryPolicy = new RetryPolicy(new AppProperties());

    @Test
    void delayDoublesFromOneMinute() {
        assertThat(retryPolicy.delay(0)).isEqualTo(Duration.ofMillis(60_000));
        assertThat(retryPolicy.delay(1)).isEqualTo(Duration.ofMillis(120_000));
        assertThat(retryPolicy.delay(2)).isEqualTo(Duration.ofMillis(240_000));
        assertThat(retryPolicy.delay(3)).isEqualTo(Duration.ofMillis(480_000));
        assertThat(retryPolicy.delay(4)).isEqualTo(Duration.ofMillis(960_000));
        assertThat(retryPolicy.delay(5)).isEqualTo(Duration.ofMillis(1_920_000));
    }

    @Test
    void customBaseDelayIsHonoured() {
        assertThat(new RetryPolicy(Duration.ofSeconds(5)).delay(3)).isEqualTo(Duration.ofSeconds(40));
    }

    @Test
    void negativeIndexIsRejected() {
        assertThatThrownBy(() -> retryPolicy.delay(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
