package com.example.presence.shared.service.broadcast;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class LocalSessionSinksTest {

    private final LocalSessionSinks sinks = new LocalSessionSinks();

    @Test
    void emitToUnknownConnectionIsGone() {
        assertThat(sinks.emit("nobody", "{}")).isEqualTo(DeliveryOutcome.GONE);
    }

    @Test
    void emittedFramesReachTheOpenStream() {
        StepVerifier.create(sinks.open("c-1"))
                .then(() -> assertThat(sinks.emit("c-1", "frame-1")).isEqualTo(DeliveryOutcome.DELIVERED))
                .expectNext("frame-1")
                .then(() -> sinks.close("c-1"))
                .verifyComplete();
    }

    @Test
    void closedConnectionIsGone() {
        sinks.open("c-1");
        sinks.close("c-1");

        assertThat(sinks.emit("c-1", "frame")).isEqualTo(DeliveryOutcome.GONE);
        assertThat(sinks.isOpen("c-1")).isFalse();
    }
}
