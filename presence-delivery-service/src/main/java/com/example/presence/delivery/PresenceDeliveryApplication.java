package com.example.presence.delivery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.annotation.EnableAsync;
import reactor.core.publisher.Hooks;

/**
 * Notification dispatch, retry scheduling, dead-letter administration and daily cleanup.
 */
@SpringBootApplication
@EnableAsync
@ComponentScan("com.example.presence")
public class PresenceDeliveryApplication {

    static {
        // Carries the MDC correlation id across Reactor schedulers
        Hooks.enableAutomaticContextPropagation();
    }

    public static void main(String[] args) {
        SpringApplication.run(PresenceDeliveryApplication.class, args);
    }
}
