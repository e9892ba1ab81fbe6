package com.example.presence.realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.annotation.EnableAsync;
import reactor.core.publisher.Hooks;

/**
 * Real-time presence service: WebSocket sessions, rooms, chat and live status,
 * plus the change reactor that turns registry mutations into presence events.
 */
@SpringBootApplication
@EnableAsync
@ComponentScan("com.example.presence")
public class PresenceRealtimeApplication {

    static {
        // Carries the MDC correlation id across Reactor scheduler hops
        Hooks.enableAutomaticContextPropagation();
    }

    public static void main(String[] args) {
        SpringApplication.run(PresenceRealtimeApplication.class, args);
    }
}
