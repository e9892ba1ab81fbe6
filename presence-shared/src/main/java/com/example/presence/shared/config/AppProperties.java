package com.example.presence.shared.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
public class AppProperties {

    private String podName;
    private String clusterName;

    private final Connection connection = new Connection();
    private final Broadcast broadcast = new Broadcast();
    private final Chat chat = new Chat();
    private final Status status = new Status();
    private final Auth auth = new Auth();
    private final Kafka kafka = new Kafka();
    private final Outbox outbox = new Outbox();
    private final Retry retry = new Retry();
    private final Cleanup cleanup = new Cleanup();
    private final Retention retention = new Retention();

    @Data
    public static class Connection {
        // Passive expiry window, refreshed on every touch
        private Duration ttl = Duration.ofHours(2);
        // Must stay well under the ttl
        @Positive
        private long heartbeatIntervalMs = 300_000L;
    }

    @Data
    public static class Broadcast {
        private Duration attemptTimeout = Duration.ofSeconds(5);
        @Positive
        private int maxConcurrency = 64;
    }

    @Data
    public static class Chat {
        private Duration retention = Duration.ofDays(30);
    }

    @Data
    public static class Status {
        private Duration ttl = Duration.ofHours(24);
    }

    @Data
    public static class Auth {
        private boolean enabled = true;
        private String tokenSecret = "";
    }

    @Data
    public static class Kafka {
        private final Topic topic = new Topic();
        private final Consumer consumer = new Consumer();

        @Data
        public static class Topic {
            @NotBlank
            private String nameRegistryMutations = "presence-registry-mutations";
            @NotBlank
            private String nameRelayPrefix = "presence-relay-";
            @NotBlank
            private String nameDeliveryDeadLetter = "notification-delivery-dlt";
            @Positive
            private int partitions = 6;
            @Positive
            private short replicationFactor = 1;
        }

        @Data
        public static class Consumer {
            @NotBlank
            private String groupChangeReactor = "presence-change-reactor-group";
            @NotBlank
            private String groupRelayPrefix = "presence-relay-group-";
        }
    }

    @Data
    public static class Outbox {
        @Positive
        private int pollBatchSize = 100;
        @Positive
        private long pollIntervalMs = 1000L;
    }

    @Data
    public static class Retry {
        private Duration baseDelay = Duration.ofSeconds(60);
        @Positive
        private int maxAttempts = 6;
        private Duration maxAge = Duration.ofHours(24);
        private Duration runTimeout = Duration.ofSeconds(300);
        private Duration attemptTimeout = Duration.ofSeconds(10);
        @Positive
        private int batchSize = 200;
        @Positive
        private long intervalMs = 1_800_000L;
        @NotBlank
        private String memoryClass = "512";
    }

    @Data
    public static class Cleanup {
        private Duration expiredNotificationGrace = Duration.ofDays(7);
        private Duration notificationRetention = Duration.ofDays(90);
        private Duration deliveryRecordRetention = Duration.ofDays(30);
        private Duration runTimeout = Duration.ofSeconds(900);
        @Positive
        private int batchSize = 25;
        @Positive
        private int topFailureReasons = 10;
        @NotBlank
        private String cron = "0 0 3 * * *";
        @NotBlank
        private String memoryClass = "512";
    }

    @Data
    public static class Retention {
        @Positive
        private long intervalMs = 3_600_000L;
        @Positive
        private int batchSize = 25;
    }
}
