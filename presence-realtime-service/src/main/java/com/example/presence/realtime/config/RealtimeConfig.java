package com.example.presence.realtime.config;

import com.example.presence.realtime.auth.CredentialValidator;
import com.example.presence.realtime.auth.HmacCredentialValidator;
import com.example.presence.realtime.reactor.CollaboratorResolver;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.service.KafkaListenerHelper;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import java.util.Set;

@Configuration
@Slf4j
public class RealtimeConfig {

    /**
     * Relay topic for the sockets held by this pod. Single partition keeps per-connection order.
     */
    @Bean
    public NewTopic podRelayTopic(KafkaListenerHelper kafkaListenerHelper, AppProperties appProperties) {
        return TopicBuilder.name(kafkaListenerHelper.getRelayTopic())
                .partitions(1)
                .replicas(appProperties.getKafka().getTopic().getReplicationFactor())
                .config("retention.ms", "3600000") // 1 hour
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialValidator credentialValidator(AppProperties appProperties) {
        if (!appProperties.getAuth().isEnabled()) {
            log.warn("Credential validation is disabled; every non-empty token is accepted");
        }
        return new HmacCredentialValidator(appProperties.getAuth());
    }

    /**
     * No collaborator policy is bundled; presence online/offline events go nowhere until one is provided.
     */
    @Bean
    @ConditionalOnMissingBean
    public CollaboratorResolver collaboratorResolver() {
        return userId -> Set.of();
    }
}
