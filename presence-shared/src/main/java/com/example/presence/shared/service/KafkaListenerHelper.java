package com.example.presence.shared.service;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Topic, group and container factory names for {@code @KafkaListener} SpEL expressions.
 */
@Service
@RequiredArgsConstructor
public class KafkaListenerHelper {

    private final AppProperties appProperties;

    private static final String REGISTRY_MUTATION_CONTAINER_FACTORY = "registryMutationListenerContainerFactory";
    private static final String RELAY_CONTAINER_FACTORY = "relayListenerContainerFactory";

    public String getRegistryMutationTopic() {
        return appProperties.getKafka().getTopic().getNameRegistryMutations();
    }

    public String getRegistryMutationDltTopic() {
        return getRegistryMutationTopic() + Constants.DLT_SUFFIX;
    }

    public String getChangeReactorGroupId() {
        return appProperties.getKafka().getConsumer().getGroupChangeReactor();
    }

    /**
     * Each pod consumes only its own relay topic, in its own group.
     */
    public String getRelayTopic() {
        return appProperties.getKafka().getTopic().getNameRelayPrefix() + appProperties.getPodName();
    }

    public String getRelayGroupId() {
        return appProperties.getKafka().getConsumer().getGroupRelayPrefix() + appProperties.getPodName();
    }

    public String getRegistryMutationContainerFactory() {
        return REGISTRY_MUTATION_CONTAINER_FACTORY;
    }

    public String getRelayContainerFactory() {
        return RELAY_CONTAINER_FACTORY;
    }
}
