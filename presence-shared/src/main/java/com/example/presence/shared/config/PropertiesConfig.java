package com.example.presence.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jdbc.repository.config.EnableJdbcRepositories;

@Configuration
@EnableJdbcRepositories(basePackages = "com.example.presence.shared.repository")
public class PropertiesConfig {

    @Value("${pod.name:${POD_NAME:presence-realtime-0}}")
    private String podName;

    @Value("${cluster.name:${CLUSTER_NAME:cluster-a}}")
    private String clusterName;

    @Bean
    @ConfigurationProperties(prefix = "presence")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();

        // Pod identity comes from the environment, the rest is bound from presence.*
        properties.setPodName(podName);
        properties.setClusterName(clusterName);
        return properties;
    }
}
