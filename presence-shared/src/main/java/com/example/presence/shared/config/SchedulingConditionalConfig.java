package com.example.presence.shared.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables @Scheduled jobs for every profile except 'test'.
 */
@Configuration
@EnableScheduling
@Profile("!test")
public class SchedulingConditionalConfig {
}
