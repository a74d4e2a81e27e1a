package com.starscape.imagepipeline.common.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the queue and change-stream pollers.
 * Turned off with app.pipeline.polling.enabled=false, e.g. for tests that drive the workers by hand.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "app.pipeline.polling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
    // Enables @Scheduled annotations
}
