package com.starscape.offlineocr.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Configuration to enable Spring's scheduled task execution.
 * Required for the job admission loop.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
    // Enables @Scheduled annotations
}
