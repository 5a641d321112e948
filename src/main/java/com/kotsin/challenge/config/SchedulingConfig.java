package com.kotsin.challenge.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the engine tick.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
}
