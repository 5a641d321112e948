package com.kotsin.challenge.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class AppConfig {

    /** Engine time source. Tests substitute a controllable clock. */
    @Bean
    public Clock engineClock() {
        return Clock.systemUTC();
    }

    /** Signal ids already queued, so redelivered signals are not traded twice. */
    @Bean
    public Cache<String, Boolean> processedSignalsCache(
            @Value("${engine.idempotency.max-entries:100000}") long maxEntries,
            @Value("${engine.idempotency.ttl-hours:24}") long ttlHours) {
        return Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(Duration.ofHours(ttlHours))
                .build();
    }
}
