package com.kotsin.challenge.config;

import com.kotsin.challenge.state.InMemorySnapshotStore;
import com.kotsin.challenge.state.SnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Snapshot store for runs without Redis. The Redis store lives in {@link RedisConfig}.
 */
@Configuration
@Slf4j
public class StateStoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "engine.state", name = "store", havingValue = "memory")
    public SnapshotStore inMemorySnapshotStore() {
        log.warn("Engine state kept in memory only; it will not survive a restart");
        return new InMemorySnapshotStore();
    }
}
