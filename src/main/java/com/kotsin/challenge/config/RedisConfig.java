package com.kotsin.challenge.config;

import com.kotsin.challenge.state.RedisSnapshotStore;
import com.kotsin.challenge.state.SnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Snapshot persistence in Redis. Only loaded when {@code engine.state.store} is redis, so a
 * memory-only run needs no Redis connection at all.
 */
@Configuration
@ConditionalOnProperty(prefix = "engine.state", name = "store", havingValue = "redis", matchIfMissing = true)
@Slf4j
public class RedisConfig {

    /** Engine's own template, kept apart from Boot's shared {@code stringRedisTemplate}. */
    @Bean
    public StringRedisTemplate engineStringRedisTemplate(RedisConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate(connectionFactory);
        // Snapshot writes are multiSet plus a scan-and-delete; no MULTI/EXEC needed
        template.setEnableTransactionSupport(false);
        return template;
    }

    @Bean
    public SnapshotStore redisSnapshotStore(@Qualifier("engineStringRedisTemplate") StringRedisTemplate redis,
                                            EngineProperties properties) {
        log.info("Engine state persisted to Redis under {}", properties.getState().getKeyPrefix());
        return new RedisSnapshotStore(redis);
    }
}
