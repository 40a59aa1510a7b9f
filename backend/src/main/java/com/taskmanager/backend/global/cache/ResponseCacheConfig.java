package com.taskmanager.backend.global.cache;

import java.time.Clock;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the response cache backend.
 * <pre>
 * taskflow:
 *   cache:
 *     type: redis   # or memory
 *     max-entries: 10000   # memory only
 * </pre>
 */
@Configuration
public class ResponseCacheConfig {

    private static final Logger log = LoggerFactory.getLogger(ResponseCacheConfig.class);

    @Bean
    @ConditionalOnProperty(name = "taskflow.cache.type", havingValue = "redis")
    public ResponseCache redisResponseCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        log.info("Using Redis response cache");
        return new RedisResponseCache(redisTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "taskflow.cache.type", havingValue = "memory", matchIfMissing = true)
    public ResponseCache inMemoryResponseCache(
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${taskflow.cache.max-entries:10000}") long maxEntries
    ) {
        log.info("Using in-memory response cache, max-entries={}", maxEntries);
        return new InMemoryResponseCache(objectMapper, clock, maxEntries);
    }
}
