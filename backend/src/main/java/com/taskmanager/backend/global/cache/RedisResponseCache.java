package com.taskmanager.backend.global.cache;

import java.time.Duration;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Shared cache backed by Redis string values; expiry is delegated to the Redis key TTL.
 */
public class RedisResponseCache extends AbstractJsonResponseCache {

    private final StringRedisTemplate redisTemplate;

    public RedisResponseCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        super(objectMapper);
        this.redisTemplate = redisTemplate;
    }

    @Override
    protected Optional<String> read(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    protected void write(String key, String payload, Duration ttl) {
        redisTemplate.opsForValue().set(key, payload, ttl);
    }
}
