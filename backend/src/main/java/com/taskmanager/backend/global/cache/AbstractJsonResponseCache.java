package com.taskmanager.backend.global.cache;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores results as JSON so a hit returns exactly the payload that was cached,
 * independent of later changes to the objects that produced it.
 * Backend failures degrade to computing the result directly.
 */
public abstract class AbstractJsonResponseCache implements ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(AbstractJsonResponseCache.class);

    private final ObjectMapper objectMapper;

    protected AbstractJsonResponseCache(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> T getOrCompute(String key, Duration ttl, TypeReference<T> type, Supplier<T> compute) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(compute, "compute must not be null");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            return compute.get();
        }

        Optional<String> cached = safeRead(key);
        if (cached.isPresent()) {
            try {
                return objectMapper.readValue(cached.get(), type);
            } catch (JsonProcessingException ex) {
                log.warn("Discarding unreadable cache entry key={}", key, ex);
            }
        }

        T value = compute.get();
        try {
            safeWrite(key, objectMapper.writeValueAsString(value), ttl);
        } catch (JsonProcessingException ex) {
            log.warn("Result for cache key={} could not be serialized; not cached", key, ex);
        }
        return value;
    }

    private Optional<String> safeRead(String key) {
        try {
            return read(key);
        } catch (RuntimeException ex) {
            log.warn("Cache read failed key={}: {}", key, ex.getMessage());
            return Optional.empty();
        }
    }

    private void safeWrite(String key, String payload, Duration ttl) {
        try {
            write(key, payload, ttl);
        } catch (RuntimeException ex) {
            log.warn("Cache write failed key={}: {}", key, ex.getMessage());
        }
    }

    protected abstract Optional<String> read(String key);

    protected abstract void write(String key, String payload, Duration ttl);
}
