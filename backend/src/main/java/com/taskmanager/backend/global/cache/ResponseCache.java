package com.taskmanager.backend.global.cache;

import java.time.Duration;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Time-bounded memo for read-only query results.
 * <p>
 * Entries are never invalidated on write: a mutation becomes visible to a cached
 * query only once its entry's TTL has elapsed. Two concurrent misses on the same
 * key may both compute; the later write wins.
 */
public interface ResponseCache {

    /**
     * Returns the cached value for {@code key} if it was stored less than {@code ttl} ago,
     * otherwise runs {@code compute}, stores its result and returns it.
     */
    <T> T getOrCompute(String key, Duration ttl, TypeReference<T> type, Supplier<T> compute);
}
