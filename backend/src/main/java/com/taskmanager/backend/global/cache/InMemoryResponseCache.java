package com.taskmanager.backend.global.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import org.springframework.beans.factory.DisposableBean;

/**
 * Process-local cache for single-instance deployments and tests, backed by Caffeine.
 * Each entry expires after the ttl it was written with; the store is bounded by {@code maxEntries}.
 */
public class InMemoryResponseCache extends AbstractJsonResponseCache implements DisposableBean {

    private final Cache<String, Entry> store;

    public InMemoryResponseCache(ObjectMapper objectMapper, Clock clock, long maxEntries) {
        super(objectMapper);
        this.store = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new EntryTtlExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    @Override
    protected Optional<String> read(String key) {
        return Optional.ofNullable(store.getIfPresent(key)).map(Entry::payload);
    }

    @Override
    protected void write(String key, String payload, Duration ttl) {
        store.put(key, new Entry(payload, ttl));
    }

    public void clear() {
        store.invalidateAll();
    }

    public long size() {
        store.cleanUp();
        return store.estimatedSize();
    }

    @Override
    public void destroy() {
        clear();
    }

    private record Entry(String payload, Duration ttl) {
    }

    private static final class EntryTtlExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
