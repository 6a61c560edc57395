package com.bank.lease.infrastructure.cache.memory;

import com.bank.lease.domain.cache.CacheService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * In-memory implementation of CacheService backed by a bounded Caffeine cache.
 * Each entry carries its own time-to-live.
 */
@Component("memoryCacheService")
public class MemoryCacheService implements CacheService {

    private static final Logger log = LoggerFactory.getLogger(MemoryCacheService.class);

    private final Cache<String, CacheEntry> cache;

    public MemoryCacheService(@Value("${lease.cache.maximum-size:100000}") long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new EntryExpiry())
                .build();
        log.info("Initialized in-memory cache with maximum size {}", maximumSize);
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        Object value = entry.value;
        if (value != null && type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        return Optional.empty();
    }

    @Override
    public void put(String key, Object value) {
        cache.put(key, new CacheEntry(value, Long.MAX_VALUE));
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        cache.put(key, new CacheEntry(value, ttl.toNanos()));
    }

    @Override
    public void evict(String key) {
        cache.invalidate(key);
    }

    @Override
    public boolean exists(String key) {
        return cache.getIfPresent(key) != null;
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    private static final class CacheEntry {
        private final Object value;
        private final long ttlNanos;

        CacheEntry(Object value, long ttlNanos) {
            this.value = value;
            this.ttlNanos = ttlNanos;
        }
    }

    private static final class EntryExpiry implements Expiry<String, CacheEntry> {
        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
