package com.bank.lease.domain.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Abstraction for caching services.
 * Allows switching between in-memory or distributed implementations.
 */
public interface CacheService {

    /**
     * Get a value from cache
     * @param key The cache key
     * @param type The expected type
     * @return Optional containing the value if found and of the expected type
     */
    <T> Optional<T> get(String key, Class<T> type);

    void put(String key, Object value);

    /**
     * Put a value in cache with its own expiration
     */
    void put(String key, Object value, Duration ttl);

    void evict(String key);

    boolean exists(String key);

    void clear();
}
