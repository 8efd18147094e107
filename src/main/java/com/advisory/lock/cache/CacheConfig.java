package com.advisory.lock.cache;

/**
 * Configuration for the query result cache.
 *
 * @param maxSize    maximum number of cached results
 * @param ttlSeconds time-to-live in seconds for each result
 */
public record CacheConfig(int maxSize, int ttlSeconds) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default: 1,000 results, 60s TTL.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(1_000, 60);
    }
}
