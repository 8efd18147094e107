package com.advisory.lock.cache;

/**
 * Query cache counters.
 *
 * @param hitCount    lookups answered from the cache
 * @param missCount   lookups not answered, including bypassed ones
 * @param bypassCount lookups skipped inside an uncached scope
 * @param size        current number of entries
 */
public record CacheStats(long hitCount, long missCount, long bypassCount, long size) {

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
