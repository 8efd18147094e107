package com.advisory.lock.cache;

import com.advisory.lock.api.LockedBlock;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Caffeine-backed query cache with per-thread bypass.
 */
public class CaffeineQueryCache implements QueryCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineQueryCache.class);

    private final Cache<String, Object> cache;
    // Depth of nested uncached scopes on each thread
    private final ThreadLocal<Integer> bypassDepth = new ThreadLocal<>();
    private final LongAdder bypassed = new LongAdder();

    public CaffeineQueryCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineQueryCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<Object> get(String query) {
        if (isBypassed()) {
            bypassed.increment();
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(query));
    }

    @Override
    public void put(String query, Object result) {
        if (isBypassed() || result == null) {
            return;
        }
        cache.put(query, result);
    }

    @Override
    public <T, X extends Exception> T uncached(LockedBlock<T, X> block) throws X {
        Integer outer = bypassDepth.get();
        bypassDepth.set(outer == null ? 1 : outer + 1);
        try {
            return block.call();
        } finally {
            if (outer == null) {
                bypassDepth.remove();
            } else {
                bypassDepth.set(outer);
            }
        }
    }

    @Override
    public boolean isBypassed() {
        return bypassDepth.get() != null;
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all query cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        long bypassCount = bypassed.sum();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount() + bypassCount,
                bypassCount,
                cache.estimatedSize()
        );
    }
}
