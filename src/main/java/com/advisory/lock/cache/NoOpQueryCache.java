package com.advisory.lock.cache;

import com.advisory.lock.api.LockedBlock;

import java.util.Optional;

/**
 * Stores nothing. Used when the data-access layer has no result cache.
 */
public class NoOpQueryCache implements QueryCache {

    @Override
    public Optional<Object> get(String query) {
        return Optional.empty();
    }

    @Override
    public void put(String query, Object result) {
        // no-op
    }

    @Override
    public <T, X extends Exception> T uncached(LockedBlock<T, X> block) throws X {
        return block.call();
    }

    @Override
    public boolean isBypassed() {
        return false;
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
