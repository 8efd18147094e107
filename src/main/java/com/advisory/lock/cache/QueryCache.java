package com.advisory.lock.cache;

import com.advisory.lock.api.LockedBlock;

import java.util.Optional;

/**
 * Result cache of the data-access layer that lock holders can switch off.
 *
 * <p>Results computed before a lock was taken may be stale once it is held,
 * so locked work asking for it runs inside {@link #uncached(LockedBlock)}.
 * Inside that scope lookups miss and nothing is stored.</p>
 *
 * <p>The bypass is tracked per thread, not per execution context: sessions
 * opened with an explicit context share the bypass state of the thread
 * that runs them.</p>
 */
public interface QueryCache {

    Optional<Object> get(String query);

    void put(String query, Object result);

    /**
     * Runs the block with the cache bypassed for the calling thread.
     * Scopes nest; the cache comes back when the outermost one exits.
     */
    <T, X extends Exception> T uncached(LockedBlock<T, X> block) throws X;

    /**
     * Returns true if the calling thread is inside an uncached scope.
     */
    boolean isBypassed();

    void invalidateAll();

    CacheStats getStats();
}
