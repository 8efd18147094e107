package com.advisory.lock.stack;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Registry of {@link LockStack}s keyed by execution context.
 *
 * <p>A context is any object identifying a unit of sequential execution. By
 * default it is the calling {@link Thread}; callers driving fibers, event
 * loops or simulated contexts pass their own key to {@link #forContext(Object)}.
 * Keys are held weakly and compared by identity, so a stack is created on
 * first use and reclaimed together with its context.</p>
 *
 * <p>The registry itself is safe for concurrent use. The stacks it returns
 * are not, and must only be used by their own context.</p>
 */
public class ExecutionStacks {

    private final Cache<Object, LockStack> stacks = Caffeine.newBuilder()
            .weakKeys()
            .build();

    /**
     * Returns the stack of the calling thread.
     */
    public LockStack current() {
        return forContext(Thread.currentThread());
    }

    /**
     * Returns the stack bound to the given context, creating it if needed.
     *
     * @param context the context key, compared by identity
     */
    public LockStack forContext(Object context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        return stacks.get(context, k -> new LockStack());
    }

    /**
     * Returns the approximate number of contexts with a stack.
     */
    public long contextCount() {
        stacks.cleanUp();
        return stacks.estimatedSize();
    }
}
