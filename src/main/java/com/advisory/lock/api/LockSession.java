package com.advisory.lock.api;

import com.advisory.lock.acquire.AcquisitionRequest;
import com.advisory.lock.acquire.AcquisitionStrategies;
import com.advisory.lock.acquire.AcquisitionStrategy;
import com.advisory.lock.backend.AdvisoryLockBackend;
import com.advisory.lock.cache.QueryCache;
import com.advisory.lock.key.LockName;
import com.advisory.lock.logging.LogContext;
import com.advisory.lock.metrics.MetricsService;
import com.advisory.lock.stack.LockStack;
import com.advisory.lock.stack.LockStackItem;
import com.advisory.lock.tracing.Span;
import com.advisory.lock.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * One request to run a block under a named advisory lock.
 *
 * <p>If the calling context already holds the same lock in the same mode the
 * block runs straight away and the backend is not consulted. Otherwise the
 * lock is acquired according to the options' timeout; when that fails the
 * block does not run and {@link LockResult#failed()} is returned. Once
 * acquired, the lock is popped from the context's stack and released through
 * the backend on every exit path, in that order. An exception from the block
 * reaches the caller after the release; a release failure is attached to it
 * as suppressed.</p>
 *
 * <p>Sessions are created by {@link AdvisoryLocks} and are bound to the stack
 * of one execution context.</p>
 */
public class LockSession {
    private static final Logger log = LoggerFactory.getLogger(LockSession.class);

    private final AdvisoryLockBackend backend;
    private final Object rawName;
    private final String prefix;
    private final LockOptions options;
    private final LockStack stack;
    private final AcquisitionStrategies strategies;
    private final QueryCache queryCache;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;

    private LockName lockName;
    private LockStackItem stackItem;

    LockSession(AdvisoryLockBackend backend, Object rawName, String prefix, LockOptions options,
                LockStack stack, AcquisitionStrategies strategies, QueryCache queryCache,
                MetricsService metricsService, TracingService tracingService, Clock clock) {
        if (backend == null) {
            throw new IllegalArgumentException("backend must not be null");
        }
        if (rawName == null) {
            throw new IllegalArgumentException("lock name must not be null");
        }
        this.backend = backend;
        this.rawName = rawName;
        this.prefix = prefix;
        this.options = options != null ? options : LockOptions.defaults();
        this.stack = stack;
        this.strategies = strategies;
        this.queryCache = queryCache;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.clock = clock;
    }

    /**
     * Returns the prefixed lock name and its key, resolved on first use.
     */
    public LockName getLockName() {
        if (lockName == null) {
            lockName = LockName.resolve(prefix, rawName);
        }
        return lockName;
    }

    public LockStackItem getStackItem() {
        if (stackItem == null) {
            stackItem = new LockStackItem(getLockName(), options.isShared());
        }
        return stackItem;
    }

    public LockOptions getOptions() {
        return options;
    }

    /**
     * Returns true if the calling context already holds this lock in this mode.
     */
    public boolean isAlreadyLocked() {
        return stack.contains(getStackItem());
    }

    /**
     * Runs the block under the lock.
     *
     * @return the block's value wrapped as acquired, or {@link LockResult#failed()}
     * @throws X                          whatever the block throws, after the lock is released
     * @throws LockConfigurationException if the backend cannot provide the requested mode
     * @throws LockBackendException       if the backend fails while locking or unlocking
     */
    public <T, X extends Exception> LockResult<T> run(LockedBlock<T, X> block) throws X {
        LockName name = getLockName();
        try (LogContext logCtx = LogContext.forLock(name, options.isShared());
             Span span = tracingService.startLockSpan(name, options.isShared())) {
            if (isAlreadyLocked()) {
                log.debug("lock.reentrant lockName={} depth={}", name.value(), stack.size());
                metricsService.incrementReentrant();
                span.setAttribute("lock.reentrant", true);
                span.setAttribute("lock.acquired", true);
                return LockResult.acquired(callBlock(block, span));
            }
            span.setAttribute("lock.reentrant", false);

            backend.checkSupported(options.isShared(), options.isTransaction());
            AcquisitionRequest request = new AcquisitionRequest(
                    name, options.isShared(), options.isTransaction(), options.getTimeout());
            AcquisitionStrategy strategy = strategies.select(request, backend);

            Instant started = clock.instant();
            boolean acquired = strategy.acquire(backend, request);
            Instant acquiredAt = clock.instant();
            metricsService.recordAcquisition(strategy.mode(), acquired, Duration.between(started, acquiredAt));
            span.setAttribute("lock.acquired", acquired);

            if (!acquired) {
                log.debug("lock.not_acquired lockName={} mode={} timeout={}",
                        name.value(), strategy.mode(), options.getTimeout());
                return LockResult.failed();
            }
            log.debug("lock.acquired lockName={} lockKey={} mode={} shared={} transaction={}",
                    name.value(), name.key(), strategy.mode(), options.isShared(), options.isTransaction());
            return runWithAcquiredLock(block, span, acquiredAt);
        }
    }

    private <T, X extends Exception> LockResult<T> runWithAcquiredLock(LockedBlock<T, X> block, Span span,
                                                                        Instant acquiredAt) throws X {
        LockStackItem item = getStackItem();
        stack.push(item);
        T value;
        try {
            value = callBlock(block, span);
        } catch (Throwable failure) {
            unwind(item, acquiredAt, failure);
            throw failure;
        }
        unwind(item, acquiredAt, null);
        return LockResult.acquired(value);
    }

    private <T, X extends Exception> T callBlock(LockedBlock<T, X> block, Span span) throws X {
        try {
            return options.isDisableQueryCache() ? queryCache.uncached(block) : block.call();
        } catch (Throwable t) {
            span.recordException(t);
            span.markFailed();
            throw t;
        }
    }

    /**
     * Pops the stack, then releases through the backend.
     *
     * @param blockFailure what the block threw, or null if it completed
     */
    private void unwind(LockStackItem item, Instant acquiredAt, Throwable blockFailure) {
        LockStackItem popped = stack.pop();
        try {
            backend.releaseLock(item.lockName(), item.shared(), options.isTransaction());
            log.debug("lock.released lockName={}", item.lockName().value());
        } catch (RuntimeException e) {
            metricsService.incrementReleaseFailure();
            log.warn("lock.release.failed lockName={} error={}", item.lockName().value(), e.getMessage());
            if (blockFailure == null) {
                throw e;
            }
            blockFailure.addSuppressed(e);
        } finally {
            metricsService.recordHeld(Duration.between(acquiredAt, clock.instant()));
        }

        if (!popped.equals(item)) {
            IllegalStateException outOfOrder = new IllegalStateException(
                    "Lock stack out of order: expected " + item + " but found " + popped);
            if (blockFailure == null) {
                throw outOfOrder;
            }
            blockFailure.addSuppressed(outOfOrder);
        }
    }
}
