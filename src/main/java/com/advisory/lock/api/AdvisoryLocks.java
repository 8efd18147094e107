package com.advisory.lock.api;

import com.advisory.lock.acquire.AcquisitionStrategies;
import com.advisory.lock.acquire.IntervalSource;
import com.advisory.lock.acquire.PollingStrategy;
import com.advisory.lock.acquire.Sleeper;
import com.advisory.lock.backend.AdvisoryLockBackend;
import com.advisory.lock.backend.AdvisoryLockBackends;
import com.advisory.lock.cache.NoOpQueryCache;
import com.advisory.lock.cache.QueryCache;
import com.advisory.lock.config.LockSettings;
import com.advisory.lock.key.LockName;
import com.advisory.lock.metrics.MetricsService;
import com.advisory.lock.metrics.NoOpMetricsService;
import com.advisory.lock.stack.ExecutionStacks;
import com.advisory.lock.stack.LockStack;
import com.advisory.lock.stack.LockStackItem;
import com.advisory.lock.tracing.NoOpTracingService;
import com.advisory.lock.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Main entry point: runs blocks of code while holding a named database advisory lock.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * AdvisoryLocks locks = AdvisoryLocks.builder()
 *     .settings(LockSettings.fromEnvironment())
 *     .build();
 *
 * LockResult&lt;Invoice&gt; result = locks.withLock(connection, "invoice:42",
 *         LockOptions.ofTimeoutSeconds(5), () -&gt; invoices.settle(42));
 * if (!result.isAcquired()) {
 *     // someone else is settling invoice 42
 * }
 * </pre>
 *
 * <p>Held locks are tracked per execution context, by default the calling
 * thread, so a context that re-enters a lock it already holds is not blocked
 * by itself. Use {@link #sessionInContext} to track some other unit of
 * execution.</p>
 */
public class AdvisoryLocks {
    private static final Logger log = LoggerFactory.getLogger(AdvisoryLocks.class);

    private final LockSettings settings;
    private final ExecutionStacks stacks;
    private final AcquisitionStrategies strategies;
    private final QueryCache queryCache;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;

    private AdvisoryLocks(Builder builder) {
        this.settings = builder.settings != null ? builder.settings : LockSettings.fromEnvironment();
        this.stacks = builder.stacks != null ? builder.stacks : new ExecutionStacks();
        this.queryCache = builder.queryCache != null ? builder.queryCache : new NoOpQueryCache();
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        Sleeper sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.threadSleep();
        IntervalSource intervals = builder.intervalSource != null
                ? builder.intervalSource : settings.retryPolicy()::nextInterval;
        this.strategies = new AcquisitionStrategies(
                new PollingStrategy(clock, sleeper, intervals), settings.preferNativeBlocking());

        log.info("AdvisoryLocks initialized: prefix='{}', retryPolicy={}, preferNativeBlocking={}",
                settings.prefix(), settings.retryPolicy(), settings.preferNativeBlocking());
    }

    /**
     * Creates a session bound to the calling thread.
     */
    public LockSession session(AdvisoryLockBackend backend, Object lockName, LockOptions options) {
        return session(stacks.current(), backend, lockName, options);
    }

    /**
     * Creates a session bound to an explicit execution context.
     *
     * @param context identifies the unit of execution, compared by identity
     */
    public LockSession sessionInContext(Object context, AdvisoryLockBackend backend,
                                        Object lockName, LockOptions options) {
        return session(stacks.forContext(context), backend, lockName, options);
    }

    private LockSession session(LockStack stack, AdvisoryLockBackend backend, Object lockName, LockOptions options) {
        return new LockSession(backend, lockName, settings.prefix(), options, stack,
                strategies, queryCache, metricsService, tracingService, clock);
    }

    /**
     * Runs the block while holding the lock.
     *
     * @return the block's value, or {@link LockResult#failed()} if the lock was not acquired
     */
    public <T, X extends Exception> LockResult<T> withLock(AdvisoryLockBackend backend, Object lockName,
                                                          LockOptions options, LockedBlock<T, X> block) throws X {
        return session(backend, lockName, options).run(block);
    }

    /**
     * Runs the block while holding the lock, waiting at most {@code timeoutSeconds}
     * (null waits forever, zero tries once).
     */
    public <T, X extends Exception> LockResult<T> withLock(AdvisoryLockBackend backend, Object lockName,
                                                          Number timeoutSeconds, LockedBlock<T, X> block) throws X {
        return withLock(backend, lockName, LockOptions.ofTimeoutSeconds(timeoutSeconds), block);
    }

    /**
     * Runs the block while holding the lock, with options given as a map.
     *
     * @throws LockConfigurationException on unknown or malformed options
     * @see LockOptions#fromMap(Map)
     */
    public <T, X extends Exception> LockResult<T> withLock(AdvisoryLockBackend backend, Object lockName,
                                                          Map<String, ?> options, LockedBlock<T, X> block) throws X {
        return withLock(backend, lockName, LockOptions.fromMap(options), block);
    }

    /**
     * Runs the block while holding the lock, choosing the backend from the connection's database.
     */
    public <T, X extends Exception> LockResult<T> withLock(Connection connection, Object lockName,
                                                          LockOptions options, LockedBlock<T, X> block) throws X {
        return withLock(AdvisoryLockBackends.forConnection(connection), lockName, options, block);
    }

    /**
     * Runs the block while holding the lock and returns its value directly.
     *
     * @throws LockAcquisitionException if the lock was not acquired
     */
    public <T, X extends Exception> T withLockOrThrow(AdvisoryLockBackend backend, Object lockName,
                                                     LockOptions options, LockedBlock<T, X> block) throws X {
        LockSession session = session(backend, lockName, options);
        LockResult<T> result = session.run(block);
        if (!result.isAcquired()) {
            String name = session.getLockName().value();
            throw new LockAcquisitionException(name, "Failed to acquire advisory lock '" + name + "'"
                    + (session.getOptions().waitsForever() ? "" : " within " + session.getOptions().getTimeout()));
        }
        return result.getValue();
    }

    /**
     * Returns true if the calling thread holds the lock in either mode.
     */
    public boolean isHeld(Object lockName) {
        return isHeld(lockName, false) || isHeld(lockName, true);
    }

    /**
     * Returns true if the calling thread holds the lock in the given mode.
     */
    public boolean isHeld(Object lockName, boolean shared) {
        return stacks.current().contains(new LockStackItem(LockName.resolve(settings.prefix(), lockName), shared));
    }

    /**
     * Returns the names of the locks held by the calling thread, outermost first.
     */
    public List<String> currentLockNames() {
        return stacks.current().snapshot().stream()
                .map(item -> item.lockName().value())
                .toList();
    }

    public LockSettings getSettings() {
        return settings;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LockSettings settings;
        private ExecutionStacks stacks;
        private QueryCache queryCache;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock;
        private Sleeper sleeper;
        private IntervalSource intervalSource;

        public Builder settings(LockSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder executionStacks(ExecutionStacks stacks) {
            this.stacks = stacks;
            return this;
        }

        public Builder queryCache(QueryCache queryCache) {
            this.queryCache = queryCache;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Overrides the randomized pause between polling attempts.
         */
        public Builder intervalSource(IntervalSource intervalSource) {
            this.intervalSource = intervalSource;
            return this;
        }

        public AdvisoryLocks build() {
            return new AdvisoryLocks(this);
        }
    }
}
