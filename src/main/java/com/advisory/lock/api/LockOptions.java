package com.advisory.lock.api;

import java.time.Duration;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Options for a single lock request.
 *
 * <p>The timeout decides how the request waits: {@code null} waits forever,
 * zero makes one attempt, a positive duration keeps trying until it elapses.</p>
 */
public class LockOptions {

    public static final String TIMEOUT_SECONDS = "timeout_seconds";
    public static final String SHARED = "shared";
    public static final String TRANSACTION = "transaction";
    public static final String DISABLE_QUERY_CACHE = "disable_query_cache";

    private static final Set<String> VALID_KEYS =
            Set.of(TIMEOUT_SECONDS, SHARED, TRANSACTION, DISABLE_QUERY_CACHE);

    private final Duration timeout;
    private final boolean shared;
    private final boolean transaction;
    private final boolean disableQueryCache;

    private LockOptions(Builder builder) {
        this.timeout = builder.timeout;
        this.shared = builder.shared;
        this.transaction = builder.transaction;
        this.disableQueryCache = builder.disableQueryCache;
    }

    /**
     * Returns the wait budget, or null to wait forever.
     */
    public Duration getTimeout() {
        return timeout;
    }

    public boolean waitsForever() {
        return timeout == null;
    }

    public boolean isShared() {
        return shared;
    }

    public boolean isTransaction() {
        return transaction;
    }

    public boolean isDisableQueryCache() {
        return disableQueryCache;
    }

    /**
     * Exclusive, session-level, waiting forever.
     */
    public static LockOptions defaults() {
        return builder().build();
    }

    /**
     * A single attempt that never waits.
     */
    public static LockOptions tryOnce() {
        return builder().timeout(Duration.ZERO).build();
    }

    /**
     * Options from a bare timeout in seconds; null waits forever.
     *
     * @throws LockConfigurationException if the timeout is negative or not finite
     */
    public static LockOptions ofTimeoutSeconds(Number timeoutSeconds) {
        return builder().timeoutSeconds(timeoutSeconds).build();
    }

    /**
     * Options from a map keyed by {@value #TIMEOUT_SECONDS}, {@value #SHARED},
     * {@value #TRANSACTION} and {@value #DISABLE_QUERY_CACHE}.
     *
     * @throws LockConfigurationException on an unknown key or a value of the wrong type
     */
    public static LockOptions fromMap(Map<String, ?> options) {
        if (options == null) {
            return defaults();
        }
        Set<String> unknown = new TreeSet<>(Comparator.nullsFirst(Comparator.<String>naturalOrder()));
        for (String key : options.keySet()) {
            if (key == null || !VALID_KEYS.contains(key)) {
                unknown.add(key);
            }
        }
        if (!unknown.isEmpty()) {
            throw new LockConfigurationException("Unknown lock option(s): " + unknown
                    + "; valid options are " + new TreeSet<>(VALID_KEYS));
        }

        Builder builder = builder();
        Object timeout = options.get(TIMEOUT_SECONDS);
        if (timeout != null && !(timeout instanceof Number)) {
            throw new LockConfigurationException(TIMEOUT_SECONDS + " must be a number, got "
                    + timeout.getClass().getSimpleName());
        }
        builder.timeoutSeconds((Number) timeout);
        builder.shared(flag(options, SHARED));
        builder.transaction(flag(options, TRANSACTION));
        builder.disableQueryCache(flag(options, DISABLE_QUERY_CACHE));
        return builder.build();
    }

    private static boolean flag(Map<String, ?> options, String key) {
        Object value = options.get(key);
        if (value == null) {
            return false;
        }
        if (!(value instanceof Boolean b)) {
            throw new LockConfigurationException(key + " must be a boolean, got "
                    + value.getClass().getSimpleName());
        }
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration timeout;
        private boolean shared = false;
        private boolean transaction = false;
        private boolean disableQueryCache = false;

        /**
         * Sets the wait budget; null waits forever.
         */
        public Builder timeout(Duration timeout) {
            if (timeout != null && timeout.isNegative()) {
                throw new LockConfigurationException("timeout must be >= 0, got " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        /**
         * Sets the wait budget in (possibly fractional) seconds; null waits forever.
         */
        public Builder timeoutSeconds(Number seconds) {
            if (seconds == null) {
                return timeout(null);
            }
            double value = seconds.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
                throw new LockConfigurationException(TIMEOUT_SECONDS + " must be a finite number >= 0, got " + seconds);
            }
            long nanos = Math.round(value * 1_000_000_000d);
            // a positive budget below one nanosecond still polls
            return timeout(Duration.ofNanos(value > 0 && nanos == 0 ? 1 : nanos));
        }

        public Builder waitForever() {
            this.timeout = null;
            return this;
        }

        public Builder shared(boolean shared) {
            this.shared = shared;
            return this;
        }

        public Builder transaction(boolean transaction) {
            this.transaction = transaction;
            return this;
        }

        public Builder disableQueryCache(boolean disableQueryCache) {
            this.disableQueryCache = disableQueryCache;
            return this;
        }

        public LockOptions build() {
            return new LockOptions(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LockOptions that)) return false;
        return shared == that.shared
                && transaction == that.transaction
                && disableQueryCache == that.disableQueryCache
                && Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timeout, shared, transaction, disableQueryCache);
    }

    @Override
    public String toString() {
        return "LockOptions{" +
                "timeout=" + (timeout == null ? "forever" : timeout) +
                ", shared=" + shared +
                ", transaction=" + transaction +
                ", disableQueryCache=" + disableQueryCache +
                '}';
    }
}
