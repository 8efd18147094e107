package com.advisory.lock.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a lock request: whether the lock was held and what the block returned.
 *
 * <p>{@link #getValue()} is null both when the block returned null and when
 * it never ran. Check {@link #isAcquired()} to tell them apart.</p>
 *
 * @param <T> the block's result type
 */
public final class LockResult<T> {

    private static final LockResult<?> FAILED = new LockResult<>(false, null);

    private final boolean acquired;
    private final T value;

    private LockResult(boolean acquired, T value) {
        this.acquired = acquired;
        this.value = value;
    }

    /**
     * The block ran under the lock and returned {@code value}.
     */
    public static <T> LockResult<T> acquired(T value) {
        return new LockResult<>(true, value);
    }

    /**
     * The lock was not obtained and the block did not run. Always the same instance.
     */
    @SuppressWarnings("unchecked")
    public static <T> LockResult<T> failed() {
        return (LockResult<T>) FAILED;
    }

    public boolean isAcquired() {
        return acquired;
    }

    public T getValue() {
        return value;
    }

    /**
     * Returns the block's value, empty if the lock was not acquired or the block returned null.
     */
    public Optional<T> asOptional() {
        return Optional.ofNullable(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LockResult<?> that)) return false;
        return acquired == that.acquired && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(acquired, value);
    }

    @Override
    public String toString() {
        return acquired ? "LockResult{acquired, value=" + value + '}' : "LockResult{not acquired}";
    }
}
