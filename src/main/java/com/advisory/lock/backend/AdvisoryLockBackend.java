package com.advisory.lock.backend;

import com.advisory.lock.key.LockName;

/**
 * Database-specific advisory lock primitives, bound to a single database
 * session. Integer-keyed engines use {@link LockName#key()}, name-keyed
 * engines use {@link LockName#value()}.
 */
public interface AdvisoryLockBackend {

    /**
     * Attempts to take the lock without waiting.
     *
     * @param lockName      the resolved lock name
     * @param shared        request a shared lock instead of an exclusive one
     * @param transactional scope the lock to the current transaction
     * @return true if the lock was acquired
     * @throws com.advisory.lock.api.LockBackendException if the database call fails
     */
    boolean tryLock(LockName lockName, boolean shared, boolean transactional);

    /**
     * Returns true if {@link #blockingLock} is available.
     */
    default boolean supportsBlockingLock() {
        return false;
    }

    /**
     * Waits inside the database until the lock is granted.
     *
     * @return true once acquired, false if the database refused the lock
     * @throws UnsupportedOperationException if {@link #supportsBlockingLock()} is false
     */
    default boolean blockingLock(LockName lockName, boolean shared, boolean transactional) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no blocking lock");
    }

    /**
     * Releases a lock taken through this backend. Best effort; may be a no-op
     * for transaction-scoped locks.
     */
    void releaseLock(LockName lockName, boolean shared, boolean transactional);

    /**
     * Rejects lock modes this backend cannot provide. Called before any lock attempt.
     *
     * @throws com.advisory.lock.api.LockConfigurationException for an unsupported mode
     */
    default void checkSupported(boolean shared, boolean transactional) {
    }
}
