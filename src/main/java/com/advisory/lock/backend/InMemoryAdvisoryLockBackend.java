package com.advisory.lock.backend;

import com.advisory.lock.api.LockBackendException;
import com.advisory.lock.api.LockConfigurationException;
import com.advisory.lock.key.LockName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One session against an {@link InMemoryLockRegistry}.
 * Suitable for single-JVM deployments and tests; sessions created over the
 * same registry contend with each other like database sessions do.
 */
public class InMemoryAdvisoryLockBackend implements AdvisoryLockBackend, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(InMemoryAdvisoryLockBackend.class);

    private final InMemoryLockRegistry registry;

    public InMemoryAdvisoryLockBackend(InMemoryLockRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    @Override
    public boolean tryLock(LockName lockName, boolean shared, boolean transactional) {
        boolean acquired = registry.tryAcquire(this, lockName.key(), shared);
        log.debug("lock.try lockName={} shared={} acquired={}", lockName.value(), shared, acquired);
        return acquired;
    }

    @Override
    public boolean supportsBlockingLock() {
        return true;
    }

    @Override
    public boolean blockingLock(LockName lockName, boolean shared, boolean transactional) {
        try {
            registry.acquire(this, lockName.key(), shared);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockBackendException("Interrupted while waiting for lock: " + lockName.value(), e);
        }
    }

    @Override
    public void releaseLock(LockName lockName, boolean shared, boolean transactional) {
        if (!registry.release(this, lockName.key(), shared)) {
            log.warn("lock.release.not_held lockName={} shared={}", lockName.value(), shared);
        }
    }

    @Override
    public void checkSupported(boolean shared, boolean transactional) {
        if (transactional) {
            throw new LockConfigurationException("In-memory locks have no transaction scope");
        }
    }

    /**
     * Ends the session, dropping any locks it still holds.
     */
    @Override
    public void close() {
        registry.releaseAll(this);
    }
}
