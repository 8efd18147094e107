package com.advisory.lock.acquire;

import com.advisory.lock.key.LockName;

import java.time.Duration;

/**
 * What to acquire and how long to wait for it.
 *
 * @param lockName      the resolved lock name
 * @param shared        shared instead of exclusive
 * @param transactional scoped to the enclosing transaction
 * @param timeout       null waits forever, zero tries once, positive bounds the wait
 */
public record AcquisitionRequest(LockName lockName, boolean shared, boolean transactional, Duration timeout) {

    public AcquisitionRequest {
        if (lockName == null) {
            throw new IllegalArgumentException("lockName must not be null");
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
    }

    public boolean waitsForever() {
        return timeout == null;
    }
}
