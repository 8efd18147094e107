package com.advisory.lock.acquire;

import com.advisory.lock.backend.AdvisoryLockBackend;

/**
 * One way of obtaining a lock from a backend.
 * Not getting the lock is a normal {@code false} result, never an exception.
 */
public interface AcquisitionStrategy {

    /**
     * @return true if the lock is now held through {@code backend}
     * @throws com.advisory.lock.api.LockBackendException if the backend fails
     */
    boolean acquire(AdvisoryLockBackend backend, AcquisitionRequest request);

    AcquisitionMode mode();
}
