package com.advisory.lock.acquire;

import com.advisory.lock.backend.AdvisoryLockBackend;

/**
 * Waits inside the database via the backend's blocking call.
 * The wait cannot be cancelled from the client once issued.
 */
public class NativeBlockingStrategy implements AcquisitionStrategy {

    @Override
    public boolean acquire(AdvisoryLockBackend backend, AcquisitionRequest request) {
        return backend.blockingLock(request.lockName(), request.shared(), request.transactional());
    }

    @Override
    public AcquisitionMode mode() {
        return AcquisitionMode.BLOCKING;
    }
}
