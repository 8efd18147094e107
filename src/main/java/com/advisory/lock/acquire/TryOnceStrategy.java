package com.advisory.lock.acquire;

import com.advisory.lock.backend.AdvisoryLockBackend;

/**
 * A single non-blocking attempt.
 */
public class TryOnceStrategy implements AcquisitionStrategy {

    @Override
    public boolean acquire(AdvisoryLockBackend backend, AcquisitionRequest request) {
        return backend.tryLock(request.lockName(), request.shared(), request.transactional());
    }

    @Override
    public AcquisitionMode mode() {
        return AcquisitionMode.TRY_ONCE;
    }
}
