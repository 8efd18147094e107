package com.advisory.lock.acquire;

import com.advisory.lock.backend.AdvisoryLockBackend;

/**
 * Picks the strategy for a request from its timeout.
 *
 * <ul>
 *   <li>zero: {@link TryOnceStrategy}</li>
 *   <li>positive: {@link PollingStrategy} up to the timeout</li>
 *   <li>none: {@link NativeBlockingStrategy} when preferred and the backend has a
 *       blocking call, otherwise {@link PollingStrategy} without a deadline</li>
 * </ul>
 */
public class AcquisitionStrategies {

    private final AcquisitionStrategy tryOnce;
    private final AcquisitionStrategy polling;
    private final AcquisitionStrategy blocking;
    private final boolean preferNativeBlocking;

    public AcquisitionStrategies(PollingStrategy polling, boolean preferNativeBlocking) {
        this(new TryOnceStrategy(), polling, new NativeBlockingStrategy(), preferNativeBlocking);
    }

    public AcquisitionStrategies(AcquisitionStrategy tryOnce, AcquisitionStrategy polling,
                                 AcquisitionStrategy blocking, boolean preferNativeBlocking) {
        this.tryOnce = tryOnce;
        this.polling = polling;
        this.blocking = blocking;
        this.preferNativeBlocking = preferNativeBlocking;
    }

    public AcquisitionStrategy select(AcquisitionRequest request, AdvisoryLockBackend backend) {
        if (request.waitsForever()) {
            return preferNativeBlocking && backend.supportsBlockingLock() ? blocking : polling;
        }
        if (request.timeout().isZero()) {
            return tryOnce;
        }
        return polling;
    }
}
