package com.advisory.lock.metrics;

import com.advisory.lock.acquire.AcquisitionMode;

import java.time.Duration;

/**
 * Interface for recording advisory lock metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    /**
     * Records a completed acquisition attempt against the backend.
     *
     * @param mode     how the attempt waited
     * @param acquired whether the lock was obtained
     * @param waited   time spent acquiring
     */
    void recordAcquisition(AcquisitionMode mode, boolean acquired, Duration waited);

    void incrementReentrant();

    void recordHeld(Duration held);

    void incrementReleaseFailure();
}
