package com.advisory.lock.metrics;

import com.advisory.lock.acquire.AcquisitionMode;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordAcquisition(AcquisitionMode mode, boolean acquired, Duration waited) {
    }

    @Override
    public void incrementReentrant() {
    }

    @Override
    public void recordHeld(Duration held) {
    }

    @Override
    public void incrementReleaseFailure() {
    }
}
