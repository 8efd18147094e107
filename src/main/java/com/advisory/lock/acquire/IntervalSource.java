package com.advisory.lock.acquire;

import java.time.Duration;

/**
 * Supplies the pause before the next polling attempt.
 */
@FunctionalInterface
public interface IntervalSource {

    Duration nextInterval();
}
