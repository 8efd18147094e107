package com.advisory.lock.acquire;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounds of the randomized pause between polling attempts.
 * Each pause is drawn uniformly between the bounds.
 *
 * @param minInterval shortest pause between attempts
 * @param maxInterval longest pause between attempts
 */
public record RetryPolicy(Duration minInterval, Duration maxInterval) {

    public RetryPolicy {
        if (minInterval == null || maxInterval == null) {
            throw new IllegalArgumentException("intervals must not be null");
        }
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must be >= 0");
        }
        if (maxInterval.compareTo(minInterval) < 0) {
            throw new IllegalArgumentException("maxInterval must be >= minInterval");
        }
    }

    /**
     * Default policy: pauses of 50 to 150 ms.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(Duration.ofMillis(50), Duration.ofMillis(150));
    }

    /**
     * Picks a pause uniformly within the bounds.
     */
    public Duration nextInterval() {
        long min = minInterval.toNanos();
        long max = maxInterval.toNanos();
        if (min == max) {
            return minInterval;
        }
        return Duration.ofNanos(ThreadLocalRandom.current().nextLong(min, max + 1));
    }
}
