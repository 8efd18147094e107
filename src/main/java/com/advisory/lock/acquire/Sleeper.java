package com.advisory.lock.acquire;

import java.time.Duration;

/**
 * Pauses the calling context between polling attempts.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleeps the calling thread.
     */
    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
    }
}
