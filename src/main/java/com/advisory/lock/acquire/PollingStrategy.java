package com.advisory.lock.acquire;

import com.advisory.lock.api.LockAcquisitionException;
import com.advisory.lock.backend.AdvisoryLockBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Repeats non-blocking attempts with randomized pauses.
 *
 * <p>The deadline is fixed before the first attempt. Every pass tries the lock
 * before looking at the deadline, so the lock is still attempted once after
 * the deadline has passed. Without a timeout the loop runs until the lock is
 * acquired.</p>
 */
public class PollingStrategy implements AcquisitionStrategy {
    private static final Logger log = LoggerFactory.getLogger(PollingStrategy.class);

    private final Clock clock;
    private final Sleeper sleeper;
    private final IntervalSource intervals;

    public PollingStrategy(RetryPolicy retryPolicy) {
        this(Clock.systemUTC(), Sleeper.threadSleep(), retryPolicy::nextInterval);
    }

    public PollingStrategy(Clock clock, Sleeper sleeper, IntervalSource intervals) {
        this.clock = clock;
        this.sleeper = sleeper;
        this.intervals = intervals;
    }

    @Override
    public boolean acquire(AdvisoryLockBackend backend, AcquisitionRequest request) {
        Instant deadline = request.waitsForever() ? null : clock.instant().plus(request.timeout());
        int attempts = 0;
        while (true) {
            attempts++;
            if (backend.tryLock(request.lockName(), request.shared(), request.transactional())) {
                log.debug("lock.poll.acquired lockName={} attempts={}", request.lockName().value(), attempts);
                return true;
            }
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                log.debug("lock.poll.timeout lockName={} attempts={} timeout={}",
                        request.lockName().value(), attempts, request.timeout());
                return false;
            }
            pause(request);
        }
    }

    @Override
    public AcquisitionMode mode() {
        return AcquisitionMode.POLLING;
    }

    private void pause(AcquisitionRequest request) {
        Duration interval = intervals.nextInterval();
        try {
            sleeper.sleep(interval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(request.lockName().value(),
                    "Interrupted while waiting for lock: " + request.lockName().value(), e);
        }
    }
}
