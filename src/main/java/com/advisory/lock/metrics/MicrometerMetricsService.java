package com.advisory.lock.metrics;

import com.advisory.lock.acquire.AcquisitionMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code advisory.lock.acquire}: Timer (tags: mode, outcome)</li>
 *   <li>{@code advisory.lock.reentrant}: Counter</li>
 *   <li>{@code advisory.lock.held}: Timer</li>
 *   <li>{@code advisory.lock.release.failure}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    static final String ACQUIRE = "advisory.lock.acquire";
    static final String REENTRANT = "advisory.lock.reentrant";
    static final String HELD = "advisory.lock.held";
    static final String RELEASE_FAILURE = "advisory.lock.release.failure";

    private final MeterRegistry registry;
    private final Map<String, Timer> acquireTimers = new ConcurrentHashMap<>();
    private final Counter reentrantCounter;
    private final Timer heldTimer;
    private final Counter releaseFailureCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.reentrantCounter = Counter.builder(REENTRANT)
                .description("Lock requests satisfied by a lock the context already held")
                .register(registry);
        this.heldTimer = Timer.builder(HELD)
                .description("Time advisory locks were held")
                .register(registry);
        this.releaseFailureCounter = Counter.builder(RELEASE_FAILURE)
                .description("Failed advisory lock releases")
                .register(registry);
    }

    @Override
    public void recordAcquisition(AcquisitionMode mode, boolean acquired, Duration waited) {
        String outcome = acquired ? "acquired" : "not_acquired";
        Timer timer = acquireTimers.computeIfAbsent(mode.name() + ":" + outcome, k ->
                Timer.builder(ACQUIRE)
                        .description("Time spent acquiring advisory locks")
                        .tag("mode", mode.name())
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(waited);
    }

    @Override
    public void incrementReentrant() {
        reentrantCounter.increment();
    }

    @Override
    public void recordHeld(Duration held) {
        heldTimer.record(held);
    }

    @Override
    public void incrementReleaseFailure() {
        releaseFailureCounter.increment();
    }
}
