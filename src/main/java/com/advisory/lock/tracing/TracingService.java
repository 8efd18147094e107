package com.advisory.lock.tracing;

import com.advisory.lock.key.LockName;

/**
 * Interface for distributed tracing integration.
 * The default {@link NoOpTracingService} does nothing, so the library works
 * without any tracing dependencies on the classpath.
 */
public interface TracingService {

    String RUN_SPAN = "advisory_lock.run";

    /**
     * Starts a span for one lock request, tagged with the lock's name, key and mode.
     */
    Span startLockSpan(LockName lockName, boolean shared);
}
