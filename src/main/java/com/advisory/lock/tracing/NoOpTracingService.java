package com.advisory.lock.tracing;

import com.advisory.lock.key.LockName;

/**
 * No-op implementation of {@link TracingService}.
 */
public class NoOpTracingService implements TracingService {

    private static final Span NO_OP_SPAN = new NoOpSpan();

    @Override
    public Span startLockSpan(LockName lockName, boolean shared) {
        return NO_OP_SPAN;
    }

    private static class NoOpSpan implements Span {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setAttribute(String key, boolean value) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void markFailed() {
        }

        @Override
        public void close() {
        }
    }
}
