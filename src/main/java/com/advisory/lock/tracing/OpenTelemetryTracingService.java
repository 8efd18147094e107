package com.advisory.lock.tracing;

import com.advisory.lock.key.LockName;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * OpenTelemetry-based implementation of {@link TracingService}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startLockSpan(LockName lockName, boolean shared) {
        io.opentelemetry.api.trace.Span otelSpan = tracer.spanBuilder(RUN_SPAN)
                .setAttribute("lock.name", lockName.value())
                .setAttribute("lock.key", lockName.key())
                .setAttribute("lock.shared", shared)
                .startSpan();
        return new OTelSpanAdapter(otelSpan);
    }

    private static class OTelSpanAdapter implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;
        private boolean failed;

        OTelSpanAdapter(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void setAttribute(String key, String value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, boolean value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void recordException(Throwable t) {
            otelSpan.recordException(t);
        }

        @Override
        public void markFailed() {
            failed = true;
        }

        @Override
        public void close() {
            otelSpan.setStatus(failed ? StatusCode.ERROR : StatusCode.OK);
            otelSpan.end();
        }
    }
}
