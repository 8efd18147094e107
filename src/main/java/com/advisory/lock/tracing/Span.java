package com.advisory.lock.tracing;

/**
 * A traced lock request. Ends when closed, so it can be used in
 * try-with-resources.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, boolean value);

    void recordException(Throwable t);

    /**
     * Marks the span failed. Spans not marked failed end as OK.
     */
    void markFailed();

    @Override
    void close();
}
