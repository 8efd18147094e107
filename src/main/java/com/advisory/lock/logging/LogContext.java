package com.advisory.lock.logging;

import com.advisory.lock.key.LockName;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC wrapper for structured logging of lock requests.
 * Keys added here are removed again on close; keys an enclosing context
 * had set are restored.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forLock(lockName, false)) {
 *     log.debug("lock.acquired");
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String LOCK_NAME = "lockName";
    public static final String LOCK_KEY = "lockKey";
    public static final String LOCK_MODE = "lockMode";
    public static final String OPERATION = "operation";

    private final List<String> keys = new ArrayList<>();
    private final List<String> previousValues = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one advisory lock request.
     */
    public static LogContext forLock(LockName lockName, boolean shared) {
        LogContext ctx = new LogContext();
        ctx.put(OPERATION, "advisory_lock");
        ctx.put(LOCK_NAME, lockName.value());
        ctx.put(LOCK_KEY, Long.toString(lockName.key()));
        ctx.put(LOCK_MODE, shared ? "shared" : "exclusive");
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        previousValues.add(MDC.get(key));
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (int i = keys.size() - 1; i >= 0; i--) {
            String previous = previousValues.get(i);
            if (previous == null) {
                MDC.remove(keys.get(i));
            } else {
                MDC.put(keys.get(i), previous);
            }
        }
        keys.clear();
        previousValues.clear();
    }
}
