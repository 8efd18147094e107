package com.advisory.lock.api;

/**
 * Wraps a failure talking to the database while locking or unlocking.
 * These are never retried.
 */
public class LockBackendException extends RuntimeException {

    public LockBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
