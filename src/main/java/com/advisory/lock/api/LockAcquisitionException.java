package com.advisory.lock.api;

/**
 * Runtime exception thrown when an advisory lock cannot be acquired and the
 * caller asked for a failure to be raised, or when waiting for the lock is
 * interrupted.
 */
public class LockAcquisitionException extends RuntimeException {

    private final String lockName;

    public LockAcquisitionException(String lockName, String message) {
        super(message);
        this.lockName = lockName;
    }

    public LockAcquisitionException(String lockName, String message, Throwable cause) {
        super(message, cause);
        this.lockName = lockName;
    }

    /**
     * Returns the resolved name of the lock that was not acquired.
     */
    public String getLockName() {
        return lockName;
    }
}
