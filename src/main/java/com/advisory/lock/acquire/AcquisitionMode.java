package com.advisory.lock.acquire;

/**
 * How a lock request waits for the backend.
 */
public enum AcquisitionMode {
    /** One non-blocking attempt. */
    TRY_ONCE,
    /** Repeated non-blocking attempts with randomized pauses, until a deadline or forever. */
    POLLING,
    /** A single call that waits inside the database. */
    BLOCKING
}
