package com.advisory.lock.api;

/**
 * Thrown for invalid lock options or for a lock mode the backend cannot
 * provide. Always raised before the backend is asked for a lock.
 */
public class LockConfigurationException extends IllegalArgumentException {

    public LockConfigurationException(String message) {
        super(message);
    }

    public LockConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
