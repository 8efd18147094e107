package com.advisory.lock.config;

import com.advisory.lock.acquire.RetryPolicy;

/**
 * Process-wide lock settings.
 *
 * @param prefix               prepended to every lock name; namespaces environments sharing one database
 * @param retryPolicy          pause bounds for polling acquisition
 * @param preferNativeBlocking use the backend's blocking call for wait-forever requests instead of polling
 */
public record LockSettings(String prefix, RetryPolicy retryPolicy, boolean preferNativeBlocking) {

    public static final String PREFIX_PROPERTY = "advisory.lock.prefix";
    public static final String PREFIX_ENV = "ADVISORY_LOCK_PREFIX";

    public LockSettings {
        if (prefix == null) {
            prefix = "";
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy must not be null");
        }
    }

    /**
     * Defaults: no prefix, 50-150 ms polling, no native blocking.
     */
    public static LockSettings defaults() {
        return new LockSettings("", RetryPolicy.defaults(), false);
    }

    /**
     * Defaults with the prefix taken from the {@value #PREFIX_PROPERTY} system
     * property, falling back to the {@value #PREFIX_ENV} environment variable.
     */
    public static LockSettings fromEnvironment() {
        String prefix = System.getProperty(PREFIX_PROPERTY);
        if (prefix == null) {
            prefix = System.getenv(PREFIX_ENV);
        }
        return defaults().withPrefix(prefix);
    }

    public LockSettings withPrefix(String prefix) {
        return new LockSettings(prefix, retryPolicy, preferNativeBlocking);
    }

    public LockSettings withRetryPolicy(RetryPolicy retryPolicy) {
        return new LockSettings(prefix, retryPolicy, preferNativeBlocking);
    }

    public LockSettings withPreferNativeBlocking(boolean preferNativeBlocking) {
        return new LockSettings(prefix, retryPolicy, preferNativeBlocking);
    }
}
