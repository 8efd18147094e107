package com.advisory.lock.config;

import com.advisory.lock.acquire.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LockSettingsTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(LockSettings.PREFIX_PROPERTY);
    }

    @Test
    @DisplayName("Defaults have no prefix and the standard retry policy")
    void testDefaults() {
        LockSettings settings = LockSettings.defaults();
        assertEquals("", settings.prefix());
        assertEquals(RetryPolicy.defaults(), settings.retryPolicy());
        assertFalse(settings.preferNativeBlocking());
    }

    @Test
    @DisplayName("System property supplies the prefix")
    void testPrefixFromProperty() {
        System.setProperty(LockSettings.PREFIX_PROPERTY, "staging:");
        assertEquals("staging:", LockSettings.fromEnvironment().prefix());
    }

    @Test
    @DisplayName("Null prefix is treated as empty")
    void testNullPrefix() {
        assertEquals("", LockSettings.defaults().withPrefix(null).prefix());
    }

    @Test
    @DisplayName("Should reject null retry policy")
    void testNullRetryPolicy() {
        assertThrows(IllegalArgumentException.class, () -> new LockSettings("", null, false));
    }

    @Test
    @DisplayName("Copy methods change one field only")
    void testWithers() {
        RetryPolicy fast = new RetryPolicy(Duration.ofMillis(1), Duration.ofMillis(2));
        LockSettings settings = LockSettings.defaults()
                .withPrefix("p:")
                .withRetryPolicy(fast)
                .withPreferNativeBlocking(true);

        assertEquals(new LockSettings("p:", fast, true), settings);
    }
}
