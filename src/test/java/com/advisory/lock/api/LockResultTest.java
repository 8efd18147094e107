package com.advisory.lock.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LockResultTest {

    @Test
    @DisplayName("Acquired result carries the block value")
    void testAcquired() {
        LockResult<Integer> result = LockResult.acquired(7);
        assertTrue(result.isAcquired());
        assertEquals(7, result.getValue());
        assertEquals(Optional.of(7), result.asOptional());
    }

    @Test
    @DisplayName("Failed result is a shared instance without a value")
    void testFailedSingleton() {
        LockResult<String> first = LockResult.failed();
        LockResult<Integer> second = LockResult.failed();
        assertSame(first, second);
        assertFalse(first.isAcquired());
        assertNull(first.getValue());
        assertTrue(first.asOptional().isEmpty());
    }

    @Test
    @DisplayName("A block returning null is distinguishable from a failed lock")
    void testNullValue() {
        LockResult<Object> ranWithNull = LockResult.acquired(null);
        assertTrue(ranWithNull.isAcquired());
        assertNull(ranWithNull.getValue());
        assertNotEquals(LockResult.failed(), ranWithNull);
    }

    @Test
    @DisplayName("Results compare by value")
    void testEquality() {
        assertEquals(LockResult.acquired("x"), LockResult.acquired("x"));
        assertEquals(LockResult.acquired("x").hashCode(), LockResult.acquired("x").hashCode());
        assertNotEquals(LockResult.acquired("x"), LockResult.acquired("y"));
    }
}
