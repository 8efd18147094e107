package com.advisory.lock.backend;

import com.advisory.lock.api.LockConfigurationException;
import com.advisory.lock.key.LockName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryAdvisoryLockBackendTest {

    private static final LockName NAME = LockName.resolve("", "shared-key");

    private final InMemoryLockRegistry registry = new InMemoryLockRegistry();
    private final InMemoryAdvisoryLockBackend first = new InMemoryAdvisoryLockBackend(registry);
    private final InMemoryAdvisoryLockBackend second = new InMemoryAdvisoryLockBackend(registry);

    @Nested
    @DisplayName("Exclusive locks")
    class ExclusiveTests {

        @Test
        @DisplayName("Should acquire and release lock")
        void testAcquireRelease() {
            assertTrue(first.tryLock(NAME, false, false));
            assertTrue(registry.isLocked(NAME.key()));
            first.releaseLock(NAME, false, false);
            assertFalse(registry.isLocked(NAME.key()));
        }

        @Test
        @DisplayName("Should exclude other sessions")
        void testExcludesOthers() {
            assertTrue(first.tryLock(NAME, false, false));
            assertFalse(second.tryLock(NAME, false, false));
            assertFalse(second.tryLock(NAME, true, false));

            first.releaseLock(NAME, false, false);
            assertTrue(second.tryLock(NAME, false, false));
        }

        @Test
        @DisplayName("Same session may lock repeatedly and must release as often")
        void testSessionReentrant() {
            assertTrue(first.tryLock(NAME, false, false));
            assertTrue(first.tryLock(NAME, false, false));

            first.releaseLock(NAME, false, false);
            assertFalse(second.tryLock(NAME, false, false));

            first.releaseLock(NAME, false, false);
            assertTrue(second.tryLock(NAME, false, false));
        }

        @Test
        @DisplayName("Different keys do not contend")
        void testDifferentKeys() {
            assertTrue(first.tryLock(NAME, false, false));
            assertTrue(second.tryLock(LockName.resolve("", "other-key"), false, false));
        }
    }

    @Nested
    @DisplayName("Shared locks")
    class SharedTests {

        @Test
        @DisplayName("Shared holders coexist")
        void testSharedCoexist() {
            assertTrue(first.tryLock(NAME, true, false));
            assertTrue(second.tryLock(NAME, true, false));
        }

        @Test
        @DisplayName("A shared holder blocks other sessions' exclusive requests")
        void testSharedBlocksExclusive() {
            assertTrue(first.tryLock(NAME, true, false));
            assertFalse(second.tryLock(NAME, false, false));
        }

        @Test
        @DisplayName("The only shared holder may upgrade to exclusive")
        void testSoleHolderUpgrade() {
            assertTrue(first.tryLock(NAME, true, false));
            assertTrue(first.tryLock(NAME, false, false));
        }
    }

    @Nested
    @DisplayName("Session lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Releasing a lock that is not held is tolerated")
        void testReleaseNotHeld() {
            assertDoesNotThrow(() -> first.releaseLock(NAME, false, false));
            assertFalse(registry.release(first, NAME.key(), false));
        }

        @Test
        @DisplayName("Closing a session drops its locks")
        void testCloseReleasesAll() {
            first.tryLock(NAME, false, false);
            first.tryLock(NAME, false, false);
            first.close();
            assertFalse(registry.isLocked(NAME.key()));
        }

        @Test
        @DisplayName("Transaction-scoped locks are rejected")
        void testNoTransactions() {
            assertThrows(LockConfigurationException.class, () -> first.checkSupported(false, true));
            assertDoesNotThrow(() -> first.checkSupported(true, false));
        }

        @Test
        @DisplayName("Blocking lock waits until the holder releases")
        void testBlockingWaits() throws Exception {
            assertTrue(first.supportsBlockingLock());
            assertTrue(first.tryLock(NAME, false, false));

            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch acquired = new CountDownLatch(1);
            AtomicBoolean result = new AtomicBoolean();
            Thread waiter = new Thread(() -> {
                started.countDown();
                result.set(second.blockingLock(NAME, false, false));
                acquired.countDown();
            });
            waiter.start();

            assertTrue(started.await(5, TimeUnit.SECONDS));
            assertFalse(acquired.await(100, TimeUnit.MILLISECONDS));

            first.releaseLock(NAME, false, false);

            assertTrue(acquired.await(5, TimeUnit.SECONDS));
            assertTrue(result.get());
            waiter.join(5000);
        }
    }
}
