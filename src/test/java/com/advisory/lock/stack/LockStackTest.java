package com.advisory.lock.stack;

import com.advisory.lock.key.LockName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LockStackTest {

    private static LockStackItem item(String name, boolean shared) {
        return new LockStackItem(LockName.resolve("", name), shared);
    }

    @Nested
    @DisplayName("LockStack")
    class StackTests {

        private LockStack stack;

        @BeforeEach
        void setUp() {
            stack = new ExecutionStacks().forContext(new Object());
        }

        @Test
        @DisplayName("Pops in reverse push order")
        void testLifo() {
            stack.push(item("a", false));
            stack.push(item("b", false));
            stack.push(item("c", true));

            assertEquals(item("c", true), stack.pop());
            assertEquals(item("b", false), stack.pop());
            assertEquals(item("a", false), stack.pop());
            assertTrue(stack.isEmpty());
        }

        @Test
        @DisplayName("Pop on empty stack fails")
        void testPopEmpty() {
            assertThrows(IllegalStateException.class, () -> stack.pop());
        }

        @Test
        @DisplayName("Contains compares name and shared flag")
        void testStructuralContains() {
            stack.push(item("a", true));

            assertTrue(stack.contains(item("a", true)));
            assertFalse(stack.contains(item("a", false)));
            assertFalse(stack.contains(item("b", true)));
        }

        @Test
        @DisplayName("Snapshot lists outermost first and is detached")
        void testSnapshot() {
            stack.push(item("outer", false));
            stack.push(item("inner", false));

            List<LockStackItem> snapshot = stack.snapshot();
            stack.pop();

            assertEquals(List.of(item("outer", false), item("inner", false)), snapshot);
            assertEquals(1, stack.size());
        }

        @Test
        @DisplayName("Should reject null items")
        void testNullItem() {
            assertThrows(IllegalArgumentException.class, () -> stack.push(null));
        }
    }

    @Nested
    @DisplayName("ExecutionStacks")
    class RegistryTests {

        private final ExecutionStacks stacks = new ExecutionStacks();

        @Test
        @DisplayName("Same context gets the same stack")
        void testSameContext() {
            Object context = new Object();
            assertSame(stacks.forContext(context), stacks.forContext(context));
            assertSame(stacks.current(), stacks.current());
        }

        @Test
        @DisplayName("Different contexts get independent stacks")
        void testIndependentContexts() {
            LockStack first = stacks.forContext(new Object());
            LockStack second = stacks.forContext(new Object());
            first.push(item("a", false));

            assertNotSame(first, second);
            assertTrue(second.isEmpty());
        }

        @Test
        @DisplayName("Each thread has its own current stack")
        void testPerThread() throws Exception {
            stacks.current().push(item("main", false));

            LockStack other = CompletableFuture.supplyAsync(stacks::current).get(5, TimeUnit.SECONDS);

            assertNotSame(stacks.current(), other);
            assertFalse(other.contains(item("main", false)));
            stacks.current().pop();
        }

        @Test
        @DisplayName("Should reject null context")
        void testNullContext() {
            assertThrows(IllegalArgumentException.class, () -> stacks.forContext(null));
        }
    }
}
