package com.advisory.lock.stack;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * The locks currently held by a single execution context, innermost last.
 *
 * <p>Not thread-safe: a stack belongs to exactly one context and is only
 * touched by it. Obtain instances from {@link ExecutionStacks}.</p>
 */
public class LockStack {

    private final Deque<LockStackItem> items = new ArrayDeque<>();

    LockStack() {
    }

    public void push(LockStackItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        items.addLast(item);
    }

    /**
     * Removes and returns the innermost item.
     *
     * @throws IllegalStateException if the stack is empty
     */
    public LockStackItem pop() {
        LockStackItem item = items.pollLast();
        if (item == null) {
            throw new IllegalStateException("Lock stack is empty");
        }
        return item;
    }

    public boolean contains(LockStackItem item) {
        return items.contains(item);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    /**
     * Returns a copy of the held items, outermost first.
     */
    public List<LockStackItem> snapshot() {
        return new ArrayList<>(items);
    }

    @Override
    public String toString() {
        return "LockStack" + items;
    }
}
