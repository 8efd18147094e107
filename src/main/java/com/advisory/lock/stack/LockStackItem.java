package com.advisory.lock.stack;

import com.advisory.lock.key.LockName;

/**
 * One lock held by an execution context.
 * Two items are equal only when both the name and the shared flag match.
 *
 * @param lockName the resolved lock name
 * @param shared   whether the lock was taken in shared mode
 */
public record LockStackItem(LockName lockName, boolean shared) {

    public LockStackItem {
        if (lockName == null) {
            throw new IllegalArgumentException("lockName must not be null");
        }
    }
}
