package com.advisory.lock.backend;

import java.util.HashMap;
import java.util.Map;

/**
 * Process-local table of advisory locks shared by {@link InMemoryAdvisoryLockBackend} sessions.
 *
 * <p>Mirrors database advisory lock rules: locks belong to a session, not a
 * thread; a session may take the same lock repeatedly and must release it as
 * many times; an exclusive lock excludes every other session; a shared lock
 * only excludes other sessions' exclusive locks.</p>
 */
public class InMemoryLockRegistry {

    private final Map<Long, LockState> locks = new HashMap<>();

    /**
     * Takes the lock for the session if it is free for that session.
     */
    public synchronized boolean tryAcquire(Object session, long key, boolean shared) {
        LockState state = locks.computeIfAbsent(key, k -> new LockState());
        if (!state.isGrantable(session, shared)) {
            return false;
        }
        state.grant(session, shared);
        return true;
    }

    /**
     * Waits until the lock can be granted to the session.
     */
    public synchronized void acquire(Object session, long key, boolean shared) throws InterruptedException {
        while (!tryAcquire(session, key, shared)) {
            wait();
        }
    }

    /**
     * Releases one hold of the lock.
     *
     * @return false if the session did not hold the lock in that mode
     */
    public synchronized boolean release(Object session, long key, boolean shared) {
        LockState state = locks.get(key);
        if (state == null || !state.revoke(session, shared)) {
            return false;
        }
        if (state.isFree()) {
            locks.remove(key);
        }
        notifyAll();
        return true;
    }

    public synchronized boolean isLocked(long key) {
        LockState state = locks.get(key);
        return state != null && !state.isFree();
    }

    /**
     * Drops every lock held by the session, as a database does when a session ends.
     */
    public synchronized void releaseAll(Object session) {
        locks.values().forEach(state -> state.revokeAll(session));
        locks.values().removeIf(LockState::isFree);
        notifyAll();
    }

    private static final class LockState {
        private Object exclusiveOwner;
        private int exclusiveHolds;
        private final Map<Object, Integer> sharedHolds = new HashMap<>();

        boolean isGrantable(Object session, boolean shared) {
            if (exclusiveOwner != null && exclusiveOwner != session) {
                return false;
            }
            if (shared) {
                return true;
            }
            for (Object holder : sharedHolds.keySet()) {
                if (holder != session) {
                    return false;
                }
            }
            return true;
        }

        void grant(Object session, boolean shared) {
            if (shared) {
                sharedHolds.merge(session, 1, Integer::sum);
            } else {
                exclusiveOwner = session;
                exclusiveHolds++;
            }
        }

        boolean revoke(Object session, boolean shared) {
            if (shared) {
                Integer holds = sharedHolds.get(session);
                if (holds == null) {
                    return false;
                }
                if (holds == 1) {
                    sharedHolds.remove(session);
                } else {
                    sharedHolds.put(session, holds - 1);
                }
                return true;
            }
            if (exclusiveOwner != session) {
                return false;
            }
            if (--exclusiveHolds == 0) {
                exclusiveOwner = null;
            }
            return true;
        }

        void revokeAll(Object session) {
            sharedHolds.remove(session);
            if (exclusiveOwner == session) {
                exclusiveOwner = null;
                exclusiveHolds = 0;
            }
        }

        boolean isFree() {
            return exclusiveOwner == null && sharedHolds.isEmpty();
        }
    }
}
