package com.advisory.lock.api;

/**
 * Work to run while a lock is held.
 *
 * @param <T> the result type
 * @param <X> the checked exception the work may throw
 */
@FunctionalInterface
public interface LockedBlock<T, X extends Exception> {

    T call() throws X;
}
