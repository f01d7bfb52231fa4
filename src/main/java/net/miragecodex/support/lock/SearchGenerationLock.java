package net.miragecodex.support.lock;

import java.util.function.Supplier;

/**
 * Mutual exclusion per generated item (a page of search results or a book page)
 * across every process sharing the store.
 */
public interface SearchGenerationLock {

    /**
     * Runs {@code action} while holding the lock for {@code key}, blocking until
     * it is available. The lock is released when the action returns or throws.
     */
    <T> T withLock(AdvisoryLockKey key, Supplier<T> action);
}
