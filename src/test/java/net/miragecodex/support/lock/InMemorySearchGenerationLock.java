package net.miragecodex.support.lock;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-local {@link SearchGenerationLock} for tests that exercise concurrent misses without a database.
 */
public class InMemorySearchGenerationLock implements SearchGenerationLock {

    private final ConcurrentMap<AdvisoryLockKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public <T> T withLock(AdvisoryLockKey key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, ignored -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
