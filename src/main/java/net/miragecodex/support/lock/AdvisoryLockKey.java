package net.miragecodex.support.lock;

/**
 * Address of something generated at most once, mapped onto a PostgreSQL advisory lock.
 *
 * <p>Implementations hash a kind-specific string so that keys of different
 * kinds do not share a lock. {@code toString} is used in log lines.</p>
 */
public interface AdvisoryLockKey {

    /** Stable 64-bit key for {@code pg_advisory_lock}. */
    long advisoryLockKey();
}
