package net.miragecodex.support.lock;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.function.Supplier;
import net.miragecodex.support.retry.AdvisoryLockAcquisitionException;
import net.miragecodex.support.retry.RetrySupport;
import net.miragecodex.support.retry.RetrySupport.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * {@link SearchGenerationLock} backed by a PostgreSQL session advisory lock.
 *
 * <p>The lock lives on one pooled connection held for the whole action. Work
 * inside the action uses other connections, so the pool must be larger than the
 * number of concurrent generations.</p>
 */
@Component
public class PostgresAdvisorySearchLock implements SearchGenerationLock {

    private static final Logger log = LoggerFactory.getLogger(PostgresAdvisorySearchLock.class);

    private final JdbcTemplate jdbcTemplate;
    private final RetryConfig retryConfig = RetryConfig.forAdvisoryLock(log);

    public PostgresAdvisorySearchLock(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public <T> T withLock(AdvisoryLockKey key, Supplier<T> action) {
        long lockKey = key.advisoryLockKey();
        return RetrySupport.executeWithLockRetry(
            retryConfig,
            "generation lock " + key,
            () -> jdbcTemplate.execute((ConnectionCallback<T>) connection -> runLocked(connection, key, lockKey, action))
        );
    }

    private <T> T runLocked(Connection connection, AdvisoryLockKey key, long lockKey, Supplier<T> action) {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?)")) {
            statement.setLong(1, lockKey);
            statement.execute();
        } catch (SQLException exception) {
            throw new AdvisoryLockAcquisitionException(lockKey, exception);
        }
        log.debug("Acquired generation lock for {} (lockKey={})", key, lockKey);
        try {
            return action.get();
        } finally {
            unlock(connection, key, lockKey);
        }
    }

    private void unlock(Connection connection, AdvisoryLockKey key, long lockKey) {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, lockKey);
            statement.execute();
            log.debug("Released generation lock for {}", key);
        } catch (SQLException exception) {
            // Session lock stays held until the pooled connection is closed.
            log.error("Failed to release generation lock for {} (lockKey={})", key, lockKey, exception);
        }
    }
}
