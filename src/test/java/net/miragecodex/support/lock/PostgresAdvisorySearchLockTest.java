package net.miragecodex.support.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import net.miragecodex.domain.search.SearchKey;
import net.miragecodex.support.retry.AdvisoryLockAcquisitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

class PostgresAdvisorySearchLockTest {

    private static final SearchKey KEY = new SearchKey("a".repeat(64), 1);

    private JdbcTemplate jdbcTemplate;
    private Connection connection;
    private PreparedStatement lockStatement;
    private PreparedStatement unlockStatement;
    private PostgresAdvisorySearchLock lock;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws SQLException {
        jdbcTemplate = mock(JdbcTemplate.class);
        connection = mock(Connection.class);
        lockStatement = mock(PreparedStatement.class);
        unlockStatement = mock(PreparedStatement.class);
        when(connection.prepareStatement("SELECT pg_advisory_lock(?)")).thenReturn(lockStatement);
        when(connection.prepareStatement("SELECT pg_advisory_unlock(?)")).thenReturn(unlockStatement);
        when(jdbcTemplate.execute(any(ConnectionCallback.class))).thenAnswer(invocation ->
            ((ConnectionCallback<Object>) invocation.getArgument(0)).doInConnection(connection));
        lock = new PostgresAdvisorySearchLock(jdbcTemplate);
    }

    @Test
    void should_LockRunAndUnlock_When_ActionSucceeds() throws SQLException {
        String result = lock.withLock(KEY, () -> "stored");

        assertThat(result).isEqualTo("stored");
        InOrder order = inOrder(lockStatement, unlockStatement);
        order.verify(lockStatement).setLong(1, KEY.advisoryLockKey());
        order.verify(lockStatement).execute();
        order.verify(unlockStatement).setLong(1, KEY.advisoryLockKey());
        order.verify(unlockStatement).execute();
    }

    @Test
    void should_UnlockAndPropagate_When_ActionThrows() throws SQLException {
        assertThatThrownBy(() -> lock.withLock(KEY, () -> {
            throw new IllegalStateException("generation failed");
        })).isInstanceOf(IllegalStateException.class).hasMessage("generation failed");

        verify(unlockStatement).execute();
    }

    @Test
    void should_RetryAndThenFail_When_LockCannotBeAcquired() throws SQLException {
        when(lockStatement.execute()).thenThrow(new SQLException("connection reset"));

        assertThatThrownBy(() -> lock.withLock(KEY, () -> "never"))
            .isInstanceOfSatisfying(AdvisoryLockAcquisitionException.class, exception ->
                assertThat(exception.getLockKey()).isEqualTo(KEY.advisoryLockKey()));
        verify(lockStatement, times(3)).execute();
    }

    @Test
    void should_ReturnResult_When_UnlockFails() throws SQLException {
        when(unlockStatement.execute()).thenThrow(new SQLException("gone"));

        assertThat(lock.withLock(KEY, () -> 7)).isEqualTo(7);
    }
}
