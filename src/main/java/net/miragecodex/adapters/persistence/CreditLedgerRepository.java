package net.miragecodex.adapters.persistence;

import jakarta.annotation.Nullable;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.miragecodex.config.CreditProperties;
import net.miragecodex.domain.credit.CreditBalance;
import net.miragecodex.domain.credit.CreditTransaction;
import net.miragecodex.domain.credit.TransactionType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Postgres adapter for the credit ledger: balances, holds, transactions and
 * reconciliation entries.
 *
 * <p>Methods here are single statements; the ledger service composes them
 * inside its own transactions. {@link #lockBalance(String)} must run inside one.
 * Holds older than {@code miragecodex.credits.hold-ttl} belong to misses that
 * never finished and no longer count against the balance.</p>
 */
@Repository
public class CreditLedgerRepository {

    private static final RowMapper<CreditTransaction> TRANSACTION_MAPPER = (rs, rowNum) -> {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new CreditTransaction(
            rs.getLong("id"),
            rs.getString("user_id"),
            rs.getInt("amount"),
            rs.getString("transaction_type"),
            rs.getString("description"),
            createdAt != null ? createdAt.toInstant() : Instant.EPOCH
        );
    };

    private final JdbcTemplate jdbcTemplate;
    private final CreditProperties properties;

    public CreditLedgerRepository(JdbcTemplate jdbcTemplate, CreditProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    /**
     * Creates a zero-balance account row when the user has none.
     *
     * @return whether the row was created by this call
     */
    public boolean ensureAccount(String userId) {
        return jdbcTemplate.update(
            "INSERT INTO user_credits (user_id, balance, updated_at) VALUES (?, 0, NOW()) ON CONFLICT (user_id) DO NOTHING",
            userId
        ) > 0;
    }

    /**
     * Locks the user's balance row for the rest of the current transaction and
     * returns balance and outstanding holds.
     */
    public Optional<CreditBalance> lockBalance(String userId) {
        Integer balance = jdbcTemplate.query(
            "SELECT balance FROM user_credits WHERE user_id = ? FOR UPDATE",
            rs -> rs.next() ? rs.getInt("balance") : null,
            userId
        );
        if (balance == null) {
            return Optional.empty();
        }
        return Optional.of(new CreditBalance(userId, balance, sumHolds(userId)));
    }

    /**
     * Non-locking read of balance and holds.
     */
    public Optional<CreditBalance> findBalance(String userId) {
        Integer balance = jdbcTemplate.query(
            "SELECT balance FROM user_credits WHERE user_id = ?",
            rs -> rs.next() ? rs.getInt("balance") : null,
            userId
        );
        if (balance == null) {
            return Optional.empty();
        }
        return Optional.of(new CreditBalance(userId, balance, sumHolds(userId)));
    }

    public long insertHold(String userId, int amount, String reference) {
        Long holdId = jdbcTemplate.queryForObject(
            "INSERT INTO credit_holds (user_id, amount, reference, created_at) VALUES (?, ?, ?, NOW()) RETURNING id",
            Long.class,
            userId,
            amount,
            reference
        );
        if (holdId == null) {
            throw new IllegalStateException("Credit hold insert returned no id for user " + userId);
        }
        return holdId;
    }

    /**
     * @return whether a hold was removed
     */
    public boolean deleteHold(long holdId) {
        return jdbcTemplate.update("DELETE FROM credit_holds WHERE id = ?", holdId) > 0;
    }

    public void insertTransaction(String userId,
                                  int amount,
                                  TransactionType type,
                                  String description,
                                  @Nullable String metadataJson) {
        jdbcTemplate.update(
            """
            INSERT INTO credit_transactions (user_id, amount, transaction_type, description, metadata, created_at)
            VALUES (?, ?, ?, ?, CAST(? AS jsonb), NOW())
            """,
            userId,
            amount,
            type.code(),
            description,
            metadataJson
        );
    }

    public void applyBalanceDelta(String userId, int delta) {
        int updated = jdbcTemplate.update(
            "UPDATE user_credits SET balance = balance + ?, updated_at = NOW() WHERE user_id = ?",
            delta,
            userId
        );
        if (updated != 1) {
            throw new IllegalStateException("No credit account for user " + userId);
        }
    }

    public List<CreditTransaction> findTransactions(String userId, int limit, int offset) {
        return jdbcTemplate.query(
            """
            SELECT id, user_id, amount, transaction_type, description, created_at
            FROM credit_transactions
            WHERE user_id = ?
            ORDER BY created_at DESC, id DESC
            LIMIT ? OFFSET ?
            """,
            TRANSACTION_MAPPER,
            userId,
            limit,
            offset
        );
    }

    public long countTransactions(String userId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM credit_transactions WHERE user_id = ?",
            Long.class,
            userId
        );
        return count != null ? count : 0L;
    }

    public void insertReconciliationEntry(String userId, @Nullable UUID searchId, int amount, String reason) {
        jdbcTemplate.update(
            """
            INSERT INTO credit_reconciliation_entries (user_id, search_id, amount, reason, created_at)
            VALUES (?, ?, ?, ?, NOW())
            """,
            userId,
            searchId,
            amount,
            reason
        );
    }

    /**
     * Removes holds past their time-to-live.
     *
     * @return number of holds removed
     */
    public int deleteExpiredHolds() {
        return jdbcTemplate.update(
            "DELETE FROM credit_holds WHERE created_at <= NOW() - (? * INTERVAL '1 second')",
            properties.getHoldTtl().toSeconds()
        );
    }

    private int sumHolds(String userId) {
        Integer held = jdbcTemplate.queryForObject(
            """
            SELECT COALESCE(SUM(amount), 0)
            FROM credit_holds
            WHERE user_id = ? AND created_at > NOW() - (? * INTERVAL '1 second')
            """,
            Integer.class,
            userId,
            properties.getHoldTtl().toSeconds()
        );
        return held != null ? held : 0;
    }
}
