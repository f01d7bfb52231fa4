package net.miragecodex.domain.credit;

import java.time.Instant;

/**
 * Append-only ledger entry. Negative amounts are debits.
 */
public record CreditTransaction(long id, String userId, int amount, String type, String description, Instant createdAt) {
}
