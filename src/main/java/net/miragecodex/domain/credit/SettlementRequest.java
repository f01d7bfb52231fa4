package net.miragecodex.domain.credit;

import java.util.UUID;
import net.miragecodex.domain.search.SearchKey;

/**
 * What a successful miss produced, for the ledger to charge.
 *
 * @param totalGeneratedPages sum of page counts of the generated books
 */
public record SettlementRequest(CreditAuthorization authorization,
                                UUID searchId,
                                SearchKey key,
                                int totalGeneratedPages,
                                String description) {
}
