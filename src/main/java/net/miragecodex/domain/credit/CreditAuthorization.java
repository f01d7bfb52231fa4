package net.miragecodex.domain.credit;

import jakarta.annotation.Nullable;

/**
 * Outcome of a ledger authorization.
 *
 * <p>A metered authorization carries the hold that reserves the estimate; an
 * unmetered one carries the caller's personal provider key instead.</p>
 */
public record CreditAuthorization(String userId,
                                  boolean allowed,
                                  boolean metered,
                                  @Nullable Long holdId,
                                  int estimatedCost,
                                  int available,
                                  @Nullable String personalApiKey) {

    public static CreditAuthorization metered(String userId, long holdId, int estimatedCost, int available) {
        return new CreditAuthorization(userId, true, true, holdId, estimatedCost, available, null);
    }

    public static CreditAuthorization unmetered(String userId, String personalApiKey) {
        return new CreditAuthorization(userId, true, false, null, 0, 0, personalApiKey);
    }

    public static CreditAuthorization denied(String userId, int estimatedCost, int available) {
        return new CreditAuthorization(userId, false, true, null, estimatedCost, available, null);
    }

    @Override
    public String toString() {
        // personalApiKey intentionally omitted
        return "CreditAuthorization[userId=%s, allowed=%s, metered=%s, holdId=%s, estimatedCost=%d, available=%d]"
            .formatted(userId, allowed, metered, holdId, estimatedCost, available);
    }
}
