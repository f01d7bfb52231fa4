package net.miragecodex.domain.credit;

import java.util.List;

/**
 * One page of a user's transactions, newest first.
 *
 * @param page 1-based page number
 */
public record TransactionPage(List<CreditTransaction> items, int page, int limit, long total) {

    public TransactionPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public int totalPages() {
        return limit <= 0 ? 0 : (int) ((total + limit - 1) / limit);
    }

    public boolean hasMore() {
        return (long) page * limit < total;
    }
}
