package net.miragecodex.controller.dto;

import java.time.Instant;
import java.util.List;
import net.miragecodex.domain.credit.CreditTransaction;
import net.miragecodex.domain.credit.TransactionPage;

/**
 * Paged ledger history for the signed-in user.
 */
public record TransactionPageDto(List<TransactionDto> transactions, Pagination pagination) {

    public record TransactionDto(long id, int amount, String type, String description, Instant createdAt) {

        static TransactionDto fromTransaction(CreditTransaction transaction) {
            return new TransactionDto(
                transaction.id(),
                transaction.amount(),
                transaction.type(),
                transaction.description(),
                transaction.createdAt()
            );
        }
    }

    public record Pagination(int page, int limit, long total, int totalPages, boolean hasMore) {
    }

    public static TransactionPageDto fromPage(TransactionPage page) {
        return new TransactionPageDto(
            page.items().stream().map(TransactionDto::fromTransaction).toList(),
            new Pagination(page.page(), page.limit(), page.total(), page.totalPages(), page.hasMore())
        );
    }
}
