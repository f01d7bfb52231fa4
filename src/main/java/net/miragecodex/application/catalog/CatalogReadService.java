package net.miragecodex.application.catalog;

import jakarta.annotation.Nullable;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.miragecodex.adapters.persistence.BookCatalogReadRepository;
import net.miragecodex.adapters.persistence.CatalogRepository;
import net.miragecodex.application.credit.CreditCostTable;
import net.miragecodex.domain.book.AuthorBookSummary;
import net.miragecodex.domain.book.EditionSummary;
import net.miragecodex.domain.book.RandomBook;
import net.miragecodex.domain.catalog.ModelCreditCosts;
import org.springframework.stereotype.Service;

/**
 * Read-only views over the generated catalog for the browse endpoints.
 */
@Service
public class CatalogReadService {

    static final int MAX_AUTHOR_BOOKS_LIMIT = 50;

    private final CatalogRepository catalogRepository;
    private final BookCatalogReadRepository bookReadRepository;
    private final CreditCostTable costTable;

    public CatalogReadService(CatalogRepository catalogRepository,
                              BookCatalogReadRepository bookReadRepository,
                              CreditCostTable costTable) {
        this.catalogRepository = catalogRepository;
        this.bookReadRepository = bookReadRepository;
        this.costTable = costTable;
    }

    public Optional<ModelCreditCosts> creditCosts(int modelId) {
        return catalogRepository.findActiveModel(modelId).map(costTable::costsFor);
    }

    public List<EditionSummary> editions(UUID bookId) {
        return bookReadRepository.findEditions(bookId);
    }

    public Optional<RandomBook> randomBook() {
        return bookReadRepository.findRandomBook();
    }

    /**
     * @param limit clamped to [1, 50]
     * @param offset negative values are treated as 0
     */
    public List<AuthorBookSummary> authorBooks(UUID authorId, @Nullable UUID excludeBookId, int limit, int offset) {
        int safeLimit = Math.min(Math.max(limit, 1), MAX_AUTHOR_BOOKS_LIMIT);
        return bookReadRepository.findBooksByAuthor(authorId, excludeBookId, safeLimit, Math.max(offset, 0));
    }
}
