package net.miragecodex.domain.search;

import jakarta.annotation.Nullable;
import java.util.List;
import net.miragecodex.domain.catalog.Language;

/**
 * Everything the cache store writes for one miss, in rank order.
 */
public record SearchCommit(SearchKey key,
                           @Nullable String userId,
                           Language language,
                           String genreSlug,
                           int modelId,
                           @Nullable String freeText,
                           List<String> tagSlugs,
                           int pageSize,
                           List<BookDraft> books) {

    public SearchCommit {
        tagSlugs = tagSlugs == null ? List.of() : List.copyOf(tagSlugs);
        books = books == null ? List.of() : List.copyOf(books);
    }
}
