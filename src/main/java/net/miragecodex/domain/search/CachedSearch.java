package net.miragecodex.domain.search;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Persisted result page addressed by {@link SearchKey}. Immutable once written.
 */
public record CachedSearch(UUID searchId, SearchKey key, List<RankedBook> books, Instant createdAt) {

    public CachedSearch {
        books = books == null ? List.of() : List.copyOf(books);
    }
}
