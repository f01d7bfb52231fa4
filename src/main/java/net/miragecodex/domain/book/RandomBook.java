package net.miragecodex.domain.book;

import jakarta.annotation.Nullable;
import java.util.UUID;

/**
 * A book picked uniformly from the stored editions, with one of its editions.
 */
public record RandomBook(UUID bookId,
                         String title,
                         String summary,
                         int pageCount,
                         @Nullable String coverUrl,
                         AuthorProfile author,
                         String genreSlug,
                         String genreLabel,
                         UUID editionId,
                         String languageCode,
                         int modelId,
                         String modelName) {
}
