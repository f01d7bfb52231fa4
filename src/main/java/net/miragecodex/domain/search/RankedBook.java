package net.miragecodex.domain.search;

import java.util.UUID;
import net.miragecodex.domain.book.AuthorProfile;
import net.miragecodex.domain.book.BookRecord;

/**
 * One denormalized entry of a cached search page.
 *
 * @param rank 1-based position within the page
 * @param book persisted book with its sections
 * @param author the book's author
 * @param editionId edition printed for this search
 * @param modelId model that generated the edition
 * @param languageCode edition language code
 * @param languageLabel edition language display label
 */
public record RankedBook(int rank,
                         BookRecord book,
                         AuthorProfile author,
                         UUID editionId,
                         int modelId,
                         String languageCode,
                         String languageLabel) {
}
