package net.miragecodex.domain.book;

import java.time.Instant;
import java.util.UUID;

/**
 * Compact listing row for an author's bibliography.
 */
public record AuthorBookSummary(UUID id, String title, int pageCount, String genreSlug, Instant createdAt) {
}
