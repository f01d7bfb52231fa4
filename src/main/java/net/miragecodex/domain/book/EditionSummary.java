package net.miragecodex.domain.book;

import java.time.Instant;
import java.util.UUID;

/**
 * One (book, language, model) printing of a conceptual book.
 */
public record EditionSummary(UUID id,
                             UUID bookId,
                             String languageCode,
                             String languageLabel,
                             int modelId,
                             String modelName,
                             Instant createdAt) {
}
