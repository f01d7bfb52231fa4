package net.miragecodex.domain.book;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored text of one page of an edition, written in the edition's language by its model.
 */
public record BookPage(UUID editionId, int pageNumber, String content, Instant createdAt) {
}
