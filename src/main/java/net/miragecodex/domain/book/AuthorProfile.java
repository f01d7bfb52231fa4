package net.miragecodex.domain.book;

import java.util.UUID;

/**
 * Persisted author. Genre affinity is derived from the author's books.
 */
public record AuthorProfile(UUID id, String penName, String stylePrompt, String bio) {
}
