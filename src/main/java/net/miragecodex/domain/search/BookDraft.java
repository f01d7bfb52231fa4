package net.miragecodex.domain.search;

import net.miragecodex.domain.book.AuthorProfile;
import net.miragecodex.domain.generation.GeneratedBook;

/**
 * Generated book paired with its assigned author, ready to persist.
 */
public record BookDraft(GeneratedBook book, AuthorProfile author) {
}
