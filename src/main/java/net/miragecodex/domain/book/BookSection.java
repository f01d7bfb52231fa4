package net.miragecodex.domain.book;

/**
 * Contiguous page range of a book with its own title and summary.
 */
public record BookSection(String title, int fromPage, int toPage, String summary) {
}
