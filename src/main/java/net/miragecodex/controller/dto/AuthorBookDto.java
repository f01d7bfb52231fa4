package net.miragecodex.controller.dto;

import java.time.Instant;
import net.miragecodex.domain.book.AuthorBookSummary;

public record AuthorBookDto(String id, String title, int pageCount, String genreSlug, Instant createdAt) {

    public static AuthorBookDto fromSummary(AuthorBookSummary summary) {
        return new AuthorBookDto(
            summary.id().toString(),
            summary.title(),
            summary.pageCount(),
            summary.genreSlug(),
            summary.createdAt()
        );
    }
}
