package net.miragecodex.controller.dto;

import java.time.Instant;
import net.miragecodex.application.page.BookPageOutcome;
import net.miragecodex.domain.book.BookPage;

/**
 * @param generated whether this request had the page written
 */
public record BookPageDto(String editionId, int pageNumber, String content, boolean generated, Instant createdAt) {

    public static BookPageDto fromOutcome(BookPageOutcome outcome) {
        BookPage page = outcome.page();
        return new BookPageDto(
            page.editionId().toString(),
            page.pageNumber(),
            page.content(),
            outcome.generated(),
            page.createdAt()
        );
    }
}
