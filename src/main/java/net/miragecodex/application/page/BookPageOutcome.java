package net.miragecodex.application.page;

import net.miragecodex.domain.book.BookPage;

/**
 * A served book page and whether this request had it written.
 */
public record BookPageOutcome(BookPage page, boolean generated) {

    public static BookPageOutcome stored(BookPage page) {
        return new BookPageOutcome(page, false);
    }

    public static BookPageOutcome written(BookPage page) {
        return new BookPageOutcome(page, true);
    }
}
