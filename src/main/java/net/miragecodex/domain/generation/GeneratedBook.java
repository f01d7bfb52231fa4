package net.miragecodex.domain.generation;

import java.util.List;
import net.miragecodex.domain.book.BookSection;

/**
 * Validated generator output for one book. Sections partition {@code [1, pageCount]}.
 */
public record GeneratedBook(String title, String summary, int pageCount, String coverPrompt, List<BookSection> sections) {

    public GeneratedBook {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }
}
