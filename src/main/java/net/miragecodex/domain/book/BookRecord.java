package net.miragecodex.domain.book;

import jakarta.annotation.Nullable;
import java.util.List;
import java.util.UUID;

/**
 * Persisted book with ordered sections.
 *
 * @param coverUrl rendered cover, absent until an external image step fills it
 */
public record BookRecord(UUID id,
                         String title,
                         String summary,
                         int pageCount,
                         String coverPrompt,
                         @Nullable String coverUrl,
                         List<BookSection> sections,
                         UUID authorId,
                         int primaryLanguageId) {

    public BookRecord {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }
}
