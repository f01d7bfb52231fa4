package net.miragecodex.domain.book;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.miragecodex.domain.catalog.GenerationModel;

/**
 * Everything needed to write a page of an edition: the book, its author's
 * voice, the edition's language and model, and the book's sections.
 */
public record EditionDetails(UUID editionId,
                             UUID bookId,
                             String title,
                             String summary,
                             int pageCount,
                             String penName,
                             String stylePrompt,
                             String languageCode,
                             GenerationModel model,
                             List<BookSection> sections) {

    public EditionDetails {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    /** Section whose page range contains {@code pageNumber}. */
    public Optional<BookSection> sectionFor(int pageNumber) {
        return sections.stream()
            .filter(section -> pageNumber >= section.fromPage() && pageNumber <= section.toPage())
            .findFirst();
    }
}
