package net.miragecodex.application.generation;

import java.util.Comparator;
import java.util.List;
import net.miragecodex.application.generation.ContentGenerationException.ErrorCode;
import net.miragecodex.domain.book.BookSection;

/**
 * Checks that sections partition {@code [1, pageCount]} without gaps or overlaps.
 *
 * <p>Sections are compared after sorting by {@code fromPage}; the model is not
 * required to emit them in order, but the sorted list must start at page 1,
 * end at {@code pageCount}, and chain {@code toPage + 1 == next.fromPage}.</p>
 */
final class BookSectionValidator {

    private BookSectionValidator() {
    }

    /**
     * Returns the sections sorted by {@code fromPage} when they partition the book.
     *
     * @throws ContentGenerationException with {@code SECTION_PARTITION_VIOLATION} otherwise
     */
    static List<BookSection> validate(List<BookSection> sections, int pageCount) {
        if (pageCount < 1) {
            throw partitionFailure("pageCount must be positive but was " + pageCount);
        }
        if (sections == null || sections.isEmpty()) {
            throw partitionFailure("book has no sections");
        }
        List<BookSection> sorted = sections.stream()
            .sorted(Comparator.comparingInt(BookSection::fromPage))
            .toList();

        if (sorted.get(0).fromPage() != 1) {
            throw partitionFailure("first section starts at page %d, expected 1".formatted(sorted.get(0).fromPage()));
        }
        for (int i = 0; i < sorted.size(); i++) {
            BookSection section = sorted.get(i);
            if (section.fromPage() > section.toPage()) {
                throw partitionFailure("section '%s' has fromPage %d after toPage %d"
                    .formatted(section.title(), section.fromPage(), section.toPage()));
            }
            if (i + 1 < sorted.size()) {
                int nextFrom = sorted.get(i + 1).fromPage();
                if (section.toPage() + 1 != nextFrom) {
                    String problem = section.toPage() >= nextFrom ? "overlaps" : "leaves a gap before";
                    throw partitionFailure("section ending at page %d %s section starting at page %d"
                        .formatted(section.toPage(), problem, nextFrom));
                }
            }
        }
        int lastPage = sorted.get(sorted.size() - 1).toPage();
        if (lastPage != pageCount) {
            throw partitionFailure("last section ends at page %d, expected %d".formatted(lastPage, pageCount));
        }
        return sorted;
    }

    private static ContentGenerationException partitionFailure(String detail) {
        return new ContentGenerationException(ErrorCode.SECTION_PARTITION_VIOLATION,
            "Generated sections violate page partition: " + detail);
    }
}
