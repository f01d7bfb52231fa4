package net.miragecodex.application.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import net.miragecodex.domain.book.BookSection;
import org.junit.jupiter.api.Test;

class BookSectionValidatorTest {

    @Test
    void should_ReturnSectionsSortedByFromPage_When_PartitionIsValid() {
        List<BookSection> sections = List.of(
            new BookSection("Part II", 11, 30, "Middle"),
            new BookSection("Part I", 1, 10, "Start"),
            new BookSection("Part III", 31, 42, "End")
        );

        List<BookSection> validated = BookSectionValidator.validate(sections, 42);

        assertThat(validated).extracting(BookSection::title).containsExactly("Part I", "Part II", "Part III");
    }

    @Test
    void should_AcceptSinglePageSection_When_BookHasOnePage() {
        assertThat(BookSectionValidator.validate(List.of(new BookSection("Only", 1, 1, "All")), 1)).hasSize(1);
    }

    @Test
    void should_RejectPartition_When_FirstSectionDoesNotStartAtPageOne() {
        List<BookSection> sections = List.of(new BookSection("Late", 2, 10, "x"));

        assertThatThrownBy(() -> BookSectionValidator.validate(sections, 10))
            .isInstanceOfSatisfying(ContentGenerationException.class, exception -> {
                assertThat(exception.errorCode()).isEqualTo(ContentGenerationException.ErrorCode.SECTION_PARTITION_VIOLATION);
                assertThat(exception.getMessage()).contains("first section starts at page 2");
            });
    }

    @Test
    void should_RejectPartition_When_SectionsOverlap() {
        List<BookSection> sections = List.of(
            new BookSection("A", 1, 10, "x"),
            new BookSection("B", 10, 20, "y")
        );

        assertThatThrownBy(() -> BookSectionValidator.validate(sections, 20))
            .isInstanceOf(ContentGenerationException.class)
            .hasMessageContaining("overlaps");
    }

    @Test
    void should_RejectPartition_When_SectionsLeaveGap() {
        List<BookSection> sections = List.of(
            new BookSection("A", 1, 10, "x"),
            new BookSection("B", 12, 20, "y")
        );

        assertThatThrownBy(() -> BookSectionValidator.validate(sections, 20))
            .isInstanceOf(ContentGenerationException.class)
            .hasMessageContaining("leaves a gap before");
    }

    @Test
    void should_RejectPartition_When_LastSectionStopsShortOfPageCount() {
        List<BookSection> sections = List.of(new BookSection("A", 1, 18, "x"));

        assertThatThrownBy(() -> BookSectionValidator.validate(sections, 20))
            .isInstanceOf(ContentGenerationException.class)
            .hasMessageContaining("last section ends at page 18");
    }

    @Test
    void should_RejectPartition_When_SectionRangeIsInverted() {
        List<BookSection> sections = List.of(new BookSection("Backwards", 1, 0, "x"));

        assertThatThrownBy(() -> BookSectionValidator.validate(sections, 1))
            .hasMessageContaining("has fromPage 1 after toPage 0");
    }

    @Test
    void should_RejectPartition_When_NoSectionsGiven() {
        assertThatThrownBy(() -> BookSectionValidator.validate(List.of(), 5))
            .isInstanceOf(ContentGenerationException.class)
            .hasMessageContaining("book has no sections");
    }
}
