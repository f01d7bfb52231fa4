package net.miragecodex.controller.dto;

import jakarta.annotation.Nullable;
import java.util.List;
import net.miragecodex.domain.book.BookRecord;
import net.miragecodex.domain.search.RankedBook;

/**
 * One book of a search page, with the edition it was printed in.
 */
public record SearchBookDto(
    String id,
    int rank,
    String title,
    String summary,
    int pageCount,
    @Nullable String coverUrl,
    AuthorDto author,
    String language,
    String languageCode,
    String editionId,
    int modelId,
    List<SectionDto> sections
) {
    public static SearchBookDto fromRankedBook(RankedBook ranked) {
        BookRecord book = ranked.book();
        return new SearchBookDto(
            book.id().toString(),
            ranked.rank(),
            book.title(),
            book.summary(),
            book.pageCount(),
            book.coverUrl(),
            AuthorDto.fromProfile(ranked.author()),
            ranked.languageLabel(),
            ranked.languageCode(),
            ranked.editionId().toString(),
            ranked.modelId(),
            book.sections().stream().map(SectionDto::fromSection).toList()
        );
    }
}
