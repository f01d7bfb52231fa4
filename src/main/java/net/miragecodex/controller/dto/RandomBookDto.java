package net.miragecodex.controller.dto;

import jakarta.annotation.Nullable;
import net.miragecodex.domain.book.RandomBook;

/**
 * A randomly picked book with the edition to open it in.
 */
public record RandomBookDto(String id, String title, String summary, int pageCount, @Nullable String coverUrl,
                            AuthorDto author, String genreSlug, String genre, String editionId,
                            String languageCode, int modelId, String modelName) {

    public static RandomBookDto fromRandomBook(RandomBook book) {
        return new RandomBookDto(
            book.bookId().toString(),
            book.title(),
            book.summary(),
            book.pageCount(),
            book.coverUrl(),
            AuthorDto.fromProfile(book.author()),
            book.genreSlug(),
            book.genreLabel(),
            book.editionId().toString(),
            book.languageCode(),
            book.modelId(),
            book.modelName()
        );
    }
}
