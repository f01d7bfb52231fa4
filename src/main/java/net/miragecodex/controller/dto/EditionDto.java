package net.miragecodex.controller.dto;

import java.time.Instant;
import net.miragecodex.domain.book.EditionSummary;

public record EditionDto(String id, String bookId, String languageCode, String language, int modelId,
                         String modelName, Instant createdAt) {

    public static EditionDto fromEdition(EditionSummary edition) {
        return new EditionDto(
            edition.id().toString(),
            edition.bookId().toString(),
            edition.languageCode(),
            edition.languageLabel(),
            edition.modelId(),
            edition.modelName(),
            edition.createdAt()
        );
    }
}
