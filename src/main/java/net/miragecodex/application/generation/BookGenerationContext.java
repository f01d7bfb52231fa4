package net.miragecodex.application.generation;

import jakarta.annotation.Nullable;
import java.util.List;
import net.miragecodex.domain.generation.GenerationTarget;

/**
 * Inputs for generating one page of books.
 */
public record BookGenerationContext(GenerationTarget target,
                                    @Nullable String freeText,
                                    String genrePrompt,
                                    List<String> tagPrompts,
                                    String languageCode,
                                    int pageNumber,
                                    int pageSize) {

    public BookGenerationContext {
        tagPrompts = tagPrompts == null ? List.of() : List.copyOf(tagPrompts);
    }
}
