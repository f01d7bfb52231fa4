package net.miragecodex.application.generation;

import jakarta.annotation.Nullable;
import net.miragecodex.domain.generation.GenerationTarget;

/**
 * Inputs for fabricating a batch of authors.
 */
public record AuthorGenerationContext(GenerationTarget target,
                                      String genreSlug,
                                      String genrePrompt,
                                      String languageCode,
                                      @Nullable String freeText) {
}
