package net.miragecodex.application.author;

import jakarta.annotation.Nullable;
import net.miragecodex.domain.generation.GenerationTarget;

/**
 * Inputs for resolving the authors of one generated page.
 *
 * @param genrePrompt genre guidance passed to author generation
 * @param count number of authors required
 */
public record AuthorPoolRequest(String genreSlug,
                                String genrePrompt,
                                int count,
                                String languageCode,
                                @Nullable String freeText,
                                GenerationTarget target) {
}
