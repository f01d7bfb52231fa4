package net.miragecodex.application.generation;

import jakarta.annotation.Nullable;
import net.miragecodex.domain.book.BookSection;
import net.miragecodex.domain.generation.GenerationTarget;

/**
 * Inputs for writing one page of an edition.
 *
 * @param section section containing the page, when the book has one covering it
 * @param previousPageContent stored text of the page before, for continuity
 */
public record PageGenerationContext(GenerationTarget target,
                                    String title,
                                    String summary,
                                    String penName,
                                    @Nullable String stylePrompt,
                                    String languageCode,
                                    int pageNumber,
                                    int pageCount,
                                    @Nullable BookSection section,
                                    @Nullable String previousPageContent) {
}
