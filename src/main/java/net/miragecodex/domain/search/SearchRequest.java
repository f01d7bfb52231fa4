package net.miragecodex.domain.search;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Search parameters as received from a caller, before or after facet resolution.
 *
 * @param freeText optional description of the desired book
 * @param languageCode optional language code; absent means "infer it"
 * @param genreSlug optional genre slug; absent means "infer it"
 * @param tagSlugs tag slugs in any order, possibly with duplicates
 * @param modelId generation model identifier
 * @param pageNumber 1-based page number
 * @param pageSize server-fixed number of books per page
 */
public record SearchRequest(@Nullable String freeText,
                            @Nullable String languageCode,
                            @Nullable String genreSlug,
                            List<String> tagSlugs,
                            @Nullable Integer modelId,
                            int pageNumber,
                            int pageSize) {

    public SearchRequest {
        tagSlugs = tagSlugs == null ? List.of() : List.copyOf(tagSlugs);
    }

    /**
     * Returns a copy with the genre and language facets replaced.
     */
    public SearchRequest withFacets(String resolvedGenreSlug, String resolvedLanguageCode) {
        return new SearchRequest(freeText, resolvedLanguageCode, resolvedGenreSlug, tagSlugs, modelId, pageNumber, pageSize);
    }
}
