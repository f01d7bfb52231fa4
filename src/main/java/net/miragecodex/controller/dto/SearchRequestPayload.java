package net.miragecodex.controller.dto;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Request body of {@code POST /api/search}.
 *
 * @param pageNumber 1-based page; defaults to 1 when omitted
 */
public record SearchRequestPayload(
    @Nullable String freeText,
    @Nullable String languageCode,
    @Nullable String genreSlug,
    @Nullable List<String> tagSlugs,
    @Nullable Integer modelId,
    @Nullable Integer pageNumber
) {
}
