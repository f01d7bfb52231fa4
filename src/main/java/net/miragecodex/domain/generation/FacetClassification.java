package net.miragecodex.domain.generation;

/**
 * Genre and language picked for a free-text description.
 */
public record FacetClassification(String genreSlug, String languageCode) {
}
