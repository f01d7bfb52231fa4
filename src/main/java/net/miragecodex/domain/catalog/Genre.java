package net.miragecodex.domain.catalog;

import jakarta.annotation.Nullable;

/**
 * Catalog genre. {@code promptBoost} is extra guidance appended to generation prompts.
 */
public record Genre(String slug, String label, @Nullable String promptBoost) {
}
