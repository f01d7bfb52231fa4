package net.miragecodex.domain.catalog;

import jakarta.annotation.Nullable;

/**
 * Generation model offered to callers.
 *
 * @param name provider model name sent to the generator
 * @param domainCode provider domain used to look up personal API keys
 * @param searchCredits per-search estimate, or null to use the configured default
 * @param pageGenerationCredits per-page cost, or null to use the configured default
 */
public record GenerationModel(int id,
                              String name,
                              String domainCode,
                              @Nullable Integer searchCredits,
                              @Nullable Integer pageGenerationCredits) {
}
