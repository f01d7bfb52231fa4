package net.miragecodex.application.generation;

import net.miragecodex.domain.generation.GenerationTarget;

/**
 * One call to a structured-generation capability.
 *
 * @param target model and credentials to use
 * @param schemaName short label of the expected JSON shape, for logs
 * @param systemPrompt instructions including the exact JSON shape
 * @param userPrompt request-specific context
 * @param temperature sampling temperature
 */
public record StructuredGenerationRequest(GenerationTarget target,
                                          String schemaName,
                                          String systemPrompt,
                                          String userPrompt,
                                          double temperature) {
}
