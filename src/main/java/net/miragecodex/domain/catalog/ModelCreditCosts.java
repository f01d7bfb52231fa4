package net.miragecodex.domain.catalog;

/**
 * Resolved credit costs for a model, defaults applied.
 */
public record ModelCreditCosts(int modelId, int searchCredits, int pageGenerationCredits) {
}
