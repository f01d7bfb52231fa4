package net.miragecodex.controller.dto;

import net.miragecodex.domain.catalog.ModelCreditCosts;

public record ModelCreditCostsDto(int modelId, int searchCredits, int pageGenerationCredits) {

    public static ModelCreditCostsDto fromCosts(ModelCreditCosts costs) {
        return new ModelCreditCostsDto(costs.modelId(), costs.searchCredits(), costs.pageGenerationCredits());
    }
}
