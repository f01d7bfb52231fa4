package net.miragecodex.application.credit;

import net.miragecodex.config.SearchGenerationProperties;
import net.miragecodex.domain.catalog.GenerationModel;
import net.miragecodex.domain.catalog.ModelCreditCosts;
import org.springframework.stereotype.Component;

/**
 * Credit prices per model, with configured defaults for models that carry none.
 */
@Component
public class CreditCostTable {

    private final SearchGenerationProperties properties;

    public CreditCostTable(SearchGenerationProperties properties) {
        this.properties = properties;
    }

    public ModelCreditCosts costsFor(GenerationModel model) {
        int searchCredits = model.searchCredits() != null
            ? model.searchCredits()
            : properties.getDefaultSearchCredits();
        int pageCredits = model.pageGenerationCredits() != null
            ? model.pageGenerationCredits()
            : properties.getDefaultPageGenerationCredits();
        return new ModelCreditCosts(model.id(), searchCredits, pageCredits);
    }

    /**
     * Settlement charge for a generated page of results: one credit per started
     * block of {@code pagesPerCredit} book pages.
     */
    public int settlementCost(int totalGeneratedPages) {
        if (totalGeneratedPages < 0) {
            throw new IllegalArgumentException("totalGeneratedPages must be non-negative");
        }
        int pagesPerCredit = properties.getPagesPerCredit();
        return (totalGeneratedPages + pagesPerCredit - 1) / pagesPerCredit;
    }
}
