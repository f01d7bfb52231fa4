package net.miragecodex.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for the search-and-generate pipeline.
 */
@Component
@ConfigurationProperties(prefix = "miragecodex.search")
public class SearchGenerationProperties {

    /**
     * Books per result page. Fixed by the server; requests cannot override it.
     */
    private int pageSize = 3;

    /**
     * Probability that a batch attempts to reuse existing authors of the genre.
     */
    private double authorReuseProbability = 0.5;

    /**
     * Generated pages covered by one credit at settlement.
     */
    private int pagesPerCredit = 10;

    /**
     * Search estimate used when a model row carries no explicit cost.
     */
    private int defaultSearchCredits = 5;

    /**
     * Per-page cost used when a model row carries no explicit cost.
     */
    private int defaultPageGenerationCredits = 3;

    /**
     * Attempts per generator call, first attempt included.
     */
    private int generationMaxAttempts = 3;

    /**
     * Wait before the second generator attempt; doubles for each further attempt.
     */
    private Duration generationBaseBackoff = Duration.ofSeconds(1);

    /**
     * Sampling temperature for author and book generation.
     */
    private double generationTemperature = 0.9;

    /**
     * Sampling temperature for genre/language classification.
     */
    private double classificationTemperature = 0.1;

    /**
     * Sampling temperature for writing book pages.
     */
    private double pageTemperature = 0.8;

    /**
     * Upper bound on a generated book's page count.
     */
    private int maxPagesPerBook = 200;

    /**
     * Genre used when a facet cannot be resolved.
     */
    private String fallbackGenreSlug = "fiction";

    /**
     * Language used when a facet cannot be resolved.
     */
    private String fallbackLanguageCode = "en";

    /**
     * Worker threads available to miss-path generation.
     */
    private int executorPoolSize = 8;

    @PostConstruct
    void validate() {
        Assert.isTrue(pageSize >= 1, "miragecodex.search.page-size must be at least 1");
        Assert.isTrue(authorReuseProbability >= 0.0 && authorReuseProbability <= 1.0,
                "miragecodex.search.author-reuse-probability must be within [0, 1]");
        Assert.isTrue(pagesPerCredit > 0, "miragecodex.search.pages-per-credit must be positive");
        Assert.isTrue(defaultSearchCredits >= 0, "miragecodex.search.default-search-credits must be non-negative");
        Assert.isTrue(defaultPageGenerationCredits >= 0,
                "miragecodex.search.default-page-generation-credits must be non-negative");
        Assert.isTrue(generationMaxAttempts >= 1, "miragecodex.search.generation-max-attempts must be at least 1");
        Assert.isTrue(!generationBaseBackoff.isNegative(), "miragecodex.search.generation-base-backoff must be non-negative");
        Assert.isTrue(maxPagesPerBook >= 1, "miragecodex.search.max-pages-per-book must be at least 1");
        Assert.hasText(fallbackGenreSlug, "miragecodex.search.fallback-genre-slug must not be blank");
        Assert.hasText(fallbackLanguageCode, "miragecodex.search.fallback-language-code must not be blank");
        Assert.isTrue(executorPoolSize >= 1, "miragecodex.search.executor-pool-size must be at least 1");
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public double getAuthorReuseProbability() {
        return authorReuseProbability;
    }

    public void setAuthorReuseProbability(double authorReuseProbability) {
        this.authorReuseProbability = authorReuseProbability;
    }

    public int getPagesPerCredit() {
        return pagesPerCredit;
    }

    public void setPagesPerCredit(int pagesPerCredit) {
        this.pagesPerCredit = pagesPerCredit;
    }

    public int getDefaultSearchCredits() {
        return defaultSearchCredits;
    }

    public void setDefaultSearchCredits(int defaultSearchCredits) {
        this.defaultSearchCredits = defaultSearchCredits;
    }

    public int getDefaultPageGenerationCredits() {
        return defaultPageGenerationCredits;
    }

    public void setDefaultPageGenerationCredits(int defaultPageGenerationCredits) {
        this.defaultPageGenerationCredits = defaultPageGenerationCredits;
    }

    public int getGenerationMaxAttempts() {
        return generationMaxAttempts;
    }

    public void setGenerationMaxAttempts(int generationMaxAttempts) {
        this.generationMaxAttempts = generationMaxAttempts;
    }

    public Duration getGenerationBaseBackoff() {
        return generationBaseBackoff;
    }

    public void setGenerationBaseBackoff(Duration generationBaseBackoff) {
        this.generationBaseBackoff = generationBaseBackoff;
    }

    public double getGenerationTemperature() {
        return generationTemperature;
    }

    public void setGenerationTemperature(double generationTemperature) {
        this.generationTemperature = generationTemperature;
    }

    public double getClassificationTemperature() {
        return classificationTemperature;
    }

    public void setClassificationTemperature(double classificationTemperature) {
        this.classificationTemperature = classificationTemperature;
    }

    public double getPageTemperature() {
        return pageTemperature;
    }

    public void setPageTemperature(double pageTemperature) {
        this.pageTemperature = pageTemperature;
    }

    public int getMaxPagesPerBook() {
        return maxPagesPerBook;
    }

    public void setMaxPagesPerBook(int maxPagesPerBook) {
        this.maxPagesPerBook = maxPagesPerBook;
    }

    public String getFallbackGenreSlug() {
        return fallbackGenreSlug;
    }

    public void setFallbackGenreSlug(String fallbackGenreSlug) {
        this.fallbackGenreSlug = fallbackGenreSlug;
    }

    public String getFallbackLanguageCode() {
        return fallbackLanguageCode;
    }

    public void setFallbackLanguageCode(String fallbackLanguageCode) {
        this.fallbackLanguageCode = fallbackLanguageCode;
    }

    public int getExecutorPoolSize() {
        return executorPoolSize;
    }

    public void setExecutorPoolSize(int executorPoolSize) {
        this.executorPoolSize = executorPoolSize;
    }
}
