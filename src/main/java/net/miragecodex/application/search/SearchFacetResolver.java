package net.miragecodex.application.search;

import java.util.List;
import net.miragecodex.adapters.persistence.CatalogRepository;
import net.miragecodex.application.generation.ContentGenerationException;
import net.miragecodex.application.generation.ContentGeneratorGateway;
import net.miragecodex.config.SearchGenerationProperties;
import net.miragecodex.domain.catalog.GenerationModel;
import net.miragecodex.domain.catalog.Genre;
import net.miragecodex.domain.catalog.Language;
import net.miragecodex.domain.generation.FacetClassification;
import net.miragecodex.domain.generation.GenerationTarget;
import net.miragecodex.domain.search.SearchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Fills in absent genre and language facets for a cache miss.
 *
 * <p>Runs after the key has been derived from the request as sent, and only
 * under the generation lock, so a repeated request never reaches the
 * classifier.</p>
 *
 * <p>With free text the generator classifies the query against the active
 * catalog; any failure or off-catalog answer falls back to the configured
 * defaults. Classification runs on the platform credential.</p>
 */
@Component
public class SearchFacetResolver {

    private static final Logger log = LoggerFactory.getLogger(SearchFacetResolver.class);

    private final CatalogRepository catalogRepository;
    private final ContentGeneratorGateway generatorGateway;
    private final SearchGenerationProperties properties;

    public SearchFacetResolver(CatalogRepository catalogRepository,
                               ContentGeneratorGateway generatorGateway,
                               SearchGenerationProperties properties) {
        this.catalogRepository = catalogRepository;
        this.generatorGateway = generatorGateway;
        this.properties = properties;
    }

    public SearchRequest resolve(SearchRequest request, GenerationModel model) {
        String genreSlug = trimToNull(request.genreSlug());
        String languageCode = trimToNull(request.languageCode());
        if (genreSlug != null && languageCode != null) {
            return request.withFacets(genreSlug, languageCode);
        }

        String freeText = trimToNull(request.freeText());
        if (freeText != null) {
            FacetClassification classification = classify(freeText, model);
            if (genreSlug == null) {
                genreSlug = classification.genreSlug();
            }
            if (languageCode == null) {
                languageCode = classification.languageCode();
            }
        } else {
            genreSlug = genreSlug != null ? genreSlug : properties.getFallbackGenreSlug();
            languageCode = languageCode != null ? languageCode : properties.getFallbackLanguageCode();
        }
        log.debug("Resolved facets genre={} language={}", genreSlug, languageCode);
        return request.withFacets(genreSlug, languageCode);
    }

    private FacetClassification classify(String freeText, GenerationModel model) {
        List<Genre> genres = catalogRepository.findActiveGenres();
        List<Language> languages = catalogRepository.findAllLanguages();
        FacetClassification fallback = new FacetClassification(
            properties.getFallbackGenreSlug(), properties.getFallbackLanguageCode());
        if (genres.isEmpty() || languages.isEmpty()) {
            return fallback;
        }
        if (!generatorGateway.isPlatformConfigured()) {
            log.debug("No platform credential for facet classification, using defaults");
            return fallback;
        }

        FacetClassification classification;
        try {
            classification = generatorGateway.classifyFacets(
                freeText, genres, languages, GenerationTarget.platform(model.name()));
        } catch (ContentGenerationException exception) {
            log.warn("Facet classification failed, using defaults ({}): {}",
                exception.errorCode(), exception.getMessage());
            return fallback;
        }

        boolean knownGenre = genres.stream().anyMatch(genre -> genre.slug().equals(classification.genreSlug()));
        boolean knownLanguage = languages.stream()
            .anyMatch(language -> language.code().equals(classification.languageCode()));
        if (!knownGenre || !knownLanguage) {
            log.warn("Facet classification returned off-catalog values genre={} language={}",
                classification.genreSlug(), classification.languageCode());
        }
        return new FacetClassification(
            knownGenre ? classification.genreSlug() : fallback.genreSlug(),
            knownLanguage ? classification.languageCode() : fallback.languageCode()
        );
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
