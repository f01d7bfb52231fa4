package net.miragecodex.application.generation;

import java.util.List;
import java.util.function.Function;
import net.miragecodex.application.generation.ContentGenerationException.ErrorCode;
import net.miragecodex.config.SearchGenerationProperties;
import net.miragecodex.domain.catalog.Genre;
import net.miragecodex.domain.catalog.Language;
import net.miragecodex.domain.generation.FacetClassification;
import net.miragecodex.domain.generation.GeneratedAuthor;
import net.miragecodex.domain.generation.GeneratedBook;
import net.miragecodex.domain.generation.GenerationTarget;
import net.miragecodex.support.retry.RetrySupport;
import net.miragecodex.support.retry.RetrySupport.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.databind.JsonNode;

/**
 * Generates authors, books, book pages and facet classifications through a {@link StructuredGenerationClient}.
 *
 * <p>Transport failures, malformed JSON, wrong item counts and broken section
 * partitions are retried with exponential backoff. When every attempt fails the
 * caller receives {@code RETRIES_EXHAUSTED} carrying the last failure as cause.</p>
 */
@Service
public class ContentGeneratorGateway {

    private static final Logger log = LoggerFactory.getLogger(ContentGeneratorGateway.class);

    private final StructuredGenerationClient client;
    private final SearchGenerationProperties properties;
    private final GeneratedContentParser contentParser;
    private final RetryConfig retryConfig;

    public ContentGeneratorGateway(StructuredGenerationClient client, SearchGenerationProperties properties) {
        this.client = client;
        this.properties = properties;
        this.contentParser = new GeneratedContentParser(properties.getMaxPagesPerBook());
        this.retryConfig = RetryConfig.exponential(
            log,
            properties.getGenerationMaxAttempts(),
            properties.getGenerationBaseBackoff().toMillis()
        );
    }

    /**
     * Fabricates exactly {@code count} authors.
     */
    public List<GeneratedAuthor> generateAuthors(AuthorGenerationContext context, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1");
        }
        StructuredGenerationRequest request = new StructuredGenerationRequest(
            context.target(),
            GeneratedContentParser.AUTHORS_FIELD,
            GenerationPrompts.authorsSystemPrompt(context, count),
            GenerationPrompts.authorsUserPrompt(context, count),
            properties.getGenerationTemperature()
        );
        return generateWithRetry("author generation (genre=" + context.genreSlug() + ")", request,
            payload -> contentParser.parseAuthors(payload, count));
    }

    /**
     * Generates exactly {@code context.pageSize()} books whose sections partition their pages.
     */
    public List<GeneratedBook> generateBooks(BookGenerationContext context) {
        StructuredGenerationRequest request = new StructuredGenerationRequest(
            context.target(),
            GeneratedContentParser.BOOKS_FIELD,
            GenerationPrompts.booksSystemPrompt(context, properties.getMaxPagesPerBook()),
            GenerationPrompts.booksUserPrompt(context),
            properties.getGenerationTemperature()
        );
        return generateWithRetry("book generation (page=" + context.pageNumber() + ")", request,
            payload -> contentParser.parseBooks(payload, context.pageSize()));
    }

    /**
     * Writes the text of one book page.
     */
    public String generatePage(PageGenerationContext context) {
        StructuredGenerationRequest request = new StructuredGenerationRequest(
            context.target(),
            GeneratedContentParser.PAGE_FIELD,
            GenerationPrompts.pageSystemPrompt(context),
            GenerationPrompts.pageUserPrompt(context),
            properties.getPageTemperature()
        );
        return generateWithRetry("page generation (page=" + context.pageNumber() + ")", request,
            contentParser::parsePage);
    }

    /**
     * Whether calls without a personal key can reach the provider.
     */
    public boolean isPlatformConfigured() {
        return client.isPlatformConfigured();
    }

    /**
     * Picks a genre slug and language code for free text. Single attempt; callers
     * fall back to defaults on failure, so retrying would only add latency.
     */
    public FacetClassification classifyFacets(String freeText,
                                              List<Genre> genres,
                                              List<Language> languages,
                                              GenerationTarget target) {
        StructuredGenerationRequest request = new StructuredGenerationRequest(
            target,
            "classification",
            GenerationPrompts.classificationSystemPrompt(genres, languages),
            GenerationPrompts.classificationUserPrompt(freeText),
            properties.getClassificationTemperature()
        );
        return contentParser.parseClassification(client.generate(request));
    }

    private <T> T generateWithRetry(String label,
                                    StructuredGenerationRequest request,
                                    Function<JsonNode, T> parser) {
        try {
            return RetrySupport.execute(
                retryConfig,
                label,
                () -> parser.apply(client.generate(request)),
                ContentGenerationException::retryable
            );
        } catch (ContentGenerationException exception) {
            if (!exception.isRetryable()) {
                throw exception;
            }
            log.error("{} failed after {} attempts (model={})",
                label, retryConfig.maxAttempts(), request.target().modelName(), exception);
            throw new ContentGenerationException(ErrorCode.RETRIES_EXHAUSTED,
                label + " failed after " + retryConfig.maxAttempts() + " attempts: " + exception.getMessage(),
                exception);
        }
    }
}
