package net.miragecodex.application.search;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import net.miragecodex.adapters.persistence.CatalogRepository;
import net.miragecodex.adapters.persistence.SearchCacheRepository;
import net.miragecodex.application.search.SearchPipelineException.ErrorCode;
import net.miragecodex.config.SearchGenerationProperties;
import net.miragecodex.domain.catalog.GenerationModel;
import net.miragecodex.domain.catalog.Genre;
import net.miragecodex.domain.catalog.Language;
import net.miragecodex.domain.catalog.Tag;
import net.miragecodex.domain.search.CachedSearch;
import net.miragecodex.domain.search.SearchKey;
import net.miragecodex.domain.search.SearchOutcome;
import net.miragecodex.domain.search.SearchRequest;
import net.miragecodex.support.lock.SearchGenerationLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Entry point of a search: validate, derive the key, serve a hit or run the
 * miss path.
 *
 * <p>The key is taken from the request as sent, with an absent genre hashed as
 * null. Missing facets are classified on the miss path only, so hits never
 * reach the generator.</p>
 *
 * <p>Hits are served to anonymous callers. A miss requires a user and runs
 * under the per-key generation lock on the generation executor; the request
 * thread waits for it without being able to cancel it, so a disconnected
 * client still leaves a stored page behind. The cache is checked again once
 * the lock is held, so concurrent identical misses generate once.</p>
 */
@Service
public class BookSearchUseCase {

    private static final Logger log = LoggerFactory.getLogger(BookSearchUseCase.class);

    private final SearchKeyCanonicalizer canonicalizer;
    private final SearchFacetResolver facetResolver;
    private final CatalogRepository catalogRepository;
    private final SearchCacheRepository cacheRepository;
    private final SearchGenerationLock generationLock;
    private final SearchCommitPipeline commitPipeline;
    private final SearchGenerationProperties properties;
    private final Executor generationExecutor;

    public BookSearchUseCase(SearchKeyCanonicalizer canonicalizer,
                             SearchFacetResolver facetResolver,
                             CatalogRepository catalogRepository,
                             SearchCacheRepository cacheRepository,
                             SearchGenerationLock generationLock,
                             SearchCommitPipeline commitPipeline,
                             SearchGenerationProperties properties,
                             @Qualifier("searchGenerationExecutor") Executor generationExecutor) {
        this.canonicalizer = canonicalizer;
        this.facetResolver = facetResolver;
        this.catalogRepository = catalogRepository;
        this.cacheRepository = cacheRepository;
        this.generationLock = generationLock;
        this.commitPipeline = commitPipeline;
        this.properties = properties;
        this.generationExecutor = generationExecutor;
    }

    /**
     * Serves one page of search results.
     *
     * @param rawRequest caller parameters; any page size it carries is replaced by the server's
     * @param userId authenticated caller, empty for anonymous requests
     * @throws SearchPipelineException classified failure
     */
    public SearchOutcome search(SearchRequest rawRequest, Optional<String> userId) {
        if (rawRequest == null) {
            throw SearchPipelineException.invalid("Search request is required");
        }
        SearchRequest request = new SearchRequest(
            rawRequest.freeText(),
            rawRequest.languageCode(),
            rawRequest.genreSlug(),
            rawRequest.tagSlugs(),
            rawRequest.modelId(),
            rawRequest.pageNumber(),
            properties.getPageSize()
        );
        canonicalizer.validate(request);

        try {
            GenerationModel model = catalogRepository.findActiveModel(request.modelId())
                .orElseThrow(() -> SearchPipelineException.invalid("Unknown modelId " + request.modelId()));
            requireKnownFacets(request);

            SearchKey key = canonicalizer.fingerprint(request);
            log.debug("Search {} -> {}", key, PipelineStage.KEY_DERIVED);

            Optional<CachedSearch> cached = cacheRepository.find(key);
            log.debug("Search {} -> {}", key, PipelineStage.CACHE_CHECKED);
            if (cached.isPresent()) {
                log.info("Cache hit for {}", key);
                return SearchOutcome.hit(cached.get());
            }

            String user = userId.filter(id -> !id.isBlank())
                .orElseThrow(() -> new SearchPipelineException(ErrorCode.AUTHENTICATION_REQUIRED,
                    "Sign in to generate new results"));
            log.info("Cache miss for {} (user={})", key, user);

            return runDetached(() -> generationLock.withLock(key, () -> generateOnce(key, request, user, model)));
        } catch (DataAccessException exception) {
            log.error("Search store unavailable", exception);
            throw new SearchPipelineException(ErrorCode.PERSISTENCE_FAILED, "Search store unavailable", exception);
        }
    }

    private void requireKnownFacets(SearchRequest request) {
        if (StringUtils.hasText(request.languageCode())) {
            String code = request.languageCode().trim();
            catalogRepository.findLanguageByCode(code)
                .orElseThrow(() -> SearchPipelineException.invalid("Unknown languageCode " + code));
        }
        if (StringUtils.hasText(request.genreSlug())) {
            String slug = request.genreSlug().trim();
            catalogRepository.findActiveGenre(slug)
                .orElseThrow(() -> SearchPipelineException.invalid("Unknown genreSlug " + slug));
        }
    }

    // Facets are classified only here, once per stored page, so a repeated request keeps its key.
    private SearchOutcome generateOnce(SearchKey key, SearchRequest request, String user, GenerationModel model) {
        Optional<CachedSearch> storedMeanwhile = cacheRepository.find(key);
        if (storedMeanwhile.isPresent()) {
            log.info("Cache hit for {} after waiting on generation lock", key);
            return SearchOutcome.hit(storedMeanwhile.get());
        }

        SearchRequest resolved = facetResolver.resolve(request, model);
        Language language = catalogRepository.findLanguageByCode(resolved.languageCode())
            .orElseThrow(() -> SearchPipelineException.invalid("Unknown languageCode " + resolved.languageCode()));
        Genre genre = catalogRepository.findActiveGenre(resolved.genreSlug())
            .orElseThrow(() -> SearchPipelineException.invalid("Unknown genreSlug " + resolved.genreSlug()));
        List<Tag> tags = catalogRepository.findTagsBySlugs(SearchKeyCanonicalizer.normalizeTags(resolved.tagSlugs()));

        MissContext context = new MissContext(key, resolved, user, language, genre, tags, model);
        return SearchOutcome.generated(commitPipeline.commit(context));
    }

    private SearchOutcome runDetached(Supplier<SearchOutcome> work) {
        CompletableFuture<SearchOutcome> future;
        try {
            future = CompletableFuture.supplyAsync(work, generationExecutor);
        } catch (RejectedExecutionException exception) {
            throw new SearchPipelineException(ErrorCode.GENERATION_FAILED,
                "Generation capacity exhausted, try again shortly", exception);
        }
        try {
            return future.join();
        } catch (CompletionException exception) {
            throw translateAsyncFailure(exception.getCause() != null ? exception.getCause() : exception);
        }
    }

    private static RuntimeException translateAsyncFailure(Throwable cause) {
        if (cause instanceof SearchPipelineException pipelineException) {
            return pipelineException;
        }
        if (cause instanceof RuntimeException runtimeException) {
            log.error("Search generation failed outside the commit pipeline", runtimeException);
            return new SearchPipelineException(ErrorCode.PERSISTENCE_FAILED,
                "Failed to coordinate search generation", runtimeException);
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new SearchPipelineException(ErrorCode.GENERATION_FAILED, "Search generation failed", cause);
    }
}
