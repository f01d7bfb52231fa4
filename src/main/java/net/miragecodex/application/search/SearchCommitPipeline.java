package net.miragecodex.application.search;

import java.util.ArrayList;
import java.util.List;
import net.miragecodex.adapters.persistence.SearchCacheRepository;
import net.miragecodex.application.author.AuthorPoolRequest;
import net.miragecodex.application.author.AuthorPoolSelector;
import net.miragecodex.application.credit.CreditLedgerService;
import net.miragecodex.application.generation.BookGenerationContext;
import net.miragecodex.application.generation.ContentGenerationException;
import net.miragecodex.application.generation.ContentGeneratorGateway;
import net.miragecodex.application.search.SearchPipelineException.ErrorCode;
import net.miragecodex.domain.book.AuthorProfile;
import net.miragecodex.domain.catalog.Genre;
import net.miragecodex.domain.catalog.Tag;
import net.miragecodex.domain.credit.CreditAuthorization;
import net.miragecodex.domain.credit.SettlementRequest;
import net.miragecodex.domain.generation.GeneratedBook;
import net.miragecodex.domain.generation.GenerationTarget;
import net.miragecodex.domain.search.BookDraft;
import net.miragecodex.domain.search.CacheWrite;
import net.miragecodex.domain.search.CachedSearch;
import net.miragecodex.domain.search.SearchCommit;
import net.miragecodex.domain.search.SearchKey;
import net.miragecodex.domain.search.SearchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Miss path of a search: authorize, resolve authors, generate books, persist
 * the page, settle credits.
 *
 * <p>Callers hold the generation lock for the key. A failure before the page is
 * stored releases the credit hold and surfaces as a {@link SearchPipelineException};
 * a settlement failure after the page is stored is recorded for reconciliation
 * and the stored page is still returned.</p>
 */
@Service
public class SearchCommitPipeline {

    private static final Logger log = LoggerFactory.getLogger(SearchCommitPipeline.class);

    private static final int DESCRIPTION_QUERY_MAX_LENGTH = 80;

    private final CreditLedgerService creditLedger;
    private final AuthorPoolSelector authorPoolSelector;
    private final ContentGeneratorGateway generatorGateway;
    private final SearchCacheRepository cacheRepository;

    public SearchCommitPipeline(CreditLedgerService creditLedger,
                                AuthorPoolSelector authorPoolSelector,
                                ContentGeneratorGateway generatorGateway,
                                SearchCacheRepository cacheRepository) {
        this.creditLedger = creditLedger;
        this.authorPoolSelector = authorPoolSelector;
        this.generatorGateway = generatorGateway;
        this.cacheRepository = cacheRepository;
    }

    CachedSearch commit(MissContext context) {
        SearchKey key = context.key();
        logStage(key, PipelineStage.AUTHORIZING);
        CreditAuthorization authorization = authorize(context);

        PipelineStage stage = PipelineStage.AUTHORIZING;
        CacheWrite write;
        int totalGeneratedPages;
        try {
            GenerationTarget target = new GenerationTarget(context.model().name(), authorization.personalApiKey());
            SearchRequest request = context.request();

            List<AuthorProfile> authors = authorPoolSelector.selectOrCreate(new AuthorPoolRequest(
                context.genre().slug(),
                genrePrompt(context.genre()),
                request.pageSize(),
                context.language().code(),
                request.freeText(),
                target
            ));
            stage = PipelineStage.AUTHORS_RESOLVED;
            logStage(key, stage);

            List<GeneratedBook> books = generatorGateway.generateBooks(new BookGenerationContext(
                target,
                SearchKeyCanonicalizer.normalizeFreeText(request.freeText()),
                genrePrompt(context.genre()),
                tagPrompts(context.tags()),
                context.language().code(),
                request.pageNumber(),
                request.pageSize()
            ));
            stage = PipelineStage.BOOKS_GENERATED;
            logStage(key, stage);

            List<BookDraft> drafts = pairWithAuthors(books, authors);
            totalGeneratedPages = books.stream().mapToInt(GeneratedBook::pageCount).sum();

            stage = PipelineStage.PERSISTING;
            logStage(key, stage);
            write = cacheRepository.put(new SearchCommit(
                key,
                context.userId(),
                context.language(),
                context.genre().slug(),
                context.model().id(),
                SearchKeyCanonicalizer.normalizeFreeText(request.freeText()),
                SearchKeyCanonicalizer.normalizeTags(request.tagSlugs()),
                request.pageSize(),
                drafts
            ));
        } catch (RuntimeException failure) {
            releaseQuietly(authorization);
            throw translateFailure(key, stage, failure);
        }

        CachedSearch stored = write.result();
        if (!write.created()) {
            // Another writer stored this page first; its requester is the one charged.
            releaseQuietly(authorization);
            return stored;
        }

        logStage(key, PipelineStage.SETTLING);
        settle(new SettlementRequest(
            authorization,
            stored.searchId(),
            key,
            totalGeneratedPages,
            describe(context)
        ));
        logStage(key, PipelineStage.DONE);
        return stored;
    }

    private CreditAuthorization authorize(MissContext context) {
        CreditAuthorization authorization;
        try {
            authorization = creditLedger.authorize(context.userId(), context.model(), context.key());
        } catch (DataAccessException exception) {
            throw new SearchPipelineException(ErrorCode.PERSISTENCE_FAILED,
                "Credit authorization failed", exception);
        }
        if (!authorization.allowed()) {
            throw new SearchPipelineException(ErrorCode.INSUFFICIENT_CREDITS,
                "Search requires %d credits but only %d are available"
                    .formatted(authorization.estimatedCost(), authorization.available()));
        }
        return authorization;
    }

    private void settle(SettlementRequest request) {
        try {
            creditLedger.settle(request);
        } catch (RuntimeException settlementFailure) {
            log.error("Settlement failed for user {} on {} after commit; result is kept",
                request.authorization().userId(), request.key(), settlementFailure);
            creditLedger.recordSettlementFailure(request, settlementFailure);
        }
    }

    private void releaseQuietly(CreditAuthorization authorization) {
        try {
            creditLedger.release(authorization);
        } catch (RuntimeException releaseFailure) {
            log.error("Failed to release credit hold {} for user {}",
                authorization.holdId(), authorization.userId(), releaseFailure);
        }
    }

    private static SearchPipelineException translateFailure(SearchKey key, PipelineStage stage, RuntimeException failure) {
        if (failure instanceof SearchPipelineException pipelineException) {
            return pipelineException;
        }
        if (failure instanceof ContentGenerationException generationException) {
            log.error("Generation failed for {} at {} ({})", key, stage, generationException.errorCode(), failure);
            return new SearchPipelineException(ErrorCode.GENERATION_FAILED,
                "Content generation failed: " + generationException.getMessage(), failure);
        }
        log.error("Persistence failed for {} at {}", key, stage, failure);
        return new SearchPipelineException(ErrorCode.PERSISTENCE_FAILED,
            "Failed to store search results", failure);
    }

    private static List<BookDraft> pairWithAuthors(List<GeneratedBook> books, List<AuthorProfile> authors) {
        if (authors.size() < books.size()) {
            throw new IllegalStateException("Resolved %d authors for %d books".formatted(authors.size(), books.size()));
        }
        List<BookDraft> drafts = new ArrayList<>(books.size());
        for (int i = 0; i < books.size(); i++) {
            drafts.add(new BookDraft(books.get(i), authors.get(i)));
        }
        return drafts;
    }

    private static String genrePrompt(Genre genre) {
        return StringUtils.hasText(genre.promptBoost())
            ? genre.label() + ". " + genre.promptBoost()
            : genre.label();
    }

    private static List<String> tagPrompts(List<Tag> tags) {
        return tags.stream()
            .map(tag -> StringUtils.hasText(tag.promptBoost()) ? tag.promptBoost() : tag.label())
            .toList();
    }

    private static String describe(MissContext context) {
        String freeText = SearchKeyCanonicalizer.normalizeFreeText(context.request().freeText());
        String subject;
        if (freeText == null) {
            subject = context.genre().label();
        } else if (freeText.length() > DESCRIPTION_QUERY_MAX_LENGTH) {
            subject = "\"" + freeText.substring(0, DESCRIPTION_QUERY_MAX_LENGTH) + "...\"";
        } else {
            subject = "\"" + freeText + "\"";
        }
        return "Search %s (page %d, %s)".formatted(subject, context.key().pageNumber(), context.model().name());
    }

    private static void logStage(SearchKey key, PipelineStage stage) {
        log.debug("Search {} -> {}", key, stage);
    }
}
