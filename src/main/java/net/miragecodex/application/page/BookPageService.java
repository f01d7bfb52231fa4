package net.miragecodex.application.page;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import net.miragecodex.adapters.persistence.BookPageRepository;
import net.miragecodex.application.credit.CreditLedgerService;
import net.miragecodex.application.generation.ContentGenerationException;
import net.miragecodex.application.generation.ContentGeneratorGateway;
import net.miragecodex.application.generation.PageGenerationContext;
import net.miragecodex.application.page.BookPageException.ErrorCode;
import net.miragecodex.domain.book.BookPage;
import net.miragecodex.domain.book.BookPageKey;
import net.miragecodex.domain.book.EditionDetails;
import net.miragecodex.domain.credit.CreditAuthorization;
import net.miragecodex.domain.generation.GenerationTarget;
import net.miragecodex.support.lock.SearchGenerationLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Serves the pages of an edition, writing each one at most once.
 *
 * <p>Stored pages are public. Writing a missing page needs a signed-in caller
 * and costs the edition model's page generation credits unless the caller has
 * a personal key for the model's provider. The write runs under the page's
 * generation lock on the generation executor, with a second lookup once the
 * lock is held, like a search miss.</p>
 */
@Service
public class BookPageService {

    private static final Logger log = LoggerFactory.getLogger(BookPageService.class);

    private final BookPageRepository pageRepository;
    private final CreditLedgerService creditLedger;
    private final ContentGeneratorGateway generatorGateway;
    private final SearchGenerationLock generationLock;
    private final Executor generationExecutor;

    public BookPageService(BookPageRepository pageRepository,
                           CreditLedgerService creditLedger,
                           ContentGeneratorGateway generatorGateway,
                           SearchGenerationLock generationLock,
                           @Qualifier("searchGenerationExecutor") Executor generationExecutor) {
        this.pageRepository = pageRepository;
        this.creditLedger = creditLedger;
        this.generatorGateway = generatorGateway;
        this.generationLock = generationLock;
        this.generationExecutor = generationExecutor;
    }

    /**
     * Stored page, without ever generating. Empty when the page has not been written yet.
     */
    public Optional<BookPage> findStored(UUID editionId, int pageNumber) {
        BookPageKey key = toKey(editionId, pageNumber);
        try {
            return pageRepository.find(key);
        } catch (DataAccessException exception) {
            log.error("Page store unavailable for {}", key, exception);
            throw new BookPageException(ErrorCode.PERSISTENCE_FAILED, "Page store unavailable", exception);
        }
    }

    /**
     * Returns the stored page, writing it first when it does not exist.
     *
     * @param userId authenticated caller, empty for anonymous requests
     * @throws BookPageException classified failure
     */
    public BookPageOutcome readOrWrite(UUID editionId, int pageNumber, Optional<String> userId) {
        BookPageKey key = toKey(editionId, pageNumber);
        try {
            Optional<BookPage> stored = pageRepository.find(key);
            if (stored.isPresent()) {
                log.debug("Page {} served from store", key);
                return BookPageOutcome.stored(stored.get());
            }

            EditionDetails edition = pageRepository.findEditionDetails(editionId)
                .orElseThrow(() -> new BookPageException(ErrorCode.NOT_FOUND, "Unknown edition " + editionId));
            if (pageNumber > edition.pageCount()) {
                throw new BookPageException(ErrorCode.INVALID_REQUEST,
                    "Page %d is beyond the book's %d pages".formatted(pageNumber, edition.pageCount()));
            }
            String user = userId.filter(id -> !id.isBlank())
                .orElseThrow(() -> new BookPageException(ErrorCode.AUTHENTICATION_REQUIRED,
                    "Sign in to read unwritten pages"));
            log.info("Page {} not written yet (user={})", key, user);

            return runDetached(() -> generationLock.withLock(key, () -> writeOnce(key, edition, user)));
        } catch (DataAccessException exception) {
            log.error("Page store unavailable for {}", key, exception);
            throw new BookPageException(ErrorCode.PERSISTENCE_FAILED, "Page store unavailable", exception);
        }
    }

    private BookPageOutcome writeOnce(BookPageKey key, EditionDetails edition, String user) {
        Optional<BookPage> storedMeanwhile = pageRepository.find(key);
        if (storedMeanwhile.isPresent()) {
            log.info("Page {} stored while waiting on generation lock", key);
            return BookPageOutcome.stored(storedMeanwhile.get());
        }

        CreditAuthorization authorization = authorize(user, edition, key);
        String content;
        try {
            content = generatorGateway.generatePage(pageContext(key, edition, authorization));
            if (!pageRepository.insert(key, content, user)) {
                BookPage existing = pageRepository.find(key).orElseThrow(() ->
                    new IllegalStateException("Page " + key + " conflicted but could not be read back"));
                releaseQuietly(authorization);
                return BookPageOutcome.stored(existing);
            }
        } catch (RuntimeException failure) {
            releaseQuietly(authorization);
            throw translateFailure(key, failure);
        }

        settle(authorization, key, "Page %d of \"%s\" (%s)"
            .formatted(key.pageNumber(), edition.title(), edition.model().name()));
        return BookPageOutcome.written(new BookPage(key.editionId(), key.pageNumber(), content, Instant.now()));
    }

    private PageGenerationContext pageContext(BookPageKey key, EditionDetails edition, CreditAuthorization authorization) {
        String previousPage = null;
        if (key.pageNumber() > 1) {
            previousPage = pageRepository.find(new BookPageKey(key.editionId(), key.pageNumber() - 1))
                .map(BookPage::content)
                .orElse(null);
        }
        return new PageGenerationContext(
            new GenerationTarget(edition.model().name(), authorization.personalApiKey()),
            edition.title(),
            edition.summary(),
            edition.penName(),
            edition.stylePrompt(),
            edition.languageCode(),
            key.pageNumber(),
            edition.pageCount(),
            edition.sectionFor(key.pageNumber()).orElse(null),
            previousPage
        );
    }

    private CreditAuthorization authorize(String user, EditionDetails edition, BookPageKey key) {
        CreditAuthorization authorization;
        try {
            authorization = creditLedger.authorizePage(user, edition.model(), key);
        } catch (DataAccessException exception) {
            throw new BookPageException(ErrorCode.PERSISTENCE_FAILED, "Credit authorization failed", exception);
        }
        if (!authorization.allowed()) {
            throw new BookPageException(ErrorCode.INSUFFICIENT_CREDITS,
                "Page requires %d credits but only %d are available"
                    .formatted(authorization.estimatedCost(), authorization.available()));
        }
        return authorization;
    }

    private void settle(CreditAuthorization authorization, BookPageKey key, String description) {
        try {
            creditLedger.settlePage(authorization, key, description);
        } catch (RuntimeException settlementFailure) {
            log.error("Settlement failed for user {} on page {} after commit; page is kept",
                authorization.userId(), key, settlementFailure);
            creditLedger.recordPageSettlementFailure(authorization, key, settlementFailure);
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

    private BookPageOutcome runDetached(Supplier<BookPageOutcome> work) {
        CompletableFuture<BookPageOutcome> future;
        try {
            future = CompletableFuture.supplyAsync(work, generationExecutor);
        } catch (RejectedExecutionException exception) {
            throw new BookPageException(ErrorCode.GENERATION_FAILED,
                "Generation capacity exhausted, try again shortly", exception);
        }
        try {
            return future.join();
        } catch (CompletionException exception) {
            Throwable cause = exception.getCause() != null ? exception.getCause() : exception;
            if (cause instanceof BookPageException pageException) {
                throw pageException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            log.error("Page generation failed outside the write path", cause);
            throw new BookPageException(ErrorCode.PERSISTENCE_FAILED, "Failed to coordinate page generation", cause);
        }
    }

    private static BookPageKey toKey(UUID editionId, int pageNumber) {
        if (editionId == null) {
            throw new BookPageException(ErrorCode.INVALID_REQUEST, "editionId is required");
        }
        if (pageNumber < 1) {
            throw new BookPageException(ErrorCode.INVALID_REQUEST, "pageNumber must be at least 1");
        }
        return new BookPageKey(editionId, pageNumber);
    }

    private static BookPageException translateFailure(BookPageKey key, RuntimeException failure) {
        if (failure instanceof BookPageException pageException) {
            return pageException;
        }
        if (failure instanceof ContentGenerationException generationException) {
            log.error("Generation failed for page {} ({})", key, generationException.errorCode(), failure);
            return new BookPageException(ErrorCode.GENERATION_FAILED,
                "Page generation failed: " + generationException.getMessage(), failure);
        }
        log.error("Persistence failed for page {}", key, failure);
        return new BookPageException(ErrorCode.PERSISTENCE_FAILED, "Failed to store page", failure);
    }
}
