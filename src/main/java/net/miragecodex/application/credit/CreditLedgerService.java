package net.miragecodex.application.credit;

import jakarta.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import net.miragecodex.adapters.persistence.CreditLedgerRepository;
import net.miragecodex.adapters.persistence.UserApiKeyRepository;
import net.miragecodex.config.CreditProperties;
import net.miragecodex.domain.book.BookPageKey;
import net.miragecodex.domain.catalog.GenerationModel;
import net.miragecodex.domain.credit.CreditAuthorization;
import net.miragecodex.domain.credit.CreditBalance;
import net.miragecodex.domain.credit.SettlementRequest;
import net.miragecodex.domain.credit.TransactionPage;
import net.miragecodex.domain.credit.TransactionType;
import net.miragecodex.domain.search.SearchKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Per-user credit metering for miss-path searches and book page generation.
 *
 * <p>{@code authorize} reserves the model's search estimate as a hold so that
 * concurrent searches by the same user see the reduced available balance;
 * {@code settle} replaces the hold with a debit of the actual cost. Every
 * balance change is paired with a transaction row in the same transaction, and
 * each method locks the user's balance row first. A new account is opened with
 * a starter grant recorded as a {@code grant} transaction.</p>
 */
@Service
public class CreditLedgerService {

    private static final Logger log = LoggerFactory.getLogger(CreditLedgerService.class);

    static final int MAX_TRANSACTION_PAGE_SIZE = 100;

    private final CreditLedgerRepository ledgerRepository;
    private final UserApiKeyRepository apiKeyRepository;
    private final CreditCostTable costTable;
    private final CreditProperties creditProperties;
    private final ObjectMapper objectMapper;
    private TransactionTemplate releaseTransaction;

    public CreditLedgerService(CreditLedgerRepository ledgerRepository,
                               UserApiKeyRepository apiKeyRepository,
                               CreditCostTable costTable,
                               CreditProperties creditProperties,
                               ObjectMapper objectMapper) {
        this.ledgerRepository = ledgerRepository;
        this.apiKeyRepository = apiKeyRepository;
        this.costTable = costTable;
        this.creditProperties = creditProperties;
        this.objectMapper = objectMapper;
    }

    @Autowired
    void setTransactionManager(@Nullable PlatformTransactionManager transactionManager) {
        if (transactionManager != null) {
            TransactionTemplate template = new TransactionTemplate(transactionManager);
            template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
            this.releaseTransaction = template;
        }
    }

    /**
     * Decides whether the user may run a miss-path search on {@code model}.
     *
     * <p>A personal key for the model's provider domain yields an unmetered
     * authorization. Otherwise the search estimate must fit in the available
     * balance, and a hold for it is recorded.</p>
     */
    @Transactional
    public CreditAuthorization authorize(String userId, GenerationModel model, SearchKey key) {
        Optional<String> personalKey = apiKeyRepository.findApiKey(userId, model.domainCode());
        if (personalKey.isPresent()) {
            log.debug("User {} authorized unmetered for {} via personal {} key", userId, key, model.domainCode());
            return CreditAuthorization.unmetered(userId, personalKey.get());
        }
        return holdEstimate(userId, costTable.costsFor(model).searchCredits(),
            key.fingerprint() + ":" + key.pageNumber(), key.toString());
    }

    /**
     * Decides whether the user may have a page of an edition written by
     * {@code model}, holding the model's page generation cost when metered.
     */
    @Transactional
    public CreditAuthorization authorizePage(String userId, GenerationModel model, BookPageKey key) {
        Optional<String> personalKey = apiKeyRepository.findApiKey(userId, model.domainCode());
        if (personalKey.isPresent()) {
            log.debug("User {} authorized unmetered for page {} via personal {} key", userId, key, model.domainCode());
            return CreditAuthorization.unmetered(userId, personalKey.get());
        }
        return holdEstimate(userId, costTable.costsFor(model).pageGenerationCredits(), key.reference(), key.toString());
    }

    /**
     * Charges the actual cost of a committed miss and removes its hold.
     *
     * <p>The charge may exceed the estimate, in which case the balance can go
     * negative; the debt then blocks later authorizations.</p>
     *
     * @return credits debited, zero for unmetered authorizations
     */
    @Transactional
    public int settle(SettlementRequest request) {
        CreditAuthorization authorization = request.authorization();
        if (!authorization.metered()) {
            return 0;
        }
        String userId = authorization.userId();
        int cost = costTable.settlementCost(request.totalGeneratedPages());

        ledgerRepository.lockBalance(userId)
            .orElseThrow(() -> new IllegalStateException("No credit account for user " + userId));
        releaseHold(authorization);
        if (cost > 0) {
            ledgerRepository.insertTransaction(userId, -cost, TransactionType.SEARCH, request.description(),
                settlementMetadata(request, cost));
            ledgerRepository.applyBalanceDelta(userId, -cost);
        }
        log.info("Settled {} credits for user {} on {} ({} pages)", cost, userId, request.key(),
            request.totalGeneratedPages());
        return cost;
    }

    /**
     * Charges the held page generation cost of a stored page and removes its hold.
     *
     * @return credits debited, zero for unmetered authorizations
     */
    @Transactional
    public int settlePage(CreditAuthorization authorization, BookPageKey key, String description) {
        if (!authorization.metered()) {
            return 0;
        }
        String userId = authorization.userId();
        int cost = authorization.estimatedCost();

        ledgerRepository.lockBalance(userId)
            .orElseThrow(() -> new IllegalStateException("No credit account for user " + userId));
        releaseHold(authorization);
        if (cost > 0) {
            ledgerRepository.insertTransaction(userId, -cost, TransactionType.PAGE_GENERATION, description,
                pageMetadata(key, cost));
            ledgerRepository.applyBalanceDelta(userId, -cost);
        }
        log.info("Settled {} credits for user {} on page {}", cost, userId, key);
        return cost;
    }

    /**
     * Drops the hold of an authorization whose search or page did not commit.
     */
    @Transactional
    public void release(CreditAuthorization authorization) {
        if (!authorization.metered() || authorization.holdId() == null) {
            return;
        }
        ledgerRepository.lockBalance(authorization.userId());
        releaseHold(authorization);
    }

    /**
     * Opens the user's account if needed, crediting the starter grant once.
     *
     * @return whether the account was created by this call
     */
    @Transactional
    public boolean openAccount(String userId) {
        if (!ledgerRepository.ensureAccount(userId)) {
            return false;
        }
        int starter = creditProperties.getStarterCredits();
        if (starter > 0) {
            ledgerRepository.insertTransaction(userId, starter, TransactionType.GRANT, "Starter credits", null);
            ledgerRepository.applyBalanceDelta(userId, starter);
        }
        log.info("Opened credit account for user {} with {} starter credits", userId, starter);
        return true;
    }

    /**
     * Records a settlement that could not be applied so it can be reconciled later.
     * Never throws: the search result has already been committed.
     */
    public void recordSettlementFailure(SettlementRequest request, RuntimeException cause) {
        recordUnsettled(request.authorization(), request.searchId(), request.key().toString(),
            costTable.settlementCost(request.totalGeneratedPages()), "settlement failed: " + cause.getMessage());
    }

    /**
     * Page counterpart of {@link #recordSettlementFailure}. Never throws.
     */
    public void recordPageSettlementFailure(CreditAuthorization authorization, BookPageKey key, RuntimeException cause) {
        recordUnsettled(authorization, null, key.toString(), authorization.estimatedCost(),
            "page settlement failed for " + key.reference() + ": " + cause.getMessage());
    }

    private void recordUnsettled(CreditAuthorization authorization,
                                 @Nullable UUID searchId,
                                 String reference,
                                 int amount,
                                 String reason) {
        try {
            releaseInOwnTransaction(authorization);
        } catch (DataAccessException releaseFailure) {
            log.error("Could not release hold {} for user {} after settlement failure",
                authorization.holdId(), authorization.userId(), releaseFailure);
        }
        try {
            ledgerRepository.insertReconciliationEntry(authorization.userId(), searchId, amount, reason);
            log.warn("Recorded reconciliation entry for user {} on {} amount {}",
                authorization.userId(), reference, amount);
        } catch (DataAccessException recordFailure) {
            log.error("UNRECORDED SETTLEMENT userId={} searchId={} key={} amount={} reason={}",
                authorization.userId(), searchId, reference, amount, reason, recordFailure);
        }
    }

    /**
     * Balance of the user, opening the account on first access.
     */
    @Transactional
    public CreditBalance currentBalance(String userId) {
        openAccount(userId);
        return ledgerRepository.findBalance(userId).orElse(CreditBalance.empty(userId));
    }

    /**
     * @param page 1-based page, values below 1 are treated as 1
     * @param limit page size, clamped to [1, 100]
     */
    @Transactional(readOnly = true)
    public TransactionPage transactions(String userId, int page, int limit) {
        int safePage = Math.max(page, 1);
        int safeLimit = Math.min(Math.max(limit, 1), MAX_TRANSACTION_PAGE_SIZE);
        int offset = (safePage - 1) * safeLimit;
        return new TransactionPage(
            ledgerRepository.findTransactions(userId, safeLimit, offset),
            safePage,
            safeLimit,
            ledgerRepository.countTransactions(userId)
        );
    }

    // Self-invocation skips the @Transactional proxy, so the row lock needs an explicit transaction.
    private void releaseInOwnTransaction(CreditAuthorization authorization) {
        if (releaseTransaction != null) {
            releaseTransaction.executeWithoutResult(status -> release(authorization));
        } else {
            release(authorization);
        }
    }

    private CreditAuthorization holdEstimate(String userId, int estimate, String holdReference, String label) {
        openAccount(userId);
        CreditBalance balance = ledgerRepository.lockBalance(userId).orElse(CreditBalance.empty(userId));
        if (balance.available() < estimate) {
            log.info("User {} denied for {}: estimate {} exceeds available {}",
                userId, label, estimate, balance.available());
            return CreditAuthorization.denied(userId, estimate, balance.available());
        }
        long holdId = ledgerRepository.insertHold(userId, estimate, holdReference);
        return CreditAuthorization.metered(userId, holdId, estimate, balance.available());
    }

    private void releaseHold(CreditAuthorization authorization) {
        if (authorization.holdId() != null && !ledgerRepository.deleteHold(authorization.holdId())) {
            log.warn("Credit hold {} for user {} was already gone", authorization.holdId(), authorization.userId());
        }
    }

    private String pageMetadata(BookPageKey key, int cost) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("editionId", key.editionId().toString());
        metadata.put("pageNumber", key.pageNumber());
        metadata.put("actualCost", cost);
        return writeMetadata(metadata);
    }

    private String settlementMetadata(SettlementRequest request, int cost) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("searchId", request.searchId().toString());
        metadata.put("fingerprint", request.key().fingerprint());
        metadata.put("pageNumber", request.key().pageNumber());
        metadata.put("totalGeneratedPages", request.totalGeneratedPages());
        metadata.put("estimatedCost", request.authorization().estimatedCost());
        metadata.put("actualCost", cost);
        return writeMetadata(metadata);
    }

    private String writeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JacksonException exception) {
            throw new IllegalStateException("Failed to serialize transaction metadata", exception);
        }
    }
}
