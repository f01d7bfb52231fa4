package net.miragecodex.scheduler;

import net.miragecodex.adapters.persistence.CreditLedgerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deletes credit holds left behind by misses that never settled or released,
 * for example after a crash between authorization and commit.
 *
 * <p>Expired holds are already ignored when computing available balances; the
 * sweep only keeps the table small.</p>
 */
@Component
public class CreditHoldSweepScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(CreditHoldSweepScheduler.class);

    private final CreditLedgerRepository ledgerRepository;

    public CreditHoldSweepScheduler(CreditLedgerRepository ledgerRepository) {
        this.ledgerRepository = ledgerRepository;
    }

    @Scheduled(fixedDelayString = "${miragecodex.credits.hold-sweep-interval:PT5M}", initialDelayString = "PT1M")
    public void sweepExpiredHolds() {
        int removed;
        try {
            removed = ledgerRepository.deleteExpiredHolds();
        } catch (DataAccessException exception) {
            throw new IllegalStateException("Failed to sweep expired credit holds", exception);
        }
        if (removed > 0) {
            LOGGER.warn("Swept {} expired credit holds", removed);
        } else {
            LOGGER.debug("No expired credit holds to sweep");
        }
    }
}
