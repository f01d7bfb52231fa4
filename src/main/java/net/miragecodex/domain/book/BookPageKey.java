package net.miragecodex.domain.book;

import java.util.UUID;
import net.miragecodex.support.lock.AdvisoryLockKey;
import net.miragecodex.util.HashUtils;

/**
 * Cache address of one generated page of an edition.
 *
 * @param editionId edition the page belongs to
 * @param pageNumber 1-based page number within the book
 */
public record BookPageKey(UUID editionId, int pageNumber) implements AdvisoryLockKey {

    public BookPageKey {
        if (editionId == null) {
            throw new IllegalArgumentException("editionId is required");
        }
        if (pageNumber < 1) {
            throw new IllegalArgumentException("pageNumber must be >= 1");
        }
    }

    @Override
    public long advisoryLockKey() {
        return HashUtils.sha256Long("book-page:" + editionId + ":" + pageNumber);
    }

    /** Reference stored on credit holds and transactions. */
    public String reference() {
        return "page:" + editionId + ":" + pageNumber;
    }

    @Override
    public String toString() {
        return editionId + "#page" + pageNumber;
    }
}
