package net.miragecodex.domain.search;

import net.miragecodex.support.lock.AdvisoryLockKey;
import net.miragecodex.util.HashUtils;

/**
 * Cache address of one page of results: the canonical fingerprint plus the page number.
 *
 * @param fingerprint 64-character lowercase SHA-256 hex digest
 * @param pageNumber 1-based page number
 */
public record SearchKey(String fingerprint, int pageNumber) implements AdvisoryLockKey {

    private static final int LOG_PREFIX_LENGTH = 12;

    public SearchKey {
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("fingerprint is required");
        }
        if (pageNumber < 1) {
            throw new IllegalArgumentException("pageNumber must be >= 1");
        }
    }

    /** Short fingerprint prefix for log lines. */
    public String shortFingerprint() {
        return fingerprint.length() <= LOG_PREFIX_LENGTH ? fingerprint : fingerprint.substring(0, LOG_PREFIX_LENGTH);
    }

    @Override
    public long advisoryLockKey() {
        return HashUtils.sha256Long(fingerprint + ":" + pageNumber);
    }

    @Override
    public String toString() {
        return shortFingerprint() + "#p" + pageNumber;
    }
}
