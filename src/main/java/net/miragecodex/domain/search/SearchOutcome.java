package net.miragecodex.domain.search;

/**
 * Result page plus whether it was served from the cache.
 */
public record SearchOutcome(CachedSearch result, boolean cached) {

    public static SearchOutcome hit(CachedSearch result) {
        return new SearchOutcome(result, true);
    }

    public static SearchOutcome generated(CachedSearch result) {
        return new SearchOutcome(result, false);
    }
}
