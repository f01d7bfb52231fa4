package net.miragecodex.domain.search;

/**
 * Result of a cache put.
 *
 * @param created false when another writer had already stored the page
 */
public record CacheWrite(CachedSearch result, boolean created) {
}
