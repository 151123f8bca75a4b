package com.resume.network.cache;

import java.util.Optional;

/**
 * Cache for search results, keyed by (operation, inputs, snapshot version).
 * Entries for a snapshot version are valid for exactly that version, so results are identical
 * with and without a cache.
 */
public interface ResultCache {

    /**
     * Gets a cached result.
     *
     * @param key  the cache key
     * @param type the expected result type
     * @return the cached result, or empty if not cached
     */
    <R> Optional<R> get(CacheKey key, Class<R> type);

    /**
     * Caches a result.
     */
    void put(CacheKey key, Object result);

    /**
     * Invalidates all entries computed against snapshots older than {@code snapshotVersion}.
     */
    void invalidateBefore(long snapshotVersion);

    /**
     * Invalidates all cache entries.
     */
    void invalidateAll();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();
}
