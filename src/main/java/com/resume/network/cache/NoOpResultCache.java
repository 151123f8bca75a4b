package com.resume.network.cache;

import java.util.Optional;

/**
 * No-op cache implementation. All operations are no-ops.
 * Used as the default when caching is disabled.
 */
public class NoOpResultCache implements ResultCache {

    @Override
    public <R> Optional<R> get(CacheKey key, Class<R> type) {
        return Optional.empty();
    }

    @Override
    public void put(CacheKey key, Object result) {
        // no-op
    }

    @Override
    public void invalidateBefore(long snapshotVersion) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
