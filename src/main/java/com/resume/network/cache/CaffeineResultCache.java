package com.resume.network.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.resume.network.pool.CandidatePool;
import com.resume.network.pool.SnapshotListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed result cache. Implements {@link SnapshotListener} to drop entries of
 * superseded snapshots as soon as a new one is published.
 */
public class CaffeineResultCache implements ResultCache, SnapshotListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResultCache.class);

    private final Cache<CacheKey, Object> cache;

    public CaffeineResultCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineResultCache initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public <R> Optional<R> get(CacheKey key, Class<R> type) {
        Object cached = cache.getIfPresent(key);
        if (cached == null) {
            return Optional.empty();
        }
        if (!type.isInstance(cached)) {
            log.warn("cache.typeMismatch operation={} expected={} actual={}",
                    key.operation(), type.getSimpleName(), cached.getClass().getSimpleName());
            cache.invalidate(key);
            return Optional.empty();
        }
        return Optional.of(type.cast(cached));
    }

    @Override
    public void put(CacheKey key, Object result) {
        if (result != null) {
            cache.put(key, result);
        }
    }

    @Override
    public void invalidateBefore(long snapshotVersion) {
        int before = cache.asMap().size();
        cache.asMap().keySet().removeIf(key -> key.snapshotVersion() < snapshotVersion);
        log.debug("Invalidated {} cache entries older than version {}", before - cache.asMap().size(), snapshotVersion);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    @Override
    public void onSnapshotPublished(CandidatePool snapshot) {
        invalidateBefore(snapshot.version());
    }
}
