package com.resume.network.metrics;

import com.resume.network.core.model.SearchOperation;

import java.time.Duration;

/**
 * Metrics abstraction for the search engine. {@link NoOpMetricsService} is the default;
 * {@link MicrometerMetricsService} records to a Micrometer registry.
 */
public interface MetricsService {

    void recordOperationDuration(SearchOperation operation, Duration duration);

    void incrementCandidatesIngested(int count);

    void incrementNormalizationFailures(int count);

    void recordSimilarityScore(double score);

    void recordEdgeCount(long edges);

    void incrementOracleFallback(String reason);

    void recordCacheHit();

    void recordCacheMiss();
}
