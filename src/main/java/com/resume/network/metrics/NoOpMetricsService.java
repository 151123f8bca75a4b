package com.resume.network.metrics;

import com.resume.network.core.model.SearchOperation;

import java.time.Duration;

/**
 * Metrics implementation that records nothing.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordOperationDuration(SearchOperation operation, Duration duration) {
    }

    @Override
    public void incrementCandidatesIngested(int count) {
    }

    @Override
    public void incrementNormalizationFailures(int count) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordEdgeCount(long edges) {
    }

    @Override
    public void incrementOracleFallback(String reason) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
