package com.resume.network.metrics;

import com.resume.network.core.model.SearchOperation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code resume.search.duration} - Timer (tag: operation)</li>
 *   <li>{@code resume.ingested} - Counter</li>
 *   <li>{@code resume.normalization.failed} - Counter</li>
 *   <li>{@code resume.similarity.score} - DistributionSummary</li>
 *   <li>{@code resume.network.edges} - DistributionSummary</li>
 *   <li>{@code resume.oracle.fallback} - Counter (tag: reason)</li>
 *   <li>{@code resume.cache.hit} / {@code resume.cache.miss} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<SearchOperation, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, Counter> fallbackCounters = new ConcurrentHashMap<>();
    private final Counter ingestedCounter;
    private final Counter normalizationFailedCounter;
    private final DistributionSummary similarityScoreSummary;
    private final DistributionSummary edgeCountSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.ingestedCounter = Counter.builder("resume.ingested")
                .description("Number of resumes normalized into the pool")
                .register(registry);
        this.normalizationFailedCounter = Counter.builder("resume.normalization.failed")
                .description("Number of resumes rejected by the normalizer")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("resume.similarity.score")
                .description("Distribution of returned similarity scores")
                .register(registry);
        this.edgeCountSummary = DistributionSummary.builder("resume.network.edges")
                .description("Colleague edges per network build")
                .register(registry);
        this.cacheHitCounter = Counter.builder("resume.cache.hit")
                .description("Number of result cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("resume.cache.miss")
                .description("Number of result cache misses")
                .register(registry);
    }

    @Override
    public void recordOperationDuration(SearchOperation operation, Duration duration) {
        Timer timer = timers.computeIfAbsent(operation, op ->
                Timer.builder("resume.search.duration")
                        .description("Duration of search operations")
                        .tag("operation", op.getTag())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementCandidatesIngested(int count) {
        ingestedCounter.increment(count);
    }

    @Override
    public void incrementNormalizationFailures(int count) {
        normalizationFailedCounter.increment(count);
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordEdgeCount(long edges) {
        edgeCountSummary.record(edges);
    }

    @Override
    public void incrementOracleFallback(String reason) {
        Counter counter = fallbackCounters.computeIfAbsent(reason, r ->
                Counter.builder("resume.oracle.fallback")
                        .description("Natural-language translations that fell back to keyword matching")
                        .tag("reason", r)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
