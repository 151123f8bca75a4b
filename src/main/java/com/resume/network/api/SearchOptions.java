package com.resume.network.api;

import com.resume.network.cache.CacheConfig;
import com.resume.network.ingestion.SeniorityThresholds;
import com.resume.network.network.ColleagueEdgeOptions;
import com.resume.network.similarity.SimilarityWeights;

import java.time.Duration;

/**
 * Options for the search service.
 * Configures similarity weights, colleague-edge rules, pagination, the oracle timeout and caching.
 */
public class SearchOptions {

    private static final int DEFAULT_SIMILARITY_LIMIT = 20;
    private static final int DEFAULT_SIMILARITY_PARALLEL_THRESHOLD = 2_000;
    private static final int DEFAULT_MAX_PAGE_SIZE = 100;
    private static final Duration DEFAULT_ORACLE_TIMEOUT = Duration.ofSeconds(5);
    private static final int DEFAULT_MAX_CONCURRENT_ORACLE_CALLS = 4;
    private static final int DEFAULT_TOP_CONNECTORS = 10;

    private final SimilarityWeights similarityWeights;
    private final int defaultSimilarityLimit;
    private final double minSimilarityScore;
    private final int similarityParallelThreshold;
    private final boolean requireSameDepartment;
    private final int minOverlapMonths;
    private final int edgeParallelThreshold;
    private final boolean includeMentionedColleagues;
    private final SeniorityThresholds seniorityThresholds;
    private final int maxPageSize;
    private final Duration oracleTimeout;
    private final int maxConcurrentOracleCalls;
    private final int topConnectors;
    private final CacheConfig cacheConfig;

    private SearchOptions(Builder builder) {
        this.similarityWeights = builder.similarityWeights;
        this.defaultSimilarityLimit = builder.defaultSimilarityLimit;
        this.minSimilarityScore = builder.minSimilarityScore;
        this.similarityParallelThreshold = builder.similarityParallelThreshold;
        this.requireSameDepartment = builder.requireSameDepartment;
        this.minOverlapMonths = builder.minOverlapMonths;
        this.edgeParallelThreshold = builder.edgeParallelThreshold;
        this.includeMentionedColleagues = builder.includeMentionedColleagues;
        this.seniorityThresholds = builder.seniorityThresholds;
        this.maxPageSize = builder.maxPageSize;
        this.oracleTimeout = builder.oracleTimeout;
        this.maxConcurrentOracleCalls = builder.maxConcurrentOracleCalls;
        this.topConnectors = builder.topConnectors;
        this.cacheConfig = builder.cacheConfig;
    }

    public SimilarityWeights getSimilarityWeights() {
        return similarityWeights;
    }

    public int getDefaultSimilarityLimit() {
        return defaultSimilarityLimit;
    }

    public double getMinSimilarityScore() {
        return minSimilarityScore;
    }

    public int getSimilarityParallelThreshold() {
        return similarityParallelThreshold;
    }

    public boolean isRequireSameDepartment() {
        return requireSameDepartment;
    }

    public int getMinOverlapMonths() {
        return minOverlapMonths;
    }

    public int getEdgeParallelThreshold() {
        return edgeParallelThreshold;
    }

    public boolean isIncludeMentionedColleagues() {
        return includeMentionedColleagues;
    }

    public SeniorityThresholds getSeniorityThresholds() {
        return seniorityThresholds;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public Duration getOracleTimeout() {
        return oracleTimeout;
    }

    public int getMaxConcurrentOracleCalls() {
        return maxConcurrentOracleCalls;
    }

    public int getTopConnectors() {
        return topConnectors;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public ColleagueEdgeOptions toColleagueEdgeOptions() {
        return new ColleagueEdgeOptions(requireSameDepartment, minOverlapMonths, edgeParallelThreshold,
                includeMentionedColleagues);
    }

    /**
     * Creates default options: organization overlap alone links colleagues, no cache.
     */
    public static SearchOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options that only link colleagues from the same department with at least three
     * months of overlap.
     */
    public static SearchOptions strictColleagues() {
        return builder()
                .requireSameDepartment(true)
                .minOverlapMonths(3)
                .build();
    }

    /**
     * Creates default options with the Caffeine result cache enabled.
     */
    public static SearchOptions cached() {
        return builder()
                .cacheConfig(CacheConfig.defaults())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SimilarityWeights similarityWeights = SimilarityWeights.defaultWeights();
        private int defaultSimilarityLimit = DEFAULT_SIMILARITY_LIMIT;
        private double minSimilarityScore = 0.0;
        private int similarityParallelThreshold = DEFAULT_SIMILARITY_PARALLEL_THRESHOLD;
        private boolean requireSameDepartment = false;
        private int minOverlapMonths = 0;
        private int edgeParallelThreshold = ColleagueEdgeOptions.DEFAULT_PARALLEL_THRESHOLD;
        private boolean includeMentionedColleagues = true;
        private SeniorityThresholds seniorityThresholds = SeniorityThresholds.defaults();
        private int maxPageSize = DEFAULT_MAX_PAGE_SIZE;
        private Duration oracleTimeout = DEFAULT_ORACLE_TIMEOUT;
        private int maxConcurrentOracleCalls = DEFAULT_MAX_CONCURRENT_ORACLE_CALLS;
        private int topConnectors = DEFAULT_TOP_CONNECTORS;
        private CacheConfig cacheConfig = CacheConfig.disabled();

        public Builder similarityWeights(SimilarityWeights weights) {
            this.similarityWeights = weights;
            return this;
        }

        public Builder defaultSimilarityLimit(int limit) {
            this.defaultSimilarityLimit = limit;
            return this;
        }

        public Builder minSimilarityScore(double minScore) {
            this.minSimilarityScore = minScore;
            return this;
        }

        public Builder similarityParallelThreshold(int threshold) {
            this.similarityParallelThreshold = threshold;
            return this;
        }

        public Builder requireSameDepartment(boolean requireSameDepartment) {
            this.requireSameDepartment = requireSameDepartment;
            return this;
        }

        public Builder minOverlapMonths(int months) {
            this.minOverlapMonths = months;
            return this;
        }

        public Builder edgeParallelThreshold(int threshold) {
            this.edgeParallelThreshold = threshold;
            return this;
        }

        public Builder includeMentionedColleagues(boolean includeMentionedColleagues) {
            this.includeMentionedColleagues = includeMentionedColleagues;
            return this;
        }

        public Builder seniorityThresholds(SeniorityThresholds thresholds) {
            this.seniorityThresholds = thresholds;
            return this;
        }

        public Builder maxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
            return this;
        }

        public Builder oracleTimeout(Duration timeout) {
            this.oracleTimeout = timeout;
            return this;
        }

        public Builder maxConcurrentOracleCalls(int calls) {
            this.maxConcurrentOracleCalls = calls;
            return this;
        }

        public Builder topConnectors(int topConnectors) {
            this.topConnectors = topConnectors;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public SearchOptions build() {
            if (similarityWeights == null) {
                throw new IllegalArgumentException("similarityWeights is required");
            }
            if (defaultSimilarityLimit < 1) {
                throw new IllegalArgumentException("defaultSimilarityLimit must be >= 1");
            }
            if (minSimilarityScore < 0.0 || minSimilarityScore > 1.0) {
                throw new IllegalArgumentException("minSimilarityScore must be between 0.0 and 1.0");
            }
            if (minOverlapMonths < 0) {
                throw new IllegalArgumentException("minOverlapMonths must be >= 0");
            }
            if (maxPageSize < 1) {
                throw new IllegalArgumentException("maxPageSize must be >= 1");
            }
            if (oracleTimeout == null || oracleTimeout.isNegative() || oracleTimeout.isZero()) {
                throw new IllegalArgumentException("oracleTimeout must be positive");
            }
            if (seniorityThresholds == null) {
                throw new IllegalArgumentException("seniorityThresholds is required");
            }
            if (cacheConfig == null) {
                throw new IllegalArgumentException("cacheConfig is required");
            }
            return new SearchOptions(this);
        }
    }
}
