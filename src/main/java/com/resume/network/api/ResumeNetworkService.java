package com.resume.network.api;

import com.resume.network.cache.CaffeineResultCache;
import com.resume.network.cache.CacheKey;
import com.resume.network.cache.NoOpResultCache;
import com.resume.network.cache.ResultCache;
import com.resume.network.core.model.SearchOperation;
import com.resume.network.ingestion.IngestionResult;
import com.resume.network.ingestion.JsonResumeImporter;
import com.resume.network.ingestion.ProgressCallback;
import com.resume.network.ingestion.RawResume;
import com.resume.network.ingestion.ResumeIngestionService;
import com.resume.network.ingestion.ResumeNormalizer;
import com.resume.network.ingestion.SeniorityClassifier;
import com.resume.network.llm.NoOpQueryOracle;
import com.resume.network.llm.QueryOracle;
import com.resume.network.llm.QueryTranslator;
import com.resume.network.llm.TranslatedQuery;
import com.resume.network.logging.LogContext;
import com.resume.network.metrics.MetricsService;
import com.resume.network.metrics.NoOpMetricsService;
import com.resume.network.network.ColleagueEdgeBuilder;
import com.resume.network.network.ColleagueNetworkBuilder;
import com.resume.network.network.InternalInconsistencyException;
import com.resume.network.network.NetworkGraph;
import com.resume.network.network.PathResult;
import com.resume.network.pool.CandidatePool;
import com.resume.network.pool.CandidatePoolHolder;
import com.resume.network.pool.CandidateStore;
import com.resume.network.pool.InMemoryCandidateStore;
import com.resume.network.pool.SnapshotListener;
import com.resume.network.query.QueryPage;
import com.resume.network.query.QueryValidationException;
import com.resume.network.query.StructuredQuery;
import com.resume.network.query.StructuredQueryExecutor;
import com.resume.network.rules.DefaultNormalizationRules;
import com.resume.network.rules.NormalizationEngine;
import com.resume.network.rules.SkillSynonyms;
import com.resume.network.similarity.CandidateSimilarityScorer;
import com.resume.network.similarity.SimilarityEngine;
import com.resume.network.similarity.SimilarityMatch;
import com.resume.network.similarity.SimilarityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Main entry point for resume search and colleague-network analysis.
 *
 * <p>Every request runs against exactly one immutable pool snapshot, captured when the request
 * starts. Ingestion publishes new snapshots concurrently; a request in flight never observes a
 * partially applied batch.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (ResumeNetworkService service = ResumeNetworkService.builder()
 *         .options(SearchOptions.cached())
 *         .build()) {
 *
 *     service.ingest(resumes);
 *
 *     SimilarityResult similar = service.findSimilar("cand-42", 10);
 *     PathResult path = service.shortestPath("cand-42", "cand-7");
 *
 *     SearchOutcome&lt;QueryPage&gt; outcome = service.handle(
 *             new SearchRequest.StructuredSearch(query, 0, 25));
 * }
 * </pre>
 */
public class ResumeNetworkService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResumeNetworkService.class);

    private final SearchOptions options;
    private final CandidatePoolHolder poolHolder;
    private final ResumeIngestionService ingestionService;
    private final JsonResumeImporter importer;
    private final SimilarityEngine similarityEngine;
    private final ColleagueNetworkBuilder networkBuilder;
    private final StructuredQueryExecutor queryExecutor;
    private final QueryTranslator queryTranslator;
    private final MetricsService metricsService;
    private final ResultCache resultCache;
    private final AtomicReference<NetworkGraph> graph = new AtomicReference<>();

    private ResumeNetworkService(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        NormalizationEngine normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        SkillSynonyms skillSynonyms = builder.skillSynonyms != null
                ? builder.skillSynonyms : SkillSynonyms.defaults();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        CandidateStore store = builder.candidateStore != null
                ? builder.candidateStore : new InMemoryCandidateStore();
        this.poolHolder = builder.poolHolder != null ? builder.poolHolder : new CandidatePoolHolder();

        ResumeNormalizer normalizer = new ResumeNormalizer(normalizationEngine, skillSynonyms,
                new SeniorityClassifier(options.getSeniorityThresholds()), clock);
        this.ingestionService = new ResumeIngestionService(normalizer, store, poolHolder, metricsService);
        this.importer = new JsonResumeImporter(ingestionService);

        this.similarityEngine = new SimilarityEngine(
                new CandidateSimilarityScorer(options.getSimilarityWeights()),
                options.getDefaultSimilarityLimit(),
                options.getSimilarityParallelThreshold());
        this.networkBuilder = new ColleagueNetworkBuilder(
                new ColleagueEdgeBuilder(clock, options.toColleagueEdgeOptions()));
        this.queryExecutor = new StructuredQueryExecutor(normalizationEngine, skillSynonyms, clock,
                options.getMaxPageSize());

        QueryOracle oracle = builder.queryOracle != null ? builder.queryOracle : new NoOpQueryOracle();
        this.queryTranslator = QueryTranslator.builder()
                .oracle(oracle)
                .normalizationEngine(normalizationEngine)
                .skillSynonyms(skillSynonyms)
                .metricsService(metricsService)
                .clock(clock)
                .timeout(options.getOracleTimeout())
                .maxConcurrentCalls(options.getMaxConcurrentOracleCalls())
                .build();

        if (builder.resultCache != null) {
            this.resultCache = builder.resultCache;
        } else if (options.getCacheConfig().enabled()) {
            this.resultCache = new CaffeineResultCache(options.getCacheConfig());
        } else {
            this.resultCache = new NoOpResultCache();
        }
        // Cached results are keyed by snapshot version; older entries go when a new snapshot is published.
        if (resultCache instanceof SnapshotListener listener) {
            poolHolder.addListener(listener);
        }

        if (builder.loadOnStart) {
            ingestionService.reload();
        }
        log.info("service.started oracle={} cache={} requireSameDepartment={} minOverlapMonths={}",
                oracle.getOracleName(), resultCache.getClass().getSimpleName(),
                options.isRequireSameDepartment(), options.getMinOverlapMonths());
    }

    /**
     * Runs a request against the current snapshot.
     * Validation failures and internal errors are reported in the outcome, never thrown.
     */
    public <R> SearchOutcome<R> handle(SearchRequest<R> request) {
        Objects.requireNonNull(request, "request is required");
        CandidatePool snapshot = poolHolder.current();
        SearchOperation operation = request.operation();
        String correlationId = LogContext.generateCorrelationId();
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forSearch(correlationId, operation.getTag())
                .with("snapshotVersion", String.valueOf(snapshot.version()))) {
            try {
                R result = executeCached(request, snapshot);
                log.debug("search.completed request={}", request);
                return SearchOutcome.ok(result, snapshot.version(), correlationId);
            } catch (QueryValidationException e) {
                log.info("search.rejected field={} reason={}", e.getField(), e.getReason());
                return SearchOutcome.validationError(e.getField(), e.getReason(), snapshot.version(), correlationId);
            } catch (InternalInconsistencyException e) {
                log.error("search.inconsistent request={} error={}", request, e.getMessage(), e);
                return SearchOutcome.internalError(e.getMessage(), snapshot.version(), correlationId);
            } catch (RuntimeException e) {
                log.error("search.failed request={} error={}", request, e.getMessage(), e);
                return SearchOutcome.internalError("Unexpected error: " + e.getMessage(),
                        snapshot.version(), correlationId);
            } finally {
                metricsService.recordOperationDuration(operation, Duration.ofNanos(System.nanoTime() - start));
            }
        }
    }

    private <R> R executeCached(SearchRequest<R> request, CandidatePool snapshot) {
        if (!request.cacheable()) {
            return request.execute(this, snapshot);
        }
        CacheKey key = CacheKey.of(request.operation(), snapshot.version(), request);
        R cached = resultCache.get(key, request.resultType()).orElse(null);
        if (cached != null) {
            metricsService.recordCacheHit();
            return cached;
        }
        metricsService.recordCacheMiss();
        R result = request.execute(this, snapshot);
        resultCache.put(key, result);
        return result;
    }

    // Request execution against a captured snapshot

    SimilarityResult findSimilar(CandidatePool snapshot, String referenceId, int limit) {
        int effectiveLimit = limit > 0 ? limit : options.getDefaultSimilarityLimit();
        SimilarityResult result = similarityEngine.findSimilar(referenceId, snapshot, effectiveLimit,
                options.getMinSimilarityScore());
        for (SimilarityMatch match : result.matches()) {
            metricsService.recordSimilarityScore(match.score());
        }
        return result;
    }

    QueryPage search(CandidatePool snapshot, StructuredQuery query, int page, int pageSize) {
        return queryExecutor.execute(query, snapshot, page, pageSize);
    }

    NaturalLanguageSearchResult searchNaturalLanguage(CandidatePool snapshot, String text, int page, int pageSize) {
        TranslatedQuery translation = queryTranslator.translate(text, snapshot);
        QueryPage result = queryExecutor.execute(translation.query(), snapshot, page, pageSize);
        return new NaturalLanguageSearchResult(text, translation, result);
    }

    ColleagueLookup colleagues(CandidatePool snapshot, String candidateId) {
        NetworkGraph network = graphFor(snapshot);
        if (!network.contains(candidateId)) {
            return ColleagueLookup.notFound(candidateId, snapshot.version());
        }
        return new ColleagueLookup(candidateId, true,
                network.neighbors(candidateId).stream().map(NetworkGraph.Neighbor::edge).toList(),
                network.colleagueIds(candidateId),
                network.connectedComponent(candidateId),
                snapshot.version());
    }

    PathResult shortestPath(CandidatePool snapshot, String fromId, String toId) {
        return graphFor(snapshot).shortestPath(fromId, toId);
    }

    NetworkSummary networkSummary(CandidatePool snapshot) {
        NetworkGraph network = graphFor(snapshot);
        return new NetworkSummary(snapshot.version(), snapshot.size(), network.stats(),
                network.topConnectors(options.getTopConnectors()));
    }

    /**
     * Colleague graph of the snapshot, rebuilt only when the snapshot version changes.
     */
    NetworkGraph graphFor(CandidatePool snapshot) {
        NetworkGraph current = graph.get();
        if (current != null && current.snapshotVersion() == snapshot.version()) {
            return current;
        }
        NetworkGraph rebuilt = networkBuilder.buildGraph(snapshot);
        metricsService.recordEdgeCount(rebuilt.edges().size());
        // A slower build for an older snapshot must not replace a newer graph.
        graph.accumulateAndGet(rebuilt, (existing, candidate) ->
                existing == null || existing.snapshotVersion() < candidate.snapshotVersion() ? candidate : existing);
        return rebuilt;
    }

    // Convenience API: rethrows failures instead of returning an outcome

    public SimilarityResult findSimilar(String referenceId, int limit) {
        return handle(new SearchRequest.SimilarCandidates(referenceId, limit)).getOrThrow();
    }

    public QueryPage search(StructuredQuery query, int page, int pageSize) {
        return handle(new SearchRequest.StructuredSearch(query, page, pageSize)).getOrThrow();
    }

    public NaturalLanguageSearchResult searchNaturalLanguage(String text, int page, int pageSize) {
        return handle(new SearchRequest.NaturalLanguageSearch(text, page, pageSize)).getOrThrow();
    }

    public ColleagueLookup colleagues(String candidateId) {
        return handle(new SearchRequest.Colleagues(candidateId)).getOrThrow();
    }

    public PathResult shortestPath(String fromId, String toId) {
        return handle(new SearchRequest.ShortestPath(fromId, toId)).getOrThrow();
    }

    public NetworkSummary networkSummary() {
        return handle(new SearchRequest.NetworkStatistics()).getOrThrow();
    }

    // Ingestion

    public IngestionResult ingest(Collection<RawResume> resumes) {
        return ingestionService.ingest(resumes);
    }

    public IngestionResult ingest(Collection<RawResume> resumes, ProgressCallback callback) {
        return ingestionService.ingest(resumes, callback);
    }

    /**
     * Imports resumes from a JSON array or JSON Lines stream.
     */
    public IngestionResult importJson(InputStream input, ProgressCallback callback) {
        return importer.importResumes(input, callback);
    }

    public int delete(Collection<String> candidateIds) {
        return ingestionService.delete(candidateIds);
    }

    public CandidatePool reload() {
        return ingestionService.reload();
    }

    public CandidatePool currentSnapshot() {
        return poolHolder.current();
    }

    public SearchOptions getOptions() {
        return options;
    }

    public ResultCache getResultCache() {
        return resultCache;
    }

    @Override
    public void close() {
        queryTranslator.close();
        resultCache.invalidateAll();
        log.info("service.closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SearchOptions options = SearchOptions.defaults();
        private NormalizationEngine normalizationEngine;
        private SkillSynonyms skillSynonyms;
        private Clock clock;
        private CandidateStore candidateStore;
        private CandidatePoolHolder poolHolder;
        private QueryOracle queryOracle;
        private MetricsService metricsService;
        private ResultCache resultCache;
        private boolean loadOnStart;

        public Builder options(SearchOptions options) {
            this.options = options;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        public Builder skillSynonyms(SkillSynonyms skillSynonyms) {
            this.skillSynonyms = skillSynonyms;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the candidate store. Combine with {@link #loadOnStart(boolean)} to publish its
         * contents as the first snapshot.
         */
        public Builder candidateStore(CandidateStore candidateStore) {
            this.candidateStore = candidateStore;
            return this;
        }

        public Builder poolHolder(CandidatePoolHolder poolHolder) {
            this.poolHolder = poolHolder;
            return this;
        }

        public Builder queryOracle(QueryOracle queryOracle) {
            this.queryOracle = queryOracle;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Overrides the cache selected by {@link SearchOptions#getCacheConfig()}.
         */
        public Builder resultCache(ResultCache resultCache) {
            this.resultCache = resultCache;
            return this;
        }

        public Builder loadOnStart(boolean loadOnStart) {
            this.loadOnStart = loadOnStart;
            return this;
        }

        public ResumeNetworkService build() {
            if (options == null) {
                throw new IllegalStateException("options is required");
            }
            return new ResumeNetworkService(this);
        }
    }
}
