package com.resume.network.llm;

import com.resume.network.logging.LogContext;
import com.resume.network.metrics.MetricsService;
import com.resume.network.metrics.NoOpMetricsService;
import com.resume.network.pool.CandidatePool;
import com.resume.network.query.QueryValidationException;
import com.resume.network.query.StructuredQuery;
import com.resume.network.rules.DefaultNormalizationRules;
import com.resume.network.rules.NormalizationEngine;
import com.resume.network.rules.SkillSynonyms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Translates free-form search requests into {@link StructuredQuery}s.
 *
 * <p>The {@link QueryOracle} is consulted first, on a bounded executor, and its answer must
 * arrive within the configured timeout and pass {@link OracleResponseValidator}. On timeout,
 * oracle failure or an invalid answer the {@link KeywordQueryTranslator} produces the query
 * instead. Translation never executes the query.</p>
 */
public class QueryTranslator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueryTranslator.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_CONCURRENT_CALLS = 4;
    public static final int MAX_TEXT_LENGTH = 2_000;

    static final String REASON_TIMEOUT = "timeout";
    static final String REASON_UNAVAILABLE = "oracle_unavailable";
    static final String REASON_ERROR = "oracle_error";
    static final String REASON_INVALID = "invalid_response";
    static final String REASON_BUSY = "oracle_busy";

    private final QueryOracle oracle;
    private final OracleResponseValidator validator;
    private final KeywordQueryTranslator fallback;
    private final NormalizationEngine normalizationEngine;
    private final SkillSynonyms skillSynonyms;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Duration timeout;
    private final ExecutorService executor;
    private final AtomicReference<QueryVocabulary> vocabulary = new AtomicReference<>();

    private QueryTranslator(Builder builder) {
        this.oracle = builder.oracle != null ? builder.oracle : new NoOpQueryOracle();
        this.normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine
                : DefaultNormalizationRules.createDefaultEngine();
        this.validator = builder.validator != null
                ? builder.validator
                : new OracleResponseValidator(normalizationEngine);
        this.fallback = builder.fallback != null ? builder.fallback : new KeywordQueryTranslator();
        this.skillSynonyms = builder.skillSynonyms != null ? builder.skillSynonyms : SkillSynonyms.defaults();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (builder.maxConcurrentCalls < 1) {
            throw new IllegalArgumentException("maxConcurrentCalls must be >= 1");
        }
        // Bounded queue: excess calls are rejected and take the fallback.
        this.executor = new ThreadPoolExecutor(builder.maxConcurrentCalls, builder.maxConcurrentCalls,
                0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(builder.maxConcurrentCalls * 4),
                new OracleThreadFactory());
    }

    /**
     * Translates {@code text} against the vocabulary of {@code pool}.
     *
     * @throws QueryValidationException if the text is blank or too long
     */
    public TranslatedQuery translate(String text, CandidatePool pool) {
        if (text == null || text.isBlank()) {
            throw new QueryValidationException("text", "search text must not be blank");
        }
        if (text.length() > MAX_TEXT_LENGTH) {
            throw new QueryValidationException("text", "search text exceeds " + MAX_TEXT_LENGTH + " characters");
        }
        Objects.requireNonNull(pool, "pool is required");
        QueryVocabulary vocab = vocabularyFor(pool);

        try (LogContext ctx = LogContext.forTranslation(LogContext.generateCorrelationId(), oracle.getOracleName())) {
            String reason;
            Throwable failure = null;
            try {
                StructuredQuery query = askOracle(text, vocab);
                log.info("translation.completed provenance=ORACLE query={}", query);
                return TranslatedQuery.fromOracle(query, oracle.getOracleName());
            } catch (TimeoutException e) {
                reason = REASON_TIMEOUT;
            } catch (OracleUnavailableException e) {
                reason = REASON_UNAVAILABLE;
                failure = e;
            } catch (InvalidOracleResponseException e) {
                reason = REASON_INVALID;
                failure = e;
            } catch (RejectedExecutionException e) {
                reason = REASON_BUSY;
                failure = e;
            } catch (RuntimeException e) {
                reason = REASON_ERROR;
                failure = e;
            }

            metricsService.incrementOracleFallback(reason);
            log.info("translation.fallback reason={} detail={}", reason, failure != null ? failure.getMessage() : timeout);
            StructuredQuery query = fallback.translate(text, vocab);
            return TranslatedQuery.fallback(query, reason, oracle.getOracleName());
        }
    }

    private StructuredQuery askOracle(String text, QueryVocabulary vocab) throws TimeoutException {
        OracleRequest request = new OracleRequest(text, new ArrayList<>(vocab.organizationNames()),
                new ArrayList<>(vocab.skills()), LocalDate.now(clock));
        // The availability check runs inside the task so the timeout covers it.
        Future<OracleResponse> future = executor.submit(() -> {
            if (!oracle.isAvailable()) {
                throw new OracleUnavailableException(oracle.getOracleName() + " is not available");
            }
            return oracle.translate(request);
        });
        OracleResponse response;
        try {
            response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OracleUnavailableException("Interrupted while waiting for the oracle", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new OracleUnavailableException("Oracle failed: " + cause, cause);
        }
        if (response == null) {
            throw new InvalidOracleResponseException("Oracle returned no response");
        }
        return validator.validate(response);
    }

    /**
     * Vocabulary of the given snapshot, rebuilt only when the snapshot version changes.
     */
    QueryVocabulary vocabularyFor(CandidatePool pool) {
        QueryVocabulary current = vocabulary.get();
        if (current != null && current.snapshotVersion() == pool.version()) {
            return current;
        }
        QueryVocabulary rebuilt = QueryVocabulary.from(pool, normalizationEngine, skillSynonyms);
        vocabulary.set(rebuilt);
        return rebuilt;
    }

    public QueryOracle getOracle() {
        return oracle;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private QueryOracle oracle;
        private OracleResponseValidator validator;
        private KeywordQueryTranslator fallback;
        private NormalizationEngine normalizationEngine;
        private SkillSynonyms skillSynonyms;
        private MetricsService metricsService;
        private Clock clock;
        private Duration timeout;
        private int maxConcurrentCalls = DEFAULT_MAX_CONCURRENT_CALLS;

        public Builder oracle(QueryOracle oracle) {
            this.oracle = oracle;
            return this;
        }

        public Builder validator(OracleResponseValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder fallback(KeywordQueryTranslator fallback) {
            this.fallback = fallback;
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

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxConcurrentCalls(int maxConcurrentCalls) {
            this.maxConcurrentCalls = maxConcurrentCalls;
            return this;
        }

        public QueryTranslator build() {
            return new QueryTranslator(this);
        }
    }

    private static final class OracleThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "query-oracle-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
