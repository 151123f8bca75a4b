package com.resume.network.ingestion;

import com.resume.network.core.model.Candidate;
import com.resume.network.ingestion.IngestionResult.IngestionError;
import com.resume.network.logging.LogContext;
import com.resume.network.metrics.MetricsService;
import com.resume.network.metrics.NoOpMetricsService;
import com.resume.network.pool.CandidatePool;
import com.resume.network.pool.CandidatePoolHolder;
import com.resume.network.pool.CandidateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Ingestion pipeline: normalizes raw resumes, persists the accepted candidates and publishes
 * a new pool snapshot.
 *
 * <p>Failures are isolated per resume: a resume that cannot be normalized is reported in the
 * {@link IngestionResult} and the rest of the batch proceeds. Each batch publishes at most one
 * new snapshot; re-ingested candidates replace their previous version wholesale.</p>
 */
public class ResumeIngestionService {
    private static final Logger log = LoggerFactory.getLogger(ResumeIngestionService.class);

    private static final int PROGRESS_INTERVAL = 100;

    private final ResumeNormalizer normalizer;
    private final CandidateStore store;
    private final CandidatePoolHolder poolHolder;
    private final MetricsService metricsService;

    public ResumeIngestionService(ResumeNormalizer normalizer, CandidateStore store, CandidatePoolHolder poolHolder) {
        this(normalizer, store, poolHolder, new NoOpMetricsService());
    }

    public ResumeIngestionService(ResumeNormalizer normalizer, CandidateStore store, CandidatePoolHolder poolHolder,
                                  MetricsService metricsService) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.poolHolder = Objects.requireNonNull(poolHolder, "poolHolder is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    public IngestionResult ingest(Collection<RawResume> batch) {
        return ingest(batch, ProgressCallback.NOOP);
    }

    /**
     * Normalizes and publishes a batch of resumes.
     */
    public IngestionResult ingest(Collection<RawResume> batch, ProgressCallback callback) {
        Objects.requireNonNull(batch, "batch is required");
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        if (batch.isEmpty()) {
            return IngestionResult.empty(poolHolder.current().version());
        }

        try (LogContext ctx = LogContext.forIngestion(LogContext.generateCorrelationId())) {
            List<Candidate> accepted = new ArrayList<>();
            List<IngestionError> errors = new ArrayList<>();
            long recordNumber = 0;
            for (RawResume raw : batch) {
                recordNumber++;
                String label = raw != null ? raw.label() : "record-" + recordNumber;
                try {
                    if (raw == null) {
                        throw new NormalizationException(label, "Resume is null");
                    }
                    accepted.add(normalizer.normalize(raw));
                } catch (NormalizationException e) {
                    errors.add(new IngestionError(recordNumber, label, e.getMessage()));
                    log.warn("ingest.rejected record={} resume={} error={}", recordNumber, label, e.getMessage());
                } catch (RuntimeException e) {
                    errors.add(new IngestionError(recordNumber, label, "Unexpected error: " + e.getMessage()));
                    log.error("ingest.failed record={} resume={} error={}", recordNumber, label, e.getMessage(), e);
                }
                if (recordNumber % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(recordNumber, batch.size(), "Normalized " + recordNumber + " resumes");
                }
            }

            long version = poolHolder.current().version();
            if (!accepted.isEmpty()) {
                store.saveAll(accepted);
                version = poolHolder.update(pool -> pool.withCandidates(accepted)).version();
            }

            metricsService.incrementCandidatesIngested(accepted.size());
            if (!errors.isEmpty()) {
                metricsService.incrementNormalizationFailures(errors.size());
            }

            List<String> acceptedIds = new ArrayList<>(accepted.size());
            accepted.forEach(candidate -> acceptedIds.add(candidate.getId()));
            IngestionResult result = new IngestionResult(batch.size(), acceptedIds, errors, version);
            cb.onProgress(batch.size(), batch.size(), "Ingestion completed");
            log.info("ingest.completed result={}", result);
            return result;
        }
    }

    /**
     * Removes candidates deleted upstream and publishes a new snapshot.
     *
     * @return number of candidates removed from the store
     */
    public int delete(Collection<String> candidateIds) {
        Objects.requireNonNull(candidateIds, "candidateIds is required");
        if (candidateIds.isEmpty()) {
            return 0;
        }
        int removed = store.deleteAll(candidateIds);
        CandidatePool pool = poolHolder.update(current -> current.without(candidateIds));
        log.info("ingest.deleted requested={} removed={} version={}", candidateIds.size(), removed, pool.version());
        return removed;
    }

    /**
     * Rebuilds the pool from the store, e.g. at startup.
     */
    public CandidatePool reload() {
        List<Candidate> stored = store.loadAll();
        CandidatePool pool = poolHolder.update(current -> CandidatePool.of(current.version() + 1, stored));
        log.info("pool.reloaded candidates={} version={}", pool.size(), pool.version());
        return pool;
    }

    public CandidatePoolHolder getPoolHolder() {
        return poolHolder;
    }
}
