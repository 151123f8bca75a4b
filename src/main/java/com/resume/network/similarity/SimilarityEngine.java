package com.resume.network.similarity;

import com.resume.network.core.model.Candidate;
import com.resume.network.pool.CandidatePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ranks the candidates of a pool by similarity to a reference candidate.
 *
 * <p>Stateless apart from its configuration: a result depends only on the reference, the pool
 * snapshot and the arguments, so calls are safe to run concurrently and to cache by
 * (reference id, pool version). Pools at or above {@code parallelThreshold} are scored with a
 * parallel stream; the final sort makes the output identical either way.</p>
 */
public class SimilarityEngine {
    private static final Logger log = LoggerFactory.getLogger(SimilarityEngine.class);

    public static final int DEFAULT_LIMIT = 20;
    public static final int DEFAULT_PARALLEL_THRESHOLD = 2_000;

    static final Comparator<SimilarityMatch> RANKING = Comparator
            .comparingDouble(SimilarityMatch::score).reversed()
            .thenComparing(Comparator.comparingInt(SimilarityMatch::skillOverlap).reversed())
            .thenComparing(SimilarityMatch::candidateId);

    private final CandidateSimilarityScorer scorer;
    private final int defaultLimit;
    private final int parallelThreshold;

    public SimilarityEngine() {
        this(new CandidateSimilarityScorer(), DEFAULT_LIMIT, DEFAULT_PARALLEL_THRESHOLD);
    }

    public SimilarityEngine(CandidateSimilarityScorer scorer, int defaultLimit, int parallelThreshold) {
        if (defaultLimit < 1) {
            throw new IllegalArgumentException("defaultLimit must be >= 1");
        }
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.defaultLimit = defaultLimit;
        this.parallelThreshold = parallelThreshold;
    }

    public SimilarityResult findSimilar(String referenceId, CandidatePool pool, int limit) {
        return findSimilar(referenceId, pool, limit, 0.0);
    }

    /**
     * Finds the candidates most similar to the pool member {@code referenceId}.
     *
     * @param limit    maximum number of matches; {@code <= 0} selects the default limit
     * @param minScore matches scoring below this threshold are dropped
     */
    public SimilarityResult findSimilar(String referenceId, CandidatePool pool, int limit, double minScore) {
        Objects.requireNonNull(referenceId, "referenceId is required");
        Objects.requireNonNull(pool, "pool is required");
        return pool.get(referenceId)
                .map(reference -> findSimilar(reference, pool, limit, minScore))
                .orElseGet(() -> {
                    log.debug("similarity.reference.notFound reference={} poolVersion={}", referenceId, pool.version());
                    return SimilarityResult.notFound(referenceId, pool.version());
                });
    }

    /**
     * Scores every pool member other than {@code reference}. The reference does not need to be
     * a pool member.
     */
    public SimilarityResult findSimilar(Candidate reference, CandidatePool pool, int limit, double minScore) {
        Objects.requireNonNull(reference, "reference is required");
        Objects.requireNonNull(pool, "pool is required");
        if (minScore < 0.0 || minScore > 1.0) {
            throw new IllegalArgumentException("minScore must be between 0.0 and 1.0");
        }
        int effectiveLimit = limit <= 0 ? defaultLimit : limit;

        List<Candidate> candidates = pool.candidates();
        Stream<Candidate> stream = candidates.size() >= parallelThreshold
                ? candidates.parallelStream()
                : candidates.stream();

        List<SimilarityMatch> matches = stream
                .filter(other -> !other.getId().equals(reference.getId()))
                .map(other -> {
                    SimilarityBreakdown breakdown = scorer.computeWithBreakdown(reference, other);
                    return new SimilarityMatch(other.getId(), other.getName(), breakdown.compositeScore(), breakdown);
                })
                .filter(match -> match.score() >= minScore)
                .sorted(RANKING)
                .limit(effectiveLimit)
                .collect(Collectors.toList());

        log.debug("similarity.completed reference={} poolVersion={} poolSize={} matches={}",
                reference.getId(), pool.version(), pool.size(), matches.size());
        return new SimilarityResult(reference.getId(), true, pool.version(), matches);
    }

    public CandidateSimilarityScorer getScorer() {
        return scorer;
    }
}
