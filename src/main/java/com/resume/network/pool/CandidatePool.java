package com.resume.network.pool;

import com.resume.network.core.model.Candidate;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable, versioned snapshot of the full candidate pool.
 *
 * <p>Every search operation takes a snapshot as an explicit argument and never observes a
 * partial update: ingestion builds a new snapshot with {@link #withCandidates(Collection)} or
 * {@link #without(Collection)} and publishes it through {@link CandidatePoolHolder}.
 * Candidates iterate in ascending id order.</p>
 */
public final class CandidatePool {

    private final long version;
    private final Instant createdAt;
    private final SortedMap<String, Candidate> candidates;
    private final List<Candidate> ordered;

    private CandidatePool(long version, Instant createdAt, SortedMap<String, Candidate> candidates) {
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0");
        }
        this.version = version;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.candidates = Collections.unmodifiableSortedMap(candidates);
        this.ordered = List.copyOf(candidates.values());
    }

    public static CandidatePool empty() {
        return new CandidatePool(0, Instant.now(), new TreeMap<>());
    }

    /**
     * Creates a snapshot at the given version. Later candidates with a duplicate id win.
     */
    public static CandidatePool of(long version, Collection<Candidate> candidates) {
        SortedMap<String, Candidate> map = new TreeMap<>();
        for (Candidate candidate : candidates) {
            map.put(candidate.getId(), candidate);
        }
        return new CandidatePool(version, Instant.now(), map);
    }

    /**
     * Returns the next snapshot with the given candidates added or replaced wholesale.
     */
    public CandidatePool withCandidates(Collection<Candidate> replacements) {
        SortedMap<String, Candidate> next = new TreeMap<>(candidates);
        for (Candidate candidate : replacements) {
            next.put(candidate.getId(), candidate);
        }
        return new CandidatePool(version + 1, Instant.now(), next);
    }

    /**
     * Returns the next snapshot without the given candidate ids.
     */
    public CandidatePool without(Collection<String> candidateIds) {
        SortedMap<String, Candidate> next = new TreeMap<>(candidates);
        candidateIds.forEach(next::remove);
        return new CandidatePool(version + 1, Instant.now(), next);
    }

    public long version() {
        return version;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Optional<Candidate> get(String candidateId) {
        return candidateId == null ? Optional.empty() : Optional.ofNullable(candidates.get(candidateId));
    }

    public boolean contains(String candidateId) {
        return candidateId != null && candidates.containsKey(candidateId);
    }

    /**
     * All candidates in ascending id order.
     */
    public List<Candidate> candidates() {
        return ordered;
    }

    public Map<String, Candidate> asMap() {
        return candidates;
    }

    public int size() {
        return ordered.size();
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }

    @Override
    public String toString() {
        return "CandidatePool{version=" + version + ", size=" + ordered.size() + '}';
    }
}
