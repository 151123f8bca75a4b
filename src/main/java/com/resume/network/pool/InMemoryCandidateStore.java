package com.resume.network.pool;

import com.resume.network.core.model.Candidate;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link CandidateStore}, for tests and single-process deployments.
 */
public class InMemoryCandidateStore implements CandidateStore {

    private final Map<String, Candidate> candidates = new ConcurrentHashMap<>();

    @Override
    public List<Candidate> loadAll() {
        return List.copyOf(candidates.values());
    }

    @Override
    public void saveAll(Collection<Candidate> toSave) {
        for (Candidate candidate : toSave) {
            candidates.put(candidate.getId(), candidate);
        }
    }

    @Override
    public int deleteAll(Collection<String> candidateIds) {
        int removed = 0;
        for (String id : candidateIds) {
            if (candidates.remove(id) != null) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return candidates.size();
    }
}
