package com.resume.network.pool;

import com.resume.network.core.model.Candidate;

import java.util.Collection;
import java.util.List;

/**
 * Persistence boundary for normalized candidates. The search core only needs to load the full
 * pool; the query language of the underlying store is not assumed.
 */
public interface CandidateStore {

    /**
     * Loads every stored candidate.
     */
    List<Candidate> loadAll();

    /**
     * Stores candidates, replacing any existing record with the same id.
     */
    void saveAll(Collection<Candidate> candidates);

    /**
     * Deletes candidates by id. Unknown ids are ignored.
     *
     * @return the number of candidates actually removed
     */
    int deleteAll(Collection<String> candidateIds);
}
