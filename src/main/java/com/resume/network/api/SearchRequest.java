package com.resume.network.api;

import com.resume.network.core.model.SearchOperation;
import com.resume.network.network.PathResult;
import com.resume.network.pool.CandidatePool;
import com.resume.network.query.QueryPage;
import com.resume.network.query.QueryValidationException;
import com.resume.network.query.StructuredQuery;
import com.resume.network.similarity.SimilarityResult;

/**
 * The closed set of operations the service answers. Each request type fixes its result type;
 * {@link ResumeNetworkService#handle(SearchRequest)} runs any of them against one snapshot.
 *
 * <p>Requests are values: equal requests against the same snapshot version give equal results,
 * which is what makes them usable as cache keys.</p>
 *
 * @param <R> the result type
 */
public sealed interface SearchRequest<R> permits SearchRequest.SimilarCandidates, SearchRequest.StructuredSearch,
        SearchRequest.NaturalLanguageSearch, SearchRequest.Colleagues, SearchRequest.ShortestPath,
        SearchRequest.NetworkStatistics {

    SearchOperation operation();

    Class<R> resultType();

    /**
     * Whether results may be served from the result cache.
     */
    default boolean cacheable() {
        return true;
    }

    /**
     * Runs the request against {@code snapshot}.
     *
     * @throws QueryValidationException if the request is malformed
     */
    R execute(ResumeNetworkService service, CandidatePool snapshot);

    /**
     * Candidates most similar to a reference candidate.
     *
     * @param referenceId the reference candidate
     * @param limit       maximum matches; {@code <= 0} selects the configured default
     */
    record SimilarCandidates(String referenceId, int limit) implements SearchRequest<SimilarityResult> {

        public static SimilarCandidates of(String referenceId) {
            return new SimilarCandidates(referenceId, 0);
        }

        @Override
        public SearchOperation operation() {
            return SearchOperation.SIMILAR_CANDIDATES;
        }

        @Override
        public Class<SimilarityResult> resultType() {
            return SimilarityResult.class;
        }

        @Override
        public SimilarityResult execute(ResumeNetworkService service, CandidatePool snapshot) {
            requireText("referenceId", referenceId);
            return service.findSimilar(snapshot, referenceId, limit);
        }
    }

    /**
     * One page of a structured query.
     */
    record StructuredSearch(StructuredQuery query, int page, int pageSize) implements SearchRequest<QueryPage> {

        @Override
        public SearchOperation operation() {
            return SearchOperation.STRUCTURED_SEARCH;
        }

        @Override
        public Class<QueryPage> resultType() {
            return QueryPage.class;
        }

        @Override
        public QueryPage execute(ResumeNetworkService service, CandidatePool snapshot) {
            return service.search(snapshot, query, page, pageSize);
        }
    }

    /**
     * Free-form search: translated to a structured query, then executed.
     */
    record NaturalLanguageSearch(String text, int page, int pageSize)
            implements SearchRequest<NaturalLanguageSearchResult> {

        @Override
        public SearchOperation operation() {
            return SearchOperation.NATURAL_LANGUAGE_SEARCH;
        }

        @Override
        public Class<NaturalLanguageSearchResult> resultType() {
            return NaturalLanguageSearchResult.class;
        }

        @Override
        public boolean cacheable() {
            return false;
        }

        @Override
        public NaturalLanguageSearchResult execute(ResumeNetworkService service, CandidatePool snapshot) {
            return service.searchNaturalLanguage(snapshot, text, page, pageSize);
        }
    }

    /**
     * Colleagues and connected component of one candidate.
     */
    record Colleagues(String candidateId) implements SearchRequest<ColleagueLookup> {

        @Override
        public SearchOperation operation() {
            return SearchOperation.COLLEAGUE_LOOKUP;
        }

        @Override
        public Class<ColleagueLookup> resultType() {
            return ColleagueLookup.class;
        }

        @Override
        public ColleagueLookup execute(ResumeNetworkService service, CandidatePool snapshot) {
            requireText("candidateId", candidateId);
            return service.colleagues(snapshot, candidateId);
        }
    }

    /**
     * Shortest chain of colleagues between two candidates.
     */
    record ShortestPath(String fromId, String toId) implements SearchRequest<PathResult> {

        @Override
        public SearchOperation operation() {
            return SearchOperation.SHORTEST_PATH;
        }

        @Override
        public Class<PathResult> resultType() {
            return PathResult.class;
        }

        @Override
        public PathResult execute(ResumeNetworkService service, CandidatePool snapshot) {
            requireText("fromId", fromId);
            requireText("toId", toId);
            return service.shortestPath(snapshot, fromId, toId);
        }
    }

    /**
     * Pool size, edge count, average degree and related statistics.
     */
    record NetworkStatistics() implements SearchRequest<NetworkSummary> {

        @Override
        public SearchOperation operation() {
            return SearchOperation.NETWORK_STATISTICS;
        }

        @Override
        public Class<NetworkSummary> resultType() {
            return NetworkSummary.class;
        }

        @Override
        public NetworkSummary execute(ResumeNetworkService service, CandidatePool snapshot) {
            return service.networkSummary(snapshot);
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new QueryValidationException(field, field + " is required");
        }
    }
}
