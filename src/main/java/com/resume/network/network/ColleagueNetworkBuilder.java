package com.resume.network.network;

import com.resume.network.core.model.Candidate;
import com.resume.network.core.model.ColleagueEdge;
import com.resume.network.pool.CandidatePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds {@link NetworkGraph}s from pool snapshots, for the whole pool or for a subset of it.
 */
public class ColleagueNetworkBuilder {
    private static final Logger log = LoggerFactory.getLogger(ColleagueNetworkBuilder.class);

    private final ColleagueEdgeBuilder edgeBuilder;

    public ColleagueNetworkBuilder() {
        this(new ColleagueEdgeBuilder());
    }

    public ColleagueNetworkBuilder(ColleagueEdgeBuilder edgeBuilder) {
        this.edgeBuilder = Objects.requireNonNull(edgeBuilder, "edgeBuilder is required");
    }

    public NetworkGraph buildGraph(CandidatePool pool) {
        Objects.requireNonNull(pool, "pool is required");
        List<Candidate> candidates = pool.candidates();
        return build(pool.version(), candidates);
    }

    /**
     * Builds the network restricted to {@code candidateIds}. Ids that are not in the pool are
     * ignored.
     */
    public NetworkGraph buildGraph(CandidatePool pool, Collection<String> candidateIds) {
        Objects.requireNonNull(pool, "pool is required");
        Objects.requireNonNull(candidateIds, "candidateIds is required");
        Set<String> wanted = new LinkedHashSet<>(candidateIds);
        List<Candidate> subset = new ArrayList<>();
        for (String id : wanted) {
            pool.get(id).ifPresent(subset::add);
        }
        return build(pool.version(), subset);
    }

    private NetworkGraph build(long version, List<Candidate> candidates) {
        List<ColleagueEdge> edges = edgeBuilder.buildEdges(candidates);
        List<String> ids = new ArrayList<>(candidates.size());
        candidates.forEach(c -> ids.add(c.getId()));
        NetworkGraph graph = NetworkGraph.of(version, ids, edges);
        log.info("network.built version={} nodes={} edges={}", version, graph.nodeCount(), edges.size());
        return graph;
    }

    public ColleagueEdgeBuilder getEdgeBuilder() {
        return edgeBuilder;
    }
}
