package com.resume.network.network;

import com.resume.network.core.model.ColleagueEdge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable undirected colleague network over one pool snapshot.
 *
 * <p>Each candidate maps to its {@link Neighbor} entries sorted by neighbor id. Every edge is
 * listed under both of its ends; this symmetry is verified at construction.</p>
 */
public final class NetworkGraph {

    private final long snapshotVersion;
    private final Map<String, List<Neighbor>> adjacency;
    private final List<ColleagueEdge> edges;

    /**
     * One adjacency entry: the colleague on the other end and the edge that links them.
     */
    public record Neighbor(String candidateId, ColleagueEdge edge) {
    }

    private NetworkGraph(long snapshotVersion, Map<String, List<Neighbor>> adjacency, List<ColleagueEdge> edges) {
        this.snapshotVersion = snapshotVersion;
        this.adjacency = adjacency;
        this.edges = edges;
    }

    /**
     * Builds a graph over {@code nodeIds}. Every edge must connect two of the given nodes.
     *
     * @throws IllegalArgumentException         if an edge references an unknown node
     * @throws InternalInconsistencyException if the resulting adjacency is not symmetric
     */
    public static NetworkGraph of(long snapshotVersion, Collection<String> nodeIds, List<ColleagueEdge> edges) {
        Map<String, List<Neighbor>> adjacency = new TreeMap<>();
        for (String nodeId : nodeIds) {
            adjacency.put(nodeId, new ArrayList<>());
        }
        for (ColleagueEdge edge : edges) {
            List<Neighbor> fromA = adjacency.get(edge.candidateA());
            List<Neighbor> fromB = adjacency.get(edge.candidateB());
            if (fromA == null || fromB == null) {
                throw new IllegalArgumentException("Edge references a candidate outside the graph: " + edge);
            }
            fromA.add(new Neighbor(edge.candidateB(), edge));
            fromB.add(new Neighbor(edge.candidateA(), edge));
        }

        Comparator<Neighbor> byNeighbor = Comparator.comparing(Neighbor::candidateId);
        Map<String, List<Neighbor>> frozen = new TreeMap<>();
        adjacency.forEach((id, neighbors) -> {
            neighbors.sort(byNeighbor.thenComparing(Neighbor::edge, ColleagueEdgeBuilder.EDGE_ORDER));
            frozen.put(id, List.copyOf(neighbors));
        });
        verifySymmetry(frozen);
        return new NetworkGraph(snapshotVersion, Collections.unmodifiableMap(frozen), List.copyOf(edges));
    }

    /**
     * Checks that each entry {@code A -> (B, e)} has a mirror entry {@code B -> (A, e)}.
     */
    static void verifySymmetry(Map<String, List<Neighbor>> adjacency) {
        for (Map.Entry<String, List<Neighbor>> entry : adjacency.entrySet()) {
            String nodeId = entry.getKey();
            for (Neighbor neighbor : entry.getValue()) {
                List<Neighbor> reverse = adjacency.get(neighbor.candidateId());
                if (reverse == null || !reverse.contains(new Neighbor(nodeId, neighbor.edge()))) {
                    throw new InternalInconsistencyException(
                            "Colleague edge " + nodeId + " -> " + neighbor.candidateId()
                                    + " has no reverse entry: " + neighbor.edge());
                }
            }
        }
    }

    public long snapshotVersion() {
        return snapshotVersion;
    }

    public boolean contains(String candidateId) {
        return adjacency.containsKey(candidateId);
    }

    public int nodeCount() {
        return adjacency.size();
    }

    public Set<String> nodes() {
        return adjacency.keySet();
    }

    public List<ColleagueEdge> edges() {
        return edges;
    }

    /**
     * Adjacency entries of a candidate, sorted by neighbor id; empty for unknown candidates.
     */
    public List<Neighbor> neighbors(String candidateId) {
        return adjacency.getOrDefault(candidateId, List.of());
    }

    /**
     * Distinct colleague ids of a candidate, sorted.
     */
    public SortedSet<String> colleagueIds(String candidateId) {
        SortedSet<String> ids = new TreeSet<>();
        for (Neighbor neighbor : neighbors(candidateId)) {
            ids.add(neighbor.candidateId());
        }
        return ids;
    }

    public List<ColleagueEdge> edgesBetween(String first, String second) {
        List<ColleagueEdge> between = new ArrayList<>();
        for (Neighbor neighbor : neighbors(first)) {
            if (neighbor.candidateId().equals(second)) {
                between.add(neighbor.edge());
            }
        }
        return between;
    }

    public int degree(String candidateId) {
        return colleagueIds(candidateId).size();
    }

    /**
     * Unweighted shortest path by breadth-first search. Neighbors are visited in id order, so
     * among equally short paths the lexicographically smallest is returned.
     */
    public PathResult shortestPath(String fromId, String toId) {
        if (!contains(fromId) || !contains(toId)) {
            return PathResult.unknownCandidate(fromId, toId);
        }
        if (fromId.equals(toId)) {
            return PathResult.found(fromId, toId, List.of(fromId), List.of());
        }

        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        parent.put(fromId, null);
        queue.add(fromId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : colleagueIds(current)) {
                if (parent.containsKey(next)) {
                    continue;
                }
                parent.put(next, current);
                if (next.equals(toId)) {
                    return reconstruct(fromId, toId, parent);
                }
                queue.add(next);
            }
        }
        return PathResult.unreachable(fromId, toId);
    }

    private PathResult reconstruct(String fromId, String toId, Map<String, String> parent) {
        List<String> path = new ArrayList<>();
        for (String at = toId; at != null; at = parent.get(at)) {
            path.add(at);
        }
        Collections.reverse(path);
        List<ColleagueEdge> hops = new ArrayList<>();
        for (int i = 0; i + 1 < path.size(); i++) {
            List<ColleagueEdge> between = edgesBetween(path.get(i), path.get(i + 1));
            if (between.isEmpty()) {
                throw new InternalInconsistencyException(
                        "Path step " + path.get(i) + " -> " + path.get(i + 1) + " has no edge");
            }
            hops.add(between.get(0));
        }
        return PathResult.found(fromId, toId, path, hops);
    }

    /**
     * All candidates reachable from {@code candidateId}, itself included; empty for unknown
     * candidates.
     */
    public SortedSet<String> connectedComponent(String candidateId) {
        if (!contains(candidateId)) {
            return Collections.emptySortedSet();
        }
        SortedSet<String> component = new TreeSet<>();
        Deque<String> queue = new ArrayDeque<>();
        component.add(candidateId);
        queue.add(candidateId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Neighbor neighbor : neighbors(current)) {
                if (component.add(neighbor.candidateId())) {
                    queue.add(neighbor.candidateId());
                }
            }
        }
        return Collections.unmodifiableSortedSet(component);
    }

    /**
     * All connected components, largest first, ties by smallest member id.
     */
    public List<SortedSet<String>> components() {
        List<SortedSet<String>> components = new ArrayList<>();
        Set<String> seen = new TreeSet<>();
        for (String nodeId : adjacency.keySet()) {
            if (seen.contains(nodeId)) {
                continue;
            }
            SortedSet<String> component = connectedComponent(nodeId);
            seen.addAll(component);
            components.add(component);
        }
        components.sort(Comparator.<SortedSet<String>>comparingInt(Set::size).reversed()
                .thenComparing(SortedSet::first));
        return components;
    }

    /**
     * The {@code limit} candidates with the most distinct colleagues, ties by id. Isolated
     * candidates are never reported.
     */
    public List<Connector> topConnectors(int limit) {
        List<Connector> connectors = new ArrayList<>();
        for (String nodeId : adjacency.keySet()) {
            int degree = degree(nodeId);
            if (degree > 0) {
                connectors.add(new Connector(nodeId, degree));
            }
        }
        connectors.sort(Comparator.comparingInt(Connector::degree).reversed()
                .thenComparing(Connector::candidateId));
        return limit > 0 && connectors.size() > limit ? List.copyOf(connectors.subList(0, limit)) : connectors;
    }

    public NetworkStats stats() {
        if (adjacency.isEmpty()) {
            return NetworkStats.empty();
        }
        long degreeSum = 0;
        int isolated = 0;
        for (String nodeId : adjacency.keySet()) {
            int degree = degree(nodeId);
            degreeSum += degree;
            if (degree == 0) {
                isolated++;
            }
        }
        List<SortedSet<String>> components = components();
        return new NetworkStats(
                adjacency.size(),
                degreeSum / 2,
                edges.size(),
                (double) degreeSum / adjacency.size(),
                components.size(),
                isolated,
                components.get(0).size());
    }

    @Override
    public String toString() {
        return "NetworkGraph{version=" + snapshotVersion + ", nodes=" + adjacency.size() + ", edges=" + edges.size() + "}";
    }
}
