package com.resume.network.api;

import com.resume.network.network.Connector;
import com.resume.network.network.NetworkStats;

import java.util.List;

/**
 * Network statistics of one snapshot, with its best-connected candidates.
 */
public record NetworkSummary(long snapshotVersion, int poolSize, NetworkStats stats, List<Connector> topConnectors) {

    public NetworkSummary {
        topConnectors = topConnectors != null ? List.copyOf(topConnectors) : List.of();
    }

    public long edgeCount() {
        return stats.edgeCount();
    }

    public double averageDegree() {
        return stats.averageDegree();
    }
}
