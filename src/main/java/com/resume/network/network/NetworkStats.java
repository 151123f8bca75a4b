package com.resume.network.network;

/**
 * Summary statistics of a colleague network.
 *
 * @param nodeCount            candidates in the network
 * @param edgeCount            distinct colleague pairs
 * @param relationshipCount    colleague edges, counting one per shared organization stint
 * @param averageDegree        mean number of distinct colleagues per candidate
 * @param componentCount       connected components, isolated candidates included
 * @param isolatedCount        candidates without any colleague
 * @param largestComponentSize size of the biggest cluster
 */
public record NetworkStats(
        int nodeCount,
        long edgeCount,
        long relationshipCount,
        double averageDegree,
        int componentCount,
        int isolatedCount,
        int largestComponentSize
) {
    public static NetworkStats empty() {
        return new NetworkStats(0, 0, 0, 0.0, 0, 0, 0);
    }
}
