package com.resume.network.network;

/**
 * A candidate ranked by the number of distinct colleagues.
 */
public record Connector(String candidateId, int degree) {
}
