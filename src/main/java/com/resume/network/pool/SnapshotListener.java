package com.resume.network.pool;

/**
 * Listener notified after a new pool snapshot is published.
 */
@FunctionalInterface
public interface SnapshotListener {

    /**
     * Called after a snapshot is published.
     *
     * @param snapshot the snapshot that is now active
     */
    void onSnapshotPublished(CandidatePool snapshot);
}
