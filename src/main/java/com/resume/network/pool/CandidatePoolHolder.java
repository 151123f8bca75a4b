package com.resume.network.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holds the active snapshot. Publishing is a single atomic reference swap; requests that
 * already captured a snapshot keep using it.
 */
public class CandidatePoolHolder {
    private static final Logger log = LoggerFactory.getLogger(CandidatePoolHolder.class);

    private final AtomicReference<CandidatePool> current;
    private final List<SnapshotListener> listeners = new CopyOnWriteArrayList<>();

    public CandidatePoolHolder() {
        this(CandidatePool.empty());
    }

    public CandidatePoolHolder(CandidatePool initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial pool is required"));
    }

    public CandidatePool current() {
        return current.get();
    }

    public void addListener(SnapshotListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    /**
     * Replaces the active snapshot.
     */
    public CandidatePool publish(CandidatePool next) {
        Objects.requireNonNull(next, "next pool is required");
        CandidatePool previous = current.getAndSet(next);
        log.info("pool.published version={} size={} previousVersion={}",
                next.version(), next.size(), previous.version());
        notifyListeners(next);
        return next;
    }

    /**
     * Derives and publishes the next snapshot from the active one. The update function may run
     * more than once under contention and must be side-effect free.
     */
    public CandidatePool update(UnaryOperator<CandidatePool> update) {
        CandidatePool next = current.updateAndGet(update);
        log.info("pool.published version={} size={}", next.version(), next.size());
        notifyListeners(next);
        return next;
    }

    private void notifyListeners(CandidatePool snapshot) {
        for (SnapshotListener listener : listeners) {
            try {
                listener.onSnapshotPublished(snapshot);
            } catch (RuntimeException e) {
                log.warn("pool.listener.failed listener={} version={} error={}",
                        listener.getClass().getSimpleName(), snapshot.version(), e.getMessage(), e);
            }
        }
    }
}
