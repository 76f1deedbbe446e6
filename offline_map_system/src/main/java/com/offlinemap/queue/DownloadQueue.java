package com.offlinemap.queue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * FIFO of region ids waiting to download, plus the single active download slot.
 *
 *   enqueue ──▶ [ r3 | r2 | r1 ] ──claimNext──▶ ( active: r0 ) ──release──▶ idle
 *
 * At most one region holds the slot. A region id is never queued twice. An id that is
 * active may wait once more in the queue, so a new request for it runs after the old one.
 */
public class DownloadQueue {

    private final Deque<String> pending = new ArrayDeque<>();
    private String active;

    // Stats
    private long enqueued = 0;
    private long started = 0;
    private long removed = 0;

    /** Returns false if the id is already pending. */
    public synchronized boolean enqueue(String regionId) {
        if (pending.contains(regionId)) {
            return false;
        }
        pending.addLast(regionId);
        enqueued++;
        return true;
    }

    /**
     * Takes the slot for the next pending region. Empty when a download is already
     * running or nothing is waiting.
     */
    public synchronized Optional<String> claimNext() {
        if (active != null || pending.isEmpty()) {
            return Optional.empty();
        }
        active = pending.pollFirst();
        started++;
        return Optional.of(active);
    }

    /** Frees the slot held by {@code regionId}. */
    public synchronized void release(String regionId) {
        if (regionId.equals(active)) {
            active = null;
        }
    }

    /** Drops a region that has not started yet. The active one is unaffected. */
    public synchronized boolean remove(String regionId) {
        boolean wasPending = pending.remove(regionId);
        if (wasPending) {
            removed++;
        }
        return wasPending;
    }

    /** Drops every pending region and returns their ids. */
    public synchronized List<String> clear() {
        List<String> dropped = new ArrayList<>(pending);
        removed += dropped.size();
        pending.clear();
        return dropped;
    }

    public synchronized boolean isDownloading() { return active != null; }
    public synchronized Optional<String> getActiveRegionId() { return Optional.ofNullable(active); }
    public synchronized List<String> getPendingRegionIds() { return new ArrayList<>(pending); }
    public synchronized int size() { return pending.size(); }

    public synchronized String getStats() {
        return String.format("DownloadQueue: enqueued=%d, started=%d, removed=%d, pending=%d, active=%s",
                enqueued, started, removed, pending.size(), active == null ? "-" : active);
    }
}
