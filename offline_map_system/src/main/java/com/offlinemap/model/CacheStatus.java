package com.offlinemap.model;

import java.util.Optional;

/**
 * Aggregate view over the snapshot catalog.
 */
public class CacheStatus {
    private final long totalSize;
    private final int itemCount;
    private final Long lastUpdated;

    public CacheStatus(long totalSize, int itemCount, Long lastUpdated) {
        this.totalSize = totalSize;
        this.itemCount = itemCount;
        this.lastUpdated = lastUpdated;
    }

    public static CacheStatus empty() {
        return new CacheStatus(0, 0, null);
    }

    public long getTotalSize() { return totalSize; }
    public int getItemCount() { return itemCount; }
    public Optional<Long> getLastUpdated() { return Optional.ofNullable(lastUpdated); }

    @Override
    public String toString() {
        return String.format("CacheStatus[items=%d, size=%d, lastUpdated=%s]", itemCount, totalSize, lastUpdated);
    }
}
