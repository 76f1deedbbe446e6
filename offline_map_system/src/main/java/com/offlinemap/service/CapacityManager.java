package com.offlinemap.service;

import com.offlinemap.exception.QuotaExceededException;
import com.offlinemap.storage.RegionDB;

/**
 * Capacity Manager - enforces the offline cache quota.
 *
 * Usage is the sum of the caller-estimated sizeInMB over AVAILABLE and OUTDATED regions.
 * Bytes actually written are never measured or reconciled against the estimate.
 */
public class CapacityManager {
    private final RegionDB regionDB;
    private volatile double maxCacheSizeMB;

    public CapacityManager(RegionDB regionDB, double maxCacheSizeMB) {
        this.regionDB = regionDB;
        this.maxCacheSizeMB = maxCacheSizeMB;
    }

    public double getTotalCacheSize() {
        return regionDB.totalCachedSizeMB();
    }

    /**
     * Fails when {@code requestedMB} more would exceed the quota. Nothing is reserved on success.
     */
    public void checkCapacity(double requestedMB) {
        double current = getTotalCacheSize();
        double limit = maxCacheSizeMB;
        if (current + requestedMB > limit) {
            throw new QuotaExceededException(limit, current, requestedMB);
        }
    }

    public double getRemainingCapacity() {
        return Math.max(0, maxCacheSizeMB - getTotalCacheSize());
    }

    public void setMaxCacheSize(double sizeInMB) {
        if (sizeInMB < 0) {
            throw new IllegalArgumentException("Cache size must not be negative");
        }
        this.maxCacheSizeMB = sizeInMB;
    }

    public double getMaxCacheSize() { return maxCacheSizeMB; }

    public String getStats() {
        return String.format("Cache: %.1fMB / %.1fMB used", getTotalCacheSize(), maxCacheSizeMB);
    }
}
