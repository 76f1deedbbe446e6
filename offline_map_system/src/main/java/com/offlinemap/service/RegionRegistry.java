package com.offlinemap.service;

import com.offlinemap.exception.AlreadyDownloadingException;
import com.offlinemap.exception.DownloadTimeoutException;
import com.offlinemap.exception.OfflineMapException;
import com.offlinemap.model.GeoPoint;
import com.offlinemap.model.MapTile;
import com.offlinemap.model.OfflineRegion;
import com.offlinemap.model.RegionBounds;
import com.offlinemap.model.RegionStatus;
import com.offlinemap.storage.RegionDB;
import com.offlinemap.storage.TileStorage;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Region Registry - owns offline region records and their lifecycle.
 *
 * requestDownload():
 *   DOWNLOADING already  → fails with AlreadyDownloading (no second queue entry)
 *   AVAILABLE already    → returns the existing record, nothing is downloaded
 *   otherwise            → quota gate → record inserted as DOWNLOADING → scheduler
 *
 * Every request carries a hard timeout; when it fires while the region is still
 * DOWNLOADING the record is forced to ERROR and the future fails with Timeout.
 * Tiles already written by then are left in place.
 */
public class RegionRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(RegionRegistry.class);

    private final RegionDB regionDB;
    private final CapacityManager capacityManager;
    private final DownloadScheduler downloadScheduler;
    private final TileStorage tileStorage;
    private final ScheduledExecutorService timer;
    private final Duration downloadTimeout;
    private final Clock clock;

    public RegionRegistry(RegionDB regionDB, CapacityManager capacityManager, DownloadScheduler downloadScheduler,
                          TileStorage tileStorage, ScheduledExecutorService timer, Duration downloadTimeout,
                          Clock clock) {
        this.regionDB = regionDB;
        this.capacityManager = capacityManager;
        this.downloadScheduler = downloadScheduler;
        this.tileStorage = tileStorage;
        this.timer = timer;
        this.downloadTimeout = downloadTimeout;
        this.clock = clock;
    }

    public void initializeFileSystem() {
        try {
            tileStorage.ensureDirectory();
        } catch (IOException e) {
            LOGGER.error("Could not create tile directory: {}", e.getMessage());
        }
    }

    public List<OfflineRegion> getAllRegions() {
        return regionDB.findAll();
    }

    public Optional<OfflineRegion> getRegion(String regionId) {
        return regionDB.findById(regionId);
    }

    // ==================== Download ====================

    /**
     * Request an offline copy of {@code request}'s area. Only id, name, bounds and size are read
     * from the argument. Refusals come back as an exceptionally completed future.
     */
    public CompletableFuture<OfflineRegion> requestDownload(OfflineRegion request) {
        CompletableFuture<OfflineRegion> future;
        synchronized (regionDB) {
            Optional<OfflineRegion> existing = regionDB.findById(request.getId());
            if (existing.isPresent()) {
                RegionStatus status = existing.get().getStatus();
                if (status == RegionStatus.DOWNLOADING) {
                    return CompletableFuture.failedFuture(new AlreadyDownloadingException(request.getId()));
                }
                if (status == RegionStatus.AVAILABLE) {
                    return CompletableFuture.completedFuture(existing.get());
                }
            }

            try {
                capacityManager.checkCapacity(request.getSizeInMB());
            } catch (OfflineMapException e) {
                LOGGER.warn("Download of {} refused: {}", request.getId(), e.getMessage());
                return CompletableFuture.failedFuture(e);
            }

            OfflineRegion record = request.toRequest();
            record.setStatus(RegionStatus.DOWNLOADING);
            record.setDownloadProgress(0);
            regionDB.insert(record);
            future = downloadScheduler.submit(record.getId());
        }
        armTimeout(request.getId(), future);
        return future;
    }

    private void armTimeout(String regionId, CompletableFuture<OfflineRegion> future) {
        ScheduledFuture<?> timeout = timer.schedule(() -> {
            if (future.isDone()) {
                return;
            }
            boolean timedOut = regionDB.atomicTransition(regionId, RegionStatus.DOWNLOADING,
                    r -> r.setStatus(RegionStatus.ERROR));
            if (timedOut) {
                LOGGER.warn("Region {} download timed out after {}", regionId, downloadTimeout);
                future.completeExceptionally(new DownloadTimeoutException(regionId, downloadTimeout));
            }
        }, downloadTimeout.toMillis(), TimeUnit.MILLISECONDS);
        future.whenComplete((region, error) -> timeout.cancel(false));
    }

    // ==================== Deletion ====================

    /**
     * Removes the region, its queued work and its tile files.
     * File deletion and record removal are not atomic: an interruption can leave orphaned files.
     */
    public boolean deleteRegion(String regionId) {
        if (!regionDB.contains(regionId)) {
            return false;
        }
        downloadScheduler.cancel(regionId);

        List<MapTile> tiles = regionDB.loadTiles(regionId);
        int deleted = 0;
        for (MapTile tile : tiles) {
            if (tile.getPath() == null) {
                continue;
            }
            try {
                tileStorage.delete(tile.getPath());
                deleted++;
            } catch (IOException e) {
                LOGGER.error("Could not delete tile file {}: {}", tile.getPath(), e.getMessage());
            }
        }
        regionDB.removeTiles(regionId);
        regionDB.remove(regionId);
        LOGGER.info("Region {} deleted ({} tile files removed)", regionId, deleted);
        return true;
    }

    public void deleteAllRegions() {
        downloadScheduler.clearQueue();
        for (OfflineRegion region : regionDB.findAll()) {
            deleteRegion(region.getId());
        }
        regionDB.clear();
    }

    /** Persisted tile list of a region (tiles that were written to disk). */
    public List<MapTile> loadTileData(String regionId) {
        return regionDB.loadTiles(regionId);
    }

    // ==================== Coverage ====================

    public boolean isPointCovered(GeoPoint point) {
        for (OfflineRegion region : regionDB.findByStatus(RegionStatus.AVAILABLE)) {
            if (region.getBounds().contains(point)) {
                return true;
            }
        }
        return false;
    }

    public boolean isRegionAvailableOffline(RegionBounds target) {
        for (OfflineRegion region : regionDB.findByStatus(RegionStatus.AVAILABLE)) {
            if (isRegionCovered(target, region.getBounds())) {
                return true;
            }
        }
        return false;
    }

    /** True iff {@code target} lies entirely inside {@code container}, edges included. */
    public static boolean isRegionCovered(RegionBounds target, RegionBounds container) {
        return container.covers(target);
    }

    // ==================== Staleness ====================

    /**
     * Marks every AVAILABLE region last updated more than {@code staleAfter} ago as OUTDATED.
     * Returns the ids marked.
     */
    public List<String> markStaleRegions(Duration staleAfter) {
        long now = clock.millis();
        List<String> outdated = new ArrayList<>();
        for (OfflineRegion region : regionDB.findByStatus(RegionStatus.AVAILABLE)) {
            Long lastUpdated = region.getLastUpdated();
            if (lastUpdated == null || now - lastUpdated <= staleAfter.toMillis()) {
                continue;
            }
            if (regionDB.atomicTransition(region.getId(), RegionStatus.AVAILABLE,
                    r -> r.setStatus(RegionStatus.OUTDATED))) {
                outdated.add(region.getId());
            }
        }
        return outdated;
    }

    public double getTotalCacheSize() {
        return capacityManager.getTotalCacheSize();
    }
}
