package com.offlinemap.service;

import com.offlinemap.cache.SnapshotCache;
import com.offlinemap.config.OfflineMapConfig;
import com.offlinemap.listener.DownloadProgressListener;
import com.offlinemap.model.AutoUpdateSettings;
import com.offlinemap.model.GeoPoint;
import com.offlinemap.model.MapTile;
import com.offlinemap.model.OfflineRegion;
import com.offlinemap.model.RegionBounds;
import com.offlinemap.network.NetworkMonitor;
import com.offlinemap.queue.DownloadQueue;
import com.offlinemap.storage.FileKeyValueStore;
import com.offlinemap.storage.JsonStore;
import com.offlinemap.storage.KeyValueStore;
import com.offlinemap.storage.LocalTileStorage;
import com.offlinemap.storage.RegionDB;
import com.offlinemap.storage.TileStorage;
import com.offlinemap.worker.HttpTileFetcher;
import com.offlinemap.worker.TileDownloadWorker;
import com.offlinemap.worker.TileFetcher;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * Offline Map Service - the engine's public API and composition root.
 *
 *   requestDownload ─▶ RegionRegistry ─▶ CapacityManager (quota gate)
 *                            │
 *                            ▼
 *                     DownloadScheduler ─▶ TileDownloadWorker ─▶ TileFetcher / TileStorage
 *                            ▲
 *   AutoUpdateScheduler ─────┘ (stale regions: delete + request again)
 *
 *   SnapshotCache stands alone: parsed graph snapshots, no tiles.
 *
 * Owned by the application and passed around by reference; there is no static instance.
 */
public class OfflineMapService {

    private final RegionDB regionDB;
    private final CapacityManager capacityManager;
    private final DownloadScheduler downloadScheduler;
    private final RegionRegistry regionRegistry;
    private final AutoUpdateScheduler autoUpdateScheduler;
    private final SnapshotCache snapshotCache;
    private final ScheduledExecutorService timeoutTimer;
    private final ScheduledExecutorService autoUpdateTicker;

    public OfflineMapService(OfflineMapConfig config, KeyValueStore keyValueStore, TileStorage tileStorage,
                             TileFetcher tileFetcher, NetworkMonitor networkMonitor, Clock clock) {
        JsonStore jsonStore = new JsonStore(keyValueStore);
        this.timeoutTimer = Executors.newSingleThreadScheduledExecutor();
        this.autoUpdateTicker = Executors.newSingleThreadScheduledExecutor();

        this.regionDB = new RegionDB(jsonStore);
        this.capacityManager = new CapacityManager(regionDB, config.getMaxCacheSizeMB());
        this.downloadScheduler = new DownloadScheduler(regionDB, new TileDownloadWorker(tileFetcher, tileStorage),
                new DownloadQueue(), config, clock);
        this.regionRegistry = new RegionRegistry(regionDB, capacityManager, downloadScheduler, tileStorage,
                timeoutTimer, config.getDownloadTimeout(), clock);
        this.autoUpdateScheduler = new AutoUpdateScheduler(regionRegistry, jsonStore, networkMonitor,
                autoUpdateTicker, config, clock);
        this.snapshotCache = new SnapshotCache(jsonStore, clock);
    }

    /** Production wiring: file-backed storage and HTTP tile downloads. */
    public static OfflineMapService create(OfflineMapConfig config, NetworkMonitor networkMonitor) {
        return new OfflineMapService(config,
                new FileKeyValueStore(config.getStoragePath()),
                new LocalTileStorage(config.getTileBasePath()),
                new HttpTileFetcher(config.getUserAgent(), config.getConnectTimeout(), config.getReadTimeout()),
                networkMonitor,
                Clock.systemDefaultZone());
    }

    /** Creates the tile directory and starts the auto-update checker. */
    public void start() {
        regionRegistry.initializeFileSystem();
        autoUpdateScheduler.start();
    }

    public void shutdown() {
        autoUpdateScheduler.stop();
        downloadScheduler.shutdown();
        autoUpdateTicker.shutdownNow();
        timeoutTimer.shutdownNow();
    }

    // ==================== Regions ====================

    public List<OfflineRegion> getAllRegions() { return regionRegistry.getAllRegions(); }

    public Optional<OfflineRegion> getRegion(String regionId) { return regionRegistry.getRegion(regionId); }

    public CompletableFuture<OfflineRegion> requestDownload(OfflineRegion region) {
        return regionRegistry.requestDownload(region);
    }

    public boolean deleteRegion(String regionId) { return regionRegistry.deleteRegion(regionId); }

    public void deleteAllRegions() { regionRegistry.deleteAllRegions(); }

    public List<MapTile> loadTileData(String regionId) { return regionRegistry.loadTileData(regionId); }

    public boolean isPointCovered(GeoPoint point) { return regionRegistry.isPointCovered(point); }

    public boolean isRegionAvailableOffline(RegionBounds bounds) {
        return regionRegistry.isRegionAvailableOffline(bounds);
    }

    // ==================== Capacity ====================

    public double getTotalCacheSize() { return capacityManager.getTotalCacheSize(); }

    public void setMaxCacheSize(double sizeInMB) { capacityManager.setMaxCacheSize(sizeInMB); }

    public double getMaxCacheSize() { return capacityManager.getMaxCacheSize(); }

    // ==================== Progress ====================

    public void addProgressListener(DownloadProgressListener listener) {
        downloadScheduler.addProgressListener(listener);
    }

    public void removeProgressListener(DownloadProgressListener listener) {
        downloadScheduler.removeProgressListener(listener);
    }

    // ==================== Auto-update ====================

    public List<String> checkForUpdates() { return autoUpdateScheduler.checkForUpdates(); }

    public AutoUpdateSettings getAutoUpdateSettings() { return autoUpdateScheduler.getSettings(); }

    public void updateAutoUpdateSettings(Consumer<AutoUpdateSettings> changes) {
        autoUpdateScheduler.updateSettings(changes);
    }

    // ==================== Components ====================

    public SnapshotCache getSnapshotCache() { return snapshotCache; }
    public AutoUpdateScheduler getAutoUpdateScheduler() { return autoUpdateScheduler; }
    public RegionRegistry getRegionRegistry() { return regionRegistry; }
    public DownloadScheduler getDownloadScheduler() { return downloadScheduler; }

    public String getStats() {
        return String.format("Regions: %d | %s | %s", regionDB.size(), capacityManager.getStats(),
                downloadScheduler.getStats());
    }
}
