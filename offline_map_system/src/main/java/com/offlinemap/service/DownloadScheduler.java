package com.offlinemap.service;

import com.offlinemap.config.OfflineMapConfig;
import com.offlinemap.exception.DownloadFailedException;
import com.offlinemap.exception.ErrorCode;
import com.offlinemap.exception.OfflineMapException;
import com.offlinemap.listener.DownloadProgressListener;
import com.offlinemap.model.MapTile;
import com.offlinemap.model.OfflineRegion;
import com.offlinemap.model.RegionStatus;
import com.offlinemap.queue.DownloadQueue;
import com.offlinemap.storage.RegionDB;
import com.offlinemap.tile.TileCoordinateEngine;
import com.offlinemap.worker.TileDownloadWorker;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Download Scheduler - turns queued region ids into tiles on disk.
 *
 * Flow:
 * 1. A region id is enqueued; the scheduler claims the single active slot if it is free
 * 2. Tiles for the region's bounds are computed (adaptive per-zoom cap)
 * 3. Tiles are fetched in batches of {@code batchSize}; a batch fully settles before the next starts
 * 4. Every settled tile recomputes floor(downloaded / total * 100) and notifies listeners
 * 5. When all tiles settled: failed/total above the threshold → ERROR, otherwise AVAILABLE
 *    and the list of written tiles is persisted
 * 6. The slot is released and the next queued region starts, whatever the outcome
 *
 * The pending future for a region is completed here, on the download thread, instead of
 * being polled by the requester. That future also identifies the run: once a region is
 * cancelled or requested again, the older run still in flight no longer touches the record,
 * its listeners or the new future, and the new request waits for the slot.
 */
public class DownloadScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(DownloadScheduler.class);

    private final RegionDB regionDB;
    private final TileDownloadWorker worker;
    private final DownloadQueue queue;
    private final OfflineMapConfig config;
    private final Clock clock;

    private final List<DownloadProgressListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, CompletableFuture<OfflineRegion>> completions = new ConcurrentHashMap<>();

    private final ExecutorService regionExecutor = Executors.newSingleThreadExecutor();
    private final ExecutorService tileExecutor;

    public DownloadScheduler(RegionDB regionDB, TileDownloadWorker worker, DownloadQueue queue,
                             OfflineMapConfig config, Clock clock) {
        this.regionDB = regionDB;
        this.worker = worker;
        this.queue = queue;
        this.config = config;
        this.clock = clock;
        this.tileExecutor = Executors.newFixedThreadPool(config.getBatchSize());
    }

    // ==================== Submission ====================

    /**
     * Queue a region that is already recorded as DOWNLOADING. The returned future completes
     * with the AVAILABLE record, or exceptionally with {@link DownloadFailedException}.
     */
    public CompletableFuture<OfflineRegion> submit(String regionId) {
        CompletableFuture<OfflineRegion> future = new CompletableFuture<>();
        CompletableFuture<OfflineRegion> previous = completions.put(regionId, future);
        if (previous != null && !previous.isDone()) {
            previous.completeExceptionally(new OfflineMapException(ErrorCode.DOWNLOAD_FAILED,
                    "Download superseded: " + regionId));
        }
        if (!queue.enqueue(regionId)) {
            LOGGER.debug("Region {} already queued", regionId);
        }
        processQueue();
        return future;
    }

    /**
     * Best-effort cancellation: a region that has not started is dropped from the queue.
     * A running download is not interrupted; its result is discarded on completion.
     * Either way the pending future fails.
     */
    public boolean cancel(String regionId) {
        boolean dequeued = queue.remove(regionId);
        CompletableFuture<OfflineRegion> future = completions.remove(regionId);
        if (future != null) {
            future.completeExceptionally(new OfflineMapException(ErrorCode.DOWNLOAD_FAILED,
                    "Download cancelled: " + regionId));
        }
        return dequeued;
    }

    /** Drops every queued region and fails their futures. */
    public void clearQueue() {
        for (String regionId : queue.clear()) {
            CompletableFuture<OfflineRegion> future = completions.remove(regionId);
            if (future != null) {
                future.completeExceptionally(new OfflineMapException(ErrorCode.DOWNLOAD_FAILED,
                        "Download cancelled: " + regionId));
            }
        }
    }

    private void processQueue() {
        Optional<String> next = queue.claimNext();
        if (next.isEmpty()) {
            return;
        }
        String regionId = next.get();
        try {
            regionExecutor.execute(() -> runRegion(regionId));
        } catch (RuntimeException e) {
            // executor shut down
            queue.release(regionId);
            LOGGER.warn("Scheduler stopped, region {} not started", regionId);
        }
    }

    private void runRegion(String regionId) {
        CompletableFuture<OfflineRegion> run = completions.get(regionId);
        try {
            if (run == null) {
                LOGGER.info("Region {} was cancelled before it started", regionId);
                return;
            }
            downloadRegion(regionId, run);
        } catch (RuntimeException e) {
            LOGGER.error("Region {} download aborted: {}", regionId, e.getMessage(), e);
            failRun(regionId, run, new OfflineMapException(ErrorCode.DOWNLOAD_FAILED,
                    "Download failed: " + e.getMessage(), e));
        } finally {
            queue.release(regionId);
            processQueue();
        }
    }

    // ==================== Region download ====================

    private boolean isCurrent(String regionId, CompletableFuture<OfflineRegion> run) {
        return completions.get(regionId) == run;
    }

    private void downloadRegion(String regionId, CompletableFuture<OfflineRegion> run) {
        Optional<OfflineRegion> found = regionDB.findById(regionId);
        if (found.isEmpty() || found.get().getStatus() != RegionStatus.DOWNLOADING) {
            LOGGER.info("Region {} no longer waiting for download, skipped", regionId);
            if (completions.remove(regionId, run)) {
                run.completeExceptionally(new OfflineMapException(ErrorCode.DOWNLOAD_FAILED,
                        "Download cancelled: " + regionId));
            }
            return;
        }
        OfflineRegion region = found.get();
        LOGGER.info("Region download started: {} ({})", region.getName(), regionId);

        List<MapTile> tiles = TileCoordinateEngine.tilesForRegion(region.getBounds(),
                config.getMinZoom(), config.getMaxZoom(), config.getTileBudget(), config.getTileUrlTemplate());
        int totalTiles = tiles.size();
        if (totalTiles == 0) {
            failRun(regionId, run, new DownloadFailedException(regionId, 0, 0));
            return;
        }

        ProgressTracker tracker = new ProgressTracker(regionId, run, totalTiles);
        int batchSize = config.getBatchSize();
        for (int start = 0; start < totalTiles; start += batchSize) {
            List<MapTile> batch = tiles.subList(start, Math.min(start + batchSize, totalTiles));
            CompletableFuture<?>[] inFlight = batch.stream()
                    .map(tile -> CompletableFuture
                            .supplyAsync(() -> worker.download(tile), tileExecutor)
                            .exceptionally(e -> false)
                            .thenAccept(tracker::record))
                    .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(inFlight).join();
        }

        complete(region, tiles, tracker, run);
    }

    private void complete(OfflineRegion region, List<MapTile> tiles, ProgressTracker tracker,
                          CompletableFuture<OfflineRegion> run) {
        String regionId = region.getId();
        int total = tracker.total;
        int failed = tracker.failed;
        int downloaded = tracker.downloaded;
        boolean tooManyFailures = (double) failed / total > config.getFailureThreshold();
        LOGGER.info("Region download finished: {}, succeeded: {}, failed: {}", region.getName(), downloaded, failed);

        boolean transitioned;
        synchronized (regionDB) {
            if (!isCurrent(regionId, run)) {
                // cancelled, or the id was requested again: the record belongs to the newer request
                LOGGER.warn("Region {} was cancelled or requested again during download, result discarded", regionId);
                return;
            }
            if (tooManyFailures) {
                transitioned = regionDB.atomicTransition(regionId, RegionStatus.DOWNLOADING,
                        r -> r.setStatus(RegionStatus.ERROR));
            } else {
                long now = clock.millis();
                transitioned = regionDB.atomicTransition(regionId, RegionStatus.DOWNLOADING, r -> {
                    r.setStatus(RegionStatus.AVAILABLE);
                    r.setDownloadProgress(100);
                    r.setLastUpdated(now);
                });
            }
        }

        List<MapTile> written = tiles.stream().filter(t -> t.getPath() != null).collect(Collectors.toList());
        if (!transitioned) {
            // timed out while running: keep the tile list so a delete can remove the files
            if (regionDB.contains(regionId) && !written.isEmpty()) {
                regionDB.saveTiles(regionId, written);
            }
            completions.remove(regionId, run);
            LOGGER.warn("Region {} left DOWNLOADING during download, result discarded", regionId);
            return;
        }

        if (tooManyFailures) {
            LOGGER.warn("Region {} failed: {}/{} tiles", regionId, failed, total);
            completions.remove(regionId, run);
            run.completeExceptionally(new DownloadFailedException(regionId, failed, total));
            return;
        }

        regionDB.saveTiles(regionId, written);
        tracker.finish();
        completions.remove(regionId, run);
        run.complete(regionDB.findById(regionId).orElse(region));
    }

    /** Marks the region ERROR and fails the run, unless a newer request owns the region by now. */
    private void failRun(String regionId, CompletableFuture<OfflineRegion> run, OfflineMapException error) {
        synchronized (regionDB) {
            if (!isCurrent(regionId, run)) {
                return;
            }
            regionDB.atomicTransition(regionId, RegionStatus.DOWNLOADING, r -> r.setStatus(RegionStatus.ERROR));
            completions.remove(regionId, run);
        }
        run.completeExceptionally(error);
    }

    // ==================== Progress ====================

    public void addProgressListener(DownloadProgressListener listener) {
        if (!listeners.contains(listener)) {
            listeners.add(listener);
        }
    }

    public void removeProgressListener(DownloadProgressListener listener) {
        listeners.remove(listener);
    }

    private void notifyProgressListeners(String regionId, int progress) {
        for (DownloadProgressListener listener : listeners) {
            try {
                listener.onProgress(regionId, progress);
            } catch (RuntimeException e) {
                LOGGER.error("Progress listener failed for {}: {}", regionId, e.getMessage(), e);
            }
        }
    }

    /**
     * Per-region counters. Updates are serialized so listeners see non-decreasing values.
     */
    private final class ProgressTracker {
        private final String regionId;
        private final CompletableFuture<OfflineRegion> run;
        private final int total;
        private int downloaded;
        private int failed;
        private int lastNotified = -1;

        ProgressTracker(String regionId, CompletableFuture<OfflineRegion> run, int total) {
            this.regionId = regionId;
            this.run = run;
            this.total = total;
        }

        synchronized void record(boolean success) {
            if (success) {
                downloaded++;
            } else {
                failed++;
            }
            if (!isCurrent(regionId, run)) {
                return;
            }
            int progress = (int) Math.floor((double) downloaded / total * 100);
            regionDB.updateTransient(regionId, r -> {
                if (r.getStatus() == RegionStatus.DOWNLOADING && isCurrent(regionId, run)) {
                    r.setDownloadProgress(progress);
                }
            });
            lastNotified = progress;
            notifyProgressListeners(regionId, progress);
        }

        /** Region is AVAILABLE: report 100 even if a few tiles failed. */
        synchronized void finish() {
            if (lastNotified < 100) {
                lastNotified = 100;
                notifyProgressListeners(regionId, 100);
            }
        }
    }

    // ==================== Lifecycle ====================

    public DownloadQueue getQueue() { return queue; }

    public void shutdown() {
        regionExecutor.shutdownNow();
        tileExecutor.shutdownNow();
    }

    public String getStats() {
        return queue.getStats() + "; " + worker.getStats();
    }

    /** Ids of regions waiting behind the active one. */
    public List<String> getPendingRegionIds() {
        return new ArrayList<>(queue.getPendingRegionIds());
    }
}
