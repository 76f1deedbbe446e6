package com.offlinemap.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.offlinemap.exception.AlreadyDownloadingException;
import com.offlinemap.exception.DownloadTimeoutException;
import com.offlinemap.exception.ErrorCode;
import com.offlinemap.exception.QuotaExceededException;
import com.offlinemap.model.GeoPoint;
import com.offlinemap.model.MapTile;
import com.offlinemap.model.NetworkState;
import com.offlinemap.model.OfflineRegion;
import com.offlinemap.model.RegionBounds;
import com.offlinemap.model.RegionStatus;
import com.offlinemap.network.StaticNetworkMonitor;
import com.offlinemap.storage.InMemoryKeyValueStore;
import com.offlinemap.storage.LocalTileStorage;
import com.offlinemap.support.MutableClock;
import com.offlinemap.support.TestRegions;
import com.offlinemap.worker.SimulatedTileServer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RegionRegistryTest {

    @TempDir
    Path tileDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
    private SimulatedTileServer server;
    private OfflineMapService service;
    private RegionRegistry registry;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.shutdown();
        }
    }

    private void start(long latencyMillis, double quotaMB, Duration timeout) {
        start(new SimulatedTileServer(url -> false, latencyMillis), quotaMB, timeout);
    }

    private void start(SimulatedTileServer tileServer, double quotaMB, Duration timeout) {
        server = tileServer;
        service = new OfflineMapService(
                TestRegions.tenTileConfig().maxCacheSizeMB(quotaMB).downloadTimeout(timeout).build(),
                new InMemoryKeyValueStore(), new LocalTileStorage(tileDir), server,
                new StaticNetworkMonitor(NetworkState.wifi()), clock);
        service.start();
        registry = service.getRegionRegistry();
    }

    private void start() {
        start(0, 2000, Duration.ofMinutes(10));
    }

    @Test
    void downloadWritesTilesAndRecordsThem() throws Exception {
        start();

        OfflineRegion region = registry.requestDownload(TestRegions.tenTileRegion("a", 10)).get(5, TimeUnit.SECONDS);

        assertEquals(RegionStatus.AVAILABLE, region.getStatus());
        List<MapTile> tiles = registry.loadTileData("a");
        assertEquals(10, tiles.size());
        for (MapTile tile : tiles) {
            assertTrue(Files.exists(Paths.get(tile.getPath())), tile.getPath());
            assertTrue(tile.getPath().endsWith(tile.fileName()));
        }
    }

    @Test
    void availableRegionIsReturnedWithoutDownloadingAgain() throws Exception {
        start();
        registry.requestDownload(TestRegions.tenTileRegion("a", 10)).get(5, TimeUnit.SECONDS);
        int served = server.getServed();

        CompletableFuture<OfflineRegion> again = registry.requestDownload(TestRegions.tenTileRegion("a", 10));

        assertTrue(again.isDone());
        assertEquals(RegionStatus.AVAILABLE, again.get().getStatus());
        assertEquals(served, server.getServed());
    }

    @Test
    void secondRequestWhileDownloadingIsRefused() throws Exception {
        start(100, 2000, Duration.ofMinutes(10));
        CompletableFuture<OfflineRegion> first = registry.requestDownload(TestRegions.tenTileRegion("a", 10));

        CompletableFuture<OfflineRegion> second = registry.requestDownload(TestRegions.tenTileRegion("a", 10));

        ExecutionException e = assertThrows(ExecutionException.class, second::get);
        AlreadyDownloadingException refusal = assertInstanceOf(AlreadyDownloadingException.class, e.getCause());
        assertEquals(ErrorCode.ALREADY_DOWNLOADING, refusal.getCode());
        assertEquals(RegionStatus.AVAILABLE, first.get(5, TimeUnit.SECONDS).getStatus());
        assertEquals(10, server.getServed());
    }

    @Test
    void quotaRefusalLeavesRegistryUntouched() throws Exception {
        start(0, 60, Duration.ofMinutes(10));
        registry.requestDownload(TestRegions.tenTileRegion("a", 50)).get(5, TimeUnit.SECONDS);

        CompletableFuture<OfflineRegion> refused = registry.requestDownload(TestRegions.tenTileRegion("b", 20));

        ExecutionException e = assertThrows(ExecutionException.class, refused::get);
        QuotaExceededException quota = assertInstanceOf(QuotaExceededException.class, e.getCause());
        assertEquals(60, quota.getLimit());
        assertEquals(50, quota.getCurrent());
        assertEquals(20, quota.getRequested());
        assertFalse(registry.getRegion("b").isPresent());
        assertEquals(50, registry.getTotalCacheSize());
        assertEquals(1, registry.getAllRegions().size());
    }

    @Test
    void requestFillingQuotaExactlyIsAccepted() throws Exception {
        start(0, 60, Duration.ofMinutes(10));
        registry.requestDownload(TestRegions.tenTileRegion("a", 50)).get(5, TimeUnit.SECONDS);

        OfflineRegion b = registry.requestDownload(TestRegions.tenTileRegion("b", 10)).get(5, TimeUnit.SECONDS);

        assertEquals(RegionStatus.AVAILABLE, b.getStatus());
        assertEquals(60, registry.getTotalCacheSize());
    }

    @Test
    void deleteRemovesRecordTileListAndFiles() throws Exception {
        start();
        registry.requestDownload(TestRegions.tenTileRegion("a", 10)).get(5, TimeUnit.SECONDS);
        List<MapTile> tiles = registry.loadTileData("a");

        assertTrue(registry.deleteRegion("a"));

        assertFalse(registry.getRegion("a").isPresent());
        assertTrue(registry.loadTileData("a").isEmpty());
        for (MapTile tile : tiles) {
            assertFalse(Files.exists(Paths.get(tile.getPath())));
        }
        assertEquals(0, registry.getTotalCacheSize());
        assertFalse(registry.deleteRegion("a"));
    }

    @Test
    void deleteAllRegionsEmptiesRegistry() throws Exception {
        start();
        registry.requestDownload(TestRegions.tenTileRegion("a", 10)).get(5, TimeUnit.SECONDS);
        registry.requestDownload(new OfflineRegion("b", "B", RegionBounds.of(-80, -10, -70, 170), 10))
                .get(5, TimeUnit.SECONDS);

        registry.deleteAllRegions();

        assertTrue(registry.getAllRegions().isEmpty());
        assertTrue(registry.loadTileData("a").isEmpty());
        assertTrue(registry.loadTileData("b").isEmpty());
    }

    @Test
    void slowDownloadTimesOutAndIsMarkedError() throws Exception {
        start(400, 2000, Duration.ofMillis(100));

        CompletableFuture<OfflineRegion> future = registry.requestDownload(TestRegions.tenTileRegion("a", 10));

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        DownloadTimeoutException timeout = assertInstanceOf(DownloadTimeoutException.class, e.getCause());
        assertEquals(ErrorCode.TIMEOUT, timeout.getCode());
        assertEquals(RegionStatus.ERROR, registry.getRegion("a").get().getStatus());

        // the late result does not overwrite the timeout
        TestRegions.await(() -> !service.getDownloadScheduler().getQueue().isDownloading(), Duration.ofSeconds(5));
        assertEquals(RegionStatus.ERROR, registry.getRegion("a").get().getStatus());
        assertEquals(0, registry.getTotalCacheSize());
    }

    @Test
    void errorRegionCanBeRequestedAgain() throws Exception {
        start(400, 2000, Duration.ofMillis(100));
        CompletableFuture<OfflineRegion> first = registry.requestDownload(TestRegions.tenTileRegion("a", 10));
        assertThrows(ExecutionException.class, () -> first.get(5, TimeUnit.SECONDS));
        TestRegions.await(() -> !service.getDownloadScheduler().getQueue().isDownloading(), Duration.ofSeconds(5));

        CompletableFuture<OfflineRegion> retry = registry.requestDownload(TestRegions.tenTileRegion("a", 10));

        assertEquals(RegionStatus.DOWNLOADING, registry.getRegion("a").get().getStatus());
        ExecutionException e = assertThrows(ExecutionException.class, () -> retry.get(5, TimeUnit.SECONDS));
        assertInstanceOf(DownloadTimeoutException.class, e.getCause());
        TestRegions.await(() -> server.getServed() == 20, Duration.ofSeconds(5));
    }

    @Test
    void regionRequestedAgainDuringOldDownloadGetsTheNewBounds() throws Exception {
        start(300, 2000, Duration.ofMinutes(10));
        CompletableFuture<OfflineRegion> old = registry.requestDownload(TestRegions.tenTileRegion("a", 10));
        TestRegions.await(() -> service.getDownloadScheduler().getQueue().isDownloading(), Duration.ofSeconds(5));

        assertTrue(registry.deleteRegion("a"));
        CompletableFuture<OfflineRegion> renewed = registry.requestDownload(
                new OfflineRegion("a", "A south", RegionBounds.of(-80, -10, -70, 170), 10));

        assertThrows(ExecutionException.class, () -> old.get(5, TimeUnit.SECONDS));
        OfflineRegion region = renewed.get(10, TimeUnit.SECONDS);
        assertEquals(RegionStatus.AVAILABLE, region.getStatus());
        assertEquals(-80.0, region.getBounds().getSouthwest().getLatitude());
        List<MapTile> tiles = registry.loadTileData("a");
        assertEquals(10, tiles.size());
        assertTrue(tiles.stream().allMatch(t -> t.getY() >= 6), "tiles of the deleted bounds: " + tiles);
        assertEquals(20, server.getServed());
    }

    @Test
    void timedOutRegionRetriedWhileOldRunIsActiveDownloadsAgain() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        start(new SimulatedTileServer(url -> {
            if (calls.incrementAndGet() <= 10) {
                awaitQuietly(gate);
            }
            return false;
        }, 0), 2000, Duration.ofMillis(500));
        CompletableFuture<OfflineRegion> first = registry.requestDownload(TestRegions.tenTileRegion("a", 10));
        ExecutionException e = assertThrows(ExecutionException.class, () -> first.get(5, TimeUnit.SECONDS));
        assertInstanceOf(DownloadTimeoutException.class, e.getCause());
        assertTrue(service.getDownloadScheduler().getQueue().isDownloading());

        CompletableFuture<OfflineRegion> retry = registry.requestDownload(TestRegions.tenTileRegion("a", 10));
        gate.countDown();

        assertEquals(RegionStatus.AVAILABLE, retry.get(5, TimeUnit.SECONDS).getStatus());
        assertEquals(20, calls.get());
        assertEquals(10, registry.loadTileData("a").size());
    }

    private static void awaitQuietly(CountDownLatch gate) {
        try {
            gate.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void coverageConsidersOnlyAvailableRegions() throws Exception {
        start();
        assertFalse(registry.isPointCovered(new GeoPoint(75, 0)));

        registry.requestDownload(TestRegions.tenTileRegion("a", 10)).get(5, TimeUnit.SECONDS);

        assertTrue(registry.isPointCovered(new GeoPoint(75, 0)));
        assertTrue(registry.isPointCovered(new GeoPoint(80, 10)), "edge is covered");
        assertFalse(registry.isPointCovered(new GeoPoint(69.9, 0)));
        assertTrue(registry.isRegionAvailableOffline(RegionBounds.of(72, -100, 78, 0)));
        assertFalse(registry.isRegionAvailableOffline(RegionBounds.of(72, -100, 82, 0)));
    }

    @Test
    void staleRegionsAreMarkedOutdated() throws Exception {
        start();
        registry.requestDownload(TestRegions.tenTileRegion("a", 10)).get(5, TimeUnit.SECONDS);

        clock.advance(Duration.ofDays(30));
        assertTrue(registry.markStaleRegions(Duration.ofDays(30)).isEmpty());

        clock.advance(Duration.ofMillis(1));
        assertEquals(List.of("a"), registry.markStaleRegions(Duration.ofDays(30)));
        assertEquals(RegionStatus.OUTDATED, registry.getRegion("a").get().getStatus());
        assertFalse(registry.isPointCovered(new GeoPoint(75, 0)));
        assertEquals(10, registry.getTotalCacheSize(), "outdated regions keep their space");
    }

    @Test
    void staticCoverageCheck() {
        RegionBounds container = TestRegions.SEOUL_BOUNDS;

        assertTrue(RegionRegistry.isRegionCovered(container, container));
        assertFalse(RegionRegistry.isRegionCovered(RegionBounds.of(37.4, 126.9, 37.6, 127.0), container));
    }
}
