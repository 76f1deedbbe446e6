package com.offlinemap;

import com.offlinemap.cache.SnapshotCache;
import com.offlinemap.config.OfflineMapConfig;
import com.offlinemap.model.*;
import com.offlinemap.network.StaticNetworkMonitor;
import com.offlinemap.service.OfflineMapService;
import com.offlinemap.storage.InMemoryKeyValueStore;
import com.offlinemap.storage.LocalTileStorage;
import com.offlinemap.tile.TileCoordinateEngine;
import com.offlinemap.worker.SimulatedTileServer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.CompletionException;

/**
 * Offline Map Engine - Demo
 *
 * Walks through the offline caching engine end to end, against a simulated tile server:
 * 1. Tile math (Web-Mercator indices and the per-region tile budget)
 * 2. Region download with progress, idempotent re-requests and quota refusals
 * 3. Offline coverage checks
 * 4. Partial failure handling (more than 20% failed tiles → ERROR)
 * 5. Map graph snapshots
 * 6. Auto-update settings and staleness scan
 */
public class OfflineMapDemo {

    private static OfflineMapService service;
    private static SimulatedTileServer tileServer;
    private static StaticNetworkMonitor network;
    private static Path workDir;

    public static void main(String[] args) throws IOException {
        System.out.println("╔═══════════════════════════════════════════════════════════╗");
        System.out.println("║           OFFLINE MAP ENGINE DEMO                        ║");
        System.out.println("║    Region caching, download scheduling, auto-update      ║");
        System.out.println("╚═══════════════════════════════════════════════════════════╝");

        initializeSystem();
        try {
            demoTileMath();
            demoRegionDownload();
            demoCoverage();
            demoPartialFailure();
            demoSnapshotCache();
            demoAutoUpdate();
        } finally {
            service.shutdown();
        }

        System.out.println("\n═══════════════════════════════════════════════════════════");
        System.out.println("Demo complete!");
        System.out.println("═══════════════════════════════════════════════════════════");
    }

    private static void initializeSystem() throws IOException {
        System.out.println("\n--- Initializing System Components ---");

        workDir = Files.createTempDirectory("offline-map-demo");
        // URLs containing "/17/" fail: used to push a region past the failure threshold
        tileServer = new SimulatedTileServer(url -> url.startsWith("https://flaky.example.com/17/"), 2);
        network = new StaticNetworkMonitor(NetworkState.wifi());

        OfflineMapConfig config = OfflineMapConfig.load();
        service = new OfflineMapService(config, new InMemoryKeyValueStore(),
                new LocalTileStorage(workDir.resolve("map_tiles")), tileServer, network, Clock.systemDefaultZone());
        service.start();

        System.out.println("  ✓ Key-value store initialized (in memory)");
        System.out.println("  ✓ Tile storage at " + workDir.resolve("map_tiles"));
        System.out.println("  ✓ Simulated tile server ready");
        System.out.printf("  ✓ Zoom %d..%d, quota %.0fMB%n", config.getMinZoom(), config.getMaxZoom(), config.getMaxCacheSizeMB());
    }

    private static void demoTileMath() {
        System.out.println("\n━━━ 1. TILE MATH ━━━");
        double lat = 37.5665, lng = 126.9780;
        for (int z : new int[]{10, 14, 18}) {
            int x = TileCoordinateEngine.lon2tile(lng, z);
            int y = TileCoordinateEngine.lat2tile(lat, z);
            System.out.printf("  Seoul City Hall @ z=%d → x=%d, y=%d (tile NW corner %.4f, %.4f)%n",
                    z, x, y, TileCoordinateEngine.tile2lat(y, z), TileCoordinateEngine.tile2lon(x, z));
        }
        RegionBounds small = RegionBounds.of(37.50, 126.90, 37.60, 127.00);
        RegionBounds large = RegionBounds.of(33.0, 124.5, 38.6, 131.0);
        System.out.printf("  Small area (10km): %d tiles%n", TileCoordinateEngine.tilesForRegion(small, 10, 18).size());
        System.out.printf("  Whole peninsula:   %d tiles (coarse zooms dropped first)%n",
                TileCoordinateEngine.tilesForRegion(large, 10, 14).size());
    }

    private static void demoRegionDownload() {
        System.out.println("\n━━━ 2. REGION DOWNLOAD ━━━");
        List<Integer> progress = Collections.synchronizedList(new ArrayList<>());
        service.addProgressListener((regionId, pct) -> {
            if (pct % 25 == 0) {
                progress.add(pct);
            }
        });

        OfflineRegion seoul = new OfflineRegion("seoul", "Seoul Center",
                RegionBounds.of(37.55, 126.95, 37.58, 127.00), 50);
        OfflineRegion done = service.requestDownload(seoul).join();
        System.out.printf("  ✓ %s%n", done);
        System.out.printf("  Progress milestones: %s%n", progress);
        System.out.printf("  Tiles persisted: %d%n", service.loadTileData("seoul").size());

        OfflineRegion again = service.requestDownload(seoul).join();
        System.out.printf("  Re-request of an available region returns it as-is: %s%n", again.getStatus());

        service.setMaxCacheSize(100);
        try {
            service.requestDownload(new OfflineRegion("busan", "Busan", RegionBounds.of(35.05, 128.95, 35.20, 129.15), 80)).join();
        } catch (CompletionException e) {
            System.out.printf("  ✗ Busan refused: %s%n", e.getCause().getMessage());
        }
        service.setMaxCacheSize(2000);
        System.out.printf("  %s%n", service.getStats());
    }

    private static void demoCoverage() {
        System.out.println("\n━━━ 3. OFFLINE COVERAGE ━━━");
        GeoPoint cityHall = new GeoPoint(37.5665, 126.9780);
        GeoPoint gangnam = new GeoPoint(37.4979, 127.0276);
        System.out.printf("  City Hall %s covered: %s%n", cityHall, service.isPointCovered(cityHall));
        System.out.printf("  Gangnam %s covered: %s%n", gangnam, service.isPointCovered(gangnam));
        System.out.printf("  Inner box available offline: %s%n",
                service.isRegionAvailableOffline(RegionBounds.of(37.56, 126.96, 37.57, 126.99)));
        System.out.printf("  Overlapping box available offline: %s%n",
                service.isRegionAvailableOffline(RegionBounds.of(37.57, 126.99, 37.60, 127.05)));
    }

    private static void demoPartialFailure() {
        System.out.println("\n━━━ 4. PARTIAL FAILURE ━━━");
        // A second service pointed at the flaky server: zoom 17 is a large share of the tiles
        OfflineMapConfig flaky = OfflineMapConfig.builder()
                .tileUrlTemplate("https://flaky.example.com/{z}/{x}/{y}.png")
                .minZoom(16).maxZoom(17)
                .build();
        OfflineMapService flakyService = new OfflineMapService(flaky, new InMemoryKeyValueStore(),
                new LocalTileStorage(workDir.resolve("flaky_tiles")), tileServer, network, Clock.systemDefaultZone());
        try {
            flakyService.requestDownload(new OfflineRegion("jongno", "Jongno",
                    RegionBounds.of(37.57, 126.97, 37.58, 126.99), 5)).join();
        } catch (CompletionException e) {
            System.out.printf("  ✗ %s%n", e.getCause().getMessage());
        } finally {
            System.out.printf("  Region status: %s%n",
                    flakyService.getRegion("jongno").map(OfflineRegion::getStatus).orElse(RegionStatus.NONE));
            flakyService.shutdown();
        }
        System.out.printf("  Tile server failure rate so far: %.1f%%%n", tileServer.getFailureRate());
    }

    private static void demoSnapshotCache() {
        System.out.println("\n━━━ 5. MAP GRAPH SNAPSHOTS ━━━");
        SnapshotCache cache = service.getSnapshotCache();
        List<MapNode> nodes = Arrays.asList(
                new MapNode("n1", new GeoPoint(37.5665, 126.9780), "City Hall"),
                new MapNode("n2", new GeoPoint(37.5704, 126.9920), "Jongno 3-ga"),
                new MapNode("n3", new GeoPoint(37.5796, 126.9770), "Gyeongbokgung"));
        List<RoadSegment> segments = Arrays.asList(
                new RoadSegment("s1", "Jongno", "n1", "n2", List.of(nodes.get(0).getCoordinate(), nodes.get(1).getCoordinate()),
                        1300, 50, "primary", false),
                new RoadSegment("s2", "Sejong-daero", "n1", "n3", List.of(nodes.get(0).getCoordinate(), nodes.get(2).getCoordinate()),
                        1450, 60, "primary", false));

        MapCacheInfo info = cache.save(nodes, segments, "seoul_core");
        System.out.printf("  ✓ Saved %s%n", info);
        cache.load().ifPresent(graph -> System.out.printf("  ✓ Loaded %s%n", graph));
        System.out.printf("  Catalog: %s%n", cache.getCacheList().keySet());
        System.out.printf("  %s%n", cache.getCacheStatus());
        cache.clear("seoul_core");
        System.out.printf("  After clearing 'seoul_core': current snapshot present = %s%n", cache.load().isPresent());
    }

    private static void demoAutoUpdate() {
        System.out.println("\n━━━ 6. AUTO-UPDATE ━━━");
        service.updateAutoUpdateSettings(s -> {
            s.setUpdateInterval(UpdateInterval.DAILY);
            s.setTimeOfDay("03:00");
        });
        System.out.printf("  Settings: %s%n", service.getAutoUpdateSettings());
        System.out.printf("  Stale regions right now: %s%n", service.checkForUpdates());
        network.setState(NetworkState.cellular());
        System.out.printf("  Network switched to %s: wifi-only updates wait%n", network.currentState());
    }
}
