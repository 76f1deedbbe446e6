package com.offlinemap.cache;

import com.google.gson.reflect.TypeToken;
import com.offlinemap.exception.StorageException;
import com.offlinemap.model.CacheStatus;
import com.offlinemap.model.MapCacheInfo;
import com.offlinemap.model.MapGraph;
import com.offlinemap.model.MapNode;
import com.offlinemap.model.RoadSegment;
import com.offlinemap.storage.JsonStore;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named snapshots of the parsed map graph (nodes + road segments).
 *
 * Storage layout:
 *   map_data        → the "current" graph blob
 *   map_info        → MapCacheInfo of the current blob
 *   map_cache_list  → name → MapCacheInfo, every snapshot ever saved
 *
 * Only the current snapshot keeps its graph; catalog entries are metadata.
 * Read failures come back empty and are logged. Independent of tile downloads.
 */
public class SnapshotCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotCache.class);

    public static final String MAP_DATA_KEY = "@navigation_app/map_data";
    public static final String MAP_INFO_KEY = "@navigation_app/map_info";
    public static final String MAP_CACHE_LIST_KEY = "@navigation_app/map_cache_list";
    public static final String DEFAULT_NAME = "default_map";

    private static final Type CATALOG = new TypeToken<LinkedHashMap<String, MapCacheInfo>>() {}.getType();

    private final JsonStore jsonStore;
    private final Clock clock;

    public SnapshotCache(JsonStore jsonStore, Clock clock) {
        this.jsonStore = jsonStore;
        this.clock = clock;
    }

    public MapCacheInfo save(List<MapNode> nodes, List<RoadSegment> roadSegments) {
        return save(nodes, roadSegments, DEFAULT_NAME);
    }

    /**
     * Stores the graph as the current snapshot and records it in the catalog under {@code name}.
     *
     * @throws StorageException if the graph itself could not be written
     */
    public synchronized MapCacheInfo save(List<MapNode> nodes, List<RoadSegment> roadSegments, String name) {
        String mapData = jsonStore.toJson(new MapGraph(nodes, roadSegments));
        MapCacheInfo info = new MapCacheInfo(
                clock.millis(),
                mapData.getBytes(StandardCharsets.UTF_8).length,
                name,
                nodes.size(),
                roadSegments.size());

        if (!jsonStore.writeRaw(MAP_DATA_KEY, mapData) || !jsonStore.write(MAP_INFO_KEY, info)) {
            throw new StorageException("Map data could not be saved locally: " + name, null);
        }

        Map<String, MapCacheInfo> catalog = getCacheList();
        catalog.put(name, info);
        jsonStore.write(MAP_CACHE_LIST_KEY, catalog);

        LOGGER.info("Map snapshot saved: {}, {} nodes, {} road segments", name, nodes.size(), roadSegments.size());
        return info;
    }

    /** The current snapshot, or empty when absent or unreadable. */
    public synchronized Optional<MapGraph> load() {
        Optional<MapGraph> graph = jsonStore.read(MAP_DATA_KEY, MapGraph.class);
        if (graph.isEmpty()) {
            return Optional.empty();
        }
        if (graph.get().getNodes() == null || graph.get().getRoadSegments() == null) {
            LOGGER.error("Map snapshot is incomplete, ignoring it");
            return Optional.empty();
        }
        LOGGER.info("Map snapshot loaded: {} nodes, {} road segments",
                graph.get().getNodes().size(), graph.get().getRoadSegments().size());
        return graph;
    }

    public synchronized Optional<MapCacheInfo> getCacheInfo() {
        return jsonStore.read(MAP_INFO_KEY, MapCacheInfo.class);
    }

    public synchronized Map<String, MapCacheInfo> getCacheList() {
        Optional<Map<String, MapCacheInfo>> catalog = jsonStore.read(MAP_CACHE_LIST_KEY, CATALOG);
        return catalog.map(c -> (Map<String, MapCacheInfo>) new LinkedHashMap<>(c)).orElseGet(LinkedHashMap::new);
    }

    /** Wipes the current blob, its info and the whole catalog. */
    public synchronized boolean clear() {
        boolean ok = jsonStore.remove(MAP_DATA_KEY);
        ok &= jsonStore.remove(MAP_INFO_KEY);
        ok &= jsonStore.remove(MAP_CACHE_LIST_KEY);
        LOGGER.info("All map snapshots cleared");
        return ok;
    }

    /**
     * Removes one catalog entry. If it names the current snapshot, the current blob
     * and info go too.
     */
    public synchronized boolean clear(String name) {
        boolean ok = true;
        Map<String, MapCacheInfo> catalog = getCacheList();
        if (catalog.remove(name) != null) {
            ok = jsonStore.write(MAP_CACHE_LIST_KEY, catalog);
        }

        Optional<MapCacheInfo> current = getCacheInfo();
        if (current.isPresent() && name.equals(current.get().getName())) {
            ok &= jsonStore.remove(MAP_DATA_KEY);
            ok &= jsonStore.remove(MAP_INFO_KEY);
        }
        LOGGER.info("Map snapshot '{}' cleared", name);
        return ok;
    }

    /** Totals over the catalog. */
    public synchronized CacheStatus getCacheStatus() {
        Map<String, MapCacheInfo> catalog = getCacheList();
        if (catalog.isEmpty()) {
            return CacheStatus.empty();
        }
        long totalSize = 0;
        long lastUpdated = Long.MIN_VALUE;
        for (MapCacheInfo info : catalog.values()) {
            totalSize += info.getSize();
            lastUpdated = Math.max(lastUpdated, info.getTimestamp());
        }
        return new CacheStatus(totalSize, catalog.size(), lastUpdated);
    }
}
