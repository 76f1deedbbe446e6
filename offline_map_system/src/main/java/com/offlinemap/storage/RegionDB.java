package com.offlinemap.storage;

import com.google.gson.reflect.TypeToken;
import com.offlinemap.model.MapTile;
import com.offlinemap.model.OfflineRegion;
import com.offlinemap.model.RegionStatus;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Region records, persisted as one JSON array under {@code offline_map_regions},
 * plus each region's downloaded tile list under {@code offline_map_tiles_<regionId>}.
 *
 * All access goes through this object's monitor; it is the single lock guarding
 * region state. Records returned to callers are copies.
 *
 * A record still DOWNLOADING when loaded belongs to a run that died with the previous
 * process. It is reopened as ERROR so it can be requested again.
 */
public class RegionDB {
    private static final Logger LOGGER = LoggerFactory.getLogger(RegionDB.class);
    public static final String REGIONS_KEY = "offline_map_regions";
    public static final String TILES_KEY_PREFIX = "offline_map_tiles";

    private static final Type REGION_LIST = new TypeToken<List<OfflineRegion>>() {}.getType();
    private static final Type TILE_LIST = new TypeToken<List<MapTile>>() {}.getType();

    private final JsonStore jsonStore;
    private final Map<String, OfflineRegion> regions = new LinkedHashMap<>();

    public RegionDB(JsonStore jsonStore) {
        this.jsonStore = jsonStore;
        load();
    }

    private synchronized void load() {
        List<OfflineRegion> stored = jsonStore.<List<OfflineRegion>>read(REGIONS_KEY, REGION_LIST)
                .orElse(Collections.emptyList());
        boolean interrupted = false;
        for (OfflineRegion region : stored) {
            if (region != null && region.getId() != null) {
                if (region.getStatus() == RegionStatus.DOWNLOADING) {
                    LOGGER.warn("Region {} was downloading when the store was closed, marked error", region.getId());
                    region.setStatus(RegionStatus.ERROR);
                    interrupted = true;
                }
                regions.put(region.getId(), region);
            }
        }
        if (interrupted) {
            save();
        }
    }

    public synchronized void save() {
        jsonStore.write(REGIONS_KEY, new ArrayList<>(regions.values()));
    }

    public synchronized Optional<OfflineRegion> findById(String regionId) {
        OfflineRegion region = regions.get(regionId);
        return region == null ? Optional.empty() : Optional.of(region.copy());
    }

    public synchronized List<OfflineRegion> findAll() {
        return regions.values().stream().map(OfflineRegion::copy).collect(Collectors.toList());
    }

    public synchronized List<OfflineRegion> findByStatus(RegionStatus status) {
        return regions.values().stream()
                .filter(r -> r.getStatus() == status)
                .map(OfflineRegion::copy)
                .collect(Collectors.toList());
    }

    public synchronized boolean contains(String regionId) {
        return regions.containsKey(regionId);
    }

    /** Inserts or replaces the record and persists. */
    public synchronized void insert(OfflineRegion region) {
        regions.put(region.getId(), region);
        save();
    }

    public synchronized boolean remove(String regionId) {
        boolean removed = regions.remove(regionId) != null;
        if (removed) {
            save();
        }
        return removed;
    }

    public synchronized void clear() {
        regions.clear();
        save();
    }

    /**
     * Applies {@code change} to the live record for {@code regionId} if it is still in
     * {@code expectedStatus}, and persists. Returns false when the guard fails.
     */
    public synchronized boolean atomicTransition(String regionId, RegionStatus expectedStatus,
                                                 Consumer<OfflineRegion> change) {
        OfflineRegion region = regions.get(regionId);
        if (region == null) return false;
        if (region.getStatus() != expectedStatus) return false;

        change.accept(region);
        save();
        return true;
    }

    /**
     * Mutates the live record in memory only (progress ticks). Returns false if the region is gone.
     */
    public synchronized boolean updateTransient(String regionId, Consumer<OfflineRegion> change) {
        OfflineRegion region = regions.get(regionId);
        if (region == null) return false;
        change.accept(region);
        return true;
    }

    /** Sum of estimated sizes over regions that occupy cache space. */
    public synchronized double totalCachedSizeMB() {
        double total = 0;
        for (OfflineRegion region : regions.values()) {
            if (region.getStatus() != null && region.getStatus().occupiesCache()) {
                total += region.getSizeInMB();
            }
        }
        return total;
    }

    // ==================== Tile lists ====================

    public void saveTiles(String regionId, List<MapTile> tiles) {
        jsonStore.write(tilesKey(regionId), tiles);
    }

    public List<MapTile> loadTiles(String regionId) {
        return jsonStore.<List<MapTile>>read(tilesKey(regionId), TILE_LIST).orElse(Collections.emptyList());
    }

    public void removeTiles(String regionId) {
        jsonStore.remove(tilesKey(regionId));
    }

    public static String tilesKey(String regionId) {
        return TILES_KEY_PREFIX + "_" + regionId;
    }

    public synchronized int size() { return regions.size(); }
}
