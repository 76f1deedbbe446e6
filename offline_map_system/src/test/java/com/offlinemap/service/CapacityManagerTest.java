package com.offlinemap.service;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.offlinemap.exception.ErrorCode;
import com.offlinemap.exception.QuotaExceededException;
import com.offlinemap.model.OfflineRegion;
import com.offlinemap.model.RegionStatus;
import com.offlinemap.storage.InMemoryKeyValueStore;
import com.offlinemap.storage.JsonStore;
import com.offlinemap.storage.RegionDB;
import com.offlinemap.support.TestRegions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CapacityManagerTest {

    private RegionDB regionDB;
    private CapacityManager capacity;

    @BeforeEach
    void setUp() {
        regionDB = new RegionDB(new JsonStore(new InMemoryKeyValueStore()));
        capacity = new CapacityManager(regionDB, 100);
    }

    private void add(String id, RegionStatus status, double size) {
        OfflineRegion region = TestRegions.tenTileRegion(id, size);
        region.setStatus(status);
        regionDB.insert(region);
    }

    @Test
    void usageIgnoresRegionsWithoutCachedData() {
        add("a", RegionStatus.AVAILABLE, 40);
        add("b", RegionStatus.OUTDATED, 20);
        add("c", RegionStatus.DOWNLOADING, 500);
        add("d", RegionStatus.ERROR, 500);

        assertEquals(60, capacity.getTotalCacheSize(), 1e-9);
        assertEquals(40, capacity.getRemainingCapacity(), 1e-9);
    }

    @Test
    void limitIsInclusive() {
        add("a", RegionStatus.AVAILABLE, 60);

        assertDoesNotThrow(() -> capacity.checkCapacity(40));
        QuotaExceededException e = assertThrows(QuotaExceededException.class, () -> capacity.checkCapacity(40.5));
        assertEquals(ErrorCode.QUOTA_EXCEEDED, e.getCode());
        assertEquals("Quota exceeded: limit 100.0MB, requested 40.5MB (60.0MB in use)", e.getMessage());
    }

    @Test
    void limitCanBeChanged() {
        add("a", RegionStatus.AVAILABLE, 60);

        capacity.setMaxCacheSize(50);

        assertEquals(50, capacity.getMaxCacheSize());
        assertEquals(0, capacity.getRemainingCapacity());
        assertThrows(QuotaExceededException.class, () -> capacity.checkCapacity(1));
        assertThrows(IllegalArgumentException.class, () -> capacity.setMaxCacheSize(-1));
        assertTrue(capacity.getStats().contains("60.0MB / 50.0MB"));
    }
}
