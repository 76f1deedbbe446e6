package com.offlinemap.support;

import com.offlinemap.config.OfflineMapConfig;
import com.offlinemap.model.OfflineRegion;
import com.offlinemap.model.RegionBounds;
import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Shared fixtures.
 *
 * At zoom 3 the box 70..80N, 179W..10E spans tile columns 0..4 and rows 0..1: exactly 10 tiles.
 */
public final class TestRegions {

    public static final RegionBounds TEN_TILE_BOUNDS = RegionBounds.of(70, -179, 80, 10);
    public static final String TEMPLATE = "sim://{z}/{x}/{y}";

    public static final RegionBounds SEOUL_BOUNDS = RegionBounds.of(37.50, 126.90, 37.60, 127.00);

    private TestRegions() {}

    /** Zoom 3 only, simulated URLs. */
    public static OfflineMapConfig.Builder tenTileConfig() {
        return OfflineMapConfig.builder()
                .tileUrlTemplate(TEMPLATE)
                .minZoom(3)
                .maxZoom(3);
    }

    public static OfflineRegion tenTileRegion(String id, double sizeInMB) {
        return new OfflineRegion(id, "Region " + id, TEN_TILE_BOUNDS, sizeInMB);
    }

    public static OfflineRegion seoul() {
        return new OfflineRegion("seoul", "Seoul", SEOUL_BOUNDS, 50);
    }

    /** Polls until the condition holds; fails the test after the deadline. */
    public static void await(BooleanSupplier condition, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + timeout);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting", e);
            }
        }
    }
}
