package com.offlinemap.model;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RegionBoundsTest {

    private final RegionBounds seoul = RegionBounds.of(37.50, 126.90, 37.60, 127.00);

    @Test
    void containsInteriorAndEdgePoints() {
        assertTrue(seoul.contains(new GeoPoint(37.55, 126.95)));
        assertTrue(seoul.contains(new GeoPoint(37.60, 127.00)));
        assertTrue(seoul.contains(new GeoPoint(37.50, 126.90)));
        assertFalse(seoul.contains(new GeoPoint(37.4999, 126.95)));
        assertFalse(seoul.contains(new GeoPoint(37.55, 127.0001)));
    }

    @Test
    void coversOnlyFullyContainedBoxes() {
        assertTrue(seoul.covers(RegionBounds.of(37.52, 126.92, 37.58, 126.98)));
        assertTrue(seoul.covers(seoul));
        assertFalse(seoul.covers(RegionBounds.of(37.55, 126.95, 37.65, 126.98)), "partial overlap");
        assertFalse(seoul.covers(RegionBounds.of(35.0, 128.9, 35.2, 129.1)));
    }

    @Test
    void rejectsSwappedCorners() {
        assertThrows(IllegalArgumentException.class, () -> RegionBounds.of(37.60, 126.90, 37.50, 127.00));
        assertThrows(IllegalArgumentException.class, () -> RegionBounds.of(37.50, 127.00, 37.60, 126.90));
    }
}
