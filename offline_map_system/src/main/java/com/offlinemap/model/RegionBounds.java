package com.offlinemap.model;

/**
 * Rectangular bounding box given by its north-east and south-west corners.
 *
 * Containment uses closed intervals on both axes: a point on the edge is inside.
 */
public class RegionBounds {
    private final GeoPoint northeast;
    private final GeoPoint southwest;

    public RegionBounds(GeoPoint northeast, GeoPoint southwest) {
        if (northeast.getLatitude() < southwest.getLatitude()) {
            throw new IllegalArgumentException("Northeast latitude must not be below southwest latitude");
        }
        if (northeast.getLongitude() < southwest.getLongitude()) {
            throw new IllegalArgumentException("Northeast longitude must not be west of southwest longitude");
        }
        this.northeast = northeast;
        this.southwest = southwest;
    }

    /** Convenience factory: south, west, north, east. */
    public static RegionBounds of(double south, double west, double north, double east) {
        return new RegionBounds(new GeoPoint(north, east), new GeoPoint(south, west));
    }

    public GeoPoint getNortheast() { return northeast; }
    public GeoPoint getSouthwest() { return southwest; }

    public boolean contains(GeoPoint point) {
        return point.getLatitude() <= northeast.getLatitude()
                && point.getLatitude() >= southwest.getLatitude()
                && point.getLongitude() <= northeast.getLongitude()
                && point.getLongitude() >= southwest.getLongitude();
    }

    /** True iff {@code target} lies fully inside this box. Partial overlap is not coverage. */
    public boolean covers(RegionBounds target) {
        return target.southwest.getLatitude() >= southwest.getLatitude()
                && target.southwest.getLongitude() >= southwest.getLongitude()
                && target.northeast.getLatitude() <= northeast.getLatitude()
                && target.northeast.getLongitude() <= northeast.getLongitude();
    }

    @Override
    public String toString() {
        return String.format("[%s → %s]", southwest, northeast);
    }
}
