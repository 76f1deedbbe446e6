package com.offlinemap.tile;

import com.offlinemap.model.MapTile;
import com.offlinemap.model.RegionBounds;
import java.util.ArrayList;
import java.util.List;

/**
 * Web-Mercator tile math: geographic bounds + zoom → tile indices and back.
 *
 * At zoom z the world is a 2^z × 2^z grid; x grows eastward from -180°, y grows
 * southward from +85.0511°. Latitudes beyond the projection's limit are clamped.
 *
 * Region tile budget:
 *   cap per zoom = budget / (maxZoom - minZoom + 1)
 *   a zoom whose rectangle exceeds the cap is skipped, except the two finest zooms,
 *   so large areas lose their coarse levels first and stay near the budget.
 */
public final class TileCoordinateEngine {

    public static final double MAX_LATITUDE = 85.05112878;
    public static final int DEFAULT_TILE_BUDGET = 1000;
    public static final String DEFAULT_URL_TEMPLATE = "https://tile.openstreetmap.org/{z}/{x}/{y}.png";

    private TileCoordinateEngine() {}

    /** Convert longitude to tile X coordinate */
    public static int lon2tile(double lon, int zoom) {
        int n = 1 << zoom;
        int x = (int) Math.floor((lon + 180.0) / 360.0 * n);
        return clamp(x, n);
    }

    /** Convert latitude to tile Y coordinate */
    public static int lat2tile(double lat, int zoom) {
        int n = 1 << zoom;
        double latRad = Math.toRadians(Math.max(-MAX_LATITUDE, Math.min(MAX_LATITUDE, lat)));
        int y = (int) Math.floor((1.0 - Math.log(Math.tan(latRad) + 1.0 / Math.cos(latRad))
                / Math.PI) / 2.0 * n);
        return clamp(y, n);
    }

    /** Longitude of the west edge of tile column x */
    public static double tile2lon(int x, int zoom) {
        return x / Math.pow(2, zoom) * 360.0 - 180.0;
    }

    /** Latitude of the north edge of tile row y */
    public static double tile2lat(int y, int zoom) {
        double n = Math.PI - 2.0 * Math.PI * y / Math.pow(2, zoom);
        return Math.toDegrees(Math.atan(Math.sinh(n)));
    }

    public static String resolveUrl(String template, int z, int x, int y) {
        return template
                .replace("{z}", Integer.toString(z))
                .replace("{x}", Integer.toString(x))
                .replace("{y}", Integer.toString(y));
    }

    public static List<MapTile> tilesForRegion(RegionBounds bounds, int minZoom, int maxZoom) {
        return tilesForRegion(bounds, minZoom, maxZoom, DEFAULT_TILE_BUDGET, DEFAULT_URL_TEMPLATE);
    }

    /**
     * Every tile to download for {@code bounds} over {@code [minZoom, maxZoom]}, coarsest zoom first.
     */
    public static List<MapTile> tilesForRegion(RegionBounds bounds, int minZoom, int maxZoom,
                                               int tileBudget, String urlTemplate) {
        if (minZoom < 0 || maxZoom < minZoom) {
            throw new IllegalArgumentException("Invalid zoom range " + minZoom + ".." + maxZoom);
        }
        double maxTilesForZoom = (double) tileBudget / (maxZoom - minZoom + 1);
        List<MapTile> tiles = new ArrayList<>();

        for (int z = minZoom; z <= maxZoom; z++) {
            int minX = lon2tile(bounds.getSouthwest().getLongitude(), z);
            int maxX = lon2tile(bounds.getNortheast().getLongitude(), z);
            int minY = lat2tile(bounds.getNortheast().getLatitude(), z);
            int maxY = lat2tile(bounds.getSouthwest().getLatitude(), z);

            long tilesForZoom = (long) (maxX - minX + 1) * (maxY - minY + 1);
            if (tilesForZoom > maxTilesForZoom && z <= maxZoom - 2) {
                continue;
            }

            for (int x = minX; x <= maxX; x++) {
                for (int y = minY; y <= maxY; y++) {
                    tiles.add(new MapTile(z, x, y, resolveUrl(urlTemplate, z, x, y)));
                }
            }
        }
        return tiles;
    }

    private static int clamp(int index, int n) {
        return Math.max(0, Math.min(n - 1, index));
    }
}
