package com.offlinemap.model;

/**
 * A map tile addressed by zoom/x/y in the Web-Mercator grid.
 *
 * The world is divided into 2^z × 2^z tiles at zoom z:
 * - Zoom 0: 1 tile covers the entire world
 * - Zoom 10: ~1M tiles (region level)
 * - Zoom 18: ~69 billion tiles (street level)
 *
 * {@code path} is set once the tile has been written to local storage; only tiles
 * with a path are persisted in a region's tile list.
 */
public class MapTile {
    private final int z;
    private final int x;
    private final int y;
    private final String url;
    private String path;

    public MapTile(int z, int x, int y, String url) {
        this.z = z;
        this.x = x;
        this.y = y;
        this.url = url;
    }

    public int getZ() { return z; }
    public int getX() { return x; }
    public int getY() { return y; }
    public String getUrl() { return url; }
    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }

    /** Local file name: {@code <z>_<x>_<y>.png}. */
    public String fileName() {
        return String.format("%d_%d_%d.png", z, x, y);
    }

    @Override
    public String toString() {
        return String.format("Tile(z=%d, x=%d, y=%d) → %s", z, x, y, path != null ? path : url);
    }
}
