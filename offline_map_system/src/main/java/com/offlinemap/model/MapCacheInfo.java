package com.offlinemap.model;

/**
 * Catalog entry describing one saved map-graph snapshot.
 */
public class MapCacheInfo {
    private final long timestamp;
    private final long size;          // serialized length
    private final String name;
    private final int nodeCount;
    private final int roadSegmentCount;

    public MapCacheInfo(long timestamp, long size, String name, int nodeCount, int roadSegmentCount) {
        this.timestamp = timestamp;
        this.size = size;
        this.name = name;
        this.nodeCount = nodeCount;
        this.roadSegmentCount = roadSegmentCount;
    }

    public long getTimestamp() { return timestamp; }
    public long getSize() { return size; }
    public String getName() { return name; }
    public int getNodeCount() { return nodeCount; }
    public int getRoadSegmentCount() { return roadSegmentCount; }

    @Override
    public String toString() {
        return String.format("MapCache[%s: %d nodes, %d segments, %d bytes]",
                name, nodeCount, roadSegmentCount, size);
    }
}
