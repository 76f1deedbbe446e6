package com.offlinemap.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed map graph: the nodes and road segments produced by the map-file parser.
 *
 * This is the unit the snapshot cache serializes; it is independent of tile caching.
 */
public class MapGraph {
    private final List<MapNode> nodes;
    private final List<RoadSegment> roadSegments;

    public MapGraph(List<MapNode> nodes, List<RoadSegment> roadSegments) {
        this.nodes = new ArrayList<>(nodes);
        this.roadSegments = new ArrayList<>(roadSegments);
    }

    public List<MapNode> getNodes() { return nodes; }
    public List<RoadSegment> getRoadSegments() { return roadSegments; }

    @Override
    public String toString() {
        return String.format("MapGraph[nodes=%d, segments=%d]",
                nodes == null ? 0 : nodes.size(), roadSegments == null ? 0 : roadSegments.size());
    }
}
