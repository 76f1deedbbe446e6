package com.offlinemap.model;

import java.util.Collections;
import java.util.List;

/**
 * A road segment (edge) of the parsed road network, between two nodes.
 */
public class RoadSegment {
    private final String id;
    private final String name;
    private final String startNodeId;
    private final String endNodeId;
    private final List<GeoPoint> path;
    private final double distance;     // meters
    private final double speedLimit;   // km/h
    private final String roadType;
    private final boolean oneWay;

    public RoadSegment(String id, String name, String startNodeId, String endNodeId,
                       List<GeoPoint> path, double distance, double speedLimit,
                       String roadType, boolean oneWay) {
        this.id = id;
        this.name = name;
        this.startNodeId = startNodeId;
        this.endNodeId = endNodeId;
        this.path = path;
        this.distance = distance;
        this.speedLimit = speedLimit;
        this.roadType = roadType;
        this.oneWay = oneWay;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getStartNodeId() { return startNodeId; }
    public String getEndNodeId() { return endNodeId; }
    public List<GeoPoint> getPath() { return path == null ? Collections.emptyList() : path; }
    public double getDistance() { return distance; }
    public double getSpeedLimit() { return speedLimit; }
    public String getRoadType() { return roadType; }
    public boolean isOneWay() { return oneWay; }

    @Override
    public String toString() {
        return String.format("%s → %s (%.0fm, %dkm/h)", startNodeId, endNodeId, distance, (int) speedLimit);
    }
}
