package com.offlinemap.model;

/**
 * An intersection or notable point of the parsed road network.
 */
public class MapNode {
    private final String id;
    private final GeoPoint coordinate;
    private final String name;

    public MapNode(String id, GeoPoint coordinate, String name) {
        this.id = id;
        this.coordinate = coordinate;
        this.name = name;
    }

    public String getId() { return id; }
    public GeoPoint getCoordinate() { return coordinate; }
    public String getName() { return name; }

    @Override
    public String toString() {
        return String.format("Node[%s %s]", id, coordinate);
    }
}
