package com.example.triprisk_backend.geo;

import java.util.List;

public record BoundingBox(double minLat, double minLon, double maxLat, double maxLon) {

    public static BoundingBox around(List<Coordinate> points) {
        if (points.isEmpty()) throw new IllegalArgumentException("cannot bound an empty point list");
        double minLat = Double.POSITIVE_INFINITY, minLon = Double.POSITIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY, maxLon = Double.NEGATIVE_INFINITY;
        for (Coordinate c : points) {
            minLat = Math.min(minLat, c.lat());
            minLon = Math.min(minLon, c.lon());
            maxLat = Math.max(maxLat, c.lat());
            maxLon = Math.max(maxLon, c.lon());
        }
        return new BoundingBox(minLat, minLon, maxLat, maxLon);
    }

    public BoundingBox expand(double degrees) {
        return new BoundingBox(minLat - degrees, minLon - degrees, maxLat + degrees, maxLon + degrees);
    }

    // Overpass wants (south,west,north,east)
    public String toOverpass() {
        return minLat + "," + minLon + "," + maxLat + "," + maxLon;
    }

    // TomTom incidents want minLon,minLat,maxLon,maxLat
    public String toLonLatBbox() {
        return minLon + "," + minLat + "," + maxLon + "," + maxLat;
    }
}
