package com.example.triprisk_backend.geo;

public record Coordinate(double lat, double lon) {
    public Coordinate {
        if (Double.isNaN(lat) || lat < -90 || lat > 90) {
            throw new IllegalArgumentException("lat must be within [-90, 90], got " + lat);
        }
        if (Double.isNaN(lon) || lon < -180 || lon > 180) {
            throw new IllegalArgumentException("lon must be within [-180, 180], got " + lon);
        }
    }

    // GeoJSON order
    public double[] toLonLat() {
        return new double[]{lon, lat};
    }
}
