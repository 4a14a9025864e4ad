package com.example.triprisk_backend.geo;

import java.util.List;

public final class GeoMath {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoMath() {}

    // Haversine distance in km
    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat/2)*Math.sin(dLat/2)
                 + Math.cos(Math.toRadians(lat1))*Math.cos(Math.toRadians(lat2))
                 * Math.sin(dLon/2)*Math.sin(dLon/2);
        return 2 * EARTH_RADIUS_KM * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }

    public static double haversineKm(Coordinate a, Coordinate b) {
        return haversineKm(a.lat(), a.lon(), b.lat(), b.lon());
    }

    public static double pathLengthKm(List<Coordinate> path) {
        double total = 0;
        for (int i = 1; i < path.size(); i++) {
            total += haversineKm(path.get(i - 1), path.get(i));
        }
        return total;
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
