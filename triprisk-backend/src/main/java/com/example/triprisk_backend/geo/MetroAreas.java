package com.example.triprisk_backend.geo;

import java.util.List;

/**
 * Major Brazilian metropolitan areas and the interstate corridors between them.
 * Used by the traffic heuristic and by the urban share of the signal delay estimate.
 */
public final class MetroAreas {

    public record Metro(String name, double lat, double lon) {}

    private record Corridor(String name, double minLat, double maxLat, double minLon, double maxLon) {
        boolean contains(double lat, double lon) {
            return lat > minLat && lat < maxLat && lon > minLon && lon < maxLon;
        }
    }

    public static final List<Metro> METROS = List.of(
        new Metro("São Paulo", -23.55, -46.63),
        new Metro("Rio de Janeiro", -22.91, -43.17),
        new Metro("Belo Horizonte", -19.92, -43.94),
        new Metro("Curitiba", -25.43, -49.27),
        new Metro("Porto Alegre", -30.03, -51.23),
        new Metro("Brasília", -15.78, -47.93),
        new Metro("Salvador", -12.97, -38.51),
        new Metro("Recife", -8.05, -34.87),
        new Metro("Fortaleza", -3.72, -38.52),
        new Metro("Campinas", -22.91, -47.06),
        new Metro("São José dos Campos", -23.18, -45.88)
    );

    private static final List<Corridor> CORRIDORS = List.of(
        new Corridor("Via Dutra (SP-RJ)", -23.6, -22.8, -46.7, -43.1),
        new Corridor("Bandeirantes/Anhanguera (SP-Campinas)", -23.6, -22.8, -47.2, -46.5),
        new Corridor("Régis Bittencourt (SP-Curitiba)", -25.5, -23.5, -49.5, -46.5)
    );

    private MetroAreas() {}

    // Planar degree distance is enough for bucketing
    public static double nearestMetroDegrees(double lat, double lon) {
        double min = Double.POSITIVE_INFINITY;
        for (Metro m : METROS) {
            min = Math.min(min, Math.hypot(lat - m.lat(), lon - m.lon()));
        }
        return min;
    }

    public static double proximityFactor(double lat, double lon) {
        double d = nearestMetroDegrees(lat, lon);
        if (d < 0.3) return 2.0;
        if (d < 0.8) return 1.5;
        if (d < 2.0) return 1.0;
        return 0.6;
    }

    public static boolean isUrban(double lat, double lon) {
        return proximityFactor(lat, lon) > 1.0;
    }

    public static boolean isInterstateCorridor(double lat, double lon) {
        for (Corridor c : CORRIDORS) {
            if (c.contains(lat, lon)) return true;
        }
        return false;
    }
}
