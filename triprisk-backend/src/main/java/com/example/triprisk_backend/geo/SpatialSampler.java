package com.example.triprisk_backend.geo;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Reduces a route polyline to evenly spaced sample points.
 *
 * <p>Long trips (over 300 km) are sampled roughly every 50 km, shorter ones every 30 km,
 * never fewer than 3 points and never more than {@code maxPoints}. Indices are spread
 * linearly over the raw vertex array, so on short arrays deduplication may return fewer
 * points than targeted.
 */
public final class SpatialSampler {

    static final double LONG_TRIP_KM = 300.0;
    static final double LONG_STEP_KM = 50.0;
    static final double SHORT_STEP_KM = 30.0;

    private SpatialSampler() {}

    public static List<Coordinate> sample(List<Coordinate> raw, int maxPoints, double minDistanceKm) {
        if (raw == null || raw.size() < 2) return raw == null ? List.of() : List.copyOf(raw);
        if (maxPoints < 1) throw new IllegalArgumentException("maxPoints must be positive");

        double totalKm = GeoMath.pathLengthKm(raw);
        int target = targetCount(totalKm, maxPoints);

        if (raw.size() <= target) return List.copyOf(raw);

        TreeSet<Integer> indices = new TreeSet<>();
        int last = raw.size() - 1;
        for (int i = 0; i < target; i++) {
            double t = target == 1 ? 0 : (double) i / (target - 1);
            indices.add((int) (t * last));
        }
        List<Coordinate> out = new ArrayList<>(indices.size());
        for (int idx : indices) out.add(raw.get(idx));
        return out;
    }

    static int targetCount(double totalKm, int maxPoints) {
        double step = totalKm > LONG_TRIP_KM ? LONG_STEP_KM : SHORT_STEP_KM;
        int estimated = Math.max(3, (int) Math.floor(totalKm / step) + 1);
        return Math.min(maxPoints, estimated);
    }

    /** Attaches linear-progress ETAs to sampled points. */
    public static List<SamplePoint> withEtas(List<Coordinate> points, OffsetDateTime departure, double durationMin) {
        List<SamplePoint> out = new ArrayList<>(points.size());
        int n = points.size();
        for (int i = 0; i < n; i++) {
            double progress = (double) i / Math.max(n - 1, 1);
            long offsetSeconds = Math.round(progress * durationMin * 60.0);
            out.add(new SamplePoint(i, progress, points.get(i), departure.plusSeconds(offsetSeconds)));
        }
        return out;
    }
}
