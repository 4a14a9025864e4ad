package com.example.triprisk_backend.weather;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.OptionalInt;

final class ForecastSeries {

    private ForecastSeries() {}

    /**
     * Index of the entry closest to {@code target}, or empty when even the closest one is
     * {@code maxGap} or further away.
     */
    static OptionalInt closestIndex(List<OffsetDateTime> times, OffsetDateTime target, Duration maxGap) {
        int best = -1;
        long bestDiff = Long.MAX_VALUE;
        for (int i = 0; i < times.size(); i++) {
            OffsetDateTime t = times.get(i);
            if (t == null) continue;
            long diff = Math.abs(Duration.between(t, target).getSeconds());
            if (diff < bestDiff) {
                bestDiff = diff;
                best = i;
            }
        }
        if (best < 0 || bestDiff >= maxGap.getSeconds()) return OptionalInt.empty();
        return OptionalInt.of(best);
    }
}
