package com.example.triprisk_backend.traffic;

import java.util.List;

public record TrafficReport(TrafficSummary summary, List<TrafficSample> samples) {

    static final double DEFAULT_SPEED_KMH = 60.0;

    public static TrafficReport empty() {
        return of(List.of());
    }

    public static TrafficReport of(List<TrafficSample> samples) {
        double speedSum = 0, ratioSum = 0, delay = 0;
        int speedCount = 0;
        for (TrafficSample s : samples) {
            if (s.currentSpeedKmh() > 0) {
                speedSum += s.currentSpeedKmh();
                speedCount++;
            }
            ratioSum += s.congestionRatio();
            delay += s.delayMinutes();
        }
        double avgSpeed = speedCount == 0 ? DEFAULT_SPEED_KMH : speedSum / speedCount;
        double avgRatio = samples.isEmpty() ? 0.0 : ratioSum / samples.size();

        TrafficSummary summary = new TrafficSummary(
            Math.round(avgSpeed * 10) / 10.0,
            Math.round(avgRatio * 100) / 100.0,
            CongestionLevel.fromRatio(avgRatio),
            Math.round(delay * 10) / 10.0,
            samples.size()
        );
        return new TrafficReport(summary, List.copyOf(samples));
    }
}
