package com.example.triprisk_backend.traffic;

/** Flow reading for one point, live or estimated. */
public record TrafficFlow(
    double currentSpeedKmh,
    double freeFlowSpeedKmh,
    double congestionRatio,
    CongestionLevel congestionLevel,
    double delayMinutes,
    double confidence,
    String source
) {}
