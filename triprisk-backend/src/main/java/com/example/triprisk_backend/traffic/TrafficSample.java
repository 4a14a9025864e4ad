package com.example.triprisk_backend.traffic;

import java.time.OffsetDateTime;

public record TrafficSample(
    double lat,
    double lon,
    OffsetDateTime eta,
    double currentSpeedKmh,
    double freeFlowSpeedKmh,
    double congestionRatio,
    CongestionLevel congestionLevel,
    double delayMinutes,
    double confidence,
    String source
) {}
