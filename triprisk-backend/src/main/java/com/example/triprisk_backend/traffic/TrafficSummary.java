package com.example.triprisk_backend.traffic;

public record TrafficSummary(
    double avgSpeedKmh,
    double avgCongestionRatio,
    CongestionLevel overallCongestion,
    double totalDelayMinutes,
    int samplesCount
) {}
