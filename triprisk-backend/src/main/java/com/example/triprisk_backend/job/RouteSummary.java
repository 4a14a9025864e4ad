package com.example.triprisk_backend.job;

import com.example.triprisk_backend.weather.FogRisk;
import com.example.triprisk_backend.weather.RainRisk;

import java.util.List;

public record RouteSummary(
    double distanceKm,
    double durationMinutes,
    int totalSamples,
    int rainSamples,          // precipitation probability above 20%
    RainRisk overallRisk,
    FogRisk fogRisk,
    String recommendation,
    double confidence,
    List<String> sources,
    double trafficLightsDelayMinutes
) {}
