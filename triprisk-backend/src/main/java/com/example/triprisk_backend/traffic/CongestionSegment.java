package com.example.triprisk_backend.traffic;

import java.util.List;

/**
 * Route stretch between two consecutive samples, colored by congestion.
 *
 * @param coordinates GeoJSON {@code [lon, lat]} pairs
 */
public record CongestionSegment(
    List<double[]> coordinates,
    CongestionLevel congestionLevel,
    double congestionRatio,
    double avgSpeedKmh,
    String color
) {}
