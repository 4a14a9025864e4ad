package com.example.triprisk_backend.traffic;

/** An OSM traffic signal with a simulated light cycle, in seconds. */
public record TrafficSignalPoint(
    double lat,
    double lon,
    long osmId,
    String name,
    int greenDuration,
    int yellowDuration,
    int redDuration
) {}
