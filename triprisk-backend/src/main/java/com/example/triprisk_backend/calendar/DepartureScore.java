package com.example.triprisk_backend.calendar;

public record DepartureScore(
    int departureHour,
    String departureLabel,
    double score,
    double avgFlowRatio,
    int estimatedExtraDelayMin,
    int estimatedTotalMin,
    String estimatedArrival,
    String safety
) {}
