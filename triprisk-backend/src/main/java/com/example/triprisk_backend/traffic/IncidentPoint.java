package com.example.triprisk_backend.traffic;

public record IncidentPoint(double lat, double lon, String type, String severity, String description, double delayMinutes) {}
