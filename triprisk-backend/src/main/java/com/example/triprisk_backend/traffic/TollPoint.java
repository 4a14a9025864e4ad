package com.example.triprisk_backend.traffic;

public record TollPoint(double lat, double lon, String name, String operator) {}
