package com.example.triprisk_backend.job;

import com.example.triprisk_backend.geo.Coordinate;
import com.example.triprisk_backend.weather.RainRisk;

/** A run of consecutive weather samples sharing one rain risk. */
public record RouteSegment(Coordinate start, Coordinate end, boolean hasRain, RainRisk rainRisk, int pointCount) {}
