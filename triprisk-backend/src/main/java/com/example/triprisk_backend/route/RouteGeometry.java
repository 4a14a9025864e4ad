package com.example.triprisk_backend.route;

import com.example.triprisk_backend.geo.Coordinate;

import java.util.List;

/** A computed route. {@code engine} names the routing engine that produced it. */
public record RouteGeometry(List<Coordinate> coordinates, double distanceKm, double durationMin, String engine) {
    public RouteGeometry {
        coordinates = List.copyOf(coordinates);
    }
}
