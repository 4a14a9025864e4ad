package com.example.triprisk_backend.job;

import com.example.triprisk_backend.geo.Coordinate;
import com.example.triprisk_backend.route.RouteProfile;

import java.time.OffsetDateTime;

/**
 * @param departure null means "now"
 * @param profile   null means driving by car
 */
public record TripRequest(Coordinate origin, Coordinate destination, OffsetDateTime departure, RouteProfile profile) {
    public TripRequest {
        if (origin == null || destination == null) throw new IllegalArgumentException("origin and destination are required");
        if (profile == null) profile = RouteProfile.DRIVING_CAR;
    }
}
