package com.example.triprisk_backend.geo;

import java.time.OffsetDateTime;

/**
 * A sampled route position with its estimated time of arrival.
 *
 * @param index    position in the sampled list, starting at 0
 * @param progress fraction of the trip elapsed at this point, in [0, 1]
 */
public record SamplePoint(int index, double progress, Coordinate coordinate, OffsetDateTime eta) {

    public double lat() {return coordinate.lat();}

    public double lon() {return coordinate.lon();}
}
