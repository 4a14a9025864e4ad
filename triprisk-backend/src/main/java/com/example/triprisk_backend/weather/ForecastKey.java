package com.example.triprisk_backend.weather;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/** Coordinates rounded to 3 decimals (about 110 m) plus the local hour of the target time. */
public record ForecastKey(double lat, double lon, String hourBucket) {

    private static final DateTimeFormatter HOUR_BUCKET = DateTimeFormatter.ofPattern("yyyyMMddHH");

    public static ForecastKey of(double lat, double lon, OffsetDateTime target, ZoneId zone) {
        return new ForecastKey(round3(lat), round3(lon), target.atZoneSameInstant(zone).format(HOUR_BUCKET));
    }

    private static double round3(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
