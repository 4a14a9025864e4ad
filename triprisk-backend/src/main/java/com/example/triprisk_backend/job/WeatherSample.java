package com.example.triprisk_backend.job;

import com.example.triprisk_backend.weather.FogRisk;
import com.example.triprisk_backend.weather.RainRisk;

import java.time.OffsetDateTime;

/**
 * Forecast attached to one route sample.
 *
 * @param timestamp   ETA at the sample
 * @param description "departure", "arrival" or the trip progress as "NN%"
 */
public record WeatherSample(
    double lat,
    double lon,
    OffsetDateTime timestamp,
    double precipMm,
    int precipProb,
    Double temperatureC,
    Double windSpeedKmh,
    Integer humidityPercent,
    Integer visibilityM,
    FogRisk fogRisk,
    RainRisk rainRisk,
    String source,
    String description
) {}
