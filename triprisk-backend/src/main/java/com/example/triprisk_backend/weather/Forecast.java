package com.example.triprisk_backend.weather;

import java.time.OffsetDateTime;

/**
 * Provider-independent forecast for one place and hour.
 *
 * @param source tag of the provider that produced it
 */
public record Forecast(
    Double temperatureC,
    int precipProbability,
    double precipMm,
    Double windSpeedKmh,
    Integer humidityPercent,
    Integer visibilityM,
    FogRisk fogRisk,
    OffsetDateTime forecastTime,
    String source
) {
    public RainRisk rainRisk() {
        return RainRisk.classify(precipProbability, precipMm);
    }
}
