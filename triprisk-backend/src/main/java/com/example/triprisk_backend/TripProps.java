package com.example.triprisk_backend;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "trip")
public record TripProps(
    String timezone,
    Sampling sampling,
    Weather weather,
    Routing routing,
    Traffic traffic,
    Osm osm,
    Jobs jobs
) {
    public record Sampling(int maxPoints, double minDistanceKm) {}

    public record Weather(String openMeteoBaseUrl, String openWeatherBaseUrl, String openWeatherApiKey,
                          int maxAttempts, Duration backoffUnit, Duration cacheTtl, Duration maxForecastGap) {}

    public record Routing(String orsBaseUrl, String orsApiKey, String osrmBaseUrl) {}

    public record Traffic(String tomtomBaseUrl, String tomtomApiKey) {}

    public record Osm(String overpassUrl, String nominatimBaseUrl) {}

    // retention also bounds the durable mirror
    public record Jobs(long retentionSeconds, long sweepSeconds) {}

    public ZoneId zone() {
        return ZoneId.of(timezone);
    }

    public static boolean hasKey(String key) {
        return key != null && !key.isBlank();
    }
}
