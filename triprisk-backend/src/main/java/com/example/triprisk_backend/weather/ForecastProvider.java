package com.example.triprisk_backend.weather;

import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;

/**
 * One source of forecasts in the provider chain.
 *
 * <p>{@link #fetchForecast} completes empty when the provider answered but had nothing
 * usable for the target time, and errors when the provider could not be reached.
 */
public interface ForecastProvider {

    String id();

    /** False for generated data that should lower the confidence of a result. */
    boolean authoritative();

    /** Disabled providers are skipped without being called. */
    default boolean enabled() {
        return true;
    }

    Mono<Forecast> fetchForecast(double lat, double lon, OffsetDateTime target);
}
