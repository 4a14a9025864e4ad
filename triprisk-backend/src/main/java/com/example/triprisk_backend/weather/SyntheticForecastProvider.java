package com.example.triprisk_backend.weather;

import com.example.triprisk_backend.TripProps;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Random;

/**
 * Last resort of the chain. Generates plausible Brazilian weather: rain most likely in
 * the afternoon, fog in cold early mornings. Seeded from the rounded position and hour,
 * so the same query always yields the same forecast.
 */
@Component
public class SyntheticForecastProvider implements ForecastProvider {

    static final String ID = "synthetic";

    private final ZoneId zone;

    @Autowired
    public SyntheticForecastProvider(TripProps props) {
        this(props.zone());
    }

    SyntheticForecastProvider(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public String id() {return ID;}

    @Override
    public boolean authoritative() {return false;}

    @Override
    public Mono<Forecast> fetchForecast(double lat, double lon, OffsetDateTime target) {
        return Mono.fromSupplier(() -> generate(lat, lon, target));
    }

    Forecast generate(double lat, double lon, OffsetDateTime target) {
        Random random = new Random(ForecastKey.of(lat, lon, target, zone).hashCode());
        int hour = target.atZoneSameInstant(zone).getHour();

        int baseProb;
        double baseMm;
        if (hour >= 14 && hour <= 18) {
            baseProb = 55; baseMm = 2.0;
        } else if (hour >= 6 && hour <= 10) {
            baseProb = 25; baseMm = 0.8;
        } else {
            baseProb = 12; baseMm = 0.3;
        }

        int prob = Math.max(0, Math.min(100, baseProb + random.nextInt(31) - 15));
        double mm = prob > 30 ? round1(Math.max(0, baseMm - 0.5 + random.nextDouble() * 1.5)) : 0.0;

        boolean foggy = hour <= 8 && random.nextDouble() < 0.15;
        int visibility = foggy ? 300 + random.nextInt(501) : 8000 + random.nextInt(17001);

        return new Forecast(
            round1(18 + random.nextDouble() * 14),
            prob,
            mm,
            round1(5 + random.nextDouble() * 20),
            40 + random.nextInt(56),
            visibility,
            FogRisk.classify(visibility, null),
            target,
            ID
        );
    }

    private static double round1(double v) {
        return Math.round(v * 10) / 10.0;
    }
}
