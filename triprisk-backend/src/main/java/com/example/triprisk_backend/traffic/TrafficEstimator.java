package com.example.triprisk_backend.traffic;

import com.example.triprisk_backend.TripProps;
import com.example.triprisk_backend.calendar.HolidayCalendar;
import com.example.triprisk_backend.geo.MetroAreas;
import com.example.triprisk_backend.geo.SamplePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.DayOfWeek;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Random;

/**
 * Traffic flow per point: live TomTom readings when a key is configured, otherwise (or
 * when TomTom fails) an estimate from time of day, day type, holidays and proximity to
 * the big metropolitan areas.
 */
@Service
public class TrafficEstimator {

    private static final Logger log = LoggerFactory.getLogger(TrafficEstimator.class);

    static final String HEURISTIC = "heuristic";
    static final double JITTER = 0.05;

    private final TomTomClient tomTom;
    private final ZoneId zone;
    private final Random random;

    @Autowired
    public TrafficEstimator(TomTomClient tomTom, TripProps props) {
        this(tomTom, props.zone(), new Random());
    }

    public TrafficEstimator(TomTomClient tomTom, ZoneId zone, Random random) {
        this.tomTom = tomTom;
        this.zone = zone;
        this.random = random;
    }

    public Mono<TrafficFlow> flowAt(double lat, double lon, OffsetDateTime when) {
        if (!tomTom.enabled()) return Mono.fromSupplier(() -> estimate(lat, lon, when));
        return tomTom.flow(lat, lon)
            .onErrorResume(e -> {
                log.warn("TomTom flow failed for {},{}: {}", lat, lon, e.toString());
                return Mono.empty();
            })
            .switchIfEmpty(Mono.fromSupplier(() -> estimate(lat, lon, when)));
    }

    /** Queries every sample at its own ETA, one at a time, and aggregates the route. */
    public Mono<TrafficReport> routeTraffic(List<SamplePoint> points) {
        return Flux.fromIterable(points)
            .concatMap(p -> flowAt(p.lat(), p.lon(), p.eta()).map(f -> toSample(p, f)))
            .collectList()
            .map(TrafficReport::of);
    }

    /** One colored segment per consecutive sample pair, estimated at the pair's start ETA. */
    public Mono<List<CongestionSegment>> congestionSegments(List<SamplePoint> points) {
        if (points.size() < 2) return Mono.just(List.of());
        return Flux.range(0, points.size() - 1)
            .concatMap(i -> {
                SamplePoint from = points.get(i);
                SamplePoint to = points.get(i + 1);
                return flowAt(from.lat(), from.lon(), from.eta()).map(f -> new CongestionSegment(
                    List.of(from.coordinate().toLonLat(), to.coordinate().toLonLat()),
                    f.congestionLevel(),
                    f.congestionRatio(),
                    f.currentSpeedKmh(),
                    f.congestionLevel().color()));
            })
            .collectList();
    }

    TrafficFlow estimate(double lat, double lon, OffsetDateTime when) {
        ZonedDateTime local = (when == null ? OffsetDateTime.now(zone) : when).atZoneSameInstant(zone);
        double ratio = congestionEstimate(lat, lon, local) + (random.nextDouble() * 2 - 1) * JITTER;
        ratio = Math.max(0, Math.min(1.0, ratio));

        double freeFlow = 80 + (random.nextDouble() * 20 - 10);
        double current = freeFlow * (1 - ratio);

        return new TrafficFlow(
            Math.round(Math.max(10, current) * 10) / 10.0,
            Math.round(freeFlow * 10) / 10.0,
            Math.round(ratio * 100) / 100.0,
            CongestionLevel.fromRatio(ratio),
            Math.round(ratio * 8 * 10) / 10.0,
            0.4,
            HEURISTIC
        );
    }

    /** Congestion ratio before jitter and clamping. */
    static double congestionEstimate(double lat, double lon, ZonedDateTime local) {
        int hour = local.getHour();
        double peak;
        if (hour >= 7 && hour <= 9) peak = 0.65;
        else if (hour >= 17 && hour <= 19) peak = 0.70;
        else if (hour >= 12 && hour <= 14) peak = 0.35;
        else if (hour >= 20 && hour <= 22) peak = 0.30;
        else peak = 0.15;

        DayOfWeek dow = local.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) peak *= 0.5;

        // long weekends jam the highways and empty the cities
        if (HolidayCalendar.isExtendedHoliday(local.toLocalDate())) {
            peak *= MetroAreas.isInterstateCorridor(lat, lon) ? 1.3 : 0.4;
        }
        return peak * MetroAreas.proximityFactor(lat, lon);
    }

    private static TrafficSample toSample(SamplePoint p, TrafficFlow f) {
        return new TrafficSample(p.lat(), p.lon(), p.eta(), f.currentSpeedKmh(), f.freeFlowSpeedKmh(),
            f.congestionRatio(), f.congestionLevel(), f.delayMinutes(), f.confidence(), f.source());
    }
}
