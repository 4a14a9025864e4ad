package com.example.triprisk_backend.job;

import com.example.triprisk_backend.TripProps;
import com.example.triprisk_backend.geo.BoundingBox;
import com.example.triprisk_backend.geo.Coordinate;
import com.example.triprisk_backend.geo.SamplePoint;
import com.example.triprisk_backend.geo.SpatialSampler;
import com.example.triprisk_backend.route.RouteGeometry;
import com.example.triprisk_backend.route.RouteGeometryProvider;
import com.example.triprisk_backend.route.RouteUnavailableException;
import com.example.triprisk_backend.traffic.OverpassClient;
import com.example.triprisk_backend.traffic.TomTomClient;
import com.example.triprisk_backend.traffic.TrafficEstimator;
import com.example.triprisk_backend.traffic.TrafficReport;
import com.example.triprisk_backend.weather.ForecastAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Runs one trip analysis per submitted request: route, sampling, per-point forecasts in
 * route order, then traffic and the secondary lookups side by side. The job ends either
 * completed with the whole payload or failed with a message, never half-filled.
 */
@Service
public class JobOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    private final RouteGeometryProvider routes;
    private final ForecastAggregator forecasts;
    private final TrafficEstimator traffic;
    private final TomTomClient tomTom;
    private final OverpassClient overpass;
    private final JobStore store;
    private final TripProps props;

    private final Map<String, CompletableFuture<Void>> running = new ConcurrentHashMap<>();

    public JobOrchestrator(RouteGeometryProvider routes,
                           ForecastAggregator forecasts,
                           TrafficEstimator traffic,
                           TomTomClient tomTom,
                           OverpassClient overpass,
                           JobStore store,
                           TripProps props) {
        this.routes = routes;
        this.forecasts = forecasts;
        this.traffic = traffic;
        this.tomTom = tomTom;
        this.overpass = overpass;
        this.store = store;
        this.props = props;
    }

    /** Registers a pending job and starts its pipeline; returns without waiting for it. */
    public JobHandle submit(TripRequest request) {
        Job job = store.create();
        String id = job.id();
        CompletableFuture<Void> done = run(id, request).toFuture();
        running.put(id, done);
        done.whenComplete((v, e) -> running.remove(id));
        return new JobHandle(id, done);
    }

    public int runningCount() {
        return running.size();
    }

    Mono<Void> run(String jobId, TripRequest request) {
        ZoneId zone = props.zone();
        OffsetDateTime departure = request.departure() == null
            ? OffsetDateTime.now(zone)
            : request.departure().atZoneSameInstant(zone).toOffsetDateTime();

        return Mono.fromRunnable(() -> store.markProcessing(jobId))
            .then(routes.calculateRoute(request.origin(), request.destination(), request.profile()))
            .switchIfEmpty(Mono.error(() -> new RouteUnavailableException("No route returned")))
            .flatMap(route -> analyse(jobId, route, departure))
            .doOnNext(result -> store.complete(jobId, result))
            .flatMap(result -> store.persist(jobId))
            .onErrorResume(e -> {
                log.warn("Job {} pipeline failed: {}", jobId, e.toString());
                store.fail(jobId, e.getMessage() == null ? e.toString() : e.getMessage());
                return store.persist(jobId);
            });
    }

    private Mono<TripResult> analyse(String jobId, RouteGeometry route, OffsetDateTime departure) {
        if (route.coordinates().isEmpty()) {
            return Mono.error(new RouteUnavailableException("Route from " + route.engine() + " has no geometry"));
        }
        List<Coordinate> picked = SpatialSampler.sample(route.coordinates(),
            props.sampling().maxPoints(), props.sampling().minDistanceKm());
        List<SamplePoint> points = SpatialSampler.withEtas(picked, departure, route.durationMin());
        log.info("Job {}: {} route via {} ({} km), {} sample points",
            jobId, route.coordinates().size(), route.engine(), route.distanceKm(), points.size());

        // one forecast at a time so the samples keep route order
        return Flux.fromIterable(points)
            .concatMap(p -> forecasts.forecast(p.lat(), p.lon(), p.eta())
                .map(f -> TripReportAssembler.weatherSample(p, points.size(), f)))
            .collectList()
            .flatMap(weather -> {
                // lookups are bounded by the sampled points, not every route vertex
                BoundingBox box = BoundingBox.around(picked);
                return Mono.zip(
                        traffic.routeTraffic(points).onErrorResume(degraded(jobId, "route traffic", TrafficReport.empty())),
                        overpass.tollPoints(box).onErrorResume(degraded(jobId, "tolls", List.of())),
                        tomTom.incidents(box).onErrorResume(degraded(jobId, "incidents", List.of())),
                        traffic.congestionSegments(points).onErrorResume(degraded(jobId, "congestion segments", List.of())),
                        overpass.trafficSignals(box).onErrorResume(degraded(jobId, "traffic signals", List.of())))
                    .map(t -> TripReportAssembler.assemble(route, points, weather, forecasts.authoritativeSources(),
                        t.getT1(), t.getT2(), t.getT3(), t.getT4(), t.getT5()));
            });
    }

    private static <T> Function<Throwable, Mono<T>> degraded(String jobId, String what, T fallback) {
        return e -> {
            log.warn("Job {}: {} unavailable, continuing without: {}", jobId, what, e.toString());
            return Mono.just(fallback);
        };
    }
}
