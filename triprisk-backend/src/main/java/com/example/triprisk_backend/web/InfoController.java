package com.example.triprisk_backend.web;

import com.example.triprisk_backend.TripProps;
import com.example.triprisk_backend.geocoding.GeocodingClient;
import com.example.triprisk_backend.geocoding.Place;
import com.example.triprisk_backend.job.JobOrchestrator;
import com.example.triprisk_backend.job.JobStore;
import com.example.triprisk_backend.weather.ForecastCache;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class InfoController {

    public record HealthReport(String status, String store, String timezone, Map<String, String> apis, long activeJobs) {}

    public record MetricsReport(long cacheHits, long cacheMisses, long activeJobs, int runningPipelines) {}

    private final JobStore store;
    private final JobOrchestrator orchestrator;
    private final ForecastCache forecastCache;
    private final GeocodingClient geocoding;
    private final TripProps props;

    public InfoController(JobStore store,
                          JobOrchestrator orchestrator,
                          ForecastCache forecastCache,
                          GeocodingClient geocoding,
                          TripProps props) {
        this.store = store;
        this.orchestrator = orchestrator;
        this.forecastCache = forecastCache;
        this.geocoding = geocoding;
        this.props = props;
    }

    @GetMapping("/health")
    public HealthReport health() {
        Map<String, String> apis = new LinkedHashMap<>();
        apis.put("openroute", TripProps.hasKey(props.routing().orsApiKey()) ? "configured" : "missing_key");
        apis.put("osrm_fallback", "available");
        apis.put("open_meteo", "available");
        apis.put("openweather", TripProps.hasKey(props.weather().openWeatherApiKey()) ? "configured" : "not_configured");
        apis.put("tomtom_traffic", TripProps.hasKey(props.traffic().tomtomApiKey()) ? "configured" : "heuristic_fallback");
        return new HealthReport("healthy", store.isConnected() ? "connected" : "memory_only",
            props.timezone(), apis, store.activeJobs());
    }

    @GetMapping("/metrics")
    public MetricsReport metrics() {
        return new MetricsReport(forecastCache.hitCount(), forecastCache.missCount(),
            store.activeJobs(), orchestrator.runningCount());
    }

    @GetMapping("/geocode")
    public Mono<List<Place>> geocode(@RequestParam String q, @RequestParam(defaultValue = "5") int limit) {
        return geocoding.search(q, limit);
    }
}
