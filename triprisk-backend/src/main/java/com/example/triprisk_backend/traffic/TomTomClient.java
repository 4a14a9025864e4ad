package com.example.triprisk_backend.traffic;

import com.example.triprisk_backend.TripProps;
import com.example.triprisk_backend.geo.BoundingBox;
import com.example.triprisk_backend.upstream.UpstreamErrors;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** TomTom traffic flow and incident details. Both need an API key. */
@Component
public class TomTomClient {

    static final String SOURCE = "tomtom";
    // flow readings cover roughly 5 km of road
    static final double SEGMENT_KM = 5.0;

    private static final Map<Integer, String> INCIDENT_TYPES = Map.ofEntries(
        Map.entry(0, "Unknown"), Map.entry(1, "Accident"), Map.entry(2, "Fog"),
        Map.entry(3, "Dangerous conditions"), Map.entry(4, "Road works"), Map.entry(5, "Lane closed"),
        Map.entry(6, "Jam"), Map.entry(7, "Event"), Map.entry(8, "Ice"), Map.entry(9, "Heavy rain"));
    private static final Map<Integer, String> SEVERITIES = Map.of(
        0, "minor", 1, "minor", 2, "moderate", 3, "major", 4, "severe");

    private final WebClient http;
    private final TripProps props;

    public TomTomClient(WebClient http, TripProps props) {
        this.http = http;
        this.props = props;
    }

    public boolean enabled() {
        return TripProps.hasKey(props.traffic().tomtomApiKey());
    }

    // Flow call with timeout; retry only timeouts/5xx
    public Mono<TrafficFlow> flow(double lat, double lon) {
        return http.get()
            .uri(props.traffic().tomtomBaseUrl() + "/traffic/services/4/flowSegmentData/absolute/10/json", u -> u
                .queryParam("point", lat + "," + lon) // Flow wants lat,lon
                .queryParam("unit", "KMPH")
                .queryParam("key", props.traffic().tomtomApiKey()).build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofSeconds(6))
            .retryWhen(Retry.backoff(2, Duration.ofMillis(200)).filter(UpstreamErrors::isRetryable))
            .onErrorMap(e -> UpstreamErrors.classify(SOURCE, e))
            .map(TomTomClient::parseFlow);
    }

    static TrafficFlow parseFlow(JsonNode json) {
        JsonNode flow = json.path("flowSegmentData");
        double current = flow.path("currentSpeed").asDouble(60);
        double freeFlow = flow.path("freeFlowSpeed").asDouble(80);

        double ratio = Math.max(0, 1 - current / Math.max(freeFlow, 1));
        double delayPerKm = (1 / Math.max(current, 1) - 1 / Math.max(freeFlow, 1)) * 60;

        return new TrafficFlow(
            Math.round(current * 10) / 10.0,
            Math.round(freeFlow * 10) / 10.0,
            Math.round(ratio * 100) / 100.0,
            CongestionLevel.fromRatio(ratio),
            Math.round(Math.max(0, delayPerKm * SEGMENT_KM) * 10) / 10.0,
            flow.path("confidence").asDouble(0.8),
            SOURCE
        );
    }

    /** Current incidents in the box; empty without a key. */
    public Mono<List<IncidentPoint>> incidents(BoundingBox bbox) {
        if (!enabled()) return Mono.just(List.of());

        // Incidents v5: encode "fields" to avoid { } template expansion; bbox must be lon,lat order
        String fields = "{incidents{geometry{type,coordinates},properties{iconCategory,magnitudeOfDelay,events{description},delay}}}";
        String uri = props.traffic().tomtomBaseUrl() + "/traffic/services/5/incidentDetails"
                   + "?bbox=" + URLEncoder.encode(bbox.toLonLatBbox(), StandardCharsets.UTF_8)
                   + "&timeValidityFilter=present"
                   + "&fields=" + URLEncoder.encode(fields, StandardCharsets.UTF_8)
                   + "&key=" + URLEncoder.encode(props.traffic().tomtomApiKey(), StandardCharsets.UTF_8);

        return http.get()
            .uri(URI.create(uri))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofSeconds(8))
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300)).filter(UpstreamErrors::isRetryable))
            .onErrorMap(e -> UpstreamErrors.classify(SOURCE, e))
            .map(TomTomClient::parseIncidents);
    }

    static List<IncidentPoint> parseIncidents(JsonNode json) {
        List<IncidentPoint> out = new ArrayList<>();
        JsonNode arr = json.path("incidents");
        if (!arr.isArray()) return out;
        for (JsonNode one : arr) {
            JsonNode coords = one.path("geometry").path("coordinates");
            double[] lonLat = firstLonLat(coords);
            if (lonLat == null) continue;

            JsonNode p = one.path("properties");
            int category = p.path("iconCategory").asInt(0);
            JsonNode events = p.path("events");
            String description = events.isArray() && !events.isEmpty() ? events.get(0).path("description").asText("") : "";
            out.add(new IncidentPoint(
                lonLat[1],
                lonLat[0],
                INCIDENT_TYPES.getOrDefault(category, "Incident"),
                SEVERITIES.getOrDefault(p.path("magnitudeOfDelay").asInt(0), "unknown"),
                description,
                Math.round(p.path("delay").asDouble(0) / 60.0 * 10) / 10.0
            ));
        }
        return out;
    }

    // Point geometries are [lon,lat]; LineStrings start with one
    private static double[] firstLonLat(JsonNode coords) {
        if (!coords.isArray() || coords.isEmpty()) return null;
        JsonNode first = coords.get(0);
        if (first.isNumber() && coords.size() >= 2 && coords.get(1).isNumber()) {
            return new double[]{first.asDouble(), coords.get(1).asDouble()};
        }
        if (first.isArray() && first.size() >= 2) {
            return new double[]{first.get(0).asDouble(), first.get(1).asDouble()};
        }
        return null;
    }
}
