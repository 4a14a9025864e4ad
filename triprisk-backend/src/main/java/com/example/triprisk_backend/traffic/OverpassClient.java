package com.example.triprisk_backend.traffic;

import com.example.triprisk_backend.TripProps;
import com.example.triprisk_backend.geo.BoundingBox;
import com.example.triprisk_backend.upstream.UpstreamErrors;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * OpenStreetMap Overpass queries for toll booths and traffic signals. Keyless, with an
 * implicit rate limit, so callers must tolerate failures.
 */
@Component
public class OverpassClient {

    static final String SOURCE = "overpass";
    // about 11 km, catches plazas just off the sampled line
    static final double TOLL_MARGIN_DEG = 0.1;
    static final int YELLOW_SECONDS = 3;

    private final WebClient http;
    private final TripProps props;

    public OverpassClient(WebClient http, TripProps props) {
        this.http = http;
        this.props = props;
    }

    public Mono<List<TollPoint>> tollPoints(BoundingBox routeBox) {
        String bbox = routeBox.expand(TOLL_MARGIN_DEG).toOverpass();
        String query = "[out:json][timeout:15];"
            + "(node[\"barrier\"=\"toll_booth\"](" + bbox + ");"
            + "way[\"barrier\"=\"toll_booth\"](" + bbox + "););"
            + "out center;";
        return interpret(query).map(OverpassClient::parseTolls);
    }

    public Mono<List<TrafficSignalPoint>> trafficSignals(BoundingBox routeBox) {
        String query = "[out:json][timeout:15];"
            + "node[\"highway\"=\"traffic_signals\"](" + routeBox.toOverpass() + ");"
            + "out body;";
        return interpret(query).map(OverpassClient::parseSignals);
    }

    private Mono<JsonNode> interpret(String query) {
        return http.post()
            .uri(props.osm().overpassUrl())
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .body(BodyInserters.fromFormData("data", query))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofSeconds(20))
            .onErrorMap(e -> UpstreamErrors.classify(SOURCE, e));
    }

    static List<TollPoint> parseTolls(JsonNode json) {
        List<TollPoint> out = new ArrayList<>();
        for (JsonNode el : json.path("elements")) {
            // nodes carry lat/lon, ways only their computed center
            JsonNode pos = el.has("lat") ? el : el.path("center");
            if (!pos.path("lat").isNumber() || !pos.path("lon").isNumber()) continue;
            JsonNode tags = el.path("tags");
            String name = firstNonBlank(tags.path("name").asText(""), tags.path("ref").asText(""),
                tags.path("operator").asText(""), "Toll plaza");
            out.add(new TollPoint(pos.path("lat").asDouble(), pos.path("lon").asDouble(), name,
                tags.path("operator").asText("")));
        }
        return out;
    }

    static List<TrafficSignalPoint> parseSignals(JsonNode json) {
        List<TrafficSignalPoint> out = new ArrayList<>();
        for (JsonNode el : json.path("elements")) {
            if (!"node".equals(el.path("type").asText())) continue;
            if (!el.path("lat").isNumber() || !el.path("lon").isNumber()) continue;
            long osmId = el.path("id").asLong(0);
            // simulated cycle, stable per signal
            Random cycle = new Random(osmId);
            out.add(new TrafficSignalPoint(
                el.path("lat").asDouble(),
                el.path("lon").asDouble(),
                osmId,
                el.path("tags").path("name").asText(""),
                20 + cycle.nextInt(16),
                YELLOW_SECONDS,
                15 + cycle.nextInt(16)
            ));
        }
        return out;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) if (v != null && !v.isBlank()) return v;
        return "";
    }
}
