package com.example.triprisk_backend.geocoding;

import com.example.triprisk_backend.TripProps;
import com.example.triprisk_backend.geo.Coordinate;
import com.example.triprisk_backend.upstream.UpstreamErrors;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** City search on Nominatim. Needs no key. */
@Component
public class GeocodingClient {

    static final String PROVIDER = "nominatim";
    static final int MAX_LIMIT = 20;

    private final WebClient http;
    private final TripProps props;

    public GeocodingClient(WebClient http, TripProps props) {
        this.http = http;
        this.props = props;
    }

    /** Queries shorter than two characters answer an empty list without calling out. */
    public Mono<List<Place>> search(String query, int limit) {
        if (query == null || query.strip().length() < 2) return Mono.just(List.of());
        int capped = Math.max(1, Math.min(limit, MAX_LIMIT));

        return http.get()
            // free text goes in as a variable so it gets encoded
            .uri(props.osm().nominatimBaseUrl() + "/search", u -> u
                .queryParam("q", "{q}")
                .queryParam("format", "json")
                .queryParam("addressdetails", 1)
                .queryParam("limit", capped * 2)
                .queryParam("featuretype", "city").build(query.strip()))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofSeconds(10))
            .onErrorMap(e -> UpstreamErrors.classify(PROVIDER, e))
            .map(json -> parse(json, capped));
    }

    // one hit per ~1 km cell, most important first
    static List<Place> parse(JsonNode json, int limit) {
        List<Place> out = new ArrayList<>();
        if (!json.isArray()) return out;
        Set<String> seen = new HashSet<>();
        for (JsonNode item : json) {
            JsonNode addr = item.path("address");
            String name = firstText(addr, "city", "town", "village", "municipality");
            if (name == null) name = item.path("display_name").asText("").split(",")[0];
            name = name.strip();
            if (name.isEmpty() || !item.hasNonNull("lat") || !item.hasNonNull("lon")) continue;

            double lat = item.path("lat").asDouble();
            double lon = item.path("lon").asDouble();
            String cell = Math.round(lat * 100) + ":" + Math.round(lon * 100);
            if (!seen.add(cell)) continue;

            String state = addr.path("state").asText("");
            String display = state.isEmpty() ? name : name + ", " + state;
            out.add(new Place(name, display, new Coordinate(lat, lon),
                item.path("importance").asDouble(0)));
        }
        out.sort(Comparator.comparingDouble(Place::importance).reversed());
        return out.size() > limit ? List.copyOf(out.subList(0, limit)) : out;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String f : fields) {
            String v = node.path(f).asText("");
            if (!v.isBlank()) return v;
        }
        return null;
    }
}
