package com.example.triprisk_backend.route;

import com.example.triprisk_backend.TripProps;
import com.example.triprisk_backend.geo.Coordinate;
import com.example.triprisk_backend.geo.GeoMath;
import com.example.triprisk_backend.upstream.UpstreamErrors;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Routes through OpenRouteService when a key is configured, falling back to the public
 * OSRM server. Callers only see a failure when both engines fail.
 */
@Component
public class RouteGeometryProvider {

    private static final Logger log = LoggerFactory.getLogger(RouteGeometryProvider.class);

    static final String ORS = "openrouteservice";
    static final String OSRM = "osrm";

    private final WebClient http;
    private final TripProps props;

    public RouteGeometryProvider(WebClient http, TripProps props) {
        this.http = http;
        this.props = props;
    }

    public Mono<RouteGeometry> calculateRoute(Coordinate origin, Coordinate destination, RouteProfile profile) {
        Mono<RouteGeometry> osrm = Mono.defer(() -> viaOsrm(origin, destination))
            .onErrorMap(e -> new RouteUnavailableException("No routing engine could build a route: " + e.getMessage(), e));

        if (!TripProps.hasKey(props.routing().orsApiKey())) return osrm;

        return viaOrs(origin, destination, profile)
            .onErrorResume(e -> {
                log.warn("ORS failed ({}), trying OSRM", e.toString());
                return osrm;
            });
    }

    Mono<RouteGeometry> viaOrs(Coordinate origin, Coordinate destination, RouteProfile profile) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        ArrayNode coords = body.putArray("coordinates");
        coords.addArray().add(origin.lon()).add(origin.lat());
        coords.addArray().add(destination.lon()).add(destination.lat());

        return http.post()
            .uri(props.routing().orsBaseUrl() + "/v2/directions/" + profile.value() + "/geojson")
            .header("Authorization", props.routing().orsApiKey())
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofSeconds(15))
            .onErrorMap(e -> UpstreamErrors.classify(ORS, e))
            .map(RouteGeometryProvider::parseOrs);
    }

    static RouteGeometry parseOrs(JsonNode json) {
        JsonNode feature = json.path("features").path(0);
        JsonNode summary = feature.path("properties").path("summary");
        if (!summary.path("distance").isNumber()) throw new IllegalStateException("ORS answered without a route");
        return new RouteGeometry(
            lonLatList(feature.path("geometry").path("coordinates")),
            GeoMath.round(summary.path("distance").asDouble() / 1000, 2),
            GeoMath.round(summary.path("duration").asDouble() / 60, 1),
            ORS);
    }

    Mono<RouteGeometry> viaOsrm(Coordinate origin, Coordinate destination) {
        String routePath = "/route/v1/driving/"
            + String.format(Locale.ROOT, "%.6f,%.6f;%.6f,%.6f", origin.lon(), origin.lat(), destination.lon(), destination.lat());

        return http.get()
            .uri(props.routing().osrmBaseUrl() + routePath, u -> u
                .queryParam("overview", "full")
                .queryParam("geometries", "geojson")
                .queryParam("steps", "false").build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofSeconds(15))
            .onErrorMap(e -> UpstreamErrors.classify(OSRM, e))
            .map(RouteGeometryProvider::parseOsrm);
    }

    static RouteGeometry parseOsrm(JsonNode json) {
        if (!"Ok".equals(json.path("code").asText())) {
            throw new IllegalStateException("OSRM error: " + json.path("message").asText(json.path("code").asText("no code")));
        }
        JsonNode route = json.path("routes").path(0);
        return new RouteGeometry(
            lonLatList(route.path("geometry").path("coordinates")),
            GeoMath.round(route.path("distance").asDouble() / 1000, 2),
            GeoMath.round(route.path("duration").asDouble() / 60, 1),
            OSRM);
    }

    private static List<Coordinate> lonLatList(JsonNode coords) {
        List<Coordinate> out = new ArrayList<>();
        if (!coords.isArray()) return out;
        for (JsonNode p : coords) {
            if (p.isArray() && p.size() >= 2) out.add(new Coordinate(p.get(1).asDouble(), p.get(0).asDouble()));
        }
        return out;
    }
}
