package com.example.triprisk_backend.weather;

import com.example.triprisk_backend.TripProps;
import com.example.triprisk_backend.upstream.UpstreamErrors;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/** OpenWeather 5-day / 3-hour forecast. Needs an API key, skipped without one. */
@Component
public class OpenWeatherProvider implements ForecastProvider {

    static final String ID = "openweather";

    private final WebClient http;
    private final TripProps props;

    public OpenWeatherProvider(WebClient http, TripProps props) {
        this.http = http;
        this.props = props;
    }

    @Override
    public String id() {return ID;}

    @Override
    public boolean authoritative() {return true;}

    @Override
    public boolean enabled() {
        return TripProps.hasKey(props.weather().openWeatherApiKey());
    }

    @Override
    public Mono<Forecast> fetchForecast(double lat, double lon, OffsetDateTime target) {
        return http.get()
            .uri(props.weather().openWeatherBaseUrl() + "/data/2.5/forecast", u -> u
                .queryParam("lat", lat)
                .queryParam("lon", lon)
                .queryParam("appid", props.weather().openWeatherApiKey())
                .queryParam("units", "metric")
                .build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofSeconds(10))
            .onErrorMap(e -> UpstreamErrors.classify(ID, e))
            .flatMap(json -> Mono.justOrEmpty(parse(json, target)));
    }

    Forecast parse(JsonNode json, OffsetDateTime target) {
        JsonNode list = json.path("list");
        if (!list.isArray() || list.isEmpty()) return null;

        List<OffsetDateTime> times = new ArrayList<>(list.size());
        for (JsonNode entry : list) {
            times.add(entry.path("dt").isNumber()
                ? OffsetDateTime.ofInstant(Instant.ofEpochSecond(entry.path("dt").asLong()), props.zone())
                : null);
        }
        OptionalInt found = ForecastSeries.closestIndex(times, target, props.weather().maxForecastGap());
        if (found.isEmpty()) return null;
        JsonNode best = list.get(found.getAsInt());

        JsonNode main = best.path("main");
        JsonNode rain = best.path("rain");
        double mm = rain.path("3h").isNumber() ? rain.path("3h").asDouble() : rain.path("1h").asDouble(0.0);
        Integer visibility = best.path("visibility").isNumber() ? best.path("visibility").asInt() : null;

        return new Forecast(
            main.path("temp").isNumber() ? main.path("temp").asDouble() : null,
            (int) (best.path("pop").asDouble(0.0) * 100),
            mm,
            Math.round(best.path("wind").path("speed").asDouble(0.0) * 3.6 * 10) / 10.0,
            main.path("humidity").isNumber() ? main.path("humidity").asInt() : null,
            visibility,
            FogRisk.classify(visibility, null),
            times.get(found.getAsInt()),
            ID
        );
    }
}
