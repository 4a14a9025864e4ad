package com.example.triprisk_backend.weather;

import com.example.triprisk_backend.TripProps;
import com.example.triprisk_backend.upstream.UpstreamErrors;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/** Open-Meteo hourly forecast. Free and keyless, first in the chain. */
@Component
public class OpenMeteoProvider implements ForecastProvider {

    static final String ID = "open-meteo";
    private static final String HOURLY_FIELDS =
        "temperature_2m,precipitation_probability,precipitation,windspeed_10m,relativehumidity_2m,visibility,weathercode";

    private final WebClient http;
    private final TripProps props;

    public OpenMeteoProvider(WebClient http, TripProps props) {
        this.http = http;
        this.props = props;
    }

    @Override
    public String id() {return ID;}

    @Override
    public boolean authoritative() {return true;}

    @Override
    public Mono<Forecast> fetchForecast(double lat, double lon, OffsetDateTime target) {
        ZoneId zone = props.zone();
        LocalDate day = target.atZoneSameInstant(zone).toLocalDate();
        return http.get()
            .uri(props.weather().openMeteoBaseUrl() + "/v1/forecast", u -> u
                .queryParam("latitude", lat)
                .queryParam("longitude", lon)
                .queryParam("hourly", HOURLY_FIELDS)
                .queryParam("start_date", day.toString())
                .queryParam("end_date", day.plusDays(1).toString())
                .queryParam("timezone", zone.getId())
                .build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofSeconds(10))
            .onErrorMap(e -> UpstreamErrors.classify(ID, e))
            .flatMap(json -> Mono.justOrEmpty(parse(json, target)));
    }

    Forecast parse(JsonNode json, OffsetDateTime target) {
        JsonNode hourly = json.path("hourly");
        JsonNode timeArray = hourly.path("time");
        if (!timeArray.isArray() || timeArray.isEmpty()) return null;

        ZoneId zone = props.zone();
        List<OffsetDateTime> times = new ArrayList<>(timeArray.size());
        for (JsonNode t : timeArray) times.add(parseLocal(t.asText(), zone));

        OptionalInt found = ForecastSeries.closestIndex(times, target, props.weather().maxForecastGap());
        if (found.isEmpty()) return null;
        int idx = found.getAsInt();

        Integer visibility = intAt(hourly, "visibility", idx);
        Integer weatherCode = intAt(hourly, "weathercode", idx);
        Integer prob = intAt(hourly, "precipitation_probability", idx);
        Double mm = doubleAt(hourly, "precipitation", idx);

        return new Forecast(
            doubleAt(hourly, "temperature_2m", idx),
            prob == null ? 0 : prob,
            mm == null ? 0.0 : mm,
            doubleAt(hourly, "windspeed_10m", idx),
            intAt(hourly, "relativehumidity_2m", idx),
            visibility,
            FogRisk.classify(visibility, weatherCode),
            times.get(idx),
            ID
        );
    }

    // Open-Meteo answers naive local times in the requested zone
    private static OffsetDateTime parseLocal(String text, ZoneId zone) {
        try {
            return LocalDateTime.parse(text).atZone(zone).toOffsetDateTime();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Double doubleAt(JsonNode hourly, String field, int idx) {
        JsonNode v = hourly.path(field).path(idx);
        return v.isNumber() ? v.asDouble() : null;
    }

    private static Integer intAt(JsonNode hourly, String field, int idx) {
        JsonNode v = hourly.path(field).path(idx);
        return v.isNumber() ? (int) Math.round(v.asDouble()) : null;
    }
}
