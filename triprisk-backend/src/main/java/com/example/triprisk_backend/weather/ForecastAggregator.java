package com.example.triprisk_backend.weather;

import com.example.triprisk_backend.TripProps;
import com.example.triprisk_backend.upstream.BackoffRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves a forecast for a place and a future time by walking the provider chain
 * (Open-Meteo, OpenWeather, synthetic) in order. Every provider gets its own retry
 * budget; the first usable answer wins and is cached.
 */
@Service
public class ForecastAggregator {

    private static final Logger log = LoggerFactory.getLogger(ForecastAggregator.class);

    private final List<ForecastProvider> chain;
    private final ForecastCache cache;
    private final Retry retry;
    private final ZoneId zone;

    @Autowired
    public ForecastAggregator(OpenMeteoProvider openMeteo,
                              OpenWeatherProvider openWeather,
                              SyntheticForecastProvider synthetic,
                              ForecastCache cache,
                              TripProps props) {
        this(List.of(openMeteo, openWeather, synthetic), cache,
            BackoffRetry.exponential(props.weather().maxAttempts(), props.weather().backoffUnit()),
            props.zone());
    }

    public ForecastAggregator(List<ForecastProvider> chain, ForecastCache cache, Retry retry, ZoneId zone) {
        this.chain = List.copyOf(chain);
        this.cache = cache;
        this.retry = retry;
        this.zone = zone;
    }

    /** Completes empty when no provider in the chain had usable data. */
    public Mono<Forecast> forecast(double lat, double lon, OffsetDateTime target) {
        ForecastKey key = ForecastKey.of(lat, lon, target, zone);
        Forecast cached = cache.get(key);
        if (cached != null) return Mono.just(cached);

        return Flux.fromIterable(chain)
            .concatMap(p -> attempt(p, lat, lon, target))
            .filter(ProviderOutcome::isUsable)
            .next()
            .map(ProviderOutcome::forecast)
            .doOnNext(f -> cache.put(key, f));
    }

    Mono<ProviderOutcome> attempt(ForecastProvider provider, double lat, double lon, OffsetDateTime target) {
        if (!provider.enabled()) return Mono.just(ProviderOutcome.skipped(provider.id()));

        return Mono.defer(() -> provider.fetchForecast(lat, lon, target))
            .retryWhen(retry)
            .map(f -> ProviderOutcome.usable(provider.id(), f))
            .defaultIfEmpty(ProviderOutcome.unusable(provider.id()))
            .onErrorResume(e -> {
                log.warn("Forecast provider {} failed for {},{}: {}", provider.id(), lat, lon, e.toString());
                return Mono.just(ProviderOutcome.failed(provider.id(), e));
            });
    }

    /** Provider ids whose data counts as authoritative for confidence scoring. */
    public Set<String> authoritativeSources() {
        return chain.stream().filter(ForecastProvider::authoritative).map(ForecastProvider::id).collect(Collectors.toSet());
    }
}
