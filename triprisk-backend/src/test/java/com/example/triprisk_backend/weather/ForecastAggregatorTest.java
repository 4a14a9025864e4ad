package com.example.triprisk_backend.weather;

import com.example.triprisk_backend.upstream.BackoffRetry;
import com.example.triprisk_backend.upstream.UpstreamUnavailableException;
import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

public class ForecastAggregatorTest {

    private static final ZoneId ZONE = ZoneId.of("America/Sao_Paulo");
    private static final OffsetDateTime TARGET = OffsetDateTime.parse("2026-02-20T10:00:00-03:00");

    /** Counts calls and answers whatever the supplier gives. */
    static class FakeProvider implements ForecastProvider {
        final String id;
        final boolean enabled;
        final Supplier<Mono<Forecast>> answer;
        final AtomicInteger calls = new AtomicInteger();

        FakeProvider(String id, boolean enabled, Supplier<Mono<Forecast>> answer) {
            this.id = id;
            this.enabled = enabled;
            this.answer = answer;
        }

        @Override public String id() {return id;}
        @Override public boolean authoritative() {return !"synthetic".equals(id);}
        @Override public boolean enabled() {return enabled;}

        @Override
        public Mono<Forecast> fetchForecast(double lat, double lon, OffsetDateTime target) {
            calls.incrementAndGet();
            return answer.get();
        }
    }

    private static Forecast forecast(String source) {
        return new Forecast(25.0, 30, 0.5, 10.0, 70, 10_000, FogRisk.NONE, TARGET, source);
    }

    private static ForecastAggregator aggregator(ForecastCache cache, ForecastProvider... chain) {
        return new ForecastAggregator(List.of(chain), cache, BackoffRetry.exponential(3, Duration.ofMillis(1)), ZONE);
    }

    private static ForecastCache cache() {
        return new ForecastCache(Duration.ofSeconds(300), Ticker.systemTicker());
    }

    @Test
    void cacheHitReturnsSameInstanceWithoutCallingProviders() {
        FakeProvider meteo = new FakeProvider("open-meteo", true, () -> Mono.just(forecast("open-meteo")));
        ForecastAggregator agg = aggregator(cache(), meteo);

        Forecast first = agg.forecast(-23.5501, -46.6333, TARGET).block();
        // same 3-decimal cell, same hour bucket
        Forecast second = agg.forecast(-23.5504, -46.6331, TARGET.plusMinutes(20)).block();

        assertNotNull(first);
        assertSame(first, second);
        assertEquals(1, meteo.calls.get());
    }

    @Test
    void entriesExpireAfterTtl() {
        AtomicLong nanos = new AtomicLong();
        Ticker ticker = nanos::get;
        FakeProvider meteo = new FakeProvider("open-meteo", true, () -> Mono.just(forecast("open-meteo")));
        ForecastAggregator agg = aggregator(new ForecastCache(Duration.ofSeconds(300), ticker), meteo);

        agg.forecast(-23.55, -46.63, TARGET).block();
        nanos.addAndGet(Duration.ofSeconds(299).toNanos());
        agg.forecast(-23.55, -46.63, TARGET).block();
        assertEquals(1, meteo.calls.get());

        nanos.addAndGet(Duration.ofSeconds(2).toNanos());
        agg.forecast(-23.55, -46.63, TARGET).block();
        assertEquals(2, meteo.calls.get());
    }

    @Test
    void failingProviderIsRetriedThenChainAdvances() {
        FakeProvider meteo = new FakeProvider("open-meteo", true,
            () -> Mono.error(new UpstreamUnavailableException("open-meteo answered 503")));
        FakeProvider synthetic = new FakeProvider("synthetic", true, () -> Mono.just(forecast("synthetic")));

        Forecast f = aggregator(cache(), meteo, synthetic).forecast(-23.55, -46.63, TARGET).block();

        assertNotNull(f);
        assertEquals("synthetic", f.source());
        assertEquals(3, meteo.calls.get());
        assertEquals(1, synthetic.calls.get());
    }

    @Test
    void emptyAnswerIsNotRetried() {
        FakeProvider meteo = new FakeProvider("open-meteo", true, Mono::empty);
        FakeProvider synthetic = new FakeProvider("synthetic", true, () -> Mono.just(forecast("synthetic")));

        Forecast f = aggregator(cache(), meteo, synthetic).forecast(-23.55, -46.63, TARGET).block();

        assertEquals("synthetic", f.source());
        assertEquals(1, meteo.calls.get());
    }

    @Test
    void clientErrorsAreNotRetried() {
        WebClientResponseException badRequest = WebClientResponseException.create(
            HttpStatus.BAD_REQUEST.value(), "Bad Request", HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);
        FakeProvider meteo = new FakeProvider("open-meteo", true, () -> Mono.error(badRequest));
        FakeProvider synthetic = new FakeProvider("synthetic", true, () -> Mono.just(forecast("synthetic")));

        aggregator(cache(), meteo, synthetic).forecast(-23.55, -46.63, TARGET).block();

        assertEquals(1, meteo.calls.get());
    }

    @Test
    void disabledProviderIsSkipped() {
        FakeProvider owm = new FakeProvider("openweather", false, () -> Mono.just(forecast("openweather")));
        FakeProvider synthetic = new FakeProvider("synthetic", true, () -> Mono.just(forecast("synthetic")));

        ForecastAggregator agg = aggregator(cache(), owm, synthetic);
        ProviderOutcome outcome = agg.attempt(owm, -23.55, -46.63, TARGET).block();

        assertEquals(ProviderOutcome.Status.SKIPPED, outcome.status());
        assertEquals("synthetic", agg.forecast(-23.55, -46.63, TARGET).block().source());
        assertEquals(0, owm.calls.get());
    }

    @Test
    void completesEmptyWhenNothingIsUsable() {
        FakeProvider meteo = new FakeProvider("open-meteo", true, Mono::empty);
        assertNull(aggregator(cache(), meteo).forecast(-23.55, -46.63, TARGET).block());
    }

    @Test
    void authoritativeSourcesExcludeSynthetic() {
        FakeProvider meteo = new FakeProvider("open-meteo", true, Mono::empty);
        FakeProvider synthetic = new FakeProvider("synthetic", true, Mono::empty);
        assertEquals(Set.of("open-meteo"), aggregator(cache(), meteo, synthetic).authoritativeSources());
    }
}
