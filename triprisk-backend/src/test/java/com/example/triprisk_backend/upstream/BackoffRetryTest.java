package com.example.triprisk_backend.upstream;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class BackoffRetryTest {

    private static final Duration UNIT = Duration.ofSeconds(1);

    @Test
    void waitsDoubleEachAttempt() {
        UpstreamUnavailableException down = new UpstreamUnavailableException("down");
        assertEquals(Duration.ofSeconds(1), BackoffRetry.backoffFor(0, down, UNIT));
        assertEquals(Duration.ofSeconds(2), BackoffRetry.backoffFor(1, down, UNIT));
    }

    @Test
    void rateLimitedWaitsFiveTimesLonger() {
        RateLimitedException limited = new RateLimitedException("429", null);
        assertEquals(Duration.ofSeconds(5), BackoffRetry.backoffFor(0, limited, UNIT));
        assertEquals(Duration.ofSeconds(10), BackoffRetry.backoffFor(1, limited, UNIT));
    }

    @Test
    void givesUpAfterThreeAttemptsWithTheLastError() {
        AtomicInteger calls = new AtomicInteger();
        Mono<String> failing = Mono.defer(() -> {
            calls.incrementAndGet();
            return Mono.error(new UpstreamUnavailableException("attempt " + calls.get()));
        });

        UpstreamUnavailableException e = assertThrows(UpstreamUnavailableException.class,
            () -> failing.retryWhen(BackoffRetry.exponential(3, Duration.ofMillis(1))).block());

        assertEquals(3, calls.get());
        assertEquals("attempt 3", e.getMessage());
    }

    @Test
    void successAfterFailureStopsRetrying() {
        AtomicInteger calls = new AtomicInteger();
        Mono<String> flaky = Mono.defer(() -> calls.incrementAndGet() < 2
            ? Mono.error(new UpstreamUnavailableException("blip"))
            : Mono.just("ok"));

        assertEquals("ok", flaky.retryWhen(BackoffRetry.exponential(3, Duration.ofMillis(1))).block());
        assertEquals(2, calls.get());
    }

    @Test
    void classifiesHttpFailures() {
        WebClientResponseException tooMany = WebClientResponseException.create(429, "Too Many Requests",
            HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);
        WebClientResponseException notFound = WebClientResponseException.create(404, "Not Found",
            HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);
        WebClientResponseException bad = WebClientResponseException.create(502, "Bad Gateway",
            HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);

        assertInstanceOf(RateLimitedException.class, UpstreamErrors.classify("x", tooMany));
        assertInstanceOf(UpstreamUnavailableException.class, UpstreamErrors.classify("x", bad));
        assertSame(notFound, UpstreamErrors.classify("x", notFound));
        assertFalse(UpstreamErrors.isRetryable(notFound));
        assertTrue(UpstreamErrors.isRetryable(new UpstreamUnavailableException("x")));
    }
}
