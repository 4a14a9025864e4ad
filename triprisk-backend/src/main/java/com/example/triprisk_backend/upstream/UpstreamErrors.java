package com.example.triprisk_backend.upstream;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

public final class UpstreamErrors {

    private UpstreamErrors() {}

    /** Maps raw client failures onto the upstream taxonomy; anything else passes through. */
    public static Throwable classify(String provider, Throwable ex) {
        if (ex instanceof UpstreamUnavailableException) return ex;
        if (ex instanceof WebClientResponseException w) {
            if (w.getStatusCode().value() == 429) {
                return new RateLimitedException(provider + " rate limited (429)", w);
            }
            if (w.getStatusCode().is5xxServerError()) {
                return new UpstreamUnavailableException(provider + " answered " + w.getStatusCode().value(), w);
            }
            return ex;
        }
        if (ex instanceof TimeoutException || ex instanceof IOException || ex instanceof WebClientRequestException) {
            return new UpstreamUnavailableException(provider + " unreachable: " + ex.getMessage(), ex);
        }
        return ex;
    }

    public static boolean isRateLimited(Throwable ex) {
        return ex instanceof RateLimitedException
            || (ex instanceof WebClientResponseException w && w.getStatusCode().value() == 429);
    }

    // 4xx other than 429 means the request itself is wrong, retrying won't help
    public static boolean isRetryable(Throwable ex) {
        if (ex instanceof WebClientResponseException w) {
            return w.getStatusCode().value() == 429 || w.getStatusCode().is5xxServerError();
        }
        return true;
    }
}
