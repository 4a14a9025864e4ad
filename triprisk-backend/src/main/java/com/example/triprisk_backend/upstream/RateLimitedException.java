package com.example.triprisk_backend.upstream;

/** A provider answered 429. Retried like any outage but with a longer backoff. */
public class RateLimitedException extends UpstreamUnavailableException {

    public RateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}
