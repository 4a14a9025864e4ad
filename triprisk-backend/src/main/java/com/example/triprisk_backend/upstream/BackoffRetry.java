package com.example.triprisk_backend.upstream;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Exponential backoff without jitter: after failed attempt {@code k} (0-based) the
 * next one waits {@code 2^k * unit}, five times longer when the failure was a 429.
 * Gives up after {@code maxAttempts} attempts and re-emits the last failure.
 */
public final class BackoffRetry {

    static final int RATE_LIMIT_MULTIPLIER = 5;

    private BackoffRetry() {}

    public static Retry exponential(int maxAttempts, Duration unit) {
        return exponential(maxAttempts, unit, Schedulers.parallel());
    }

    public static Retry exponential(int maxAttempts, Duration unit, Scheduler scheduler) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long attempt = signal.totalRetries();
            if (attempt >= maxAttempts - 1 || !UpstreamErrors.isRetryable(failure)) {
                return Mono.error(failure);
            }
            return Mono.delay(backoffFor(attempt, failure, unit), scheduler);
        }));
    }

    public static Duration backoffFor(long attempt, Throwable failure, Duration unit) {
        long factor = 1L << attempt;
        if (UpstreamErrors.isRateLimited(failure)) factor *= RATE_LIMIT_MULTIPLIER;
        return unit.multipliedBy(factor);
    }
}
