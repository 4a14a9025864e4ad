package com.example.triprisk_backend.weather;

import com.example.triprisk_backend.TripProps;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Short-lived forecast cache shared by every job. Entries expire a fixed time after
 * being written; expiry is checked on access, there is no background sweeper.
 */
@Component
public class ForecastCache {

    private static final long MAX_ENTRIES = 10_000;

    private final Cache<ForecastKey, Forecast> cache;

    @Autowired
    public ForecastCache(TripProps props) {
        this(props.weather().cacheTtl(), Ticker.systemTicker());
    }

    public ForecastCache(Duration ttl, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(MAX_ENTRIES)
            .ticker(ticker)
            .executor(Runnable::run)
            .recordStats()
            .build();
    }

    public Forecast get(ForecastKey key) {
        return cache.getIfPresent(key);
    }

    public void put(ForecastKey key, Forecast forecast) {
        cache.put(key, forecast);
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long missCount() {
        return cache.stats().missCount();
    }
}
