package com.example.triprisk_backend;

import com.example.triprisk_backend.job.JobStore;
import com.example.triprisk_backend.weather.ForecastAggregator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
public class TripRiskBackendApplicationTest {

    @Autowired
    private TripProps props;

    @Autowired
    private JobStore store;

    @Autowired
    private ForecastAggregator forecasts;

    @Test
    void contextBindsPropertiesAndReachesTheDatabase() {
        assertEquals("America/Sao_Paulo", props.timezone());
        assertEquals(50, props.sampling().maxPoints());
        assertEquals(Duration.ofHours(6), props.weather().maxForecastGap());
        assertEquals(7200, props.jobs().retentionSeconds());
        assertTrue(store.isConnected());
        assertEquals(Set.of("open-meteo", "openweather"), forecasts.authoritativeSources());
    }
}
