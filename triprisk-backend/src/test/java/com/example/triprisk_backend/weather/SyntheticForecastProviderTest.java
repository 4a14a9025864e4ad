package com.example.triprisk_backend.weather;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

public class SyntheticForecastProviderTest {

    private final SyntheticForecastProvider provider = new SyntheticForecastProvider(ZoneId.of("America/Sao_Paulo"));

    @Test
    void samePointAndHourGiveTheSameForecast() {
        OffsetDateTime t = OffsetDateTime.parse("2026-02-20T15:10:00-03:00");
        Forecast a = provider.generate(-23.55, -46.63, t);
        Forecast b = provider.generate(-23.5502, -46.6298, t.plusMinutes(30));

        assertEquals(a.precipProbability(), b.precipProbability());
        assertEquals(a.visibilityM(), b.visibilityM());
        assertEquals(a.temperatureC(), b.temperatureC());
        assertEquals("synthetic", a.source());
        assertFalse(provider.authoritative());
    }

    @Test
    void valuesStayInRange() {
        OffsetDateTime t = OffsetDateTime.parse("2026-02-20T00:00:00-03:00");
        for (int h = 0; h < 24; h++) {
            Forecast f = provider.generate(-22.9, -43.2, t.plusHours(h));
            assertTrue(f.precipProbability() >= 0 && f.precipProbability() <= 100);
            assertTrue(f.precipMm() >= 0);
            assertTrue(f.humidityPercent() >= 40 && f.humidityPercent() <= 95);
        }
    }
}
