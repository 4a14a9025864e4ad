package com.example.triprisk_backend.weather;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RiskClassificationTest {

    @Test
    void rainRiskThresholds() {
        assertEquals(RainRisk.NONE, RainRisk.classify(19, 10));
        assertEquals(RainRisk.LOW, RainRisk.classify(20, 0));
        assertEquals(RainRisk.MODERATE, RainRisk.classify(59, 0));
        assertEquals(RainRisk.HIGH, RainRisk.classify(79, 4.9));
        // heavy accumulation pushes a high probability over the top
        assertEquals(RainRisk.VERY_HIGH, RainRisk.classify(79, 5.0));
        assertEquals(RainRisk.VERY_HIGH, RainRisk.classify(80, 0));
    }

    @Test
    void fogFromWeatherCodeOrVisibility() {
        assertEquals(FogRisk.HIGH, FogRisk.classify(20_000, 45));
        assertEquals(FogRisk.HIGH, FogRisk.classify(999, 0));
        assertEquals(FogRisk.MODERATE, FogRisk.classify(2999, null));
        assertEquals(FogRisk.LOW, FogRisk.classify(7999, null));
        assertEquals(FogRisk.NONE, FogRisk.classify(8000, null));
        assertEquals(FogRisk.NONE, FogRisk.classify(null, null));
    }

    @Test
    void worstPicksTheMoreSevere() {
        assertEquals(RainRisk.HIGH, RainRisk.worst(RainRisk.HIGH, RainRisk.LOW));
        assertEquals(FogRisk.MODERATE, FogRisk.worst(FogRisk.NONE, FogRisk.MODERATE));
    }
}
