package com.example.triprisk_backend.traffic;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CongestionLevelTest {

    @Test
    void levelsByRatio() {
        assertEquals(CongestionLevel.FREE, CongestionLevel.fromRatio(0.14));
        assertEquals(CongestionLevel.LIGHT, CongestionLevel.fromRatio(0.15));
        assertEquals(CongestionLevel.MODERATE, CongestionLevel.fromRatio(0.54));
        assertEquals(CongestionLevel.HEAVY, CongestionLevel.fromRatio(0.55));
        assertEquals(CongestionLevel.SEVERE, CongestionLevel.fromRatio(0.75));
        assertEquals("#dc2626", CongestionLevel.SEVERE.color());
    }

    @Test
    void emptyReportDefaultsToSixtyKmh() {
        TrafficReport r = TrafficReport.empty();
        assertEquals(60.0, r.summary().avgSpeedKmh());
        assertEquals(0, r.summary().samplesCount());
        assertEquals(CongestionLevel.FREE, r.summary().overallCongestion());
    }

    @Test
    void reportAveragesSamples() {
        OffsetDateTime t = OffsetDateTime.parse("2026-02-20T08:00:00-03:00");
        TrafficReport r = TrafficReport.of(List.of(
            new TrafficSample(-23.5, -46.6, t, 40, 80, 0.5, CongestionLevel.MODERATE, 4.0, 0.4, "heuristic"),
            new TrafficSample(-23.4, -46.5, t, 80, 80, 0.1, CongestionLevel.FREE, 0.8, 0.4, "heuristic")));

        assertEquals(60.0, r.summary().avgSpeedKmh());
        assertEquals(0.3, r.summary().avgCongestionRatio());
        assertEquals(CongestionLevel.LIGHT, r.summary().overallCongestion());
        assertEquals(4.8, r.summary().totalDelayMinutes());
        assertEquals(2, r.summary().samplesCount());
    }
}
