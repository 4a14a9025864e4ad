package com.example.triprisk_backend.calendar;

import com.example.triprisk_backend.geo.Coordinate;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

public class DepartureAdvisorTest {

    private final DepartureAdvisor advisor = new DepartureAdvisor();

    @Test
    void ranksAll24Hours() {
        DeparturePrediction p = advisor.predictBestDeparture(LocalDate.of(2026, 3, 11), 300);

        assertEquals(24, p.allHours().size());
        assertEquals(3, p.bestDepartures().size());
        assertEquals(3, p.worstDepartures().size());
        assertEquals("weekday", p.dayType());
        assertFalse(p.isHoliday());

        for (int i = 1; i < p.allHours().size(); i++) {
            assertTrue(p.allHours().get(i - 1).score() <= p.allHours().get(i).score());
        }
        assertTrue(p.bestDepartures().get(0).score() <= p.worstDepartures().get(0).score());
        assertEquals(p.allHours().get(0), p.bestDepartures().get(0));
    }

    @Test
    void holidayNameIsReported() {
        DeparturePrediction p = advisor.predictBestDeparture(LocalDate.of(2026, 12, 25), 120);

        assertTrue(p.isHoliday());
        assertEquals("Christmas", p.holidayName());
        assertEquals("holiday", p.dayType());
        assertTrue(p.recommendation().startsWith("Holiday (Christmas)."));
        assertFalse(p.upcomingHolidays().isEmpty());
    }

    @Test
    void earlyHoursCarryASafetyPenalty() {
        DepartureScore three = DepartureAdvisor.scoreHour(FlowPattern.WEEKDAY, 3, 60);
        assertEquals("low", three.safety());
        assertEquals("03:00", three.departureLabel());
        assertEquals(three.avgFlowRatio() + 0.3, three.score(), 1e-3);

        DepartureScore late = DepartureAdvisor.scoreHour(FlowPattern.WEEKDAY, 23, 60);
        assertEquals("low", late.safety());
        assertEquals(late.avgFlowRatio() + 0.2, late.score(), 1e-3);

        assertEquals("ok", DepartureAdvisor.scoreHour(FlowPattern.WEEKDAY, 10, 60).safety());
    }

    @Test
    void rejectsDurationsOutOfRange() {
        LocalDate d = LocalDate.of(2026, 3, 11);
        assertThrows(IllegalArgumentException.class, () -> advisor.predictBestDeparture(d, 29));
        assertThrows(IllegalArgumentException.class, () -> advisor.predictBestDeparture(d, 1441));
        assertThrows(IllegalArgumentException.class, () -> advisor.predictBestDeparture(d, Double.NaN));
    }

    @Test
    void historicalPatternListsPeaksAndQuietHours() {
        HistoricalPattern h = advisor.historicalPattern(new Coordinate(-23.55, -46.63), LocalDate.of(2026, 3, 11));
        assertEquals(24, h.hourlyPattern().size());
        assertEquals(4, h.peakHours().size());
        assertEquals(4, h.quietHours().size());
        assertEquals("18:00", h.peakHours().get(0));
        assertEquals("historical_model", h.dataSource());
    }
}
