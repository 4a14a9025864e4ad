package com.example.triprisk_backend.calendar;

import com.example.triprisk_backend.geo.Coordinate;
import com.example.triprisk_backend.geo.GeoMath;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ranks the 24 possible departure hours of a trip against the historical flow pattern
 * of the travel date. Lower scores are better.
 */
@Service
public class DepartureAdvisor {

    static final int UPCOMING_HORIZON_DAYS = 60;
    static final double MIN_DURATION_MIN = 30;
    static final double MAX_DURATION_MIN = 1440;

    public DeparturePrediction predictBestDeparture(LocalDate travelDate, double baseDurationMinutes) {
        if (!(baseDurationMinutes >= MIN_DURATION_MIN && baseDurationMinutes <= MAX_DURATION_MIN)) {
            throw new IllegalArgumentException("baseDurationMinutes must be within [30, 1440], got " + baseDurationMinutes);
        }
        FlowPattern pattern = FlowPattern.select(travelDate);
        String holidayName = HolidayCalendar.holidayName(travelDate).orElse(null);
        boolean extended = HolidayCalendar.isExtendedHoliday(travelDate);
        DayType dayType = DayType.of(travelDate);

        List<DepartureScore> hours = new ArrayList<>(24);
        for (int h = 0; h < 24; h++) {
            hours.add(scoreHour(pattern, h, baseDurationMinutes));
        }

        // List.sort is stable, ties keep the earlier hour first
        hours.sort(Comparator.comparingDouble(DepartureScore::score));
        List<DepartureScore> best = List.copyOf(hours.subList(0, 3));
        List<DepartureScore> worst = hours.stream()
            .sorted(Comparator.comparingDouble(DepartureScore::score).reversed())
            .limit(3)
            .toList();

        String recommendation = capitalize(dayType.label())
            + (holidayName != null ? " (" + holidayName + ")" : "")
            + ". Best departure times: " + labels(best) + "."
            + " Avoid leaving at " + labels(worst) + ".";

        return new DeparturePrediction(
            travelDate,
            dayType.label(),
            holidayName != null,
            holidayName,
            extended,
            (int) baseDurationMinutes,
            best,
            worst,
            List.copyOf(hours),
            recommendation,
            HolidayCalendar.upcomingHolidays(travelDate, UPCOMING_HORIZON_DAYS)
        );
    }

    static DepartureScore scoreHour(FlowPattern pattern, int departureHour, double baseDurationMinutes) {
        double durationHours = baseDurationMinutes / 60.0;
        int samples = Math.max(4, (int) (durationHours * 2));
        double total = 0;
        for (int i = 0; i < samples; i++) {
            double progress = (double) i / Math.max(samples - 1, 1);
            double travelHour = (departureHour + progress * durationHours) % 24;
            total += pattern.interpolate(travelHour);
        }
        double avgFlow = total / samples;

        double safetyPenalty = 0;
        if (departureHour < 5) safetyPenalty = 0.3;
        else if (departureHour >= 23) safetyPenalty = 0.2;

        long extraDelay = Math.round(avgFlow * baseDurationMinutes * 0.15);
        double totalMinutes = baseDurationMinutes + extraDelay;
        double arrivalHour = departureHour + totalMinutes / 60.0;
        int arrivalH = (int) arrivalHour % 24;
        int arrivalM = (int) ((arrivalHour % 1) * 60);

        return new DepartureScore(
            departureHour,
            String.format("%02d:00", departureHour),
            GeoMath.round(avgFlow + safetyPenalty, 3),
            GeoMath.round(avgFlow, 3),
            (int) extraDelay,
            (int) totalMinutes,
            String.format("%02d:%02d", arrivalH, arrivalM),
            safetyPenalty > 0 ? "low" : "ok"
        );
    }

    /** Hourly pattern of a date with its four busiest and four quietest hours. */
    public HistoricalPattern historicalPattern(Coordinate location, LocalDate date) {
        FlowPattern pattern = FlowPattern.select(date);
        String holidayName = HolidayCalendar.holidayName(date).orElse(null);

        Map<String, Double> hourly = new LinkedHashMap<>();
        List<Integer> byVolume = new ArrayList<>(24);
        for (int h = 0; h < 24; h++) {
            hourly.put(String.format("%02d:00", h), GeoMath.round(pattern.at(h), 3));
            byVolume.add(h);
        }
        byVolume.sort(Comparator.comparingDouble((Integer h) -> pattern.at(h)).reversed());

        return new HistoricalPattern(
            location,
            date,
            DayType.of(date).label(),
            holidayName != null,
            holidayName,
            HolidayCalendar.isExtendedHoliday(date),
            hourly,
            hourLabels(byVolume.subList(0, 4)),
            hourLabels(byVolume.subList(20, 24)),
            "historical_model"
        );
    }

    private static List<String> hourLabels(List<Integer> hours) {
        return hours.stream().map(h -> String.format("%02d:00", h)).toList();
    }

    private static String labels(List<DepartureScore> scores) {
        return scores.stream().map(DepartureScore::departureLabel).collect(Collectors.joining(", "));
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
