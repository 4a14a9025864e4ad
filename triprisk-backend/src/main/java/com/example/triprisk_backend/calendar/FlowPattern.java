package com.example.triprisk_backend.calendar;

import java.time.LocalDate;
import java.util.Arrays;

/**
 * Relative historical traffic volume per hour of day, normalized to [0, 1].
 * Values come from toll-plaza counts on the main São Paulo state highways.
 */
public enum FlowPattern {

    WEEKDAY(new double[]{
        0.05, 0.03, 0.02, 0.02, 0.04, 0.15,
        0.40, 0.75, 0.85, 0.65, 0.50, 0.55,
        0.60, 0.55, 0.50, 0.55, 0.70, 0.90,
        1.00, 0.80, 0.50, 0.30, 0.15, 0.08}),

    WEEKEND(new double[]{
        0.05, 0.03, 0.02, 0.02, 0.03, 0.08,
        0.20, 0.35, 0.55, 0.70, 0.80, 0.75,
        0.65, 0.60, 0.70, 0.80, 0.90, 1.00,
        0.85, 0.65, 0.45, 0.30, 0.15, 0.08}),

    // eve and first morning of a long weekend
    HOLIDAY_EXIT(new double[]{
        0.05, 0.03, 0.02, 0.02, 0.05, 0.20,
        0.50, 0.80, 0.95, 1.00, 0.90, 0.80,
        0.70, 0.75, 0.85, 0.95, 1.00, 0.90,
        0.70, 0.45, 0.30, 0.20, 0.12, 0.07}),

    // last day of a long weekend
    HOLIDAY_RETURN(new double[]{
        0.05, 0.03, 0.02, 0.02, 0.03, 0.10,
        0.25, 0.40, 0.55, 0.65, 0.70, 0.65,
        0.60, 0.65, 0.80, 0.95, 1.00, 1.00,
        0.95, 0.85, 0.65, 0.45, 0.25, 0.12});

    private final double[] hourly;

    FlowPattern(double[] hourly) {
        if (hourly.length != 24) throw new IllegalStateException(name() + " must have 24 entries");
        this.hourly = hourly;
    }

    public double at(int hour) {
        return hourly[Math.floorMod(hour, 24)];
    }

    public double[] hourly() {
        return Arrays.copyOf(hourly, hourly.length);
    }

    /** Linear interpolation between the surrounding whole hours, wrapping at midnight. */
    public double interpolate(double fractionalHour) {
        double floor = Math.floor(fractionalHour);
        double frac = fractionalHour - floor;
        int h0 = Math.floorMod((int) floor, 24);
        int h1 = (h0 + 1) % 24;
        return hourly[h0] * (1 - frac) + hourly[h1] * frac;
    }

    /**
     * Holiday and bridge days use the exit curve when the following day is itself a
     * holiday and the return curve otherwise; other days pick weekend or weekday.
     */
    public static FlowPattern select(LocalDate date) {
        if (HolidayCalendar.isHoliday(date) || HolidayCalendar.isExtendedHoliday(date)) {
            return HolidayCalendar.isHoliday(date.plusDays(1)) ? HOLIDAY_EXIT : HOLIDAY_RETURN;
        }
        if (date.getDayOfWeek().getValue() >= 6) return WEEKEND;
        return WEEKDAY;
    }
}
