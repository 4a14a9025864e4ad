package com.example.triprisk_backend.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.Locale;

public enum DayType {
    WEEKDAY("weekday"),
    WEEKEND("weekend"),
    HOLIDAY("holiday"),
    EXTENDED_HOLIDAY("extended holiday");

    private final String label;

    DayType(String label) {this.label = label;}

    public String label() {return label;}

    public static DayType of(LocalDate date) {
        if (HolidayCalendar.isHoliday(date)) return HOLIDAY;
        if (HolidayCalendar.isExtendedHoliday(date)) return EXTENDED_HOLIDAY;
        DayOfWeek dow = date.getDayOfWeek();
        return (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) ? WEEKEND : WEEKDAY;
    }

    static String weekdayLabel(LocalDate date) {
        return date.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }
}
