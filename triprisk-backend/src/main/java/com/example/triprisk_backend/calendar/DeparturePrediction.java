package com.example.triprisk_backend.calendar;

import java.time.LocalDate;
import java.util.List;

public record DeparturePrediction(
    LocalDate date,
    String dayType,
    boolean isHoliday,
    String holidayName,
    boolean isExtendedHoliday,
    int baseDurationMinutes,
    List<DepartureScore> bestDepartures,
    List<DepartureScore> worstDepartures,
    List<DepartureScore> allHours,
    String recommendation,
    List<HolidayRecord> upcomingHolidays
) {}
