package com.example.triprisk_backend.calendar;

import com.example.triprisk_backend.geo.Coordinate;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record HistoricalPattern(
    Coordinate location,
    LocalDate date,
    String dayType,
    boolean isHoliday,
    String holidayName,
    boolean isExtendedHoliday,
    Map<String, Double> hourlyPattern,
    List<String> peakHours,
    List<String> quietHours,
    String dataSource
) {}
