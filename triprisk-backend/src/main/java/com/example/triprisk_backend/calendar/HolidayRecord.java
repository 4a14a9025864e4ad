package com.example.triprisk_backend.calendar;

import java.time.LocalDate;

public record HolidayRecord(LocalDate date, String name, boolean extended, String weekday, String expectedFlow) {}
