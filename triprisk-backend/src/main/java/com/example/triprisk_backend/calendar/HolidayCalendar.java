package com.example.triprisk_backend.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Brazilian national holiday calendar: 8 fixed dates plus the 6 Easter-relative ones.
 * Everything is recomputed from the year on each query; nothing is stored.
 */
public final class HolidayCalendar {

    static final Map<MonthDay, String> FIXED_HOLIDAYS;
    static {
        Map<MonthDay, String> m = new LinkedHashMap<>();
        m.put(MonthDay.of(1, 1), "New Year's Day");
        m.put(MonthDay.of(4, 21), "Tiradentes");
        m.put(MonthDay.of(5, 1), "Labour Day");
        m.put(MonthDay.of(9, 7), "Independence Day");
        m.put(MonthDay.of(10, 12), "Our Lady of Aparecida");
        m.put(MonthDay.of(11, 2), "All Souls' Day");
        m.put(MonthDay.of(11, 15), "Republic Proclamation Day");
        m.put(MonthDay.of(12, 25), "Christmas");
        FIXED_HOLIDAYS = Map.copyOf(m);
    }

    private HolidayCalendar() {}

    /** Easter Sunday by the Meeus/Jones/Butcher algorithm. */
    public static LocalDate computeEaster(int year) {
        int a = year % 19;
        int b = year / 100, c = year % 100;
        int d = b / 4, e = b % 4;
        int f = (b + 8) / 25;
        int g = (b - f + 1) / 3;
        int h = (19 * a + b - d - g + 15) % 30;
        int i = c / 4, k = c % 4;
        int l = (32 + 2 * e + 2 * i - h - k) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = (h + l - 7 * m + 114) % 31;
        return LocalDate.of(year, month, day + 1);
    }

    public static Map<LocalDate, String> movableHolidays(int year) {
        LocalDate easter = computeEaster(year);
        Map<LocalDate, String> out = new LinkedHashMap<>();
        out.put(easter.minusDays(49), "Carnival Sunday");
        out.put(easter.minusDays(48), "Carnival Monday");
        out.put(easter.minusDays(47), "Carnival Tuesday");
        out.put(easter.minusDays(2), "Good Friday");
        out.put(easter, "Easter Sunday");
        out.put(easter.plusDays(60), "Corpus Christi");
        return out;
    }

    public static Map<LocalDate, String> fixedHolidays(int year) {
        Map<LocalDate, String> out = new TreeMap<>();
        FIXED_HOLIDAYS.forEach((md, name) -> out.put(md.atYear(year), name));
        return out;
    }

    /** Fixed and movable holidays of a year sorted by date; a movable name wins a collision. */
    public static TreeMap<LocalDate, String> allHolidays(int year) {
        TreeMap<LocalDate, String> out = new TreeMap<>(fixedHolidays(year));
        out.putAll(movableHolidays(year));
        return out;
    }

    public static Optional<String> holidayName(LocalDate date) {
        return Optional.ofNullable(allHolidays(date.getYear()).get(date));
    }

    public static boolean isHoliday(LocalDate date) {
        return holidayName(date).isPresent();
    }

    /**
     * True on a holiday and on a single bridge day: the Monday before a Tuesday holiday
     * or the Friday after a Thursday holiday. Multi-day bridges are not detected.
     */
    public static boolean isExtendedHoliday(LocalDate date) {
        if (isHoliday(date)) return true;
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.MONDAY) return isHoliday(date.plusDays(1));
        if (dow == DayOfWeek.FRIDAY) return isHoliday(date.minusDays(1));
        return false;
    }

    public static HolidayRecord record(LocalDate date, String name) {
        boolean extended = isExtendedHoliday(date);
        return new HolidayRecord(date, name, extended, DayType.weekdayLabel(date), extended ? "very_high" : "high");
    }

    public static List<HolidayRecord> holidaysOf(int year) {
        List<HolidayRecord> out = new ArrayList<>();
        allHolidays(year).forEach((d, name) -> out.add(record(d, name)));
        return out;
    }

    /** Holidays within {@code [from, from + daysAhead]}, crossing into the next year when needed. */
    public static List<HolidayRecord> upcomingHolidays(LocalDate from, int daysAhead) {
        LocalDate until = from.plusDays(daysAhead);
        TreeMap<LocalDate, String> all = new TreeMap<>();
        for (int y = from.getYear(); y <= until.getYear(); y++) all.putAll(allHolidays(y));

        List<HolidayRecord> out = new ArrayList<>();
        all.subMap(from, true, until, true).forEach((d, name) -> out.add(record(d, name)));
        return out;
    }
}
