package dev.devanks.voltedge.pipeline.util;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Pure calendar helpers over bucket timestamps. No holiday calendar is consulted.
 */
public final class CalendarUtils {

    public static final int BUSINESS_HOURS_START = 7;
    public static final int BUSINESS_HOURS_END = 19;   // exclusive
    public static final int PEAK_HOURS_START = 18;
    public static final int PEAK_HOURS_END = 22;       // exclusive

    private CalendarUtils() {
    }

    public static LocalDateTime hourBucket(LocalDateTime timestamp) {
        return timestamp.truncatedTo(ChronoUnit.HOURS);
    }

    /**
     * @return 0 for Monday through 6 for Sunday
     */
    public static int dayOfWeekIndex(LocalDateTime timestamp) {
        return timestamp.getDayOfWeek().getValue() - 1;
    }

    public static boolean isWeekend(LocalDateTime timestamp) {
        DayOfWeek day = timestamp.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    /**
     * Meteorological season: 0 winter (Dec-Feb), 1 spring, 2 summer, 3 autumn.
     */
    public static int season(int month) {
        return (month % 12) / 3;
    }

    public static int quarter(int month) {
        return (month - 1) / 3 + 1;
    }

    public static boolean isBusinessHour(LocalDateTime timestamp) {
        int hour = timestamp.getHour();
        return !isWeekend(timestamp) && hour >= BUSINESS_HOURS_START && hour < BUSINESS_HOURS_END;
    }

    public static boolean isPeakHour(LocalDateTime timestamp) {
        int hour = timestamp.getHour();
        return hour >= PEAK_HOURS_START && hour < PEAK_HOURS_END;
    }
}
