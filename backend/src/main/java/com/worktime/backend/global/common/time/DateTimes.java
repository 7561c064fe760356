package com.worktime.backend.global.common.time;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Date and time arithmetic shared by the accounting rules. Business code never parses or formats
 * timestamps itself; it goes through these helpers.
 */
public final class DateTimes {

    public static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("HH:mm");
    public static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    private static final int MINUTES_PER_HOUR = 60;

    private DateTimes() {
    }

    /**
     * Accepts either a full ISO-8601 timestamp with offset ({@code 2025-05-01T09:00:00+02:00}) or a
     * wall-clock time ({@code 09:00}) that is placed on {@code date} in {@code zone}. In an autumn overlap the
     * earlier offset wins.
     *
     * @throws DateTimeParseException if the text is neither
     * @throws DateTimeException if the wall-clock time does not exist on that date (spring-forward gap)
     */
    public static OffsetDateTime parseTimestamp(LocalDate date, String text, ZoneId zone) {
        String trimmed = text.trim();
        if (trimmed.indexOf('T') >= 0) {
            return OffsetDateTime.parse(trimmed);
        }
        LocalDateTime local = date.atTime(LocalTime.parse(trimmed));
        if (zone.getRules().getValidOffsets(local).isEmpty()) {
            throw new DateTimeException(local + " does not exist in " + zone + " (daylight saving gap)");
        }
        return local.atZone(zone).toOffsetDateTime();
    }

    /**
     * Parses {@code yyyy-MM-dd}, falling back to the {@code dd.MM.yyyy} form used in the UI.
     */
    public static LocalDate parseDate(String text) {
        String trimmed = text.trim();
        try {
            return LocalDate.parse(trimmed);
        } catch (DateTimeParseException ex) {
            return LocalDate.parse(trimmed, DISPLAY_DATE);
        }
    }

    public static String formatTime(OffsetDateTime value, ZoneId zone) {
        return value.atZoneSameInstant(zone).format(TIME_OF_DAY);
    }

    public static String formatDisplayDate(LocalDate date) {
        return date.format(DISPLAY_DATE);
    }

    public static long minutesBetween(OffsetDateTime start, OffsetDateTime end) {
        return Duration.between(start, end).toMinutes();
    }

    public static long hoursToMinutes(double hours) {
        return Math.round(hours * MINUTES_PER_HOUR);
    }

    public static BigDecimal minutesToHours(long minutes) {
        return BigDecimal.valueOf(minutes)
                .divide(BigDecimal.valueOf(MINUTES_PER_HOUR), 2, RoundingMode.HALF_UP);
    }

    public static long inclusiveDays(LocalDate start, LocalDate end) {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    public static LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    public static DateRange isoWeekOf(LocalDate date) {
        LocalDate monday = weekStart(date);
        return new DateRange(monday, monday.plusDays(6));
    }

    /**
     * Rounds to a multiple of {@code roundingMinutes} counted from the local midnight of the value's own offset.
     * Sub-second precision is dropped first. {@code roundingMinutes <= 0} returns the value unchanged.
     */
    public static OffsetDateTime round(OffsetDateTime value, int roundingMinutes, RoundingMethod method) {
        if (roundingMinutes <= 0) {
            return value;
        }
        OffsetDateTime seconds = value.truncatedTo(ChronoUnit.SECONDS);
        OffsetDateTime midnight = seconds.truncatedTo(ChronoUnit.DAYS);
        long secondOfDay = Duration.between(midnight, seconds).getSeconds();
        long unit = roundingMinutes * 60L;
        long steps = switch (method) {
            case DOWN -> Math.floorDiv(secondOfDay, unit);
            case UP -> Math.floorDiv(secondOfDay + unit - 1, unit);
            case NEAREST -> Math.floorDiv(secondOfDay * 2 + unit, unit * 2);
        };
        return midnight.plusSeconds(steps * unit);
    }
}
