package com.worktime.backend.modules.calendar.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Calendar backed by a fixed set of weekend days and an explicit holiday list.
 */
public final class FixedHolidayCalendar implements HolidayCalendar {

    private final Set<DayOfWeek> weekendDays;
    private final Set<LocalDate> holidays;

    public FixedHolidayCalendar(Collection<DayOfWeek> weekendDays, Collection<LocalDate> holidays) {
        this.weekendDays = weekendDays.isEmpty() ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(weekendDays);
        this.holidays = Set.copyOf(holidays);
    }

    public static FixedHolidayCalendar weekendsOnly() {
        return new FixedHolidayCalendar(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY), Set.of());
    }

    @Override
    public boolean isWeekend(LocalDate date) {
        return weekendDays.contains(date.getDayOfWeek());
    }

    @Override
    public boolean isHoliday(LocalDate date) {
        return holidays.contains(date);
    }

    public Set<LocalDate> getHolidays() {
        return holidays;
    }
}
