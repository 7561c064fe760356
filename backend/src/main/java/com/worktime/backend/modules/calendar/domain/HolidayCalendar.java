package com.worktime.backend.modules.calendar.domain;

import java.time.LocalDate;

import com.worktime.backend.global.common.time.DateRange;

/**
 * Working-day lookup supplied to aggregation and leave day counting.
 */
public interface HolidayCalendar {

    boolean isWeekend(LocalDate date);

    boolean isHoliday(LocalDate date);

    default boolean isWorkingDay(LocalDate date) {
        return !isWeekend(date) && !isHoliday(date);
    }

    default long countWorkingDays(DateRange range) {
        return range.dates().filter(this::isWorkingDay).count();
    }
}
