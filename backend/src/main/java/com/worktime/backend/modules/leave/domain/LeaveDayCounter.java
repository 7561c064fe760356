package com.worktime.backend.modules.leave.domain;

import java.util.Objects;

import com.worktime.backend.global.common.time.DateRange;
import com.worktime.backend.modules.calendar.domain.HolidayCalendar;

/**
 * Counts chargeable leave days. Shared by approval and period aggregation so both always agree.
 */
public final class LeaveDayCounter {

    private final LeaveDayCounting counting;
    private final HolidayCalendar calendar;

    public LeaveDayCounter(LeaveDayCounting counting, HolidayCalendar calendar) {
        this.counting = Objects.requireNonNull(counting, "counting");
        this.calendar = Objects.requireNonNull(calendar, "calendar");
    }

    public int count(DateRange range) {
        long days = switch (counting) {
            case CALENDAR_DAYS -> range.days();
            case WORKING_DAYS -> calendar.countWorkingDays(range);
        };
        return Math.toIntExact(days);
    }
}
