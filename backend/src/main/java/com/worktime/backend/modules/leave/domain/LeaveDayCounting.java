package com.worktime.backend.modules.leave.domain;

/**
 * How the days of a leave request are charged against the balance.
 */
public enum LeaveDayCounting {
    /** Every date of the inclusive range counts. */
    CALENDAR_DAYS,
    /** Weekends and calendar holidays are not charged. */
    WORKING_DAYS
}
