package com.worktime.backend.modules.report.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Totals of one employee over an inclusive period. Minutes are the exact values; the hour fields are
 * the same values rounded to two decimals for display.
 */
public record PeriodSummary(
        UUID employeeId,
        LocalDate periodStart,
        LocalDate periodEnd,
        long calendarDays,
        long workingDays,
        int entryCount,
        long workedMinutes,
        BigDecimal workedHours,
        long targetMinutes,
        BigDecimal targetHours,
        long overtimeMinutes,
        BigDecimal overtimeHours,
        int leaveDays,
        List<ProjectShare> projects,
        List<WeeklyTotal> weeks
) {
}
