package com.worktime.backend.modules.report.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

import com.worktime.backend.global.common.time.DateRange;
import com.worktime.backend.global.common.time.DateTimes;
import com.worktime.backend.global.config.WorkRules;
import com.worktime.backend.global.error.InvalidInputException;
import com.worktime.backend.modules.calendar.domain.HolidayCalendar;
import com.worktime.backend.modules.leave.domain.LeaveDayCounter;
import com.worktime.backend.modules.leave.domain.LeaveSpan;
import com.worktime.backend.modules.leave.domain.LeaveStatus;
import com.worktime.backend.modules.timeentry.domain.RecordedEntry;

/**
 * Folds stored entries and approved leave into period totals.
 *
 * <p>Entries outside the period, and leave that is not {@link LeaveStatus#APPROVED}, are ignored, so callers
 * may pass a superset. Leave is clipped to the period and counted with the same {@link LeaveDayCounter}
 * used for balances. All sums are whole minutes; splitting a period and adding the parts gives the
 * same worked minutes.
 */
public final class PeriodAggregator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PeriodAggregator() {
    }

    public static PeriodSummary aggregate(
            UUID employeeId,
            LocalDate periodStart,
            LocalDate periodEnd,
            Collection<RecordedEntry> entries,
            Collection<LeaveSpan> leaveRequests,
            HolidayCalendar calendar,
            LeaveDayCounter leaveDayCounter,
            WorkRules rules
    ) {
        if (periodStart == null || periodEnd == null || periodEnd.isBefore(periodStart)) {
            throw new InvalidInputException("period", "period must have a start on or before its end");
        }
        DateRange period = new DateRange(periodStart, periodEnd);
        List<RecordedEntry> inPeriod = entries.stream()
                .filter(entry -> employeeId.equals(entry.employeeId()))
                .filter(entry -> period.contains(entry.date()))
                .toList();

        long workedMinutes = inPeriod.stream().mapToLong(RecordedEntry::workedMinutes).sum();
        long workingDays = calendar.countWorkingDays(period);
        long targetMinutes = workingDays * rules.standardDailyMinutes();
        long overtimeMinutes = Math.max(0, workedMinutes - targetMinutes);

        int leaveDays = leaveRequests.stream()
                .filter(leave -> leave.status() == LeaveStatus.APPROVED)
                .map(leave -> leave.period().intersect(period))
                .flatMap(Optional::stream)
                .mapToInt(leaveDayCounter::count)
                .sum();

        return new PeriodSummary(
                employeeId,
                periodStart,
                periodEnd,
                period.days(),
                workingDays,
                inPeriod.size(),
                workedMinutes,
                DateTimes.minutesToHours(workedMinutes),
                targetMinutes,
                DateTimes.minutesToHours(targetMinutes),
                overtimeMinutes,
                DateTimes.minutesToHours(overtimeMinutes),
                leaveDays,
                projectShares(inPeriod, workedMinutes),
                weeklyTotals(inPeriod)
        );
    }

    /**
     * Worked minutes of the entries dated inside {@code range}.
     */
    public static long workedMinutes(Collection<RecordedEntry> entries, DateRange range) {
        return entries.stream()
                .filter(entry -> range.contains(entry.date()))
                .mapToLong(RecordedEntry::workedMinutes)
                .sum();
    }

    public static List<WeeklyTotal> weeklyTotals(Collection<RecordedEntry> entries) {
        Map<LocalDate, Long> byWeek = new TreeMap<>();
        for (RecordedEntry entry : entries) {
            byWeek.merge(DateTimes.weekStart(entry.date()), entry.workedMinutes(), Long::sum);
        }
        return byWeek.entrySet().stream()
                .map(week -> new WeeklyTotal(week.getKey(), week.getValue(), DateTimes.minutesToHours(week.getValue())))
                .toList();
    }

    private static List<ProjectShare> projectShares(Collection<RecordedEntry> entries, long totalMinutes) {
        Map<String, Long> byProject = new TreeMap<>();
        for (RecordedEntry entry : entries) {
            byProject.merge(entry.projectCode(), entry.workedMinutes(), Long::sum);
        }
        return byProject.entrySet().stream()
                .map(project -> new ProjectShare(
                        project.getKey(),
                        project.getValue(),
                        DateTimes.minutesToHours(project.getValue()),
                        percentage(project.getValue(), totalMinutes)))
                .toList();
    }

    private static BigDecimal percentage(long minutes, long totalMinutes) {
        if (totalMinutes == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return BigDecimal.valueOf(minutes)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(totalMinutes), 2, RoundingMode.HALF_UP);
    }
}
