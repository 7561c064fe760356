package com.worktime.backend.global.config;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import com.worktime.backend.global.common.time.DateTimes;
import com.worktime.backend.global.common.time.RoundingMethod;
import com.worktime.backend.modules.leave.domain.LeaveDayCounting;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Binds the {@code worktime.*} block of application.yml. Only {@link #toWorkRules()} and the small
 * accessor helpers leave this class; nothing reads these properties as a global.
 */
@ConfigurationProperties(prefix = "worktime")
public record WorktimeProperties(
        @DefaultValue Rules rules,
        @DefaultValue Leave leave,
        @DefaultValue Calendar calendar,
        @DefaultValue Notification notification
) {

    public WorkRules toWorkRules() {
        return new WorkRules(
                DateTimes.hoursToMinutes(rules.maxDailyHours()),
                DateTimes.hoursToMinutes(rules.maxWeeklyHours()),
                DateTimes.hoursToMinutes(rules.standardDailyHours()),
                rules.breakDurationMinutes(),
                DateTimes.hoursToMinutes(rules.minimumBreakThresholdHours()),
                rules.automaticBreakDeduction(),
                rules.roundingMinutes(),
                rules.roundingMethod(),
                rules.defaultProjectCode(),
                rules.annualLeaveDefaultBalance(),
                Math.max(rules.annualLeaveMaxBalance(), rules.annualLeaveDefaultBalance())
        );
    }

    public record Rules(
            @DefaultValue("8") double maxDailyHours,
            @DefaultValue("40") double maxWeeklyHours,
            @DefaultValue("8") double standardDailyHours,
            @DefaultValue("30") int breakDurationMinutes,
            @DefaultValue("6") double minimumBreakThresholdHours,
            @DefaultValue("true") boolean automaticBreakDeduction,
            @DefaultValue("15") int roundingMinutes,
            @DefaultValue("nearest") RoundingMethod roundingMethod,
            @DefaultValue("INTERNAL") String defaultProjectCode,
            @DefaultValue("30") int annualLeaveDefaultBalance,
            @DefaultValue("30") int annualLeaveMaxBalance
    ) {
    }

    public record Leave(
            @DefaultValue({"VACATION", "SICK", "PERSONAL", "SPECIAL", "OTHER"}) List<String> types,
            @DefaultValue("calendar-days") LeaveDayCounting dayCounting
    ) {

        public Set<String> normalizedTypes() {
            return types.stream()
                    .map(type -> type.trim().toUpperCase())
                    .collect(Collectors.toCollection(TreeSet::new));
        }
    }

    public record Calendar(
            @DefaultValue("Europe/Berlin") String zone,
            @DefaultValue({"SATURDAY", "SUNDAY"}) List<DayOfWeek> weekendDays,
            List<String> holidays
    ) {

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }

        public Set<LocalDate> holidayDates() {
            if (holidays == null) {
                return Set.of();
            }
            return holidays.stream()
                    .map(DateTimes::parseDate)
                    .collect(Collectors.toUnmodifiableSet());
        }
    }

    public record Notification(
            @DefaultValue("true") boolean enabled,
            @DefaultValue Categories categories
    ) {
    }

    public record Categories(
            @DefaultValue("true") boolean leaveRequest,
            @DefaultValue("true") boolean timeEntry
    ) {
    }
}
