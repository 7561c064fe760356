package com.worktime.backend.global.config;

import java.util.Objects;

import com.worktime.backend.global.common.time.DateTimes;
import com.worktime.backend.global.common.time.RoundingMethod;

/**
 * Immutable work-time rule set handed to every validation and aggregation call.
 * Durations are whole minutes so that sums stay exact.
 */
public record WorkRules(
        long maxDailyMinutes,
        long maxWeeklyMinutes,
        long standardDailyMinutes,
        int breakDurationMinutes,
        long minimumBreakThresholdMinutes,
        boolean automaticBreakDeduction,
        int roundingMinutes,
        RoundingMethod roundingMethod,
        String defaultProjectCode,
        int annualLeaveDefaultBalance,
        int annualLeaveMaxBalance
) {

    public WorkRules {
        Objects.requireNonNull(roundingMethod, "roundingMethod");
        Objects.requireNonNull(defaultProjectCode, "defaultProjectCode");
        if (maxDailyMinutes <= 0 || maxWeeklyMinutes <= 0 || standardDailyMinutes < 0) {
            throw new IllegalArgumentException("hour limits must be positive");
        }
        if (breakDurationMinutes < 0 || minimumBreakThresholdMinutes < 0 || roundingMinutes < 0) {
            throw new IllegalArgumentException("break and rounding settings must not be negative");
        }
        if (annualLeaveDefaultBalance < 0 || annualLeaveMaxBalance < annualLeaveDefaultBalance) {
            throw new IllegalArgumentException("leave balance cap must be >= default balance >= 0");
        }
    }

    public static WorkRules defaults() {
        return new WorkRules(
                DateTimes.hoursToMinutes(8),
                DateTimes.hoursToMinutes(40),
                DateTimes.hoursToMinutes(8),
                30,
                DateTimes.hoursToMinutes(6),
                true,
                15,
                RoundingMethod.NEAREST,
                "INTERNAL",
                30,
                30
        );
    }

    public WorkRules withMaxDailyHours(double hours) {
        return new WorkRules(DateTimes.hoursToMinutes(hours), maxWeeklyMinutes, standardDailyMinutes,
                breakDurationMinutes, minimumBreakThresholdMinutes, automaticBreakDeduction, roundingMinutes,
                roundingMethod, defaultProjectCode, annualLeaveDefaultBalance, annualLeaveMaxBalance);
    }

    public WorkRules withAutomaticBreakDeduction(boolean enabled) {
        return new WorkRules(maxDailyMinutes, maxWeeklyMinutes, standardDailyMinutes,
                breakDurationMinutes, minimumBreakThresholdMinutes, enabled, roundingMinutes,
                roundingMethod, defaultProjectCode, annualLeaveDefaultBalance, annualLeaveMaxBalance);
    }

    public WorkRules withRounding(int minutes, RoundingMethod method) {
        return new WorkRules(maxDailyMinutes, maxWeeklyMinutes, standardDailyMinutes,
                breakDurationMinutes, minimumBreakThresholdMinutes, automaticBreakDeduction, minutes,
                method, defaultProjectCode, annualLeaveDefaultBalance, annualLeaveMaxBalance);
    }
}
