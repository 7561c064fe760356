package com.worktime.backend.modules.timeentry.domain;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.worktime.backend.global.common.time.DateTimes;
import com.worktime.backend.global.common.time.TimeInterval;
import com.worktime.backend.global.config.WorkRules;
import com.worktime.backend.global.error.InvalidInputException;
import com.worktime.backend.global.error.OverlapException;

/**
 * Validates a submitted entry and turns it into the normalized form that is persisted.
 *
 * <p>The order is: structure, break derivation and minimum, rounding, overlap against the stored
 * (already rounded) entries of the same day, then the daily ceiling. Nothing is corrected silently;
 * each failed rule raises its own {@link com.worktime.backend.global.error.RuleViolationException}.
 *
 * <p>Stateless and side-effect free. The weekly ceiling needs cross-day state and is checked by the caller.
 */
public final class TimeEntryValidator {

    private TimeEntryValidator() {
    }

    /**
     * @param existing stored entries of the same employee and date, excluding the entry being replaced
     */
    public static NormalizedEntry validateAndNormalize(
            TimeEntryCandidate candidate,
            Collection<RecordedEntry> existing,
            WorkRules rules
    ) {
        Objects.requireNonNull(rules, "rules");
        requireStructure(candidate);

        long rawMinutes = DateTimes.minutesBetween(candidate.start(), candidate.end());
        // a zero break counts as not given
        boolean omitted = candidate.breakMinutes() == null || candidate.breakMinutes() == 0;
        boolean derived = omitted && rules.automaticBreakDeduction();
        int breakMinutes;
        if (derived) {
            breakMinutes = deriveBreak(candidate.start(), candidate.end(), rules);
        } else {
            breakMinutes = candidate.breakMinutes() != null ? candidate.breakMinutes() : 0;
        }
        if (breakMinutes < 0) {
            throw new InvalidInputException("breakMinutes", "break must not be negative");
        }
        if (rawMinutes >= rules.minimumBreakThresholdMinutes() && breakMinutes < rules.breakDurationMinutes()) {
            throw new InsufficientBreakException(breakMinutes, rules.breakDurationMinutes(), rawMinutes);
        }

        OffsetDateTime start = DateTimes.round(candidate.start(), rules.roundingMinutes(), rules.roundingMethod());
        OffsetDateTime end = DateTimes.round(candidate.end(), rules.roundingMinutes(), rules.roundingMethod());
        if (!start.isBefore(end)) {
            throw new InvalidInputException("endTime",
                    "entry collapses to nothing after rounding to " + rules.roundingMinutes() + " minutes");
        }
        TimeInterval interval = TimeInterval.of(start, end);
        if (breakMinutes >= interval.minutes()) {
            throw new InvalidInputException("breakMinutes", "break must be shorter than the entry itself");
        }

        List<UUID> conflicts = existing.stream()
                .filter(entry -> candidate.employeeId().equals(entry.employeeId()))
                .filter(entry -> candidate.date().equals(entry.date()))
                .filter(entry -> entry.interval().overlaps(interval))
                .map(RecordedEntry::id)
                .toList();
        if (!conflicts.isEmpty()) {
            throw new OverlapException(OverlapException.TIME_ENTRY_CODE, conflicts,
                    "entry overlaps " + conflicts.size() + " existing entr" + (conflicts.size() == 1 ? "y" : "ies")
                            + " on " + candidate.date());
        }

        long workedMinutes = interval.minutes() - breakMinutes;
        long dayTotal = workedMinutes + existing.stream()
                .filter(entry -> candidate.employeeId().equals(entry.employeeId()))
                .filter(entry -> candidate.date().equals(entry.date()))
                .mapToLong(RecordedEntry::workedMinutes)
                .sum();
        if (dayTotal > rules.maxDailyMinutes()) {
            throw new DailyLimitExceededException(candidate.date(), dayTotal, rules.maxDailyMinutes());
        }

        return new NormalizedEntry(
                candidate.employeeId(),
                candidate.date(),
                start,
                end,
                breakMinutes,
                derived,
                resolveProject(candidate.projectCode(), rules),
                trimToNull(candidate.notes())
        );
    }

    /**
     * Standard break once the raw span reaches the threshold, otherwise none.
     */
    public static int deriveBreak(OffsetDateTime start, OffsetDateTime end, WorkRules rules) {
        long rawMinutes = DateTimes.minutesBetween(start, end);
        return rawMinutes >= rules.minimumBreakThresholdMinutes() ? rules.breakDurationMinutes() : 0;
    }

    public static boolean overlaps(RecordedEntry left, RecordedEntry right) {
        return Objects.equals(left.employeeId(), right.employeeId())
                && Objects.equals(left.date(), right.date())
                && left.interval().overlaps(right.interval());
    }

    private static void requireStructure(TimeEntryCandidate candidate) {
        if (candidate == null) {
            throw new InvalidInputException("entry", "entry is required");
        }
        if (candidate.employeeId() == null) {
            throw new InvalidInputException("employeeId", "employeeId is required");
        }
        if (candidate.date() == null) {
            throw new InvalidInputException("date", "date is required");
        }
        if (candidate.start() == null) {
            throw new InvalidInputException("startTime", "startTime is required");
        }
        if (candidate.end() == null) {
            throw new InvalidInputException("endTime", "endTime is required");
        }
        if (!candidate.start().isBefore(candidate.end())) {
            throw new InvalidInputException("endTime", "startTime must be before endTime");
        }
        if (!candidate.start().toLocalDate().equals(candidate.date())) {
            throw new InvalidInputException("startTime",
                    "startTime " + candidate.start() + " does not fall on " + candidate.date());
        }
    }

    private static String resolveProject(String projectCode, WorkRules rules) {
        if (projectCode == null || projectCode.isBlank()) {
            return rules.defaultProjectCode();
        }
        return projectCode.trim();
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
