package com.worktime.backend.modules.timeentry.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.worktime.backend.global.common.time.TimeInterval;

/**
 * Read-only view of a stored, already normalized entry.
 */
public record RecordedEntry(
        UUID id,
        UUID employeeId,
        LocalDate date,
        OffsetDateTime start,
        OffsetDateTime end,
        int breakMinutes,
        String projectCode
) {

    public TimeInterval interval() {
        return TimeInterval.of(start, end);
    }

    public long workedMinutes() {
        return Math.max(0, interval().minutes() - breakMinutes);
    }
}
