package com.worktime.backend.modules.timeentry.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.worktime.backend.global.common.time.TimeInterval;

public record NormalizedEntry(
        UUID employeeId,
        LocalDate date,
        OffsetDateTime start,
        OffsetDateTime end,
        int breakMinutes,
        boolean breakDerived,
        String projectCode,
        String notes
) {

    public TimeInterval interval() {
        return TimeInterval.of(start, end);
    }

    public long workedMinutes() {
        return interval().minutes() - breakMinutes;
    }
}
