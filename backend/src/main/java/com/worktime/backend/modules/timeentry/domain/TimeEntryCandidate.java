package com.worktime.backend.modules.timeentry.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A submitted entry before validation. A {@code null} break means "not supplied".
 */
public record TimeEntryCandidate(
        UUID employeeId,
        LocalDate date,
        OffsetDateTime start,
        OffsetDateTime end,
        Integer breakMinutes,
        String projectCode,
        String notes
) {
}
