package com.worktime.backend.modules.timeentry.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import jakarta.validation.constraints.Size;

/**
 * Submitted entry. {@code startTime}/{@code endTime} take either {@code HH:mm} (placed on {@code date} in the
 * configured zone) or a full ISO-8601 timestamp with offset. Required fields are checked by the validator so the
 * response names the rule that failed.
 */
public record TimeEntryRequest(
        UUID employeeId,
        LocalDate date,
        String startTime,
        String endTime,
        Integer breakMinutes,
        @Size(max = 64, message = "PROJECT_TOO_LONG")
        String project,
        @Size(max = 2000, message = "NOTES_TOO_LONG")
        String notes
) {
}
