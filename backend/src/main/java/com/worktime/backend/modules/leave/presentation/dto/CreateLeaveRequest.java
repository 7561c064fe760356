package com.worktime.backend.modules.leave.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateLeaveRequest(
        @NotNull(message = "EMPLOYEE_REQUIRED")
        UUID employeeId,
        @NotNull(message = "START_DATE_REQUIRED")
        LocalDate startDate,
        @NotNull(message = "END_DATE_REQUIRED")
        LocalDate endDate,
        @NotBlank(message = "TYPE_REQUIRED")
        String type,
        UUID substituteId,
        @Size(max = 2000, message = "NOTES_TOO_LONG")
        String notes
) {
}
