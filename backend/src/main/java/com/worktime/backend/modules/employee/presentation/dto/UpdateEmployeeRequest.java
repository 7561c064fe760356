package com.worktime.backend.modules.employee.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * Partial profile edit. Null fields are left untouched; the {@code clear*} flags remove a reference.
 */
public record UpdateEmployeeRequest(
        @Size(max = 100, message = "DISPLAY_NAME_TOO_LONG")
        String displayName,
        @Size(max = 64, message = "DEPARTMENT_TOO_LONG")
        String department,
        UUID managerId,
        boolean clearManager,
        UUID substituteId,
        boolean clearSubstitute,
        @Min(value = 0, message = "BALANCE_CAP_NEGATIVE")
        Integer leaveBalanceCap,
        Boolean administrator
) {
}
