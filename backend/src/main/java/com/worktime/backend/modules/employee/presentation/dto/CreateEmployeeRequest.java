package com.worktime.backend.modules.employee.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateEmployeeRequest(
        @NotBlank(message = "DISPLAY_NAME_REQUIRED")
        @Size(max = 100, message = "DISPLAY_NAME_TOO_LONG")
        String displayName,
        @NotBlank(message = "EMAIL_REQUIRED")
        @Email(message = "EMAIL_INVALID")
        String email,
        @NotBlank(message = "DEPARTMENT_REQUIRED")
        @Size(max = 64, message = "DEPARTMENT_TOO_LONG")
        String department,
        UUID managerId,
        UUID substituteId,
        @Min(value = 0, message = "BALANCE_NEGATIVE")
        Integer annualLeaveBalance,
        @Min(value = 0, message = "BALANCE_CAP_NEGATIVE")
        Integer leaveBalanceCap,
        boolean administrator
) {
}
