package com.worktime.backend.modules.employee.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.worktime.backend.modules.employee.domain.Employee;

public record EmployeeResponse(
        UUID employeeId,
        String displayName,
        String email,
        String department,
        UUID managerId,
        UUID substituteId,
        int annualLeaveBalance,
        int leaveBalanceCap,
        boolean administrator,
        boolean active,
        OffsetDateTime disabledAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static EmployeeResponse from(Employee employee) {
        return new EmployeeResponse(
                employee.getId(),
                employee.getDisplayName(),
                employee.getEmail(),
                employee.getDepartment(),
                employee.getManager() != null ? employee.getManager().getId() : null,
                employee.getSubstitute() != null ? employee.getSubstitute().getId() : null,
                employee.getAnnualLeaveBalance(),
                employee.getLeaveBalanceCap(),
                employee.isAdministrator(),
                employee.isActive(),
                employee.getDisabledAt(),
                employee.getCreatedAt(),
                employee.getUpdatedAt()
        );
    }
}
