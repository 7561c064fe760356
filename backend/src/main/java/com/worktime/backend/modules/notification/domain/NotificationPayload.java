package com.worktime.backend.modules.notification.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.worktime.backend.modules.employee.domain.Employee;

/**
 * Detached snapshot handed to the dispatcher. Contains no entity references, so delivery may happen
 * after the transaction is gone.
 */
public record NotificationPayload(
        EmployeeSnapshot employee,
        EmployeeSnapshot manager,
        EmployeeSnapshot substitute,
        EmployeeSnapshot actor,
        TimeEntrySnapshot timeEntry,
        LeaveRequestSnapshot leaveRequest,
        String reason
) {

    public static NotificationPayload forTimeEntry(Employee employee, Employee actor, TimeEntrySnapshot timeEntry) {
        return new NotificationPayload(
                EmployeeSnapshot.from(employee),
                EmployeeSnapshot.from(employee.getManager()),
                null,
                EmployeeSnapshot.from(actor),
                timeEntry,
                null,
                null
        );
    }

    public static NotificationPayload forLeaveRequest(
            Employee employee,
            Employee substitute,
            Employee actor,
            LeaveRequestSnapshot leaveRequest,
            String reason
    ) {
        return new NotificationPayload(
                EmployeeSnapshot.from(employee),
                EmployeeSnapshot.from(employee.getManager()),
                EmployeeSnapshot.from(substitute),
                EmployeeSnapshot.from(actor),
                null,
                leaveRequest,
                reason
        );
    }

    public UUID subjectId() {
        if (leaveRequest != null) {
            return leaveRequest.id();
        }
        return timeEntry != null ? timeEntry.id() : null;
    }

    public record EmployeeSnapshot(UUID id, String displayName, String email) {

        public static EmployeeSnapshot from(Employee employee) {
            if (employee == null) {
                return null;
            }
            return new EmployeeSnapshot(employee.getId(), employee.getDisplayName(), employee.getEmail());
        }
    }

    public record TimeEntrySnapshot(
            UUID id,
            LocalDate date,
            OffsetDateTime start,
            OffsetDateTime end,
            int breakMinutes,
            String projectCode
    ) {
    }

    public record LeaveRequestSnapshot(
            UUID id,
            LocalDate startDate,
            LocalDate endDate,
            String type,
            String status,
            int chargedDays
    ) {
    }
}
