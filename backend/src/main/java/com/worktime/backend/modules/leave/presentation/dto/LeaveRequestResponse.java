package com.worktime.backend.modules.leave.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.worktime.backend.modules.leave.domain.LeaveRequest;
import com.worktime.backend.modules.leave.domain.LeaveStatus;

public record LeaveRequestResponse(
        UUID requestId,
        UUID employeeId,
        LocalDate startDate,
        LocalDate endDate,
        String type,
        LeaveStatus status,
        UUID substituteId,
        String notes,
        int chargedDays,
        UUID decidedBy,
        OffsetDateTime decidedAt,
        String decisionReason,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static LeaveRequestResponse from(LeaveRequest request) {
        return new LeaveRequestResponse(
                request.getId(),
                request.getEmployee().getId(),
                request.getStartDate(),
                request.getEndDate(),
                request.getLeaveType(),
                request.getStatus(),
                request.getSubstitute() != null ? request.getSubstitute().getId() : null,
                request.getNotes(),
                request.getChargedDays(),
                request.getDecidedBy() != null ? request.getDecidedBy().getId() : null,
                request.getDecidedAt(),
                request.getDecisionReason(),
                request.getCreatedAt(),
                request.getUpdatedAt()
        );
    }
}
