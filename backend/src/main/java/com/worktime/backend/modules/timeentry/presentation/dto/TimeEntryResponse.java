package com.worktime.backend.modules.timeentry.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.worktime.backend.global.common.time.DateTimes;
import com.worktime.backend.modules.timeentry.domain.TimeEntry;

public record TimeEntryResponse(
        UUID entryId,
        UUID employeeId,
        LocalDate date,
        OffsetDateTime startTime,
        OffsetDateTime endTime,
        int breakMinutes,
        long workedMinutes,
        BigDecimal workedHours,
        String project,
        String notes,
        boolean approved,
        UUID approvedBy,
        OffsetDateTime approvedAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static TimeEntryResponse from(TimeEntry entry) {
        long worked = entry.workedMinutes();
        return new TimeEntryResponse(
                entry.getId(),
                entry.getEmployee().getId(),
                entry.getEntryDate(),
                entry.getStartAt(),
                entry.getEndAt(),
                entry.getBreakMinutes(),
                worked,
                DateTimes.minutesToHours(worked),
                entry.getProjectCode(),
                entry.getNotes(),
                entry.isApproved(),
                entry.getApprovedBy() != null ? entry.getApprovedBy().getId() : null,
                entry.getApprovedAt(),
                entry.getCreatedAt(),
                entry.getUpdatedAt()
        );
    }
}
