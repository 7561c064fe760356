package com.worktime.backend.modules.leave.domain;

import java.util.UUID;

import com.worktime.backend.global.common.time.DateRange;

/**
 * Detached view of a leave request used by aggregation.
 */
public record LeaveSpan(UUID requestId, DateRange period, LeaveStatus status) {
}
