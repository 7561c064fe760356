package com.worktime.backend.modules.leave.domain;

/**
 * Outcome of a legal transition. {@code balanceDelta} is applied to the employee's balance in the same
 * transaction as the status change.
 */
public record LeaveDecision(LeaveStatus nextStatus, int balanceDelta, int chargedDays) {
}
