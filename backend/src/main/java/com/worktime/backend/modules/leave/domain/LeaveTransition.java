package com.worktime.backend.modules.leave.domain;

public enum LeaveTransition {
    APPROVE,
    REJECT,
    CANCEL
}
