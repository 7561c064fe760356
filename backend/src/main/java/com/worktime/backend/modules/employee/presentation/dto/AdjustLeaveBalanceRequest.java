package com.worktime.backend.modules.employee.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record AdjustLeaveBalanceRequest(
        @NotNull(message = "BALANCE_REQUIRED")
        Integer balance,
        String reason
) {
}
