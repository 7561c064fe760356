package com.worktime.backend.modules.report.presentation.dto;

import com.worktime.backend.modules.report.domain.PeriodSummary;

public record PeriodReportResponse(
        String employeeName,
        String label,
        PeriodSummary summary
) {
}
