package com.worktime.backend.modules.report.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public record WeeklyTotal(LocalDate weekStart, long minutes, BigDecimal hours) {
}
