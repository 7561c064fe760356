package com.worktime.backend.modules.report.domain;

import java.math.BigDecimal;

/**
 * Worked time booked on one project code. {@code percentage} is relative to the period total.
 */
public record ProjectShare(String projectCode, long minutes, BigDecimal hours, BigDecimal percentage) {
}
