package com.worktime.backend.modules.report.presentation;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

import com.worktime.backend.modules.report.application.ReportService;
import com.worktime.backend.modules.report.presentation.dto.PeriodReportResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/reports/employees/{employeeId}")
public class ReportController {

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @Operation(summary = "Monthly summary", description = "Worked hours, overtime, leave days and project breakdown of one month.")
    @GetMapping("/monthly")
    public ResponseEntity<PeriodReportResponse> monthlyReport(
            @PathVariable("employeeId") UUID employeeId,
            @RequestParam("month") @DateTimeFormat(pattern = "yyyy-MM") YearMonth month
    ) {
        return ResponseEntity.ok(reportService.monthlyReport(employeeId, month));
    }

    @GetMapping("/period")
    public ResponseEntity<PeriodReportResponse> periodReport(
            @PathVariable("employeeId") UUID employeeId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(reportService.periodReport(employeeId, from, to));
    }
}
