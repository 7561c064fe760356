package com.worktime.backend.modules.report.application;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import com.worktime.backend.global.common.time.DateTimes;
import com.worktime.backend.global.config.WorkRules;
import com.worktime.backend.global.error.InvalidInputException;
import com.worktime.backend.global.error.ProblemException;
import com.worktime.backend.modules.calendar.domain.HolidayCalendar;
import com.worktime.backend.modules.employee.domain.Employee;
import com.worktime.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.worktime.backend.modules.leave.domain.LeaveDayCounter;
import com.worktime.backend.modules.leave.domain.LeaveRequest;
import com.worktime.backend.modules.leave.domain.LeaveSpan;
import com.worktime.backend.modules.leave.domain.LeaveStatus;
import com.worktime.backend.modules.leave.infrastructure.persistence.LeaveRequestRepository;
import com.worktime.backend.modules.report.domain.PeriodAggregator;
import com.worktime.backend.modules.report.domain.PeriodSummary;
import com.worktime.backend.modules.report.presentation.dto.PeriodReportResponse;
import com.worktime.backend.modules.timeentry.domain.RecordedEntry;
import com.worktime.backend.modules.timeentry.domain.TimeEntry;
import com.worktime.backend.modules.timeentry.infrastructure.persistence.TimeEntryRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private final EmployeeRepository employeeRepository;
    private final TimeEntryRepository timeEntryRepository;
    private final LeaveRequestRepository leaveRequestRepository;
    private final HolidayCalendar holidayCalendar;
    private final LeaveDayCounter leaveDayCounter;
    private final WorkRules workRules;

    public ReportService(
            EmployeeRepository employeeRepository,
            TimeEntryRepository timeEntryRepository,
            LeaveRequestRepository leaveRequestRepository,
            HolidayCalendar holidayCalendar,
            LeaveDayCounter leaveDayCounter,
            WorkRules workRules
    ) {
        this.employeeRepository = employeeRepository;
        this.timeEntryRepository = timeEntryRepository;
        this.leaveRequestRepository = leaveRequestRepository;
        this.holidayCalendar = holidayCalendar;
        this.leaveDayCounter = leaveDayCounter;
        this.workRules = workRules;
    }

    public PeriodReportResponse monthlyReport(UUID employeeId, YearMonth month) {
        if (month == null) {
            throw new InvalidInputException("month", "month is required (YYYY-MM)");
        }
        Employee employee = loadEmployee(employeeId);
        PeriodSummary summary = summarize(employee, month.atDay(1), month.atEndOfMonth());
        return new PeriodReportResponse(employee.getDisplayName(), month.toString(), summary);
    }

    public PeriodReportResponse periodReport(UUID employeeId, LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new InvalidInputException(from == null ? "from" : "to", "period bounds are required");
        }
        Employee employee = loadEmployee(employeeId);
        PeriodSummary summary = summarize(employee, from, to);
        String label = DateTimes.formatDisplayDate(from) + " - " + DateTimes.formatDisplayDate(to);
        return new PeriodReportResponse(employee.getDisplayName(), label, summary);
    }

    private PeriodSummary summarize(Employee employee, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new InvalidInputException("to", "period end is before its start");
        }
        List<RecordedEntry> entries = timeEntryRepository.findByEmployeeBetween(employee.getId(), from, to).stream()
                .map(TimeEntry::toRecordedEntry)
                .toList();
        List<LeaveSpan> leave = leaveRequestRepository
                .findOverlapping(employee.getId(), from, to, EnumSet.of(LeaveStatus.APPROVED)).stream()
                .map(LeaveRequest::toSpan)
                .toList();

        PeriodSummary summary = PeriodAggregator.aggregate(
                employee.getId(), from, to, entries, leave, holidayCalendar, leaveDayCounter, workRules);
        log.debug("Report {}..{} for {}: {} min worked, {} min overtime, {} leave days",
                from, to, employee.getId(), summary.workedMinutes(), summary.overtimeMinutes(), summary.leaveDays());
        return summary;
    }

    private Employee loadEmployee(UUID employeeId) {
        return employeeRepository.findById(employeeId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "EMPLOYEE_NOT_FOUND"));
    }
}
