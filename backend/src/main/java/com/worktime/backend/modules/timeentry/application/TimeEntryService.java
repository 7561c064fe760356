package com.worktime.backend.modules.timeentry.application;

import java.io.IOException;
import java.io.Writer;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.worktime.backend.global.common.time.DateRange;
import com.worktime.backend.global.common.time.DateTimes;
import com.worktime.backend.global.config.WorkRules;
import com.worktime.backend.global.config.WorktimeProperties;
import com.worktime.backend.global.error.InvalidInputException;
import com.worktime.backend.global.error.ProblemException;
import com.worktime.backend.modules.employee.domain.Employee;
import com.worktime.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.worktime.backend.modules.notification.application.NotificationHooks;
import com.worktime.backend.modules.notification.domain.NotificationEvent;
import com.worktime.backend.modules.notification.domain.NotificationPayload;
import com.worktime.backend.modules.report.domain.PeriodAggregator;
import com.worktime.backend.modules.timeentry.domain.NormalizedEntry;
import com.worktime.backend.modules.timeentry.domain.RecordedEntry;
import com.worktime.backend.modules.timeentry.domain.TimeEntry;
import com.worktime.backend.modules.timeentry.domain.TimeEntryCandidate;
import com.worktime.backend.modules.timeentry.domain.TimeEntryValidator;
import com.worktime.backend.modules.timeentry.domain.WeeklyLimitExceededException;
import com.worktime.backend.modules.timeentry.infrastructure.persistence.TimeEntryRepository;
import com.worktime.backend.modules.timeentry.presentation.dto.ApproveTimeEntryRequest;
import com.worktime.backend.modules.timeentry.presentation.dto.TimeEntryRequest;
import com.worktime.backend.modules.timeentry.presentation.dto.TimeEntryResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-validate-write around {@link TimeEntryValidator}. Every mutation first locks the owning employee row,
 * so overlap and ceiling checks see a stable set of entries until the transaction commits.
 */
@Service
@Transactional
public class TimeEntryService {

    private static final Logger log = LoggerFactory.getLogger(TimeEntryService.class);
    private static final String CSV_HEADER = "date,start,end,breakMinutes,workedHours,project,notes";

    private final TimeEntryRepository timeEntryRepository;
    private final EmployeeRepository employeeRepository;
    private final NotificationHooks notificationHooks;
    private final WorkRules workRules;
    private final ZoneId zone;
    private final Clock clock;

    public TimeEntryService(
            TimeEntryRepository timeEntryRepository,
            EmployeeRepository employeeRepository,
            NotificationHooks notificationHooks,
            WorkRules workRules,
            WorktimeProperties properties,
            Clock clock
    ) {
        this.timeEntryRepository = timeEntryRepository;
        this.employeeRepository = employeeRepository;
        this.notificationHooks = notificationHooks;
        this.workRules = workRules;
        this.zone = properties.calendar().zoneId();
        this.clock = clock;
    }

    public TimeEntryResponse createEntry(TimeEntryRequest request) {
        if (request.employeeId() == null) {
            throw new InvalidInputException("employeeId", "employeeId is required");
        }
        Employee employee = lockActiveEmployee(request.employeeId());
        TimeEntryCandidate candidate = toCandidate(request);

        NormalizedEntry normalized = TimeEntryValidator.validateAndNormalize(
                candidate,
                recordedEntriesOn(employee.getId(), candidate.date(), null),
                workRules
        );
        ensureWeeklyLimit(normalized, null);

        TimeEntry entry = new TimeEntry();
        entry.setEmployee(employee);
        entry.apply(normalized);
        TimeEntry saved = timeEntryRepository.save(entry);
        log.info("Time entry {} created for {} on {} ({} min, break {}{})",
                saved.getId(), employee.getId(), normalized.date(), normalized.workedMinutes(),
                normalized.breakMinutes(), normalized.breakDerived() ? " derived" : "");

        notificationHooks.fire(
                NotificationEvent.TIME_ENTRY_CREATED,
                NotificationPayload.forTimeEntry(employee, employee, toSnapshot(saved))
        );
        return TimeEntryResponse.from(saved);
    }

    public TimeEntryResponse updateEntry(UUID entryId, TimeEntryRequest request) {
        UUID ownerId = ownerOf(entryId);
        if (request.employeeId() != null && !request.employeeId().equals(ownerId)) {
            throw new InvalidInputException("employeeId", "an entry cannot be moved to another employee");
        }
        lockActiveEmployee(ownerId);
        TimeEntry entry = loadEntry(entryId);
        ensureNotApproved(entry);

        TimeEntryCandidate candidate = toCandidate(request, ownerId);
        NormalizedEntry normalized = TimeEntryValidator.validateAndNormalize(
                candidate,
                recordedEntriesOn(ownerId, candidate.date(), entryId),
                workRules
        );
        ensureWeeklyLimit(normalized, entryId);

        entry.apply(normalized);
        TimeEntry saved = timeEntryRepository.save(entry);
        log.info("Time entry {} updated ({} min)", entryId, normalized.workedMinutes());
        return TimeEntryResponse.from(saved);
    }

    public void deleteEntry(UUID entryId) {
        employeeRepository.findByIdForUpdate(ownerOf(entryId));
        TimeEntry entry = loadEntry(entryId);
        ensureNotApproved(entry);
        timeEntryRepository.delete(entry);
        log.info("Time entry {} deleted", entryId);
    }

    public TimeEntryResponse approveEntry(UUID entryId, ApproveTimeEntryRequest request) {
        Employee employee = lockActiveEmployee(ownerOf(entryId));
        TimeEntry entry = loadEntry(entryId);
        Employee actor = employeeRepository.findById(request.actorId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "ACTOR_NOT_FOUND"));
        if (!actor.isActive() || !actor.canApproveFor(employee)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "APPROVAL_AUTHORITY_REQUIRED",
                    "only the employee's manager or an administrator may approve");
        }
        ensureNotApproved(entry);

        entry.approve(actor, OffsetDateTime.now(clock));
        TimeEntry saved = timeEntryRepository.save(entry);
        log.info("Time entry {} approved by {}", entryId, actor.getId());

        notificationHooks.fire(
                NotificationEvent.TIME_ENTRY_APPROVED,
                NotificationPayload.forTimeEntry(employee, actor, toSnapshot(saved))
        );
        return TimeEntryResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<TimeEntryResponse> listEntries(UUID employeeId, LocalDate from, LocalDate to) {
        DateRange range = toRange(from, to);
        return timeEntryRepository.findByEmployeeBetween(employeeId, range.start(), range.end()).stream()
                .map(TimeEntryResponse::from)
                .toList();
    }

    /**
     * Writes the entries of the range as CSV, times shown in the configured display zone.
     */
    @Transactional(readOnly = true)
    public void exportCsv(UUID employeeId, LocalDate from, LocalDate to, Writer writer) throws IOException {
        DateRange range = toRange(from, to);
        List<TimeEntry> entries = timeEntryRepository.findByEmployeeBetween(employeeId, range.start(), range.end());
        writer.write(CSV_HEADER);
        writer.write('\n');
        for (TimeEntry entry : entries) {
            writer.write(String.join(",",
                    entry.getEntryDate().toString(),
                    DateTimes.formatTime(entry.getStartAt(), zone),
                    DateTimes.formatTime(entry.getEndAt(), zone),
                    Integer.toString(entry.getBreakMinutes()),
                    DateTimes.minutesToHours(entry.workedMinutes()).toPlainString(),
                    csvField(entry.getProjectCode()),
                    csvField(entry.getNotes())
            ));
            writer.write('\n');
        }
        writer.flush();
    }

    private void ensureWeeklyLimit(NormalizedEntry normalized, UUID excludedEntryId) {
        DateRange week = DateTimes.isoWeekOf(normalized.date());
        List<RecordedEntry> weekEntries = timeEntryRepository
                .findByEmployeeBetween(normalized.employeeId(), week.start(), week.end()).stream()
                .filter(existing -> !existing.getId().equals(excludedEntryId))
                .map(TimeEntry::toRecordedEntry)
                .toList();
        long weekTotal = PeriodAggregator.workedMinutes(weekEntries, week) + normalized.workedMinutes();
        if (weekTotal > workRules.maxWeeklyMinutes()) {
            throw new WeeklyLimitExceededException(week.start(), weekTotal, workRules.maxWeeklyMinutes());
        }
    }

    private List<RecordedEntry> recordedEntriesOn(UUID employeeId, LocalDate date, UUID excludedEntryId) {
        if (date == null) {
            return List.of();
        }
        return timeEntryRepository.findByEmployeeAndDate(employeeId, date).stream()
                .filter(existing -> !existing.getId().equals(excludedEntryId))
                .map(TimeEntry::toRecordedEntry)
                .toList();
    }

    private TimeEntryCandidate toCandidate(TimeEntryRequest request) {
        return toCandidate(request, request.employeeId());
    }

    private TimeEntryCandidate toCandidate(TimeEntryRequest request, UUID employeeId) {
        return new TimeEntryCandidate(
                employeeId,
                request.date(),
                parseTimestamp(request.date(), request.startTime(), "startTime"),
                parseTimestamp(request.date(), request.endTime(), "endTime"),
                request.breakMinutes(),
                request.project(),
                request.notes()
        );
    }

    private OffsetDateTime parseTimestamp(LocalDate date, String text, String field) {
        if (text == null || text.isBlank()) {
            return null;
        }
        if (date == null && text.indexOf('T') < 0) {
            return null;
        }
        try {
            return DateTimes.parseTimestamp(date, text, zone);
        } catch (DateTimeParseException ex) {
            throw new InvalidInputException(field, "unreadable time '" + text + "'");
        } catch (DateTimeException ex) {
            throw new InvalidInputException(field, ex.getMessage());
        }
    }

    private Employee lockActiveEmployee(UUID employeeId) {
        Employee employee = employeeRepository.findByIdForUpdate(employeeId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "EMPLOYEE_NOT_FOUND"));
        if (!employee.isActive()) {
            throw new ProblemException(HttpStatus.CONFLICT, "EMPLOYEE_DISABLED");
        }
        return employee;
    }

    // entry rows are loaded only after the owner lock is held
    private UUID ownerOf(UUID entryId) {
        return timeEntryRepository.findEmployeeIdById(entryId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "TIME_ENTRY_NOT_FOUND"));
    }

    private TimeEntry loadEntry(UUID entryId) {
        return timeEntryRepository.findById(entryId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "TIME_ENTRY_NOT_FOUND"));
    }

    private static void ensureNotApproved(TimeEntry entry) {
        if (entry.isApproved()) {
            throw new ProblemException(HttpStatus.CONFLICT, "TIME_ENTRY_ALREADY_APPROVED");
        }
    }

    private static DateRange toRange(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new InvalidInputException(from == null ? "from" : "to", "period bounds are required");
        }
        if (to.isBefore(from)) {
            throw new InvalidInputException("to", "period end is before its start");
        }
        return new DateRange(from, to);
    }

    private static NotificationPayload.TimeEntrySnapshot toSnapshot(TimeEntry entry) {
        return new NotificationPayload.TimeEntrySnapshot(
                entry.getId(),
                entry.getEntryDate(),
                entry.getStartAt(),
                entry.getEndAt(),
                entry.getBreakMinutes(),
                entry.getProjectCode()
        );
    }

    private static String csvField(String value) {
        String safe = Objects.requireNonNullElse(value, "");
        if (safe.contains(",") || safe.contains("\"") || safe.contains("\n")) {
            return "\"" + safe.replace("\"", "\"\"") + "\"";
        }
        return safe;
    }
}
