package com.worktime.backend.modules.timeentry.presentation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.worktime.backend.modules.timeentry.application.TimeEntryService;
import com.worktime.backend.modules.timeentry.presentation.dto.ApproveTimeEntryRequest;
import com.worktime.backend.modules.timeentry.presentation.dto.TimeEntryRequest;
import com.worktime.backend.modules.timeentry.presentation.dto.TimeEntryResponse;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/time-entries")
public class TimeEntryController {

    private final TimeEntryService timeEntryService;

    public TimeEntryController(TimeEntryService timeEntryService) {
        this.timeEntryService = timeEntryService;
    }

    @GetMapping
    public ResponseEntity<List<TimeEntryResponse>> listEntries(
            @RequestParam("employeeId") UUID employeeId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return ResponseEntity.ok(timeEntryService.listEntries(employeeId, from, to));
    }

    @Operation(summary = "Record time entry",
            description = "Validates, rounds and stores a work interval. Break is derived when omitted.")
    @PostMapping
    public ResponseEntity<TimeEntryResponse> createEntry(@Valid @RequestBody TimeEntryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(timeEntryService.createEntry(request));
    }

    @PutMapping("/{entryId}")
    public ResponseEntity<TimeEntryResponse> updateEntry(
            @PathVariable("entryId") UUID entryId,
            @Valid @RequestBody TimeEntryRequest request
    ) {
        return ResponseEntity.ok(timeEntryService.updateEntry(entryId, request));
    }

    @DeleteMapping("/{entryId}")
    public ResponseEntity<Void> deleteEntry(@PathVariable("entryId") UUID entryId) {
        timeEntryService.deleteEntry(entryId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Approve time entry", description = "Manager or administrator sign-off; approved entries are frozen.")
    @PostMapping("/{entryId}/approve")
    public ResponseEntity<TimeEntryResponse> approveEntry(
            @PathVariable("entryId") UUID entryId,
            @Valid @RequestBody ApproveTimeEntryRequest request
    ) {
        return ResponseEntity.ok(timeEntryService.approveEntry(entryId, request));
    }

    @GetMapping("/export")
    public void exportEntries(
            @RequestParam("employeeId") UUID employeeId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            HttpServletResponse response
    ) throws IOException {
        response.setContentType("text/csv");
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setHeader(HttpHeaders.CONTENT_DISPOSITION,
                "attachment; filename=\"time-entries-" + from + "-" + to + ".csv\"");
        timeEntryService.exportCsv(employeeId, from, to, response.getWriter());
    }
}
