package com.worktime.backend.modules.timeentry.presentation;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.io.Writer;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.worktime.backend.global.error.OverlapException;
import com.worktime.backend.global.error.RestExceptionHandler;
import com.worktime.backend.modules.timeentry.application.TimeEntryService;
import com.worktime.backend.modules.timeentry.domain.InsufficientBreakException;
import com.worktime.backend.modules.timeentry.domain.TimeEntry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class TimeEntryControllerTest {

    private static final UUID EMPLOYEE_ID = UUID.fromString("00000000-0000-0000-0000-000000000042");

    @Mock
    private TimeEntryService timeEntryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new TimeEntryController(timeEntryService))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @Test
    void overlapIsRenderedAsConflictWithConflictingIds() throws Exception {
        UUID existing = UUID.randomUUID();
        when(timeEntryService.createEntry(any()))
                .thenThrow(new OverlapException(OverlapException.TIME_ENTRY_CODE, List.of(existing), "overlaps"));

        mockMvc.perform(post("/time-entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employeeId\":\"" + EMPLOYEE_ID + "\",\"date\":\"2025-06-02\","
                                + "\"startTime\":\"09:00\",\"endTime\":\"10:00\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("TIME_ENTRY_OVERLAP"))
                .andExpect(jsonPath("$.type").value("urn:problem:worktime:time_entry_overlap"))
                .andExpect(jsonPath("$.details.conflictingIds[0]").value(existing.toString()));
    }

    @Test
    void insufficientBreakIsUnprocessable() throws Exception {
        when(timeEntryService.createEntry(any())).thenThrow(new InsufficientBreakException(15, 30, 480));

        mockMvc.perform(post("/time-entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employeeId\":\"" + EMPLOYEE_ID + "\",\"date\":\"2025-06-02\","
                                + "\"startTime\":\"09:00\",\"endTime\":\"17:00\",\"breakMinutes\":15}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_BREAK"))
                .andExpect(jsonPath("$.status").value(422));
    }

    @Test
    void lostVersionRaceIsConflictNotServerError() throws Exception {
        UUID entryId = UUID.fromString("00000000-0000-0000-0000-000000000901");
        when(timeEntryService.approveEntry(eq(entryId), any()))
                .thenThrow(new ObjectOptimisticLockingFailureException(TimeEntry.class, entryId));

        mockMvc.perform(post("/time-entries/{id}/approve", entryId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actorId\":\"" + EMPLOYEE_ID + "\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONCURRENT_MODIFICATION"))
                .andExpect(jsonPath("$.instance").value("/time-entries/" + entryId + "/approve"));
    }

    @Test
    void malformedBodyIsInvalidInput() throws Exception {
        mockMvc.perform(post("/time-entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employeeId\":\"not-a-uuid\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
    }

    @Test
    void exportStreamsCsvAsAttachment() throws Exception {
        LocalDate from = LocalDate.of(2025, 6, 1);
        LocalDate to = LocalDate.of(2025, 6, 30);
        doAnswer(invocation -> {
            Writer writer = invocation.getArgument(3);
            writer.write("date,start,end,breakMinutes,workedHours,project,notes\n");
            writer.flush();
            return null;
        }).when(timeEntryService).exportCsv(eq(EMPLOYEE_ID), eq(from), eq(to), any(Writer.class));

        mockMvc.perform(get("/time-entries/export")
                        .param("employeeId", EMPLOYEE_ID.toString())
                        .param("from", "2025-06-01")
                        .param("to", "2025-06-30"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition",
                        "attachment; filename=\"time-entries-2025-06-01-2025-06-30.csv\""))
                .andExpect(content().string("date,start,end,breakMinutes,workedHours,project,notes\n"));
    }
}
