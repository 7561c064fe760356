package com.worktime.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.worktime.backend.modules.notification.domain.NotificationDispatchLog;
import com.worktime.backend.modules.notification.infrastructure.persistence.NotificationDispatchLogRepository;
import com.worktime.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class WorktimeIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private NotificationDispatchLogRepository dispatchLogRepository;

    @Test
    void timeEntriesAreValidatedStoredAndReported() throws Exception {
        UUID managerId = createEmployee("Mia Manager", "mia.time@example.com", null);
        UUID employeeId = createEmployee("Noah Worker", "noah.time@example.com", managerId);

        mockMvc.perform(post("/time-entries")
                        .header("X-Request-Id", "it-time-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "employeeId", employeeId,
                                "date", "2025-06-02",
                                "startTime", "09:00",
                                "endTime", "17:30",
                                "breakMinutes", 45,
                                "project", "ALPHA"))))
                .andExpect(status().isCreated())
                .andExpect(header().string("X-Request-Id", "it-time-1"))
                .andExpect(jsonPath("$.workedMinutes").value(465))
                .andExpect(jsonPath("$.workedHours").value(7.75));

        mockMvc.perform(post("/time-entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "employeeId", employeeId,
                                "date", "2025-06-02",
                                "startTime", "17:00",
                                "endTime", "19:00"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("TIME_ENTRY_OVERLAP"))
                .andExpect(jsonPath("$.details.conflictingIds.length()").value(1));

        mockMvc.perform(post("/time-entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "employeeId", employeeId,
                                "date", "2025-06-03",
                                "startTime", "09:00",
                                "endTime", "18:00",
                                "breakMinutes", 0))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("DAILY_LIMIT_EXCEEDED"));

        mockMvc.perform(get("/reports/employees/{id}/monthly", employeeId).param("month", "2025-06"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.label").value("2025-06"))
                .andExpect(jsonPath("$.summary.workedMinutes").value(465))
                .andExpect(jsonPath("$.summary.projects[0].projectCode").value("ALPHA"));

        mockMvc.perform(get("/time-entries/export")
                        .param("employeeId", employeeId.toString())
                        .param("from", "2025-06-01")
                        .param("to", "2025-06-30"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("2025-06-02,09:00,17:30,45,7.75,ALPHA,")));
    }

    @Test
    void leaveApprovalAndCancellationMoveTheBalance() throws Exception {
        UUID managerId = createEmployee("Mia Lead", "mia.leave@example.com", null);
        UUID employeeId = createEmployee("Noah Leave", "noah.leave@example.com", managerId);

        MvcResult created = mockMvc.perform(post("/leave-requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "employeeId", employeeId,
                                "startDate", "2030-06-03",
                                "endDate", "2030-06-07",
                                "type", "vacation"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andReturn();
        UUID requestId = UUID.fromString(read(created).get("requestId").asText());

        mockMvc.perform(post("/leave-requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "employeeId", employeeId,
                                "startDate", "2030-06-06",
                                "endDate", "2030-06-10",
                                "type", "VACATION"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("LEAVE_REQUEST_OVERLAP"));

        mockMvc.perform(post("/leave-requests/{id}/approve", requestId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("actorId", employeeId))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("APPROVAL_AUTHORITY_REQUIRED"));

        mockMvc.perform(post("/leave-requests/{id}/approve", requestId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("actorId", managerId))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.chargedDays").value(5));
        mockMvc.perform(get("/employees/{id}", employeeId))
                .andExpect(jsonPath("$.annualLeaveBalance").value(25));

        mockMvc.perform(post("/leave-requests/{id}/cancel", requestId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("actorId", employeeId, "reason", "plans changed"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
        mockMvc.perform(get("/employees/{id}", employeeId))
                .andExpect(jsonPath("$.annualLeaveBalance").value(30));

        mockMvc.perform(post("/leave-requests/{id}/approve", requestId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("actorId", managerId))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"));

        List<NotificationDispatchLog> dispatched = dispatchLogRepository.findBySubjectIdOrderByIdAsc(requestId);
        assertThat(dispatched).extracting(NotificationDispatchLog::getEventType)
                .containsExactly("leaveRequestCreated", "leaveRequestApproved", "leaveRequestCancelled");
    }

    @Test
    void oversizedLeaveIsRefusedAtApproval() throws Exception {
        UUID managerId = createEmployee("Mia Big", "mia.big@example.com", null);
        UUID employeeId = createEmployee("Noah Big", "noah.big@example.com", managerId);

        MvcResult created = mockMvc.perform(post("/leave-requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "employeeId", employeeId,
                                "startDate", "2030-07-01",
                                "endDate", "2030-07-31",
                                "type", "VACATION"))))
                .andExpect(status().isCreated())
                .andReturn();
        UUID requestId = UUID.fromString(read(created).get("requestId").asText());

        mockMvc.perform(post("/leave-requests/{id}/approve", requestId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("actorId", managerId))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_BALANCE"))
                .andExpect(jsonPath("$.details.requestedDays").value(31));
        mockMvc.perform(get("/employees/{id}", employeeId))
                .andExpect(jsonPath("$.annualLeaveBalance").value(30));
    }

    private UUID createEmployee(String name, String email, UUID managerId) throws Exception {
        Map<String, Object> body = new HashMap<>();
        body.put("displayName", name);
        body.put("email", email);
        body.put("department", "Engineering");
        if (managerId != null) {
            body.put("managerId", managerId);
        }
        MvcResult result = mockMvc.perform(post("/employees")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(body)))
                .andExpect(status().isCreated())
                .andReturn();
        return UUID.fromString(read(result).get("employeeId").asText());
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    private JsonNode read(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
