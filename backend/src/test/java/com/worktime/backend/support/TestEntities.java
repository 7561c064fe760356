package com.worktime.backend.support;

import java.lang.reflect.Field;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.worktime.backend.global.common.time.RoundingMethod;
import com.worktime.backend.global.config.WorktimeProperties;
import com.worktime.backend.modules.employee.domain.Employee;
import com.worktime.backend.modules.leave.domain.LeaveDayCounting;
import com.worktime.backend.modules.timeentry.domain.NormalizedEntry;
import com.worktime.backend.modules.timeentry.domain.TimeEntry;

/**
 * Builders for entities whose ids are normally generated by Hibernate.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static <T> T withId(T entity, Object id) {
        try {
            Field idField = entity.getClass().getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(entity, id);
            return entity;
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
    }

    public static Employee employee(String id, String name) {
        Employee employee = new Employee();
        employee.setDisplayName(name);
        employee.setEmail(name.toLowerCase() + "@example.com");
        employee.setDepartment("Engineering");
        employee.setAnnualLeaveBalance(30);
        employee.setLeaveBalanceCap(30);
        return withId(employee, UUID.fromString(id));
    }

    public static TimeEntry timeEntry(
            String id,
            Employee employee,
            String start,
            String end,
            int breakMinutes,
            String project
    ) {
        OffsetDateTime startAt = OffsetDateTime.parse(start);
        OffsetDateTime endAt = OffsetDateTime.parse(end);
        TimeEntry entry = new TimeEntry();
        entry.setEmployee(employee);
        entry.apply(new NormalizedEntry(
                employee.getId(),
                startAt.toLocalDate(),
                startAt,
                endAt,
                breakMinutes,
                false,
                project,
                null
        ));
        return withId(entry, UUID.fromString(id));
    }

    public static WorktimeProperties properties(boolean notificationsEnabled, boolean leaveCategory, boolean timeCategory) {
        return new WorktimeProperties(
                new WorktimeProperties.Rules(8, 40, 8, 30, 6, true, 15, RoundingMethod.NEAREST, "INTERNAL", 30, 30),
                new WorktimeProperties.Leave(
                        List.of("VACATION", "SICK", "PERSONAL", "SPECIAL", "OTHER"),
                        LeaveDayCounting.CALENDAR_DAYS
                ),
                new WorktimeProperties.Calendar(
                        "Europe/Berlin",
                        List.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY),
                        List.of("2025-05-01", "2025-05-29", "2025-06-09")
                ),
                new WorktimeProperties.Notification(
                        notificationsEnabled,
                        new WorktimeProperties.Categories(leaveCategory, timeCategory)
                )
        );
    }

    public static WorktimeProperties properties() {
        return properties(true, true, true);
    }

    public static LocalDate date(String text) {
        return LocalDate.parse(text);
    }
}
