package com.worktime.backend.modules.timeentry.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.worktime.backend.global.jpa.AbstractTimestampedEntity;
import com.worktime.backend.modules.employee.domain.Employee;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "time_entry")
public class TimeEntry extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "employee_id", nullable = false, updatable = false)
    private Employee employee;

    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    @Column(name = "start_at", nullable = false)
    private OffsetDateTime startAt;

    @Column(name = "end_at", nullable = false)
    private OffsetDateTime endAt;

    @Column(name = "break_minutes", nullable = false)
    private int breakMinutes;

    @Column(name = "project_code", nullable = false, length = 64)
    private String projectCode;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "approved_by")
    private Employee approvedBy;

    @Column(name = "approved_at")
    private OffsetDateTime approvedAt;

    public UUID getId() {
        return id;
    }

    public Employee getEmployee() {
        return employee;
    }

    public void setEmployee(Employee employee) {
        this.employee = employee;
    }

    public LocalDate getEntryDate() {
        return entryDate;
    }

    public OffsetDateTime getStartAt() {
        return startAt;
    }

    public OffsetDateTime getEndAt() {
        return endAt;
    }

    public int getBreakMinutes() {
        return breakMinutes;
    }

    public String getProjectCode() {
        return projectCode;
    }

    public String getNotes() {
        return notes;
    }

    public Employee getApprovedBy() {
        return approvedBy;
    }

    public OffsetDateTime getApprovedAt() {
        return approvedAt;
    }

    public boolean isApproved() {
        return approvedAt != null;
    }

    /**
     * Copies the validated values over this entry. The only way start, end and break change.
     */
    public void apply(NormalizedEntry normalized) {
        this.entryDate = normalized.date();
        this.startAt = normalized.start();
        this.endAt = normalized.end();
        this.breakMinutes = normalized.breakMinutes();
        this.projectCode = normalized.projectCode();
        this.notes = normalized.notes();
    }

    public void approve(Employee approver, OffsetDateTime when) {
        this.approvedBy = approver;
        this.approvedAt = when;
    }

    public long workedMinutes() {
        return toRecordedEntry().workedMinutes();
    }

    public RecordedEntry toRecordedEntry() {
        return new RecordedEntry(
                id,
                employee != null ? employee.getId() : null,
                entryDate,
                startAt,
                endAt,
                breakMinutes,
                projectCode
        );
    }
}
