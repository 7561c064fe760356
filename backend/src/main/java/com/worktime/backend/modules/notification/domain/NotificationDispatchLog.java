package com.worktime.backend.modules.notification.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import com.worktime.backend.global.jpa.AbstractTimestampedEntity;

/**
 * One row per dispatched hook event. Employee and subject ids are plain columns without foreign keys so the
 * row can be written in its own transaction while the employee row is still locked.
 */
@Entity
@Table(name = "notification_dispatch_log")
public class NotificationDispatchLog extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "event_type", nullable = false, length = 48)
    private String eventType;

    @Column(name = "employee_id", columnDefinition = "uuid")
    private UUID employeeId;

    @Column(name = "subject_id", columnDefinition = "uuid")
    private UUID subjectId;

    @Column(name = "recipients", columnDefinition = "text")
    private String recipients;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private NotificationDispatchStatus status;

    @Column(name = "skip_reason", length = 50)
    private String skipReason;

    @Column(name = "logged_at", nullable = false)
    private OffsetDateTime loggedAt;

    public Long getId() {
        return id;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public UUID getEmployeeId() {
        return employeeId;
    }

    public void setEmployeeId(UUID employeeId) {
        this.employeeId = employeeId;
    }

    public UUID getSubjectId() {
        return subjectId;
    }

    public void setSubjectId(UUID subjectId) {
        this.subjectId = subjectId;
    }

    public String getRecipients() {
        return recipients;
    }

    public void setRecipients(String recipients) {
        this.recipients = recipients;
    }

    public NotificationDispatchStatus getStatus() {
        return status;
    }

    public void setStatus(NotificationDispatchStatus status) {
        this.status = status;
    }

    public String getSkipReason() {
        return skipReason;
    }

    public void setSkipReason(String skipReason) {
        this.skipReason = skipReason;
    }

    public OffsetDateTime getLoggedAt() {
        return loggedAt;
    }

    public void setLoggedAt(OffsetDateTime loggedAt) {
        this.loggedAt = loggedAt;
    }
}
