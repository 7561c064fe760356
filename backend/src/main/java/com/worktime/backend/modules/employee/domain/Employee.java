package com.worktime.backend.modules.employee.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.worktime.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Employee master record. Never deleted once referenced; {@link #disable(OffsetDateTime)} takes it out of service.
 */
@Entity
@Table(name = "employee")
public class Employee extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "department", nullable = false, length = 64)
    private String department;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "manager_id")
    private Employee manager;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "substitute_id")
    private Employee substitute;

    @Column(name = "annual_leave_balance", nullable = false)
    private int annualLeaveBalance;

    @Column(name = "leave_balance_cap", nullable = false)
    private int leaveBalanceCap;

    @Column(name = "administrator", nullable = false)
    private boolean administrator;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "disabled_at")
    private OffsetDateTime disabledAt;

    public UUID getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getDepartment() {
        return department;
    }

    public void setDepartment(String department) {
        this.department = department;
    }

    public Employee getManager() {
        return manager;
    }

    public void setManager(Employee manager) {
        this.manager = manager;
    }

    public Employee getSubstitute() {
        return substitute;
    }

    public void setSubstitute(Employee substitute) {
        this.substitute = substitute;
    }

    public int getAnnualLeaveBalance() {
        return annualLeaveBalance;
    }

    public void setAnnualLeaveBalance(int annualLeaveBalance) {
        this.annualLeaveBalance = annualLeaveBalance;
    }

    public int getLeaveBalanceCap() {
        return leaveBalanceCap;
    }

    public void setLeaveBalanceCap(int leaveBalanceCap) {
        this.leaveBalanceCap = leaveBalanceCap;
    }

    public boolean isAdministrator() {
        return administrator;
    }

    public void setAdministrator(boolean administrator) {
        this.administrator = administrator;
    }

    public boolean isActive() {
        return active;
    }

    public OffsetDateTime getDisabledAt() {
        return disabledAt;
    }

    public void disable(OffsetDateTime when) {
        this.active = false;
        this.disabledAt = when;
    }

    /**
     * Managers approve for their direct reports; administrators approve for everyone.
     */
    public boolean canApproveFor(Employee requester) {
        if (administrator) {
            return true;
        }
        Employee requesterManager = requester.getManager();
        return requesterManager != null && id != null && id.equals(requesterManager.getId());
    }

    public void applyLeaveBalanceDelta(int delta) {
        int updated = annualLeaveBalance + delta;
        if (updated < 0) {
            throw new IllegalStateException("leave balance would become negative: " + updated);
        }
        this.annualLeaveBalance = updated;
    }
}
