package com.worktime.backend.modules.employee.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import com.worktime.backend.global.config.WorkRules;
import com.worktime.backend.global.error.InvalidInputException;
import com.worktime.backend.global.error.ProblemException;
import com.worktime.backend.modules.employee.domain.Employee;
import com.worktime.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.worktime.backend.modules.employee.presentation.dto.AdjustLeaveBalanceRequest;
import com.worktime.backend.modules.employee.presentation.dto.CreateEmployeeRequest;
import com.worktime.backend.modules.employee.presentation.dto.EmployeeResponse;
import com.worktime.backend.modules.employee.presentation.dto.UpdateEmployeeRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class EmployeeService {

    private static final Logger log = LoggerFactory.getLogger(EmployeeService.class);

    private final EmployeeRepository employeeRepository;
    private final WorkRules workRules;
    private final Clock clock;

    public EmployeeService(EmployeeRepository employeeRepository, WorkRules workRules, Clock clock) {
        this.employeeRepository = employeeRepository;
        this.workRules = workRules;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<EmployeeResponse> listEmployees(boolean includeInactive) {
        List<Employee> employees = includeInactive
                ? employeeRepository.findAllByOrderByDisplayNameAsc()
                : employeeRepository.findByActiveTrueOrderByDisplayNameAsc();
        return employees.stream()
                .map(EmployeeResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public EmployeeResponse getEmployee(UUID employeeId) {
        return EmployeeResponse.from(loadEmployee(employeeId));
    }

    public EmployeeResponse createEmployee(CreateEmployeeRequest request) {
        String email = request.email().trim().toLowerCase(Locale.ROOT);
        if (employeeRepository.existsByEmailIgnoreCase(email)) {
            throw new ProblemException(HttpStatus.CONFLICT, "EMPLOYEE_EMAIL_TAKEN", "email already registered: " + email);
        }

        int cap = request.leaveBalanceCap() != null ? request.leaveBalanceCap() : workRules.annualLeaveMaxBalance();
        int balance = request.annualLeaveBalance() != null
                ? request.annualLeaveBalance()
                : Math.min(workRules.annualLeaveDefaultBalance(), cap);
        ensureBalanceWithinCap(balance, cap);

        Employee employee = new Employee();
        employee.setDisplayName(request.displayName().trim());
        employee.setEmail(email);
        employee.setDepartment(request.department().trim());
        employee.setAnnualLeaveBalance(balance);
        employee.setLeaveBalanceCap(cap);
        employee.setAdministrator(request.administrator());
        if (request.managerId() != null) {
            employee.setManager(loadActiveReference(request.managerId(), "managerId"));
        }
        if (request.substituteId() != null) {
            employee.setSubstitute(loadActiveReference(request.substituteId(), "substituteId"));
        }

        Employee saved = employeeRepository.save(employee);
        log.info("Employee {} created in {}", saved.getId(), saved.getDepartment());
        return EmployeeResponse.from(saved);
    }

    public EmployeeResponse updateEmployee(UUID employeeId, UpdateEmployeeRequest request) {
        Employee employee = loadForUpdate(employeeId);

        if (request.displayName() != null && !request.displayName().isBlank()) {
            employee.setDisplayName(request.displayName().trim());
        }
        if (request.department() != null && !request.department().isBlank()) {
            employee.setDepartment(request.department().trim());
        }
        if (request.clearManager()) {
            employee.setManager(null);
        } else if (request.managerId() != null) {
            ensureNotSelf(employee, request.managerId(), "managerId");
            employee.setManager(loadActiveReference(request.managerId(), "managerId"));
        }
        if (request.clearSubstitute()) {
            employee.setSubstitute(null);
        } else if (request.substituteId() != null) {
            ensureNotSelf(employee, request.substituteId(), "substituteId");
            employee.setSubstitute(loadActiveReference(request.substituteId(), "substituteId"));
        }
        if (request.leaveBalanceCap() != null) {
            ensureBalanceWithinCap(employee.getAnnualLeaveBalance(), request.leaveBalanceCap());
            employee.setLeaveBalanceCap(request.leaveBalanceCap());
        }
        if (request.administrator() != null) {
            employee.setAdministrator(request.administrator());
        }

        return EmployeeResponse.from(employeeRepository.save(employee));
    }

    /**
     * Administrative correction of the remaining balance. Out-of-range values are rejected, not clamped.
     */
    public EmployeeResponse adjustLeaveBalance(UUID employeeId, AdjustLeaveBalanceRequest request) {
        Employee employee = loadForUpdate(employeeId);
        ensureBalanceWithinCap(request.balance(), employee.getLeaveBalanceCap());
        int previous = employee.getAnnualLeaveBalance();
        employee.setAnnualLeaveBalance(request.balance());
        Employee saved = employeeRepository.save(employee);
        log.info("Leave balance of {} adjusted {} -> {} ({})",
                employeeId, previous, request.balance(), request.reason() != null ? request.reason() : "no reason");
        return EmployeeResponse.from(saved);
    }

    public EmployeeResponse disableEmployee(UUID employeeId) {
        Employee employee = loadForUpdate(employeeId);
        if (!employee.isActive()) {
            return EmployeeResponse.from(employee);
        }
        employee.disable(OffsetDateTime.now(clock));
        log.info("Employee {} disabled", employeeId);
        return EmployeeResponse.from(employeeRepository.save(employee));
    }

    private Employee loadEmployee(UUID employeeId) {
        return employeeRepository.findById(employeeId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "EMPLOYEE_NOT_FOUND"));
    }

    private Employee loadForUpdate(UUID employeeId) {
        return employeeRepository.findByIdForUpdate(employeeId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "EMPLOYEE_NOT_FOUND"));
    }

    private Employee loadActiveReference(UUID referenceId, String field) {
        Employee reference = employeeRepository.findById(referenceId)
                .orElseThrow(() -> new InvalidInputException(field, field + " refers to an unknown employee"));
        if (!reference.isActive()) {
            throw new InvalidInputException(field, field + " refers to a disabled employee");
        }
        return reference;
    }

    private static void ensureNotSelf(Employee employee, UUID referenceId, String field) {
        if (referenceId.equals(employee.getId())) {
            throw new InvalidInputException(field, "an employee cannot reference itself as " + field);
        }
    }

    private static void ensureBalanceWithinCap(int balance, int cap) {
        if (balance < 0) {
            throw new InvalidInputException("annualLeaveBalance", "leave balance must not be negative");
        }
        if (balance > cap) {
            throw new InvalidInputException("annualLeaveBalance",
                    "leave balance " + balance + " exceeds the accrual cap " + cap);
        }
    }
}
