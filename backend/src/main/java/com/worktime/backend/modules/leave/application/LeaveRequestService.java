package com.worktime.backend.modules.leave.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

import com.worktime.backend.global.config.WorktimeProperties;
import com.worktime.backend.global.error.InvalidInputException;
import com.worktime.backend.global.error.OverlapException;
import com.worktime.backend.global.error.ProblemException;
import com.worktime.backend.modules.employee.domain.Employee;
import com.worktime.backend.modules.employee.infrastructure.persistence.EmployeeRepository;
import com.worktime.backend.modules.leave.domain.LeaveActor;
import com.worktime.backend.modules.leave.domain.LeaveDecision;
import com.worktime.backend.modules.leave.domain.LeaveLifecycle;
import com.worktime.backend.modules.leave.domain.LeaveRequest;
import com.worktime.backend.modules.leave.domain.LeaveStatus;
import com.worktime.backend.modules.leave.infrastructure.persistence.LeaveRequestRepository;
import com.worktime.backend.modules.leave.presentation.dto.CreateLeaveRequest;
import com.worktime.backend.modules.leave.presentation.dto.LeaveDecisionRequest;
import com.worktime.backend.modules.leave.presentation.dto.LeaveRequestResponse;
import com.worktime.backend.modules.notification.application.NotificationHooks;
import com.worktime.backend.modules.notification.domain.NotificationEvent;
import com.worktime.backend.modules.notification.domain.NotificationPayload;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists leave requests and applies {@link LeaveLifecycle} decisions. Status and balance change together
 * under the employee row lock, so concurrent approvals cannot overdraw the balance.
 */
@Service
@Transactional
public class LeaveRequestService {

    private static final Logger log = LoggerFactory.getLogger(LeaveRequestService.class);
    private static final Set<LeaveStatus> BLOCKING_STATUSES = EnumSet.of(LeaveStatus.PENDING, LeaveStatus.APPROVED);

    private final LeaveRequestRepository leaveRequestRepository;
    private final EmployeeRepository employeeRepository;
    private final LeaveLifecycle leaveLifecycle;
    private final NotificationHooks notificationHooks;
    private final Set<String> leaveTypes;
    private final Clock clock;

    public LeaveRequestService(
            LeaveRequestRepository leaveRequestRepository,
            EmployeeRepository employeeRepository,
            LeaveLifecycle leaveLifecycle,
            NotificationHooks notificationHooks,
            WorktimeProperties properties,
            Clock clock
    ) {
        this.leaveRequestRepository = leaveRequestRepository;
        this.employeeRepository = employeeRepository;
        this.leaveLifecycle = leaveLifecycle;
        this.notificationHooks = notificationHooks;
        this.leaveTypes = properties.leave().normalizedTypes();
        this.clock = clock;
    }

    public LeaveRequestResponse createLeaveRequest(CreateLeaveRequest request) {
        Employee employee = employeeRepository.findByIdForUpdate(request.employeeId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "EMPLOYEE_NOT_FOUND"));
        if (!employee.isActive()) {
            throw new ProblemException(HttpStatus.CONFLICT, "EMPLOYEE_DISABLED");
        }
        if (request.endDate().isBefore(request.startDate())) {
            throw new InvalidInputException("endDate", "endDate must not be before startDate");
        }
        String type = request.type().trim().toUpperCase(Locale.ROOT);
        if (!leaveTypes.contains(type)) {
            throw new InvalidInputException("type", "unknown leave type " + request.type() + ", expected one of " + leaveTypes);
        }
        Employee substitute = resolveSubstitute(employee, request.substituteId());

        List<UUID> conflicts = leaveRequestRepository
                .findOverlapping(employee.getId(), request.startDate(), request.endDate(), BLOCKING_STATUSES)
                .stream()
                .map(LeaveRequest::getId)
                .toList();
        if (!conflicts.isEmpty()) {
            throw new OverlapException(OverlapException.LEAVE_REQUEST_CODE, conflicts,
                    "leave overlaps " + conflicts.size() + " open or approved request(s)");
        }

        LeaveRequest leaveRequest = new LeaveRequest();
        leaveRequest.setEmployee(employee);
        leaveRequest.setStartDate(request.startDate());
        leaveRequest.setEndDate(request.endDate());
        leaveRequest.setLeaveType(type);
        leaveRequest.setSubstitute(substitute);
        leaveRequest.setNotes(trimToNull(request.notes()));
        LeaveRequest saved = leaveRequestRepository.save(leaveRequest);
        log.info("Leave request {} created for {} ({} {}..{})",
                saved.getId(), employee.getId(), type, request.startDate(), request.endDate());

        fire(NotificationEvent.LEAVE_REQUEST_CREATED, saved, employee, employee, null);
        return LeaveRequestResponse.from(saved);
    }

    public LeaveRequestResponse approve(UUID requestId, LeaveDecisionRequest decisionRequest) {
        Employee employee = lockOwner(requestId);
        LeaveRequest leaveRequest = loadRequest(requestId);
        Employee actor = loadActor(decisionRequest.actorId());

        LeaveDecision decision = leaveLifecycle.approve(
                leaveRequest.getStatus(),
                leaveRequest.period(),
                employee.getAnnualLeaveBalance(),
                LeaveActor.of(actor, employee)
        );
        return apply(leaveRequest, employee, actor, decision, decisionRequest.reason(),
                NotificationEvent.LEAVE_REQUEST_APPROVED);
    }

    public LeaveRequestResponse reject(UUID requestId, LeaveDecisionRequest decisionRequest) {
        Employee employee = lockOwner(requestId);
        LeaveRequest leaveRequest = loadRequest(requestId);
        Employee actor = loadActor(decisionRequest.actorId());

        LeaveDecision decision = leaveLifecycle.reject(
                leaveRequest.getStatus(),
                LeaveActor.of(actor, employee),
                decisionRequest.reason()
        );
        return apply(leaveRequest, employee, actor, decision, decisionRequest.reason(),
                NotificationEvent.LEAVE_REQUEST_DENIED);
    }

    public LeaveRequestResponse cancel(UUID requestId, LeaveDecisionRequest decisionRequest) {
        Employee employee = lockOwner(requestId);
        LeaveRequest leaveRequest = loadRequest(requestId);
        Employee actor = loadActor(decisionRequest.actorId());

        LeaveDecision decision = leaveLifecycle.cancel(
                leaveRequest.getStatus(),
                leaveRequest.getChargedDays(),
                LeaveActor.of(actor, employee)
        );
        return apply(leaveRequest, employee, actor, decision, decisionRequest.reason(),
                NotificationEvent.LEAVE_REQUEST_CANCELLED);
    }

    @Transactional(readOnly = true)
    public LeaveRequestResponse getLeaveRequest(UUID requestId) {
        return LeaveRequestResponse.from(loadRequest(requestId));
    }

    @Transactional(readOnly = true)
    public List<LeaveRequestResponse> listLeaveRequests(UUID employeeId, LeaveStatus status) {
        List<LeaveRequest> requests;
        if (employeeId != null && status != null) {
            requests = leaveRequestRepository.findByEmployee_IdAndStatusOrderByStartDateAsc(employeeId, status);
        } else if (employeeId != null) {
            requests = leaveRequestRepository.findByEmployee_IdOrderByStartDateAsc(employeeId);
        } else if (status != null) {
            requests = leaveRequestRepository.findByStatusOrderByStartDateAsc(status);
        } else {
            requests = leaveRequestRepository.findAllByOrderByStartDateAsc();
        }
        return requests.stream().map(LeaveRequestResponse::from).toList();
    }

    private LeaveRequestResponse apply(
            LeaveRequest leaveRequest,
            Employee employee,
            Employee actor,
            LeaveDecision decision,
            String reason,
            NotificationEvent event
    ) {
        LeaveStatus previous = leaveRequest.getStatus();
        if (decision.balanceDelta() != 0) {
            employee.applyLeaveBalanceDelta(decision.balanceDelta());
            employeeRepository.save(employee);
        }
        leaveRequest.applyDecision(decision, actor, OffsetDateTime.now(clock), trimToNull(reason));
        LeaveRequest saved = leaveRequestRepository.save(leaveRequest);
        log.info("Leave request {} {} -> {} by {} (balance delta {}, now {})",
                saved.getId(), previous, decision.nextStatus(), actor.getId(),
                decision.balanceDelta(), employee.getAnnualLeaveBalance());

        fire(event, saved, employee, actor, saved.getDecisionReason());
        return LeaveRequestResponse.from(saved);
    }

    private void fire(NotificationEvent event, LeaveRequest request, Employee employee, Employee actor, String reason) {
        Employee substitute = request.getSubstitute() != null ? request.getSubstitute() : employee.getSubstitute();
        NotificationPayload.LeaveRequestSnapshot snapshot = new NotificationPayload.LeaveRequestSnapshot(
                request.getId(),
                request.getStartDate(),
                request.getEndDate(),
                request.getLeaveType(),
                request.getStatus().name(),
                request.getChargedDays()
        );
        notificationHooks.fire(event, NotificationPayload.forLeaveRequest(employee, substitute, actor, snapshot, reason));
    }

    private Employee resolveSubstitute(Employee employee, UUID substituteId) {
        if (substituteId == null) {
            return null;
        }
        if (substituteId.equals(employee.getId())) {
            throw new InvalidInputException("substituteId", "an employee cannot substitute for themselves");
        }
        Employee substitute = employeeRepository.findById(substituteId)
                .orElseThrow(() -> new InvalidInputException("substituteId", "unknown substitute " + substituteId));
        if (!substitute.isActive()) {
            throw new InvalidInputException("substituteId", "substitute " + substituteId + " is disabled");
        }
        return substitute;
    }

    private LeaveRequest loadRequest(UUID requestId) {
        return leaveRequestRepository.findById(requestId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "LEAVE_REQUEST_NOT_FOUND"));
    }

    // the request row is read only after this lock, so its status is never older than the balance
    private Employee lockOwner(UUID requestId) {
        UUID ownerId = leaveRequestRepository.findEmployeeIdById(requestId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "LEAVE_REQUEST_NOT_FOUND"));
        return employeeRepository.findByIdForUpdate(ownerId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "EMPLOYEE_NOT_FOUND"));
    }

    private Employee loadActor(UUID actorId) {
        return employeeRepository.findById(actorId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "ACTOR_NOT_FOUND"));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
