package com.worktime.backend.modules.leave.presentation;

import java.util.List;
import java.util.UUID;

import com.worktime.backend.modules.leave.application.LeaveRequestService;
import com.worktime.backend.modules.leave.domain.LeaveStatus;
import com.worktime.backend.modules.leave.presentation.dto.CreateLeaveRequest;
import com.worktime.backend.modules.leave.presentation.dto.LeaveDecisionRequest;
import com.worktime.backend.modules.leave.presentation.dto.LeaveRequestResponse;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/leave-requests")
public class LeaveRequestController {

    private final LeaveRequestService leaveRequestService;

    public LeaveRequestController(LeaveRequestService leaveRequestService) {
        this.leaveRequestService = leaveRequestService;
    }

    @GetMapping
    public ResponseEntity<List<LeaveRequestResponse>> listLeaveRequests(
            @RequestParam(name = "employeeId", required = false) UUID employeeId,
            @RequestParam(name = "status", required = false) LeaveStatus status
    ) {
        return ResponseEntity.ok(leaveRequestService.listLeaveRequests(employeeId, status));
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<LeaveRequestResponse> getLeaveRequest(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(leaveRequestService.getLeaveRequest(requestId));
    }

    @Operation(summary = "Request leave", description = "Creates a PENDING request; the balance is charged on approval.")
    @PostMapping
    public ResponseEntity<LeaveRequestResponse> createLeaveRequest(@Valid @RequestBody CreateLeaveRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(leaveRequestService.createLeaveRequest(request));
    }

    @PostMapping("/{requestId}/approve")
    public ResponseEntity<LeaveRequestResponse> approve(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody LeaveDecisionRequest request
    ) {
        return ResponseEntity.ok(leaveRequestService.approve(requestId, request));
    }

    @Operation(summary = "Reject leave", description = "Requires approval authority and a reason field (may be empty).")
    @PostMapping("/{requestId}/reject")
    public ResponseEntity<LeaveRequestResponse> reject(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody LeaveDecisionRequest request
    ) {
        return ResponseEntity.ok(leaveRequestService.reject(requestId, request));
    }

    @Operation(summary = "Cancel leave", description = "Withdraws a pending request or cancels approved leave; charged days are credited back.")
    @PostMapping("/{requestId}/cancel")
    public ResponseEntity<LeaveRequestResponse> cancel(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody LeaveDecisionRequest request
    ) {
        return ResponseEntity.ok(leaveRequestService.cancel(requestId, request));
    }
}
