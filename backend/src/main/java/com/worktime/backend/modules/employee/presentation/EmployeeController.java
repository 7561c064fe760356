package com.worktime.backend.modules.employee.presentation;

import java.util.List;
import java.util.UUID;

import com.worktime.backend.modules.employee.application.EmployeeService;
import com.worktime.backend.modules.employee.presentation.dto.AdjustLeaveBalanceRequest;
import com.worktime.backend.modules.employee.presentation.dto.CreateEmployeeRequest;
import com.worktime.backend.modules.employee.presentation.dto.EmployeeResponse;
import com.worktime.backend.modules.employee.presentation.dto.UpdateEmployeeRequest;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/employees")
public class EmployeeController {

    private final EmployeeService employeeService;

    public EmployeeController(EmployeeService employeeService) {
        this.employeeService = employeeService;
    }

    @GetMapping
    public ResponseEntity<List<EmployeeResponse>> listEmployees(
            @RequestParam(name = "includeInactive", defaultValue = "false") boolean includeInactive
    ) {
        return ResponseEntity.ok(employeeService.listEmployees(includeInactive));
    }

    @GetMapping("/{employeeId}")
    public ResponseEntity<EmployeeResponse> getEmployee(@PathVariable("employeeId") UUID employeeId) {
        return ResponseEntity.ok(employeeService.getEmployee(employeeId));
    }

    @Operation(summary = "Create employee", description = "Registers an employee with the default annual leave balance.")
    @PostMapping
    public ResponseEntity<EmployeeResponse> createEmployee(@Valid @RequestBody CreateEmployeeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(employeeService.createEmployee(request));
    }

    @PatchMapping("/{employeeId}")
    public ResponseEntity<EmployeeResponse> updateEmployee(
            @PathVariable("employeeId") UUID employeeId,
            @Valid @RequestBody UpdateEmployeeRequest request
    ) {
        return ResponseEntity.ok(employeeService.updateEmployee(employeeId, request));
    }

    @Operation(summary = "Adjust leave balance", description = "Sets the remaining balance; must stay within 0 and the accrual cap.")
    @PostMapping("/{employeeId}/leave-balance")
    public ResponseEntity<EmployeeResponse> adjustLeaveBalance(
            @PathVariable("employeeId") UUID employeeId,
            @Valid @RequestBody AdjustLeaveBalanceRequest request
    ) {
        return ResponseEntity.ok(employeeService.adjustLeaveBalance(employeeId, request));
    }

    @PostMapping("/{employeeId}/disable")
    public ResponseEntity<EmployeeResponse> disableEmployee(@PathVariable("employeeId") UUID employeeId) {
        return ResponseEntity.ok(employeeService.disableEmployee(employeeId));
    }
}
