package com.worktime.backend.modules.leave.domain;

import java.util.Map;

import com.worktime.backend.global.error.RuleViolationException;

import org.springframework.http.HttpStatus;

public class InvalidTransitionException extends RuleViolationException {

    public static final String CODE = "INVALID_TRANSITION";

    public InvalidTransitionException(LeaveStatus from, LeaveTransition transition, String detail) {
        super(HttpStatus.CONFLICT, CODE, detail, Map.of("from", from.name(), "transition", transition.name()));
    }
}
