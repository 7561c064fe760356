package com.worktime.backend.modules.leave.domain;

import java.util.Map;

import com.worktime.backend.global.error.RuleViolationException;

import org.springframework.http.HttpStatus;

public class InsufficientBalanceException extends RuleViolationException {

    public static final String CODE = "INSUFFICIENT_BALANCE";

    private final int requestedDays;
    private final int availableDays;

    public InsufficientBalanceException(int requestedDays, int availableDays) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, CODE,
                "request needs " + requestedDays + " days but only " + availableDays + " remain",
                Map.of("requestedDays", requestedDays, "availableDays", availableDays));
        this.requestedDays = requestedDays;
        this.availableDays = availableDays;
    }

    public int getRequestedDays() {
        return requestedDays;
    }

    public int getAvailableDays() {
        return availableDays;
    }
}
