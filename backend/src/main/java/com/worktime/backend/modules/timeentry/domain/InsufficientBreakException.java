package com.worktime.backend.modules.timeentry.domain;

import java.util.Map;

import com.worktime.backend.global.error.RuleViolationException;

import org.springframework.http.HttpStatus;

public class InsufficientBreakException extends RuleViolationException {

    public static final String CODE = "INSUFFICIENT_BREAK";

    public InsufficientBreakException(int breakMinutes, int requiredBreakMinutes, long spanMinutes) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, CODE,
                "a " + spanMinutes + " minute span needs at least " + requiredBreakMinutes
                        + " minutes of break, got " + breakMinutes,
                Map.of(
                        "breakMinutes", breakMinutes,
                        "requiredBreakMinutes", requiredBreakMinutes,
                        "spanMinutes", spanMinutes
                ));
    }
}
