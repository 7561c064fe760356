package com.worktime.backend.modules.timeentry.domain;

import java.time.LocalDate;
import java.util.Map;

import com.worktime.backend.global.error.RuleViolationException;

import org.springframework.http.HttpStatus;

public class WeeklyLimitExceededException extends RuleViolationException {

    public static final String CODE = "WEEKLY_LIMIT_EXCEEDED";

    public WeeklyLimitExceededException(LocalDate weekStart, long workedMinutes, long limitMinutes) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, CODE,
                workedMinutes + " worked minutes in the week of " + weekStart
                        + " exceed the weekly limit of " + limitMinutes,
                Map.of(
                        "weekStart", weekStart.toString(),
                        "workedMinutes", workedMinutes,
                        "limitMinutes", limitMinutes
                ));
    }
}
