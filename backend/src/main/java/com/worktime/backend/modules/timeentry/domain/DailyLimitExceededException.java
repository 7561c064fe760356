package com.worktime.backend.modules.timeentry.domain;

import java.time.LocalDate;
import java.util.Map;

import com.worktime.backend.global.error.RuleViolationException;

import org.springframework.http.HttpStatus;

public class DailyLimitExceededException extends RuleViolationException {

    public static final String CODE = "DAILY_LIMIT_EXCEEDED";

    private final long workedMinutes;

    public DailyLimitExceededException(LocalDate date, long workedMinutes, long limitMinutes) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, CODE,
                workedMinutes + " worked minutes on " + date + " exceed the daily limit of " + limitMinutes,
                Map.of(
                        "date", date.toString(),
                        "workedMinutes", workedMinutes,
                        "limitMinutes", limitMinutes
                ));
        this.workedMinutes = workedMinutes;
    }

    public long getWorkedMinutes() {
        return workedMinutes;
    }
}
