package com.worktime.backend.global.error;

import java.util.Map;

import org.springframework.http.HttpStatus;

/**
 * Malformed or missing input. {@code field} names the offending attribute.
 */
public class InvalidInputException extends RuleViolationException {

    public static final String CODE = "INVALID_INPUT";

    private final String field;

    public InvalidInputException(String field, String detail) {
        super(HttpStatus.BAD_REQUEST, CODE, detail, Map.of("field", field));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
