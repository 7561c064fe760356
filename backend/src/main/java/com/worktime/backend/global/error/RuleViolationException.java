package com.worktime.backend.global.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;

/**
 * A rejected business rule. Carries the rule code plus structured details (limits, offending values,
 * conflicting record ids) so callers can render an actionable message. Always recoverable.
 */
public abstract class RuleViolationException extends ProblemException {

    private final Map<String, Object> details;

    protected RuleViolationException(HttpStatus status, String code, String detail, Map<String, ?> details) {
        super(status, code, detail);
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
