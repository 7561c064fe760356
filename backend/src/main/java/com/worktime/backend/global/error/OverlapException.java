package com.worktime.backend.global.error;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.springframework.http.HttpStatus;

/**
 * The submitted record collides with already stored records of the same employee.
 */
public class OverlapException extends RuleViolationException {

    public static final String TIME_ENTRY_CODE = "TIME_ENTRY_OVERLAP";
    public static final String LEAVE_REQUEST_CODE = "LEAVE_REQUEST_OVERLAP";

    private final List<UUID> conflictingIds;

    public OverlapException(String code, List<UUID> conflictingIds, String detail) {
        super(HttpStatus.CONFLICT, code, detail, Map.of("conflictingIds", List.copyOf(conflictingIds)));
        this.conflictingIds = List.copyOf(conflictingIds);
    }

    public List<UUID> getConflictingIds() {
        return conflictingIds;
    }
}
