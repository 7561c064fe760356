package com.worktime.backend.modules.leave.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Body of approve, reject and cancel. {@code reason} is mandatory for a rejection, though it may be empty.
 */
public record LeaveDecisionRequest(
        @NotNull(message = "ACTOR_REQUIRED")
        UUID actorId,
        @Size(max = 2000, message = "REASON_TOO_LONG")
        String reason
) {
}
