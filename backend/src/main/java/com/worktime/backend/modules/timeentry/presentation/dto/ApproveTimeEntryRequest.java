package com.worktime.backend.modules.timeentry.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record ApproveTimeEntryRequest(
        @NotNull(message = "ACTOR_REQUIRED")
        UUID actorId
) {
}
