package com.opencalsync.sync.api.dto;

import com.opencalsync.sync.domain.model.ResolutionAction;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ResolveConflictRequest(
        @NotEmpty(message = "At least one event to keep is required")
        List<Long> keepEventIds,

        @NotNull(message = "Action cannot be null")
        ResolutionAction action
) {
}
