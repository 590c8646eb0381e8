package com.opencalsync.sync.conflict;

import com.opencalsync.sync.domain.model.ResolutionAction;

import java.util.List;

public record ResolutionResult(
        Long conflictId,
        List<Long> keptEventIds,
        List<Long> removedEventIds,
        ResolutionAction action,
        CleanupResult cascade
) {
}
