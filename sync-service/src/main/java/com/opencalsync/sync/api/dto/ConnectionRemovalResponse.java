package com.opencalsync.sync.api.dto;

import com.opencalsync.sync.domain.model.EventDisposition;

public record ConnectionRemovalResponse(
        Long connectionId,
        EventDisposition disposition,
        int eventsAffected,
        int conflictsResolved,
        int conflictsRecalculated
) {
}
