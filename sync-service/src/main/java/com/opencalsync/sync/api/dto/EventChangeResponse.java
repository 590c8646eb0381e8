package com.opencalsync.sync.api.dto;

/**
 * A created or updated event plus the overlap conflict it now belongs to, if any.
 */
public record EventChangeResponse(
        CalendarEventResponse event,
        ConflictResponse conflict
) {
}
