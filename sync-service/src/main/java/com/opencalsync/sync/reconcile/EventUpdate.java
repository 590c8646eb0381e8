package com.opencalsync.sync.reconcile;

import com.opencalsync.sync.domain.model.CalendarEvent;
import com.opencalsync.sync.normalize.NormalizedEvent;

import java.util.Set;

/**
 * A stored event and the remote version it must be patched to. Only {@code changedFields} are copied,
 * plus the description, which is refreshed on every update.
 */
public record EventUpdate(
        CalendarEvent stored,
        NormalizedEvent remote,
        Set<Field> changedFields
) {
    public enum Field {
        SUMMARY,
        START_DATE,
        END_DATE,
        STATUS
    }
}
