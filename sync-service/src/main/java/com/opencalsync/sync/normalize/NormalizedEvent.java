package com.opencalsync.sync.normalize;

import com.opencalsync.sync.domain.model.CalendarEvent.EventCategory;
import com.opencalsync.sync.domain.model.CalendarEvent.EventStatus;
import com.opencalsync.sync.domain.model.Platform;

import java.time.LocalDate;

/**
 * Canonical form of a feed entry, ready to be diffed against stored events. Not persisted.
 */
public record NormalizedEvent(
        String externalUid,
        Platform platform,
        String summary,
        String description,
        LocalDate startDate,
        LocalDate endDate,
        EventCategory category,
        EventStatus status
) {
}
