package com.opencalsync.sync.normalize;

import com.opencalsync.sync.domain.model.CalendarEvent.EventCategory;

import java.util.Optional;

/**
 * One heuristic in the category table. Returns empty when it has no opinion about the entry.
 */
@FunctionalInterface
public interface CategoryRule {

    Optional<EventCategory> classify(String summary);
}
