package com.opencalsync.sync.lifecycle;

import com.opencalsync.sync.domain.model.EventDisposition;

import java.util.List;

/**
 * @param affectedEventIds every event the disposition touched
 * @param removedEventIds  events that stopped counting as active and must leave their conflicts
 */
public record DispositionResult(
        EventDisposition disposition,
        List<Long> affectedEventIds,
        List<Long> removedEventIds
) {
    public static DispositionResult untouched(EventDisposition disposition, List<Long> eventIds) {
        return new DispositionResult(disposition, eventIds, List.of());
    }
}
