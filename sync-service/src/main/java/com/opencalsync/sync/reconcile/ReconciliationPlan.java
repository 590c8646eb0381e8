package com.opencalsync.sync.reconcile;

import com.opencalsync.sync.domain.model.CalendarEvent;
import com.opencalsync.sync.normalize.NormalizedEvent;

import java.util.List;

public record ReconciliationPlan(
        List<NormalizedEvent> creates,
        List<EventUpdate> updates,
        List<CalendarEvent> cancels,
        int skippedPastEntries
) {
    public boolean isEmpty() {
        return creates.isEmpty() && updates.isEmpty() && cancels.isEmpty();
    }
}
