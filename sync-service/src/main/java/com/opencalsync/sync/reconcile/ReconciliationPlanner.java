package com.opencalsync.sync.reconcile;

import com.opencalsync.sync.domain.model.CalendarEvent;
import com.opencalsync.sync.domain.model.CalendarEvent.EventStatus;
import com.opencalsync.sync.normalize.NormalizedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Diffs one connection's normalized feed against its stored active events. Pure: reads nothing and writes nothing.
 *
 * Matching is by external UID. A matched event is updated when summary, start, end or status differ.
 * Stored events whose UID is absent from the feed are cancelled unless already cancelled.
 * When past entries are skipped, stored events that ended before today are also exempt from cancellation,
 * since their absence from the feed says nothing.
 */
@Slf4j
@Component
public class ReconciliationPlanner {

    public ReconciliationPlan plan(List<NormalizedEvent> remote, List<CalendarEvent> stored,
                                   LocalDate today, boolean skipPastEvents) {
        Map<String, CalendarEvent> storedByUid = new HashMap<>();
        List<CalendarEvent> duplicates = new ArrayList<>();
        for (CalendarEvent event : stored) {
            if (event.getExternalUid() == null) {
                continue;
            }
            if (storedByUid.putIfAbsent(event.getExternalUid(), event) != null) {
                duplicates.add(event);
            }
        }
        if (!duplicates.isEmpty()) {
            log.warn("Found {} duplicate active event(s) for the same UID; extras will be cancelled", duplicates.size());
        }

        List<NormalizedEvent> creates = new ArrayList<>();
        List<EventUpdate> updates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int skippedPast = 0;

        for (NormalizedEvent incoming : remote) {
            if (skipPastEvents && incoming.endDate().isBefore(today)) {
                skippedPast++;
                continue;
            }
            seen.add(incoming.externalUid());
            CalendarEvent existing = storedByUid.get(incoming.externalUid());
            if (existing == null) {
                creates.add(incoming);
                continue;
            }
            Set<EventUpdate.Field> changed = diff(existing, incoming);
            if (!changed.isEmpty()) {
                updates.add(new EventUpdate(existing, incoming, changed));
            }
        }

        List<CalendarEvent> cancels = new ArrayList<>();
        for (CalendarEvent event : storedByUid.values()) {
            if (!seen.contains(event.getExternalUid()) && isCancellable(event, today, skipPastEvents)) {
                cancels.add(event);
            }
        }
        for (CalendarEvent event : duplicates) {
            if (event.getStatus() != EventStatus.CANCELLED) {
                cancels.add(event);
            }
        }

        return new ReconciliationPlan(creates, updates, cancels, skippedPast);
    }

    static Set<EventUpdate.Field> diff(CalendarEvent stored, NormalizedEvent remote) {
        Set<EventUpdate.Field> changed = EnumSet.noneOf(EventUpdate.Field.class);
        if (!Objects.equals(stored.getSummary(), remote.summary())) {
            changed.add(EventUpdate.Field.SUMMARY);
        }
        if (!Objects.equals(stored.getStartDate(), remote.startDate())) {
            changed.add(EventUpdate.Field.START_DATE);
        }
        if (!Objects.equals(stored.getEndDate(), remote.endDate())) {
            changed.add(EventUpdate.Field.END_DATE);
        }
        if (stored.getStatus() != remote.status()) {
            changed.add(EventUpdate.Field.STATUS);
        }
        return changed;
    }

    private static boolean isCancellable(CalendarEvent event, LocalDate today, boolean skipPastEvents) {
        if (event.getStatus() == EventStatus.CANCELLED) {
            return false;
        }
        return !(skipPastEvents && event.getEndDate().isBefore(today));
    }
}
