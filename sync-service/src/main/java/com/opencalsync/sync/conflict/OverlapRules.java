package com.opencalsync.sync.conflict;

import com.opencalsync.sync.domain.model.CalendarEvent;
import com.opencalsync.sync.domain.model.Conflict.ConflictType;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Date-range predicates shared by detection and cleanup. All ranges are half-open.
 */
public final class OverlapRules {

    private OverlapRules() {
    }

    /**
     * {@code [aStart, aEnd)} and {@code [bStart, bEnd)} share at least one night. Symmetric in its arguments.
     */
    public static boolean overlaps(LocalDate aStart, LocalDate aEnd, LocalDate bStart, LocalDate bEnd) {
        return aStart.isBefore(bEnd) && bStart.isBefore(aEnd);
    }

    public static boolean overlaps(CalendarEvent a, CalendarEvent b) {
        return overlaps(a.getStartDate(), a.getEndDate(), b.getStartDate(), b.getEndDate());
    }

    /**
     * Same-day changeover: one event ends on the day the other starts.
     */
    public static boolean isTurnover(CalendarEvent a, CalendarEvent b) {
        return a.getEndDate().equals(b.getStartDate()) || b.getEndDate().equals(a.getStartDate());
    }

    public static boolean conflicts(ConflictType type, CalendarEvent a, CalendarEvent b) {
        if (type == ConflictType.OVERLAP) {
            return overlaps(a, b);
        }
        return !overlaps(a, b) && isTurnover(a, b);
    }

    /**
     * True if at least one pair of {@code events} still forms a conflict of the given type.
     */
    public static boolean anyPairConflicts(ConflictType type, List<CalendarEvent> events) {
        for (int i = 0; i < events.size(); i++) {
            for (int j = i + 1; j < events.size(); j++) {
                if (conflicts(type, events.get(i), events.get(j))) {
                    return true;
                }
            }
        }
        return false;
    }

    public static DateSpan span(Collection<CalendarEvent> events) {
        LocalDate start = null;
        LocalDate end = null;
        for (CalendarEvent event : events) {
            if (start == null || event.getStartDate().isBefore(start)) {
                start = event.getStartDate();
            }
            if (end == null || event.getEndDate().isAfter(end)) {
                end = event.getEndDate();
            }
        }
        if (start == null) {
            throw new IllegalArgumentException("Cannot compute the span of no events");
        }
        return new DateSpan(start, end);
    }
}
