package com.opencalsync.sync.conflict;

import com.opencalsync.common.exception.ResourceNotFoundException;
import com.opencalsync.common.exception.StateConflictException;
import com.opencalsync.common.exception.ValidationException;
import com.opencalsync.sync.domain.model.CalendarEvent;
import com.opencalsync.sync.domain.model.CalendarEvent.EventStatus;
import com.opencalsync.sync.domain.model.Conflict;
import com.opencalsync.sync.domain.model.Conflict.ConflictSeverity;
import com.opencalsync.sync.domain.model.Conflict.ConflictStatus;
import com.opencalsync.sync.domain.model.Conflict.ConflictType;
import com.opencalsync.sync.domain.model.ResolutionAction;
import com.opencalsync.sync.domain.repository.CalendarEventRepository;
import com.opencalsync.sync.domain.repository.ConflictRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Transactional half of the conflict engine. Every public method commits as one unit; callers hold the
 * property lock around it (see {@link ConflictEngine}), so a rescan's delete-and-rebuild is never observed
 * half done by a concurrent resolution.
 *
 * Detection and cleanup only consider events that are active and CONFIRMED.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConflictProcessor {

    static final Comparator<CalendarEvent> MEMBER_ORDER =
            Comparator.comparing(CalendarEvent::getStartDate).thenComparing(CalendarEvent::getId);

    private static final int DESCRIPTION_LIMIT = 1000;

    private final CalendarEventRepository eventRepository;
    private final ConflictRepository conflictRepository;
    private final Clock clock;

    /**
     * Targeted detection after a single event changed.
     *
     * If an open overlap conflict already contains every involved event it is returned unchanged.
     * Open overlap conflicts whose members are a strict subset of the involved events are replaced
     * by the new, larger conflict. Conflicts that only partially share members are left alone.
     *
     * @return the conflict covering the event, or empty if it overlaps nothing
     */
    @Transactional
    public Optional<Conflict> detectForEvent(Long eventId) {
        Optional<CalendarEvent> changed = eventRepository.findById(eventId);
        if (changed.isEmpty() || !changed.get().isBlocking()) {
            return Optional.empty();
        }
        CalendarEvent event = changed.get();

        List<CalendarEvent> members = new ArrayList<>(eventRepository.findBlockingOverlaps(
                event.getPropertyId(), event.getStartDate(), event.getEndDate()));
        members.removeIf(other -> other.getId().equals(event.getId()));
        if (members.isEmpty()) {
            return Optional.empty();
        }
        members.add(event);
        members.sort(MEMBER_ORDER);
        List<Long> memberIds = ids(members);

        List<Conflict> touching = conflictRepository.findOpenTouching(event.getPropertyId(), memberIds);
        for (Conflict existing : touching) {
            if (existing.getType() == ConflictType.OVERLAP && existing.getEventIds().containsAll(memberIds)) {
                log.debug("Event {} already covered by conflict {}", eventId, existing.getId());
                return Optional.of(existing);
            }
        }

        List<Conflict> absorbed = touching.stream()
                .filter(existing -> existing.getType() == ConflictType.OVERLAP)
                .filter(existing -> memberIds.containsAll(existing.getEventIds()))
                .collect(Collectors.toList());
        if (!absorbed.isEmpty()) {
            log.info("Replacing {} narrower conflict(s) on property {} while detecting event {}",
                    absorbed.size(), event.getPropertyId(), eventId);
            conflictRepository.deleteAll(absorbed);
        }

        Conflict conflict = conflictRepository.save(
                newConflict(event.getPropertyId(), members, ConflictType.OVERLAP, ConflictSeverity.HIGH));
        log.info("Detected overlap conflict {} on property {} between events {}",
                conflict.getId(), event.getPropertyId(), memberIds);
        return Optional.of(conflict);
    }

    /**
     * Full rescan: drops every conflict of the property and rebuilds them pairwise from the active
     * confirmed events. Overlapping pairs become HIGH overlap conflicts; touching pairs become MEDIUM
     * turnover conflicts. Acknowledged conflicts that come back with the same members stay acknowledged.
     *
     * Quadratic in the number of active events per property; the sort by start date lets the inner
     * loop stop at the first event starting after the current one ends.
     */
    @Transactional
    public RescanResult rebuild(Long propertyId) {
        List<Conflict> previous = conflictRepository.findByPropertyIdOrderByStartDateAsc(propertyId);
        Set<String> knownOverlapPairs = new HashSet<>();
        Set<String> acknowledged = new HashSet<>();
        for (Conflict conflict : previous) {
            if (conflict.getType() == ConflictType.OVERLAP) {
                knownOverlapPairs.addAll(pairKeys(conflict.getEventIds()));
            }
            if (conflict.getStatus() == ConflictStatus.ACKNOWLEDGED) {
                acknowledged.add(memberKey(conflict.getType(), conflict.getEventIds()));
            }
        }

        long replaced = conflictRepository.deleteByPropertyId(propertyId);

        List<CalendarEvent> events = eventRepository
                .findByPropertyIdAndActiveTrueAndStatusOrderByStartDateAscIdAsc(propertyId, EventStatus.CONFIRMED);
        List<Conflict> rebuilt = new ArrayList<>();
        int overlaps = 0;
        int turnovers = 0;
        int fresh = 0;
        for (int i = 0; i < events.size(); i++) {
            CalendarEvent a = events.get(i);
            for (int j = i + 1; j < events.size(); j++) {
                CalendarEvent b = events.get(j);
                if (b.getStartDate().isAfter(a.getEndDate())) {
                    break;
                }
                Conflict conflict;
                if (OverlapRules.overlaps(a, b)) {
                    conflict = newConflict(propertyId, List.of(a, b), ConflictType.OVERLAP, ConflictSeverity.HIGH);
                    overlaps++;
                    if (!knownOverlapPairs.contains(pairKey(a.getId(), b.getId()))) {
                        fresh++;
                    }
                } else if (OverlapRules.isTurnover(a, b)) {
                    conflict = newConflict(propertyId, List.of(a, b), ConflictType.TURNOVER, ConflictSeverity.MEDIUM);
                    turnovers++;
                } else {
                    continue;
                }
                if (acknowledged.contains(memberKey(conflict.getType(), conflict.getEventIds()))) {
                    conflict.setStatus(ConflictStatus.ACKNOWLEDGED);
                }
                rebuilt.add(conflict);
            }
        }
        conflictRepository.saveAll(rebuilt);

        return new RescanResult(propertyId, events.size(), replaced, overlaps, turnovers, fresh);
    }

    /**
     * Keeps {@code keepIds}, removes every other member, and marks the conflict RESOLVED.
     */
    @Transactional
    public ResolutionResult resolveManually(Long propertyId, Long conflictId,
                                            Collection<Long> keepIds, ResolutionAction action) {
        Conflict conflict = loadOpen(propertyId, conflictId);
        Set<Long> keep = new LinkedHashSet<>(keepIds);
        List<Long> strangers = keep.stream()
                .filter(id -> !conflict.getEventIds().contains(id))
                .collect(Collectors.toList());
        if (!strangers.isEmpty()) {
            throw new ValidationException(
                    "Events " + strangers + " are not members of conflict " + conflictId, "INVALID_KEEP_SET");
        }
        List<Long> remove = conflict.getEventIds().stream()
                .filter(id -> !keep.contains(id))
                .collect(Collectors.toList());
        if (remove.isEmpty()) {
            throw new ValidationException(
                    "Resolving conflict " + conflictId + " requires removing at least one event", "NOTHING_TO_REMOVE");
        }
        return applyResolution(conflict, new ArrayList<>(keep), remove, action, "manually");
    }

    /**
     * Keeps the longest active member (in whole days) and removes the others.
     * Equal durations go to the member that comes first in the conflict's member order.
     */
    @Transactional
    public ResolutionResult autoResolve(Long propertyId, Long conflictId, ResolutionAction action) {
        Conflict conflict = loadOpen(propertyId, conflictId);
        List<CalendarEvent> members = activeInOrder(conflict.getEventIds());
        if (members.size() < 2) {
            throw new StateConflictException("Conflict " + conflictId
                    + " has fewer than two active events and cannot be auto-resolved", "INSUFFICIENT_ACTIVE_EVENTS");
        }
        CalendarEvent winner = longest(members);
        List<Long> remove = members.stream()
                .map(CalendarEvent::getId)
                .filter(id -> !id.equals(winner.getId()))
                .collect(Collectors.toList());
        return applyResolution(conflict, List.of(winner.getId()), remove, action, "automatically");
    }

    /**
     * Repairs open conflicts after events were deleted, deactivated or detached.
     */
    @Transactional
    public CleanupResult cleanupAfterRemoval(Long propertyId, Collection<Long> removedEventIds) {
        return cleanup(propertyId, removedEventIds, null);
    }

    @Transactional
    public Conflict acknowledge(Long propertyId, Long conflictId) {
        Conflict conflict = loadOpen(propertyId, conflictId);
        conflict.setStatus(ConflictStatus.ACKNOWLEDGED);
        return conflictRepository.save(conflict);
    }

    @Transactional(readOnly = true)
    public List<Conflict> list(Long propertyId, ConflictStatus status) {
        if (status == null) {
            return conflictRepository.findByPropertyIdOrderByStartDateAsc(propertyId);
        }
        return conflictRepository.findByPropertyIdAndStatusOrderByStartDateAsc(propertyId, status);
    }

    @Transactional(readOnly = true)
    public Conflict get(Long propertyId, Long conflictId) {
        return conflictRepository.findByIdAndPropertyId(conflictId, propertyId)
                .orElseThrow(() -> new ResourceNotFoundException("Conflict", conflictId));
    }

    private ResolutionResult applyResolution(Conflict conflict, List<Long> keep, List<Long> remove,
                                             ResolutionAction action, String how) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<CalendarEvent> losers = eventRepository.findAllById(remove);
        if (action == ResolutionAction.DELETE) {
            eventRepository.deleteAll(losers);
        } else {
            losers.forEach(event -> event.retire(now));
            eventRepository.saveAll(losers);
        }

        conflict.resolve(now);
        conflict.setDescription(appendNote(conflict.getDescription(),
                "resolved " + how + ": kept " + keep + ", " + action.name().toLowerCase() + "d " + remove));
        conflictRepository.save(conflict);
        log.info("Resolved conflict {} {} on property {}: kept {}, {} {}",
                conflict.getId(), how, conflict.getPropertyId(), keep, action, remove);

        CleanupResult cascade = cleanup(conflict.getPropertyId(), remove, conflict.getId());
        return new ResolutionResult(conflict.getId(), keep, remove, action, cascade);
    }

    private CleanupResult cleanup(Long propertyId, Collection<Long> removedEventIds, Long skipConflictId) {
        if (removedEventIds == null || removedEventIds.isEmpty()) {
            return CleanupResult.none();
        }
        Set<Long> removed = new HashSet<>(removedEventIds);
        LocalDateTime now = LocalDateTime.now(clock);
        int resolved = 0;
        int recalculated = 0;

        for (Conflict conflict : conflictRepository.findOpenTouching(propertyId, removed)) {
            if (conflict.getId().equals(skipConflictId)) {
                continue;
            }
            List<Long> remainingIds = conflict.getEventIds().stream()
                    .filter(id -> !removed.contains(id))
                    .collect(Collectors.toList());
            if (remainingIds.size() <= 1) {
                resolveStale(conflict, "only one event remains", now);
                resolved++;
                continue;
            }

            List<CalendarEvent> remaining = activeInOrder(remainingIds).stream()
                    .filter(event -> event.getStatus() != EventStatus.CANCELLED)
                    .collect(Collectors.toList());
            if (remaining.size() <= 1) {
                resolveStale(conflict, "insufficient active events", now);
                resolved++;
            } else if (OverlapRules.anyPairConflicts(conflict.getType(), remaining)) {
                DateSpan span = OverlapRules.span(remaining);
                conflict.getEventIds().clear();
                conflict.getEventIds().addAll(ids(remaining));
                conflict.setStartDate(span.start());
                conflict.setEndDate(span.end());
                conflict.setDescription(appendNote(describe(conflict.getType(), remaining), "recalculated after event removal"));
                conflictRepository.save(conflict);
                recalculated++;
            } else {
                resolveStale(conflict, "remaining events no longer conflict", now);
                resolved++;
            }
        }

        if (resolved + recalculated > 0) {
            log.info("Conflict cleanup on property {}: {} resolved, {} recalculated", propertyId, resolved, recalculated);
        }
        return new CleanupResult(resolved, recalculated);
    }

    private void resolveStale(Conflict conflict, String reason, LocalDateTime now) {
        conflict.resolve(now);
        conflict.setDescription(appendNote(conflict.getDescription(), "automatically resolved - " + reason));
        conflictRepository.save(conflict);
    }

    private Conflict loadOpen(Long propertyId, Long conflictId) {
        Conflict conflict = get(propertyId, conflictId);
        if (!conflict.isOpen()) {
            throw new StateConflictException("Conflict " + conflictId + " is already resolved", "CONFLICT_ALREADY_RESOLVED");
        }
        return conflict;
    }

    /**
     * Active events among {@code ids}, in the order the ids are given.
     */
    private List<CalendarEvent> activeInOrder(List<Long> ids) {
        Map<Long, Integer> position = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            position.putIfAbsent(ids.get(i), i);
        }
        List<CalendarEvent> events = new ArrayList<>(eventRepository.findByIdInAndActiveTrue(ids));
        events.sort(Comparator.comparing((CalendarEvent event) -> position.get(event.getId())));
        return events;
    }

    static CalendarEvent longest(List<CalendarEvent> members) {
        CalendarEvent winner = members.get(0);
        for (CalendarEvent candidate : members.subList(1, members.size())) {
            if (candidate.durationDays() > winner.durationDays()) {
                winner = candidate;
            }
        }
        return winner;
    }

    private static Conflict newConflict(Long propertyId, List<CalendarEvent> members,
                                        ConflictType type, ConflictSeverity severity) {
        DateSpan span = OverlapRules.span(members);
        return Conflict.builder()
                .propertyId(propertyId)
                .eventIds(new ArrayList<>(ids(members)))
                .type(type)
                .severity(severity)
                .status(ConflictStatus.NEW)
                .startDate(span.start())
                .endDate(span.end())
                .description(describe(type, members))
                .build();
    }

    static String describe(ConflictType type, List<CalendarEvent> members) {
        String parts = members.stream()
                .map(event -> event.getPlatform().getDisplayName() + " " + event.getStartDate() + ".." + event.getEndDate())
                .collect(Collectors.joining(", "));
        if (type == ConflictType.TURNOVER) {
            return "Same-day turnover between " + parts;
        }
        return "Booking conflict between " + members.size() + " events: " + parts;
    }

    private static String appendNote(String description, String note) {
        String text = (description == null ? "" : description + " ") + "(" + note + ")";
        return text.length() <= DESCRIPTION_LIMIT ? text : text.substring(0, DESCRIPTION_LIMIT);
    }

    private static List<Long> ids(List<CalendarEvent> events) {
        return events.stream().map(CalendarEvent::getId).collect(Collectors.toList());
    }

    private static String pairKey(Long a, Long b) {
        return Math.min(a, b) + ":" + Math.max(a, b);
    }

    private static Set<String> pairKeys(List<Long> ids) {
        Set<String> keys = new HashSet<>();
        for (int i = 0; i < ids.size(); i++) {
            for (int j = i + 1; j < ids.size(); j++) {
                keys.add(pairKey(ids.get(i), ids.get(j)));
            }
        }
        return keys;
    }

    private static String memberKey(ConflictType type, List<Long> ids) {
        return type + ":" + ids.stream().sorted().map(String::valueOf).collect(Collectors.joining(","));
    }
}
