package com.opencalsync.sync.domain.service;

import com.opencalsync.common.exception.ResourceNotFoundException;
import com.opencalsync.common.exception.StateConflictException;
import com.opencalsync.common.exception.ValidationException;
import com.opencalsync.sync.api.dto.AvailabilityResponse;
import com.opencalsync.sync.api.dto.CalendarEventRequest;
import com.opencalsync.sync.api.dto.CalendarEventResponse;
import com.opencalsync.sync.api.dto.ConflictResponse;
import com.opencalsync.sync.api.dto.EventChangeResponse;
import com.opencalsync.sync.api.dto.UpdateCalendarEventRequest;
import com.opencalsync.sync.client.PropertyDirectory;
import com.opencalsync.sync.conflict.ConflictEngine;
import com.opencalsync.sync.domain.model.CalendarEvent;
import com.opencalsync.sync.domain.model.CalendarEvent.EventCategory;
import com.opencalsync.sync.domain.model.CalendarEvent.EventStatus;
import com.opencalsync.sync.domain.model.Conflict;
import com.opencalsync.sync.domain.model.Platform;
import com.opencalsync.sync.domain.repository.CalendarEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Manual calendar entries and calendar queries for a property.
 *
 * Writes commit before conflict detection runs, since detection takes the property lock and opens its own
 * transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CalendarEventService {

    private static final LocalDate OPEN_START = LocalDate.of(1970, 1, 1);
    private static final LocalDate OPEN_END = LocalDate.of(9999, 12, 31);

    private final CalendarEventRepository eventRepository;
    private final ConflictEngine conflictEngine;
    private final PropertyDirectory propertyDirectory;
    private final Clock clock;

    /**
     * Creates a manual event. Overlapping confirmed events reject the request unless {@code force} is set,
     * in which case the event is stored and the overlap becomes a conflict.
     */
    public EventChangeResponse createManualEvent(Long userId, Long propertyId, CalendarEventRequest request, boolean force) {
        propertyDirectory.requireOwner(propertyId, userId);
        validateRange(request.startDate(), request.endDate());
        EventStatus status = request.status() == null ? EventStatus.CONFIRMED : request.status();
        if (!force && status == EventStatus.CONFIRMED) {
            rejectOverlaps(propertyId, request.startDate(), request.endDate(), null);
        }

        CalendarEvent event = eventRepository.save(CalendarEvent.builder()
                .propertyId(propertyId)
                .platform(Platform.MANUAL)
                .summary(request.summary())
                .description(request.description())
                .startDate(request.startDate())
                .endDate(request.endDate())
                .category(request.category() == null ? EventCategory.BOOKING : request.category())
                .status(status)
                .active(true)
                .build());
        log.info("Created manual event {} on property {} ({}..{})",
                event.getId(), propertyId, event.getStartDate(), event.getEndDate());

        Optional<Conflict> conflict = conflictEngine.detectForEvent(propertyId, event.getId());
        return new EventChangeResponse(CalendarEventResponse.from(event), ConflictResponse.from(conflict.orElse(null)));
    }

    public EventChangeResponse updateEvent(Long userId, Long propertyId, Long eventId,
                                           UpdateCalendarEventRequest request, boolean force) {
        propertyDirectory.requireOwner(propertyId, userId);
        CalendarEvent event = loadActive(propertyId, eventId);

        LocalDate start = request.startDate() != null ? request.startDate() : event.getStartDate();
        LocalDate end = request.endDate() != null ? request.endDate() : event.getEndDate();
        EventStatus status = request.status() != null ? request.status() : event.getStatus();
        boolean datesChanged = !start.equals(event.getStartDate()) || !end.equals(event.getEndDate());
        validateRange(start, end);
        if (!force && datesChanged && status == EventStatus.CONFIRMED) {
            rejectOverlaps(propertyId, start, end, eventId);
        }

        boolean wasBlocking = event.isBlocking();
        LocalDateTime now = LocalDateTime.now(clock);
        if (request.summary() != null) event.setSummary(request.summary());
        if (request.description() != null) event.setDescription(request.description());
        if (request.category() != null) event.setCategory(request.category());
        event.setStartDate(start);
        event.setEndDate(end);
        if (status != event.getStatus()) {
            event.setStatus(status);
            event.setCancelledAt(status == EventStatus.CANCELLED ? now : null);
        }
        event.setUpdatedAt(now);
        event = eventRepository.save(event);
        log.info("Updated event {} on property {}", eventId, propertyId);

        if (wasBlocking && (!event.isBlocking() || datesChanged)) {
            conflictEngine.cleanupAfterRemoval(propertyId, List.of(eventId));
        }
        Optional<Conflict> conflict = conflictEngine.detectForEvent(propertyId, eventId);
        return new EventChangeResponse(CalendarEventResponse.from(event), ConflictResponse.from(conflict.orElse(null)));
    }

    /**
     * Removes an event. With {@code preserveHistory} the row is kept, cancelled and deactivated;
     * otherwise it is deleted. Conflicts that referenced it are repaired afterwards.
     */
    public void removeEvent(Long userId, Long propertyId, Long eventId, boolean preserveHistory) {
        propertyDirectory.requireOwner(propertyId, userId);
        CalendarEvent event = eventRepository.findById(eventId)
                .filter(found -> Objects.equals(found.getPropertyId(), propertyId))
                .orElseThrow(() -> new ResourceNotFoundException("CalendarEvent", eventId));
        if (preserveHistory) {
            event.retire(LocalDateTime.now(clock));
            eventRepository.save(event);
        } else {
            eventRepository.delete(event);
        }
        log.info("{} event {} on property {}", preserveHistory ? "Deactivated" : "Deleted", eventId, propertyId);
        conflictEngine.cleanupAfterRemoval(propertyId, List.of(eventId));
    }

    /**
     * Active events touching {@code [from, to)}, optionally narrowed by platform and category.
     * Missing bounds leave that side of the window open.
     */
    public List<CalendarEventResponse> listEvents(Long userId, Long propertyId, LocalDate from, LocalDate to,
                                                  Set<Platform> platforms, Set<EventCategory> categories) {
        propertyDirectory.requireOwner(propertyId, userId);
        LocalDate windowStart = from != null ? from : OPEN_START;
        LocalDate windowEnd = to != null ? to : OPEN_END;
        if (!windowEnd.isAfter(windowStart)) {
            throw new ValidationException("End date must be after start date", "INVALID_DATE_RANGE");
        }
        return eventRepository.findActiveInWindow(propertyId, windowStart, windowEnd).stream()
                .filter(event -> platforms == null || platforms.isEmpty() || platforms.contains(event.getPlatform()))
                .filter(event -> categories == null || categories.isEmpty() || categories.contains(event.getCategory()))
                .map(CalendarEventResponse::from)
                .collect(Collectors.toList());
    }

    public AvailabilityResponse checkAvailability(Long userId, Long propertyId, LocalDate start, LocalDate end) {
        propertyDirectory.requireOwner(propertyId, userId);
        if (start == null || end == null) {
            throw new ValidationException("Both start date and end date are required", "INVALID_DATE_RANGE");
        }
        validateRange(start, end);
        List<CalendarEventResponse> blocking = eventRepository.findBlockingOverlaps(propertyId, start, end).stream()
                .map(CalendarEventResponse::from)
                .collect(Collectors.toList());
        return new AvailabilityResponse(propertyId, start, end, ChronoUnit.DAYS.between(start, end),
                blocking.isEmpty(), blocking);
    }

    private CalendarEvent loadActive(Long propertyId, Long eventId) {
        return eventRepository.findById(eventId)
                .filter(CalendarEvent::isActive)
                .filter(found -> Objects.equals(found.getPropertyId(), propertyId))
                .orElseThrow(() -> new ResourceNotFoundException("CalendarEvent", eventId));
    }

    private void rejectOverlaps(Long propertyId, LocalDate start, LocalDate end, Long excludeEventId) {
        List<CalendarEvent> overlapping = eventRepository.findBlockingOverlaps(propertyId, start, end).stream()
                .filter(event -> !event.getId().equals(excludeEventId))
                .collect(Collectors.toList());
        if (!overlapping.isEmpty()) {
            List<Long> ids = overlapping.stream().map(CalendarEvent::getId).collect(Collectors.toList());
            throw new StateConflictException(
                    "The selected dates conflict with existing events " + ids, "DATE_RANGE_CONFLICT");
        }
    }

    private static void validateRange(LocalDate start, LocalDate end) {
        if (!end.isAfter(start)) {
            throw new ValidationException("End date must be after start date", "INVALID_DATE_RANGE");
        }
    }
}
