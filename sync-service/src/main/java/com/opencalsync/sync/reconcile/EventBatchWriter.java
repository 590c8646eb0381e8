package com.opencalsync.sync.reconcile;

import com.opencalsync.sync.domain.model.CalendarConnection;
import com.opencalsync.sync.domain.model.CalendarEvent;
import com.opencalsync.sync.domain.model.CalendarEvent.EventStatus;
import com.opencalsync.sync.domain.repository.CalendarEventRepository;
import com.opencalsync.sync.normalize.NormalizedEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies one batch of a reconciliation plan per call, each in its own transaction, so a failing batch
 * rolls back alone and earlier batches stay committed.
 */
@Component
@RequiredArgsConstructor
public class EventBatchWriter {

    private final CalendarEventRepository eventRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<CalendarEvent> insert(CalendarConnection connection, List<NormalizedEvent> batch) {
        List<CalendarEvent> events = batch.stream()
                .map(remote -> CalendarEvent.builder()
                        .propertyId(connection.getPropertyId())
                        .connectionId(connection.getId())
                        .externalUid(remote.externalUid())
                        .platform(remote.platform())
                        .summary(remote.summary())
                        .description(remote.description())
                        .startDate(remote.startDate())
                        .endDate(remote.endDate())
                        .category(remote.category())
                        .status(remote.status())
                        .active(true)
                        .build())
                .collect(Collectors.toList());
        return eventRepository.saveAll(events);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<CalendarEvent> update(List<EventUpdate> batch, LocalDateTime now) {
        List<CalendarEvent> patched = batch.stream()
                .map(update -> patch(update, now))
                .collect(Collectors.toList());
        return eventRepository.saveAll(patched);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<CalendarEvent> cancel(List<CalendarEvent> batch, LocalDateTime now) {
        batch.forEach(event -> event.cancel(now));
        return eventRepository.saveAll(batch);
    }

    static CalendarEvent patch(EventUpdate update, LocalDateTime now) {
        CalendarEvent event = update.stored();
        NormalizedEvent remote = update.remote();
        for (EventUpdate.Field field : update.changedFields()) {
            switch (field) {
                case SUMMARY:
                    event.setSummary(remote.summary());
                    event.setCategory(remote.category());
                    break;
                case START_DATE:
                    event.setStartDate(remote.startDate());
                    break;
                case END_DATE:
                    event.setEndDate(remote.endDate());
                    break;
                case STATUS:
                    event.setStatus(remote.status());
                    event.setCancelledAt(remote.status() == EventStatus.CANCELLED ? now : null);
                    break;
                default:
                    break;
            }
        }
        event.setDescription(remote.description());
        event.setUpdatedAt(now);
        return event;
    }
}
