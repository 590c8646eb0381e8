package com.opencalsync.sync.lifecycle;

import com.opencalsync.sync.domain.model.CalendarEvent;
import com.opencalsync.sync.domain.model.EventDisposition;
import com.opencalsync.sync.domain.repository.CalendarEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies a disposition policy to the events of one connection in a single transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventDispositionApplier {

    private final CalendarEventRepository eventRepository;

    @Transactional
    public DispositionResult apply(Long connectionId, EventDisposition disposition,
                                   boolean preserveHistory, LocalDateTime now) {
        List<CalendarEvent> events = disposition == EventDisposition.KEEP
                ? eventRepository.findByConnectionIdAndActiveTrue(connectionId)
                : eventRepository.findByConnectionId(connectionId);
        List<Long> ids = events.stream().map(CalendarEvent::getId).collect(Collectors.toList());
        if (events.isEmpty()) {
            return DispositionResult.untouched(disposition, ids);
        }

        switch (disposition) {
            case DELETE:
                if (preserveHistory) {
                    events.forEach(event -> event.retire(now));
                    eventRepository.saveAll(events);
                } else {
                    eventRepository.deleteAll(events);
                }
                break;
            case DEACTIVATE:
                events.forEach(event -> event.retire(now));
                eventRepository.saveAll(events);
                break;
            case CONVERT:
                events.forEach(CalendarEvent::convertToManual);
                eventRepository.saveAll(events);
                return DispositionResult.untouched(disposition, ids);
            case KEEP:
            default:
                log.info("Keeping {} event(s) of connection {} unchanged; they may go stale", ids.size(), connectionId);
                return DispositionResult.untouched(disposition, ids);
        }
        log.info("Applied {} to {} event(s) of connection {} (preserveHistory={})",
                disposition, ids.size(), connectionId, preserveHistory);
        return new DispositionResult(disposition, ids, ids);
    }
}
