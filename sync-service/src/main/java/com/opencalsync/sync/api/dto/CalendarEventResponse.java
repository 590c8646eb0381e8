package com.opencalsync.sync.api.dto;

import com.opencalsync.sync.domain.model.CalendarEvent;
import com.opencalsync.sync.domain.model.Platform;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record CalendarEventResponse(
        Long id,
        Long propertyId,
        Long connectionId,
        String externalUid,
        Platform platform,
        String summary,
        String description,
        LocalDate startDate,
        LocalDate endDate,
        long durationDays,
        CalendarEvent.EventCategory category,
        CalendarEvent.EventStatus status,
        boolean active,
        LocalDateTime updatedAt
) {
    public static CalendarEventResponse from(CalendarEvent event) {
        return new CalendarEventResponse(
                event.getId(),
                event.getPropertyId(),
                event.getConnectionId(),
                event.getExternalUid(),
                event.getPlatform(),
                event.getSummary(),
                event.getDescription(),
                event.getStartDate(),
                event.getEndDate(),
                event.durationDays(),
                event.getCategory(),
                event.getStatus(),
                event.isActive(),
                event.getUpdatedAt()
        );
    }
}
