package com.opencalsync.sync.api.dto;

import com.opencalsync.sync.domain.model.CalendarEvent;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * Partial update: null fields are left unchanged.
 */
public record UpdateCalendarEventRequest(
        @Size(max = 500, message = "Summary is too long")
        String summary,
        String description,
        LocalDate startDate,
        LocalDate endDate,
        CalendarEvent.EventCategory category,
        CalendarEvent.EventStatus status
) {
}
