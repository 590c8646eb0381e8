package com.opencalsync.sync.api.dto;

import com.opencalsync.sync.domain.model.CalendarEvent;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record CalendarEventRequest(
        @Size(max = 500, message = "Summary is too long")
        String summary,

        String description,

        @NotNull(message = "Start date cannot be null")
        LocalDate startDate,

        @NotNull(message = "End date cannot be null")
        LocalDate endDate,

        CalendarEvent.EventCategory category,

        CalendarEvent.EventStatus status
) {
}
