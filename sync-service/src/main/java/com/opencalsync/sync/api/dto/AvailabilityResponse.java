package com.opencalsync.sync.api.dto;

import java.time.LocalDate;
import java.util.List;

public record AvailabilityResponse(
        Long propertyId,
        LocalDate startDate,
        LocalDate endDate,
        long durationDays,
        boolean available,
        List<CalendarEventResponse> conflictingEvents
) {
}
