package com.opencalsync.sync.api.dto;

import com.opencalsync.sync.domain.model.Conflict;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public record ConflictResponse(
        Long id,
        Long propertyId,
        List<Long> eventIds,
        Conflict.ConflictType type,
        Conflict.ConflictSeverity severity,
        Conflict.ConflictStatus status,
        LocalDate startDate,
        LocalDate endDate,
        String description,
        LocalDateTime resolvedAt,
        LocalDateTime createdAt
) {
    public static ConflictResponse from(Conflict conflict) {
        if (conflict == null) {
            return null;
        }
        return new ConflictResponse(
                conflict.getId(),
                conflict.getPropertyId(),
                List.copyOf(conflict.getEventIds()),
                conflict.getType(),
                conflict.getSeverity(),
                conflict.getStatus(),
                conflict.getStartDate(),
                conflict.getEndDate(),
                conflict.getDescription(),
                conflict.getResolvedAt(),
                conflict.getCreatedAt()
        );
    }
}
