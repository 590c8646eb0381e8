package com.opencalsync.sync.api.dto;

import java.time.LocalDateTime;
import java.util.List;

public record PropertySyncStatus(
        Long propertyId,
        List<ConnectionStatusView> connections,
        int activeConnections,
        int errorConnections,
        long activeEvents,
        long openConflicts,
        int healthPercentage,
        String overallStatus,
        LocalDateTime lastSyncedAt,
        LocalDateTime nextSyncAt
) {
}
