package com.opencalsync.sync.api.dto;

import com.opencalsync.sync.domain.model.Platform;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record SyncHealthSummary(
        Long userId,
        int totalConnections,
        int activeConnections,
        int errorConnections,
        int totalProperties,
        int propertiesWithErrors,
        int healthPercentage,
        String healthStatus,
        LocalDateTime lastSyncedAt,
        List<ConnectionStatusView> recentFailures,
        Map<Platform, PlatformHealth> platforms
) {
}
