package com.opencalsync.sync.api.dto;

import com.opencalsync.sync.domain.model.CalendarConnection;
import com.opencalsync.sync.domain.model.Platform;

import java.time.LocalDateTime;

public record ConnectionResponse(
        Long id,
        Long propertyId,
        Long userId,
        Platform platform,
        String feedUrl,
        Integer syncFrequencyMinutes,
        CalendarConnection.ConnectionStatus status,
        String errorMessage,
        LocalDateTime lastSyncedAt,
        LocalDateTime lastErrorAt,
        LocalDateTime nextSyncAt,
        Integer syncCount,
        LocalDateTime createdAt
) {
    public static ConnectionResponse from(CalendarConnection connection) {
        return new ConnectionResponse(
                connection.getId(),
                connection.getPropertyId(),
                connection.getUserId(),
                connection.getPlatform(),
                connection.getFeedUrl(),
                connection.getSyncFrequencyMinutes(),
                connection.getStatus(),
                connection.getErrorMessage(),
                connection.getLastSyncedAt(),
                connection.getLastErrorAt(),
                connection.nextSyncAt(),
                connection.getSyncCount(),
                connection.getCreatedAt()
        );
    }
}
