package com.opencalsync.sync.api.dto;

import com.opencalsync.sync.domain.model.CalendarConnection;
import com.opencalsync.sync.domain.model.Platform;

import java.time.LocalDateTime;

public record ConnectionStatusView(
        Long connectionId,
        Long propertyId,
        Platform platform,
        CalendarConnection.ConnectionStatus status,
        LocalDateTime lastSyncedAt,
        LocalDateTime nextSyncAt,
        Integer syncFrequencyMinutes,
        String errorMessage,
        LocalDateTime lastErrorAt,
        long activeEvents
) {
    public static ConnectionStatusView of(CalendarConnection connection, long activeEvents) {
        return new ConnectionStatusView(
                connection.getId(),
                connection.getPropertyId(),
                connection.getPlatform(),
                connection.getStatus(),
                connection.getLastSyncedAt(),
                connection.nextSyncAt(),
                connection.getSyncFrequencyMinutes(),
                connection.getErrorMessage(),
                connection.getLastErrorAt(),
                activeEvents
        );
    }
}
