package com.opencalsync.sync.api.dto;

import com.opencalsync.sync.domain.model.CalendarConnection;

public record ConnectionTestResponse(
        Long connectionId,
        boolean valid,
        int entryCount,
        String message,
        String errorCode,
        CalendarConnection.ConnectionStatus status
) {
}
