package com.opencalsync.sync.api.dto;

public record NotificationPreferencesRequest(
        Boolean newBooking,
        Boolean modifiedBooking,
        Boolean cancelledBooking,
        Boolean conflict,
        Boolean syncFailure,
        Boolean connectionChange
) {
}
