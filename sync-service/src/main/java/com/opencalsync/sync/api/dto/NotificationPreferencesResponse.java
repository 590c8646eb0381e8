package com.opencalsync.sync.api.dto;

import com.opencalsync.sync.domain.model.NotificationPreferences;

public record NotificationPreferencesResponse(
        Long userId,
        boolean newBooking,
        boolean modifiedBooking,
        boolean cancelledBooking,
        boolean conflict,
        boolean syncFailure,
        boolean connectionChange
) {
    public static NotificationPreferencesResponse from(NotificationPreferences preferences) {
        return new NotificationPreferencesResponse(
                preferences.getUserId(),
                preferences.isNewBooking(),
                preferences.isModifiedBooking(),
                preferences.isCancelledBooking(),
                preferences.isConflict(),
                preferences.isSyncFailure(),
                preferences.isConnectionChange()
        );
    }
}
