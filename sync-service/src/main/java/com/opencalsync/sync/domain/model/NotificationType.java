package com.opencalsync.sync.domain.model;

/**
 * Kinds of user-facing notifications the engine emits. Each one can be switched off per user.
 */
public enum NotificationType {
    NEW_BOOKING,
    MODIFIED_BOOKING,
    CANCELLED_BOOKING,
    CONFLICT_DETECTED,
    SYNC_FAILURE,
    CONNECTION_CHANGE
}
