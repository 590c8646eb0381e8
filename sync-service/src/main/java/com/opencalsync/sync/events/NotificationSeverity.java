package com.opencalsync.sync.events;

public enum NotificationSeverity {
    INFO,
    WARNING,
    CRITICAL
}
