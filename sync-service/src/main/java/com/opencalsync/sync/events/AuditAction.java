package com.opencalsync.sync.events;

public enum AuditAction {
    CREATE,
    UPDATE,
    DELETE,
    ACTIVATE,
    DEACTIVATE
}
