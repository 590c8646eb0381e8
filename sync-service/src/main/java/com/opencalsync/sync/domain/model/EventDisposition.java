package com.opencalsync.sync.domain.model;

/**
 * What happens to a connection's events when the connection is removed or deactivated.
 */
public enum EventDisposition {
    /** Hard delete, or soft-deactivate and cancel when history must be preserved. */
    DELETE,
    /** Soft-deactivate and mark cancelled. */
    DEACTIVATE,
    /** Detach from the connection and relabel as manually owned. */
    CONVERT,
    /** Leave the events untouched, even though they may go stale. */
    KEEP
}
