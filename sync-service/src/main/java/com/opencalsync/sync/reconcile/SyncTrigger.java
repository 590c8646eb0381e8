package com.opencalsync.sync.reconcile;

/**
 * Why a sync runs. Scheduled runs re-check that the connection is due once the connection lock is held.
 */
public enum SyncTrigger {
    SCHEDULED,
    MANUAL,
    INITIAL
}
