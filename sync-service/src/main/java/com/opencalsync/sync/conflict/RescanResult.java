package com.opencalsync.sync.conflict;

/**
 * Outcome of a full property rescan. {@code newlyDetected} counts overlap pairs that had no conflict before the rescan.
 */
public record RescanResult(
        Long propertyId,
        int eventsScanned,
        long conflictsReplaced,
        int overlapConflicts,
        int turnoverConflicts,
        int newlyDetected
) {
    public int totalConflicts() {
        return overlapConflicts + turnoverConflicts;
    }
}
