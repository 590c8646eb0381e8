package com.opencalsync.sync.reconcile;

import com.opencalsync.sync.conflict.RescanResult;

/**
 * Outcome of one connection sync. Counts are zero for skipped runs.
 */
public record ConnectionSyncResult(
        Long connectionId,
        Long propertyId,
        Outcome outcome,
        int created,
        int updated,
        int cancelled,
        int skippedPastEntries,
        int failedBatches,
        int conflictsDetected,
        int newConflicts,
        String errorCode,
        String message
) {
    public static ConnectionSyncResult success(Long connectionId, Long propertyId, int created, int updated,
                                               int cancelled, int skippedPastEntries, int failedBatches) {
        return new ConnectionSyncResult(connectionId, propertyId, Outcome.SUCCESS, created, updated, cancelled,
                skippedPastEntries, failedBatches, 0, 0, null, null);
    }

    public static ConnectionSyncResult failed(Long connectionId, Long propertyId, String errorCode, String message) {
        return new ConnectionSyncResult(connectionId, propertyId, Outcome.FAILED, 0, 0, 0, 0, 0, 0, 0,
                errorCode, message);
    }

    public static ConnectionSyncResult skipped(Long connectionId, Long propertyId, String message) {
        return new ConnectionSyncResult(connectionId, propertyId, Outcome.SKIPPED, 0, 0, 0, 0, 0, 0, 0,
                null, message);
    }

    public ConnectionSyncResult withConflicts(RescanResult rescan) {
        return new ConnectionSyncResult(connectionId, propertyId, outcome, created, updated, cancelled,
                skippedPastEntries, failedBatches, rescan.totalConflicts(), rescan.newlyDetected(),
                errorCode, message);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public enum Outcome {
        SUCCESS,
        FAILED,
        SKIPPED
    }
}
