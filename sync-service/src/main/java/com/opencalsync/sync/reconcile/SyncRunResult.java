package com.opencalsync.sync.reconcile;

import com.opencalsync.sync.reconcile.ConnectionSyncResult.Outcome;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of a manual sync over one or more connections.
 * Conflict totals come from the last rescan of each property, so a property synced through several
 * connections is counted once.
 */
public record SyncRunResult(
        List<ConnectionSyncResult> results,
        int succeeded,
        int failed,
        int skipped,
        int eventsCreated,
        int eventsUpdated,
        int eventsCancelled,
        int conflictsDetected
) {
    public static SyncRunResult of(List<ConnectionSyncResult> results) {
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        int created = 0;
        int updated = 0;
        int cancelled = 0;
        Map<Long, Integer> conflictsByProperty = new HashMap<>();
        for (ConnectionSyncResult result : results) {
            if (result.outcome() == Outcome.SUCCESS) {
                succeeded++;
            } else if (result.outcome() == Outcome.FAILED) {
                failed++;
            } else {
                skipped++;
            }
            created += result.created();
            updated += result.updated();
            cancelled += result.cancelled();
            if (result.propertyId() != null && result.outcome() != Outcome.SKIPPED) {
                conflictsByProperty.put(result.propertyId(), result.conflictsDetected());
            }
        }
        int conflicts = conflictsByProperty.values().stream().mapToInt(Integer::intValue).sum();
        return new SyncRunResult(List.copyOf(results), succeeded, failed, skipped,
                created, updated, cancelled, conflicts);
    }
}
