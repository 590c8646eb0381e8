package com.opencalsync.sync.conflict;

import com.opencalsync.sync.domain.model.Conflict;
import com.opencalsync.sync.domain.model.Conflict.ConflictStatus;
import com.opencalsync.sync.domain.model.ResolutionAction;
import com.opencalsync.sync.lock.DistributedLockExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for conflict detection and resolution.
 *
 * Every mutating operation runs under the property's distributed lock and commits inside it, so a
 * rescan and a resolution on the same property never interleave. Reads go straight to the store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConflictEngine {

    private final ConflictProcessor processor;
    private final DistributedLockExecutor lockExecutor;

    public Optional<Conflict> detectForEvent(Long propertyId, Long eventId) {
        return lockExecutor.withPropertyLock(propertyId, () -> processor.detectForEvent(eventId));
    }

    public RescanResult rescanProperty(Long propertyId) {
        RescanResult result = lockExecutor.withPropertyLock(propertyId, () -> processor.rebuild(propertyId));
        log.info("Conflict rescan for property {}: {} events, {} overlap, {} turnover ({} new)",
                propertyId, result.eventsScanned(), result.overlapConflicts(),
                result.turnoverConflicts(), result.newlyDetected());
        return result;
    }

    public ResolutionResult resolveManually(Long propertyId, Long conflictId,
                                            Collection<Long> keepEventIds, ResolutionAction action) {
        return lockExecutor.withPropertyLock(propertyId,
                () -> processor.resolveManually(propertyId, conflictId, keepEventIds, action));
    }

    public ResolutionResult autoResolve(Long propertyId, Long conflictId, ResolutionAction action) {
        return lockExecutor.withPropertyLock(propertyId,
                () -> processor.autoResolve(propertyId, conflictId, action));
    }

    public CleanupResult cleanupAfterRemoval(Long propertyId, Collection<Long> removedEventIds) {
        if (removedEventIds.isEmpty()) {
            return CleanupResult.none();
        }
        return lockExecutor.withPropertyLock(propertyId,
                () -> processor.cleanupAfterRemoval(propertyId, removedEventIds));
    }

    public Conflict acknowledge(Long propertyId, Long conflictId) {
        return lockExecutor.withPropertyLock(propertyId, () -> processor.acknowledge(propertyId, conflictId));
    }

    public List<Conflict> listConflicts(Long propertyId, ConflictStatus status) {
        return processor.list(propertyId, status);
    }

    public Conflict getConflict(Long propertyId, Long conflictId) {
        return processor.get(propertyId, conflictId);
    }
}
