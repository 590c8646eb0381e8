package com.opencalsync.sync.domain.service;

import com.opencalsync.sync.client.PropertyDirectory;
import com.opencalsync.sync.conflict.ConflictEngine;
import com.opencalsync.sync.conflict.RescanResult;
import com.opencalsync.sync.conflict.ResolutionResult;
import com.opencalsync.sync.domain.model.Conflict;
import com.opencalsync.sync.domain.model.Conflict.ConflictStatus;
import com.opencalsync.sync.domain.model.ResolutionAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Owner-facing conflict operations. Checks property ownership, then delegates to {@link ConflictEngine}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConflictService {

    private final ConflictEngine conflictEngine;
    private final PropertyDirectory propertyDirectory;

    public List<Conflict> listConflicts(Long userId, Long propertyId, ConflictStatus status) {
        propertyDirectory.requireOwner(propertyId, userId);
        return conflictEngine.listConflicts(propertyId, status);
    }

    public Conflict getConflict(Long userId, Long propertyId, Long conflictId) {
        propertyDirectory.requireOwner(propertyId, userId);
        return conflictEngine.getConflict(propertyId, conflictId);
    }

    public RescanResult rescan(Long userId, Long propertyId) {
        propertyDirectory.requireOwner(propertyId, userId);
        log.info("Conflict rescan of property {} requested by user {}", propertyId, userId);
        return conflictEngine.rescanProperty(propertyId);
    }

    public ResolutionResult resolve(Long userId, Long propertyId, Long conflictId,
                                    List<Long> keepEventIds, ResolutionAction action) {
        propertyDirectory.requireOwner(propertyId, userId);
        return conflictEngine.resolveManually(propertyId, conflictId, keepEventIds, action);
    }

    public ResolutionResult autoResolve(Long userId, Long propertyId, Long conflictId, ResolutionAction action) {
        propertyDirectory.requireOwner(propertyId, userId);
        return conflictEngine.autoResolve(propertyId, conflictId, action);
    }

    public Conflict acknowledge(Long userId, Long propertyId, Long conflictId) {
        propertyDirectory.requireOwner(propertyId, userId);
        return conflictEngine.acknowledge(propertyId, conflictId);
    }
}
