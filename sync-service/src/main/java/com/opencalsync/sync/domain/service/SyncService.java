package com.opencalsync.sync.domain.service;

import com.opencalsync.common.exception.ResourceNotFoundException;
import com.opencalsync.sync.client.PropertyDirectory;
import com.opencalsync.sync.domain.model.CalendarConnection;
import com.opencalsync.sync.domain.repository.CalendarConnectionRepository;
import com.opencalsync.sync.reconcile.SyncRunResult;
import com.opencalsync.sync.reconcile.SyncTrigger;
import com.opencalsync.sync.schedule.SyncDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Manual sync requests. Runs the same per-connection routine as the scheduler, on the same pool,
 * and waits for the results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncService {

    private final CalendarConnectionRepository connectionRepository;
    private final PropertyDirectory propertyDirectory;
    private final SyncDispatcher dispatcher;

    public SyncRunResult syncConnection(Long userId, Long propertyId, Long connectionId) {
        propertyDirectory.requireOwner(propertyId, userId);
        CalendarConnection connection = connectionRepository.findById(connectionId)
                .filter(found -> Objects.equals(found.getPropertyId(), propertyId))
                .orElseThrow(() -> new ResourceNotFoundException("CalendarConnection", connectionId));
        log.info("Manual sync of connection {} requested by user {}", connectionId, userId);
        return run(List.of(connection));
    }

    public SyncRunResult syncProperty(Long userId, Long propertyId) {
        propertyDirectory.requireOwner(propertyId, userId);
        List<CalendarConnection> connections = schedulable(connectionRepository.findByPropertyId(propertyId));
        log.info("Manual sync of property {} requested by user {}: {} connection(s)",
                propertyId, userId, connections.size());
        return run(connections);
    }

    /**
     * Syncs every live connection the user registered, across all of their properties.
     */
    public SyncRunResult syncAllForUser(Long userId) {
        List<CalendarConnection> connections = schedulable(connectionRepository.findByUserId(userId));
        log.info("Manual sync of all connections requested by user {}: {} connection(s)", userId, connections.size());
        return run(connections);
    }

    private SyncRunResult run(List<CalendarConnection> connections) {
        SyncRunResult result = SyncRunResult.of(dispatcher.runAndWait(connections, SyncTrigger.MANUAL));
        log.info("Manual sync finished: {} succeeded, {} failed, {} skipped",
                result.succeeded(), result.failed(), result.skipped());
        return result;
    }

    private static List<CalendarConnection> schedulable(List<CalendarConnection> connections) {
        return connections.stream()
                .filter(CalendarConnection::isSchedulable)
                .collect(Collectors.toList());
    }
}
