package com.opencalsync.sync.lifecycle;

import com.opencalsync.common.exception.ResourceNotFoundException;
import com.opencalsync.common.exception.StateConflictException;
import com.opencalsync.common.exception.ValidationException;
import com.opencalsync.common.util.Constants;
import com.opencalsync.sync.api.dto.RegisterConnectionRequest;
import com.opencalsync.sync.api.dto.UpdateConnectionRequest;
import com.opencalsync.sync.client.PropertyDirectory;
import com.opencalsync.sync.conflict.CleanupResult;
import com.opencalsync.sync.conflict.ConflictEngine;
import com.opencalsync.sync.domain.model.CalendarConnection;
import com.opencalsync.sync.domain.model.CalendarConnection.ConnectionStatus;
import com.opencalsync.sync.domain.model.EventDisposition;
import com.opencalsync.sync.domain.model.NotificationType;
import com.opencalsync.sync.domain.model.Platform;
import com.opencalsync.sync.domain.repository.CalendarConnectionRepository;
import com.opencalsync.sync.domain.service.NotificationPreferenceService;
import com.opencalsync.sync.events.AuditAction;
import com.opencalsync.sync.events.AuditSink;
import com.opencalsync.sync.events.NotificationSeverity;
import com.opencalsync.sync.events.NotificationSink;
import com.opencalsync.sync.feed.FeedClient;
import com.opencalsync.sync.feed.FeedValidationResult;
import com.opencalsync.sync.lock.DistributedLockExecutor;
import com.opencalsync.sync.reconcile.ConnectionSyncResult;
import com.opencalsync.sync.reconcile.SyncTrigger;
import com.opencalsync.sync.schedule.SyncDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Coordinates connection state changes with their effects on events and conflicts.
 *
 * Flow for deactivation and removal:
 * 1. Persist the connection change
 * 2. Apply the event disposition (one transaction)
 *    Steps 1 and 2 run under the connection's sync lock, so no sync of that connection overlaps them.
 * 3. Repair conflicts that referenced removed events
 * 4. Notify the owner once
 * 5. Record one audit entry
 *
 * Each step commits on its own; a later failure never rolls back an earlier step.
 * Notification and audit failures are logged and swallowed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionLifecycleOrchestrator {

    private static final String ENTITY_TYPE = "CalendarConnection";

    private final CalendarConnectionRepository connectionRepository;
    private final PropertyDirectory propertyDirectory;
    private final FeedClient feedClient;
    private final EventDispositionApplier dispositionApplier;
    private final ConflictEngine conflictEngine;
    private final SyncDispatcher dispatcher;
    private final NotificationSink notificationSink;
    private final AuditSink auditSink;
    private final NotificationPreferenceService preferenceService;
    private final DistributedLockExecutor lockExecutor;
    private final Clock clock;

    @Value("${calendar-sync.lifecycle.initial-sync:true}")
    private boolean initialSync = true;

    public List<CalendarConnection> list(Long userId, Long propertyId) {
        propertyDirectory.requireOwner(propertyId, userId);
        return connectionRepository.findByPropertyId(propertyId);
    }

    public CalendarConnection get(Long userId, Long propertyId, Long connectionId) {
        return load(userId, propertyId, connectionId);
    }

    /**
     * Registers a feed after validating it, then runs the first sync right away.
     * A failing first sync does not undo the registration; it shows up in the connection's health.
     */
    public RegistrationResult register(Long userId, Long propertyId, RegisterConnectionRequest request) {
        propertyDirectory.requireOwner(propertyId, userId);
        int frequency = request.syncFrequencyMinutes() == null
                ? Constants.DEFAULT_SYNC_FREQUENCY_MINUTES : request.syncFrequencyMinutes();
        validateFrequency(frequency);
        if (request.platform() == Platform.MANUAL) {
            throw new ValidationException("Manual events cannot be registered as a feed", "INVALID_PLATFORM");
        }
        ensureNoLiveConnection(propertyId, request.platform(), null);
        validateFeed(request.feedUrl());

        CalendarConnection connection = connectionRepository.save(CalendarConnection.builder()
                .propertyId(propertyId)
                .userId(userId)
                .platform(request.platform())
                .feedUrl(request.feedUrl().trim())
                .syncFrequencyMinutes(frequency)
                .status(ConnectionStatus.ACTIVE)
                .build());
        log.info("Registered {} connection {} for property {}", connection.getPlatform(), connection.getId(), propertyId);

        ConnectionSyncResult firstSync = null;
        if (initialSync) {
            firstSync = dispatcher.runAndWait(List.of(connection), SyncTrigger.INITIAL).get(0);
            connection = connectionRepository.findById(connection.getId()).orElse(connection);
        }

        audit(AuditAction.CREATE, connection, userId, details(
                "platform", connection.getPlatform(),
                "syncFrequencyMinutes", frequency,
                "initialSync", firstSync == null ? "DISABLED" : firstSync.outcome()));
        notifyOwner(connection, "Calendar connected",
                connection.getPlatform().getDisplayName() + " calendar connected", NotificationSeverity.INFO);
        return new RegistrationResult(connection, firstSync);
    }

    /**
     * Changes the feed URL and/or frequency. A new URL is validated before anything is saved.
     */
    public CalendarConnection update(Long userId, Long propertyId, Long connectionId, UpdateConnectionRequest request) {
        CalendarConnection connection = load(userId, propertyId, connectionId);
        Map<String, Object> changes = new LinkedHashMap<>();

        if (request.feedUrl() != null && !request.feedUrl().isBlank()
                && !request.feedUrl().trim().equals(connection.getFeedUrl())) {
            validateFeed(request.feedUrl());
            connection.setFeedUrl(request.feedUrl().trim());
            changes.put("feedUrl", "changed");
        }
        if (request.syncFrequencyMinutes() != null
                && !request.syncFrequencyMinutes().equals(connection.getSyncFrequencyMinutes())) {
            validateFrequency(request.syncFrequencyMinutes());
            changes.put("syncFrequencyMinutes", request.syncFrequencyMinutes());
            connection.setSyncFrequencyMinutes(request.syncFrequencyMinutes());
        }
        if (changes.isEmpty()) {
            return connection;
        }

        connection = connectionRepository.save(connection);
        log.info("Updated connection {}: {}", connectionId, changes.keySet());
        audit(AuditAction.UPDATE, connection, userId, changes);
        notifyOwner(connection, "Calendar connection updated",
                connection.getPlatform().getDisplayName() + " connection settings were changed", NotificationSeverity.INFO);
        return connection;
    }

    /**
     * Validates the feed and records the outcome as connection health. Inactive connections stay inactive.
     */
    public ConnectionCheck test(Long userId, Long propertyId, Long connectionId) {
        CalendarConnection connection = load(userId, propertyId, connectionId);
        FeedValidationResult validation = feedClient.validate(connection.getFeedUrl());
        LocalDateTime now = LocalDateTime.now(clock);

        if (connection.getStatus() != ConnectionStatus.INACTIVE) {
            if (validation.valid()) {
                connection.setStatus(ConnectionStatus.ACTIVE);
                connection.setErrorMessage(null);
            } else {
                connection.markFailed(validation.message(), now);
            }
            connection = connectionRepository.save(connection);
        }
        log.info("Tested connection {}: valid={}, entries={}", connectionId, validation.valid(), validation.entryCount());
        return new ConnectionCheck(connection, validation);
    }

    public RemovalResult deactivate(Long userId, Long propertyId, Long connectionId,
                                    EventDisposition disposition, boolean preserveHistory) {
        load(userId, propertyId, connectionId);
        EventDisposition policy = disposition == null ? EventDisposition.KEEP : disposition;
        Transition transition = lockExecutor.withConnectionLock(connectionId, () -> {
            CalendarConnection connection = reload(propertyId, connectionId);
            if (connection.getStatus() == ConnectionStatus.INACTIVE) {
                throw new StateConflictException("Connection " + connectionId + " is already inactive",
                        "CONNECTION_ALREADY_INACTIVE");
            }
            connection.setStatus(ConnectionStatus.INACTIVE);
            CalendarConnection saved = connectionRepository.save(connection);
            log.info("Deactivated connection {} on property {}", connectionId, propertyId);
            return new Transition(saved, applyDisposition(saved, policy, preserveHistory));
        });
        return afterStateChange(transition, userId, AuditAction.DEACTIVATE, "deactivated", policy, preserveHistory);
    }

    public CalendarConnection reactivate(Long userId, Long propertyId, Long connectionId) {
        CalendarConnection connection = load(userId, propertyId, connectionId);
        if (connection.getStatus() != ConnectionStatus.INACTIVE) {
            throw new StateConflictException("Connection " + connectionId + " is not inactive",
                    "CONNECTION_NOT_INACTIVE");
        }
        ensureNoLiveConnection(propertyId, connection.getPlatform(), connectionId);
        connection.setStatus(ConnectionStatus.ACTIVE);
        connection.setErrorMessage(null);
        connection = connectionRepository.save(connection);
        log.info("Reactivated connection {} on property {}", connectionId, propertyId);

        audit(AuditAction.ACTIVATE, connection, userId, details("platform", connection.getPlatform()));
        notifyOwner(connection, "Calendar connection reactivated",
                connection.getPlatform().getDisplayName() + " calendar will sync again", NotificationSeverity.INFO);
        return connection;
    }

    /**
     * Deletes the connection. Its events follow {@code disposition}; KEEP leaves them pointing at a
     * connection that no longer exists.
     */
    public RemovalResult remove(Long userId, Long propertyId, Long connectionId,
                                EventDisposition disposition, boolean preserveHistory) {
        load(userId, propertyId, connectionId);
        EventDisposition policy = disposition == null ? EventDisposition.KEEP : disposition;
        Transition transition = lockExecutor.withConnectionLock(connectionId, () -> {
            CalendarConnection connection = reload(propertyId, connectionId);
            connectionRepository.delete(connection);
            log.info("Deleted connection {} on property {}", connectionId, propertyId);
            return new Transition(connection, applyDisposition(connection, policy, preserveHistory));
        });
        return afterStateChange(transition, userId, AuditAction.DELETE, "removed", policy, preserveHistory);
    }

    private DispositionResult applyDisposition(CalendarConnection connection, EventDisposition policy,
                                               boolean preserveHistory) {
        return dispositionApplier.apply(connection.getId(), policy, preserveHistory, LocalDateTime.now(clock));
    }

    private RemovalResult afterStateChange(Transition transition, Long userId, AuditAction action, String verb,
                                           EventDisposition policy, boolean preserveHistory) {
        CalendarConnection connection = transition.connection();
        DispositionResult applied = transition.applied();
        CleanupResult cleanup = conflictEngine.cleanupAfterRemoval(
                connection.getPropertyId(), applied.removedEventIds());

        notifyOwner(connection, "Calendar connection " + verb,
                String.format("%s calendar %s; %d event(s) %s, %d conflict(s) resolved",
                        connection.getPlatform().getDisplayName(), verb, applied.affectedEventIds().size(),
                        describe(policy, preserveHistory), cleanup.resolved()),
                NotificationSeverity.WARNING);
        audit(action, connection, userId, details(
                "platform", connection.getPlatform(),
                "eventAction", policy,
                "preserveHistory", preserveHistory,
                "eventsAffected", applied.affectedEventIds().size(),
                "conflictsResolved", cleanup.resolved(),
                "conflictsRecalculated", cleanup.recalculated()));
        return new RemovalResult(connection, applied, cleanup);
    }

    private CalendarConnection load(Long userId, Long propertyId, Long connectionId) {
        propertyDirectory.requireOwner(propertyId, userId);
        return reload(propertyId, connectionId);
    }

    private CalendarConnection reload(Long propertyId, Long connectionId) {
        return connectionRepository.findById(connectionId)
                .filter(connection -> Objects.equals(connection.getPropertyId(), propertyId))
                .orElseThrow(() -> new ResourceNotFoundException(ENTITY_TYPE, connectionId));
    }

    private void ensureNoLiveConnection(Long propertyId, Platform platform, Long exceptId) {
        boolean taken = connectionRepository
                .findByPropertyIdAndPlatformAndStatusNot(propertyId, platform, ConnectionStatus.INACTIVE).stream()
                .anyMatch(existing -> !existing.getId().equals(exceptId));
        if (taken) {
            throw new ValidationException("Property " + propertyId + " already has an active "
                    + platform.getDisplayName() + " connection", "DUPLICATE_PLATFORM");
        }
    }

    private void validateFeed(String url) {
        FeedValidationResult validation = feedClient.validate(url);
        if (!validation.valid()) {
            throw new ValidationException("Invalid iCal URL: " + validation.message(), "INVALID_FEED_URL");
        }
    }

    private static void validateFrequency(int frequency) {
        if (frequency < Constants.MIN_SYNC_FREQUENCY_MINUTES) {
            throw new ValidationException("Sync frequency must be at least "
                    + Constants.MIN_SYNC_FREQUENCY_MINUTES + " minutes", "INVALID_SYNC_FREQUENCY");
        }
    }

    private void notifyOwner(CalendarConnection connection, String title, String message, NotificationSeverity severity) {
        try {
            if (!preferenceService.forUser(connection.getUserId()).allows(NotificationType.CONNECTION_CHANGE)) {
                return;
            }
            notificationSink.send(connection.getPropertyId(), connection.getUserId(),
                    NotificationType.CONNECTION_CHANGE, title, message, severity);
        } catch (RuntimeException e) {
            log.warn("Failed to notify owner about connection {} (non-fatal)", connection.getId(), e);
        }
    }

    private void audit(AuditAction action, CalendarConnection connection, Long actorId, Map<String, Object> details) {
        try {
            auditSink.record(action, ENTITY_TYPE, connection.getId(), actorId, connection.getPropertyId(), details);
        } catch (RuntimeException e) {
            log.warn("Failed to record audit entry {} for connection {} (non-fatal)", action, connection.getId(), e);
        }
    }

    private static String describe(EventDisposition disposition, boolean preserveHistory) {
        switch (disposition) {
            case DELETE:
                return preserveHistory ? "deactivated" : "deleted";
            case DEACTIVATE:
                return "deactivated";
            case CONVERT:
                return "converted to manual";
            default:
                return "kept";
        }
    }

    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return details;
    }

    private record Transition(CalendarConnection connection, DispositionResult applied) {
    }
}
