package com.opencalsync.sync.reconcile;

import com.opencalsync.common.exception.BusinessException;
import com.opencalsync.sync.conflict.ConflictEngine;
import com.opencalsync.sync.conflict.RescanResult;
import com.opencalsync.sync.domain.model.CalendarConnection;
import com.opencalsync.sync.domain.model.CalendarConnection.ConnectionStatus;
import com.opencalsync.sync.domain.model.CalendarEvent;
import com.opencalsync.sync.domain.repository.CalendarConnectionRepository;
import com.opencalsync.sync.domain.repository.CalendarEventRepository;
import com.opencalsync.sync.exception.EmptyFeedException;
import com.opencalsync.sync.feed.FeedClient;
import com.opencalsync.sync.feed.RawFeedEntry;
import com.opencalsync.sync.lock.DistributedLockExecutor;
import com.opencalsync.sync.normalize.EventNormalizer;
import com.opencalsync.sync.normalize.NormalizedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Syncs one connection: fetch, normalize, diff against stored events, apply in batches, notify,
 * record connection health, then rescan the property for conflicts.
 *
 * At most one sync per connection runs at a time across all instances. A sync that finds the connection
 * locked returns SKIPPED. Failures are recorded on the connection and returned, never thrown.
 * A feed with entries but none that normalizes is a failure, so stored events are never cancelled by it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CalendarReconciler {

    private static final int ERROR_MESSAGE_LIMIT = 1000;

    private final CalendarConnectionRepository connectionRepository;
    private final CalendarEventRepository eventRepository;
    private final FeedClient feedClient;
    private final EventNormalizer normalizer;
    private final ReconciliationPlanner planner;
    private final EventBatchWriter batchWriter;
    private final SyncNotifier notifier;
    private final ConflictEngine conflictEngine;
    private final DistributedLockExecutor lockExecutor;
    private final Clock clock;

    @Value("${calendar-sync.reconcile.batch-size:100}")
    private int batchSize = 100;

    @Value("${calendar-sync.reconcile.skip-past-events:true}")
    private boolean skipPastEvents = true;

    public ConnectionSyncResult reconcile(Long connectionId, SyncTrigger trigger) {
        return lockExecutor.tryWithConnectionLock(connectionId, () -> reconcileLocked(connectionId, trigger))
                .orElseGet(() -> ConnectionSyncResult.skipped(connectionId, null, "Sync already in progress"));
    }

    private ConnectionSyncResult reconcileLocked(Long connectionId, SyncTrigger trigger) {
        Optional<CalendarConnection> found = connectionRepository.findById(connectionId);
        if (found.isEmpty()) {
            log.warn("Connection {} no longer exists, skipping {} sync", connectionId, trigger);
            return ConnectionSyncResult.skipped(connectionId, null, "Connection not found");
        }
        CalendarConnection connection = found.get();
        LocalDateTime now = LocalDateTime.now(clock);

        if (connection.getStatus() == ConnectionStatus.INACTIVE) {
            return ConnectionSyncResult.skipped(connectionId, connection.getPropertyId(), "Connection is inactive");
        }
        if (trigger == SyncTrigger.SCHEDULED && !connection.isDue(now)) {
            log.debug("Connection {} not due until {}", connectionId, connection.nextSyncAt());
            return ConnectionSyncResult.skipped(connectionId, connection.getPropertyId(), "Not due");
        }

        log.info("Starting {} sync for connection {} ({}, property {})",
                trigger, connectionId, connection.getPlatform(), connection.getPropertyId());

        ConnectionSyncResult result;
        try {
            result = synchronize(connection, now);
            connectionRepository.markSynced(connectionId, now);
            log.info("Synced connection {}: {} created, {} updated, {} cancelled, {} failed batch(es)",
                    connectionId, result.created(), result.updated(), result.cancelled(), result.failedBatches());
        } catch (RuntimeException e) {
            String message = truncate(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            String errorCode = e instanceof BusinessException business ? business.getErrorCode() : "SYNC_FAILED";
            log.error("Sync failed for connection {}: {}", connectionId, message, e);
            connectionRepository.markFailed(connectionId, message, now);
            notifier.notifyFailure(connection, message);
            result = ConnectionSyncResult.failed(connectionId, connection.getPropertyId(), errorCode, message);
        }

        return rescan(connection, result);
    }

    private ConnectionSyncResult synchronize(CalendarConnection connection, LocalDateTime now) {
        List<RawFeedEntry> entries = feedClient.fetch(connection.getFeedUrl());
        List<NormalizedEvent> remote = normalizer.normalize(entries, connection.getPlatform());
        if (remote.isEmpty() && !entries.isEmpty()) {
            throw new EmptyFeedException(connection.getFeedUrl(), entries.size());
        }
        List<CalendarEvent> stored = eventRepository.findByConnectionIdAndActiveTrue(connection.getId());

        LocalDate today = now.toLocalDate();
        ReconciliationPlan plan = planner.plan(remote, stored, today, skipPastEvents);
        if (plan.isEmpty()) {
            log.debug("Connection {} is up to date ({} remote entries)", connection.getId(), remote.size());
            return ConnectionSyncResult.success(connection.getId(), connection.getPropertyId(),
                    0, 0, 0, plan.skippedPastEntries(), 0);
        }

        int[] failedBatches = new int[1];
        List<CalendarEvent> created = applyInBatches(connection, "create", plan.creates(),
                batch -> batchWriter.insert(connection, batch), failedBatches);
        List<CalendarEvent> updated = applyInBatches(connection, "update", plan.updates(),
                batch -> batchWriter.update(batch, now), failedBatches);
        List<CalendarEvent> cancelled = applyInBatches(connection, "cancel", plan.cancels(),
                batch -> batchWriter.cancel(batch, now), failedBatches);

        notifier.notifyChanges(connection, created, updated.size(), cancelled.size());

        return ConnectionSyncResult.success(connection.getId(), connection.getPropertyId(),
                created.size(), updated.size(), cancelled.size(), plan.skippedPastEntries(), failedBatches[0]);
    }

    private <T> List<CalendarEvent> applyInBatches(CalendarConnection connection, String operation, List<T> items,
                                                   Function<List<T>, List<CalendarEvent>> writer,
                                                   int[] failedBatches) {
        List<CalendarEvent> applied = new ArrayList<>();
        for (int from = 0; from < items.size(); from += batchSize) {
            List<T> batch = items.subList(from, Math.min(from + batchSize, items.size()));
            try {
                applied.addAll(writer.apply(batch));
            } catch (RuntimeException e) {
                failedBatches[0]++;
                log.error("Failed to {} batch of {} event(s) for connection {}, continuing",
                        operation, batch.size(), connection.getId(), e);
            }
        }
        return applied;
    }

    private ConnectionSyncResult rescan(CalendarConnection connection, ConnectionSyncResult result) {
        try {
            RescanResult rescan = conflictEngine.rescanProperty(connection.getPropertyId());
            notifier.notifyConflicts(connection, rescan.newlyDetected());
            return result.withConflicts(rescan);
        } catch (RuntimeException e) {
            log.error("Conflict rescan failed for property {} after syncing connection {}",
                    connection.getPropertyId(), connection.getId(), e);
            return result;
        }
    }

    private static String truncate(String message) {
        return message.length() <= ERROR_MESSAGE_LIMIT ? message : message.substring(0, ERROR_MESSAGE_LIMIT);
    }
}
