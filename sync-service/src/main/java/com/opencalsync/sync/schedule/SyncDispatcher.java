package com.opencalsync.sync.schedule;

import com.opencalsync.sync.domain.model.CalendarConnection;
import com.opencalsync.sync.reconcile.CalendarReconciler;
import com.opencalsync.sync.reconcile.ConnectionSyncResult;
import com.opencalsync.sync.reconcile.SyncTrigger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Runs connection syncs on the bounded {@code syncExecutor} pool.
 *
 * Within this instance a connection is submitted at most once until its sync finishes; across instances the
 * reconciler's connection lock does the same job.
 */
@Slf4j
@Component
public class SyncDispatcher {

    private final CalendarReconciler reconciler;
    private final ThreadPoolTaskExecutor syncExecutor;
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public SyncDispatcher(CalendarReconciler reconciler,
                          @Qualifier("syncExecutor") ThreadPoolTaskExecutor syncExecutor) {
        this.reconciler = reconciler;
        this.syncExecutor = syncExecutor;
    }

    /**
     * Queues scheduled syncs and returns immediately.
     *
     * @return number of connections actually queued
     */
    public int submitAll(List<CalendarConnection> connections) {
        int queued = 0;
        for (CalendarConnection connection : connections) {
            Long connectionId = connection.getId();
            if (!inFlight.add(connectionId)) {
                log.debug("Connection {} already queued, skipping", connectionId);
                continue;
            }
            try {
                syncExecutor.execute(() -> {
                    try {
                        runSafely(connectionId, SyncTrigger.SCHEDULED);
                    } finally {
                        inFlight.remove(connectionId);
                    }
                });
                queued++;
            } catch (TaskRejectedException e) {
                inFlight.remove(connectionId);
                log.warn("Sync pool saturated, connection {} left for the next trigger", connectionId);
            }
        }
        return queued;
    }

    /**
     * Runs the given connections on the pool and waits for all of them. Used by manual sync requests.
     */
    public List<ConnectionSyncResult> runAndWait(List<CalendarConnection> connections, SyncTrigger trigger) {
        List<CompletableFuture<ConnectionSyncResult>> futures = new ArrayList<>();
        for (CalendarConnection connection : connections) {
            Long connectionId = connection.getId();
            CompletableFuture<ConnectionSyncResult> future;
            try {
                future = CompletableFuture.supplyAsync(() -> runSafely(connectionId, trigger), syncExecutor);
            } catch (TaskRejectedException e) {
                log.warn("Sync pool saturated, connection {} not synced", connectionId);
                future = CompletableFuture.completedFuture(ConnectionSyncResult.skipped(
                        connectionId, connection.getPropertyId(), "Sync capacity exhausted, try again later"));
            }
            futures.add(future);
        }
        return futures.stream()
                .map(this::join)
                .collect(Collectors.toList());
    }

    private ConnectionSyncResult join(CompletableFuture<ConnectionSyncResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Sync task failed unexpectedly", e.getCause());
        }
    }

    ConnectionSyncResult runSafely(Long connectionId, SyncTrigger trigger) {
        try {
            return reconciler.reconcile(connectionId, trigger);
        } catch (Exception e) {
            log.error("Unexpected error syncing connection {}", connectionId, e);
            return ConnectionSyncResult.failed(connectionId, null, "SYNC_FAILED", e.getMessage());
        }
    }
}
