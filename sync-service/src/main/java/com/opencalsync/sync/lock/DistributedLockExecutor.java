package com.opencalsync.sync.lock;

import com.opencalsync.common.exception.ServiceUnavailableException;
import com.opencalsync.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Redisson-backed mutual exclusion for the two serialization points of the engine:
 * one lock per connection around a sync or a connection state change, one lock per property around
 * conflict rescans and resolutions.
 *
 * Locks are taken without a lease time so Redisson's watchdog keeps them alive for as long as the holder runs.
 * Callers that write inside the critical section must commit before the lock is released, so the
 * transactional work always lives in a separate bean invoked from the supplied action.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DistributedLockExecutor {

    private final RedissonClient redissonClient;

    @Value("${calendar-sync.lock.property-wait-seconds:15}")
    private long propertyWaitSeconds = 15;

    @Value("${calendar-sync.lock.connection-wait-seconds:60}")
    private long connectionWaitSeconds = 60;

    /**
     * Runs {@code action} while holding the property's conflict lock, waiting for it if needed.
     *
     * @throws ServiceUnavailableException if the lock cannot be obtained in time
     */
    public <T> T withPropertyLock(Long propertyId, Supplier<T> action) {
        return withWaitingLock(Constants.CONFLICT_LOCK_PREFIX + propertyId, propertyWaitSeconds,
                "Conflict data for property " + propertyId + " is busy. Please try again.", action);
    }

    /**
     * Runs {@code action} while holding the connection's sync lock, waiting for a running sync to finish.
     * Used by state changes that must not interleave with a sync of the same connection.
     *
     * @throws ServiceUnavailableException if the sync does not finish in time
     */
    public <T> T withConnectionLock(Long connectionId, Supplier<T> action) {
        return withWaitingLock(Constants.SYNC_LOCK_PREFIX + connectionId, connectionWaitSeconds,
                "Connection " + connectionId + " is being synced. Please try again.", action);
    }

    /**
     * Runs {@code action} only if no other worker is syncing the connection.
     *
     * @return empty when the connection is already in flight elsewhere
     */
    public <T> Optional<T> tryWithConnectionLock(Long connectionId, Supplier<T> action) {
        String key = Constants.SYNC_LOCK_PREFIX + connectionId;
        RLock lock = redissonClient.getLock(key);
        if (!lock.tryLock()) {
            log.info("Connection {} is already being synced, skipping", connectionId);
            return Optional.empty();
        }
        try {
            log.debug("Acquired distributed lock: {}", key);
            return Optional.ofNullable(action.get());
        } finally {
            release(lock, key);
        }
    }

    private <T> T withWaitingLock(String key, long waitSeconds, String busyMessage, Supplier<T> action) {
        RLock lock = redissonClient.getLock(key);
        try {
            boolean acquired = lock.tryLock(waitSeconds, TimeUnit.SECONDS);
            if (!acquired) {
                throw new ServiceUnavailableException(busyMessage);
            }
            log.debug("Acquired distributed lock: {}", key);
            return action.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Interrupted while waiting for lock " + key, e);
        } finally {
            release(lock, key);
        }
    }

    private void release(RLock lock, String key) {
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("Released distributed lock: {}", key);
        }
    }
}
