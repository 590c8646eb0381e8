package com.opencalsync.sync.domain.repository;

import com.opencalsync.sync.domain.model.CalendarConnection;
import com.opencalsync.sync.domain.model.CalendarConnection.ConnectionStatus;
import com.opencalsync.sync.domain.model.Platform;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface CalendarConnectionRepository extends JpaRepository<CalendarConnection, Long> {

    List<CalendarConnection> findByPropertyId(Long propertyId);

    List<CalendarConnection> findByUserId(Long userId);

    List<CalendarConnection> findByStatusIn(Collection<ConnectionStatus> statuses);

    /**
     * Used for the one-live-connection-per-platform rule: pass INACTIVE to ignore retired connections.
     */
    List<CalendarConnection> findByPropertyIdAndPlatformAndStatusNot(
            Long propertyId, Platform platform, ConnectionStatus status);

    /**
     * Records a successful sync. Guarded on status so a connection deactivated while its sync
     * was running stays INACTIVE.
     *
     * @return 1 if the connection was updated, 0 if it is gone or inactive
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE CalendarConnection c
           SET c.lastSyncedAt = :now,
               c.status = com.opencalsync.sync.domain.model.CalendarConnection.ConnectionStatus.ACTIVE,
               c.errorMessage = NULL,
               c.syncCount = c.syncCount + 1,
               c.updatedAt = :now
           WHERE c.id = :id
             AND c.status <> com.opencalsync.sync.domain.model.CalendarConnection.ConnectionStatus.INACTIVE
           """)
    int markSynced(@Param("id") Long id, @Param("now") LocalDateTime now);

    /**
     * Records a failed sync, with the same INACTIVE guard as {@link #markSynced}.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE CalendarConnection c
           SET c.status = com.opencalsync.sync.domain.model.CalendarConnection.ConnectionStatus.ERROR,
               c.errorMessage = :message,
               c.lastErrorAt = :now,
               c.updatedAt = :now
           WHERE c.id = :id
             AND c.status <> com.opencalsync.sync.domain.model.CalendarConnection.ConnectionStatus.INACTIVE
           """)
    int markFailed(@Param("id") Long id, @Param("message") String message, @Param("now") LocalDateTime now);
}
