package com.opencalsync.sync.domain.model;

import com.opencalsync.common.util.Constants;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A registered external calendar feed for one property on one platform.
 *
 * Health moves ACTIVE &lt;-&gt; ERROR with sync outcomes; INACTIVE is only entered and left
 * through explicit deactivate/reactivate calls.
 */
@Entity
@Table(name = "calendar_connections", indexes = {
        @Index(name = "idx_connection_property", columnList = "property_id"),
        @Index(name = "idx_connection_user", columnList = "user_id"),
        @Index(name = "idx_connection_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarConnection {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", nullable = false)
    private Long propertyId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "platform", nullable = false, length = 20)
    private Platform platform;

    @Column(name = "feed_url", nullable = false, length = 2048)
    private String feedUrl;

    @Column(name = "sync_frequency_minutes", nullable = false)
    private Integer syncFrequencyMinutes;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ConnectionStatus status;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "last_synced_at")
    private LocalDateTime lastSyncedAt;

    @Column(name = "last_error_at")
    private LocalDateTime lastErrorAt;

    @Column(name = "sync_count", nullable = false)
    private Integer syncCount;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = ConnectionStatus.ACTIVE;
        }
        if (syncFrequencyMinutes == null) {
            syncFrequencyMinutes = Constants.DEFAULT_SYNC_FREQUENCY_MINUTES;
        }
        if (syncCount == null) {
            syncCount = 0;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * A connection that never synced is always due; otherwise it is due once its own interval has elapsed.
     */
    public boolean isDue(LocalDateTime now) {
        return lastSyncedAt == null || !nextSyncAt().isAfter(now);
    }

    public LocalDateTime nextSyncAt() {
        return lastSyncedAt == null ? null : lastSyncedAt.plusMinutes(syncFrequencyMinutes);
    }

    public boolean isSchedulable() {
        return status == ConnectionStatus.ACTIVE || status == ConnectionStatus.ERROR;
    }

    public void markSynced(LocalDateTime now) {
        this.lastSyncedAt = now;
        this.status = ConnectionStatus.ACTIVE;
        this.errorMessage = null;
        this.syncCount = syncCount == null ? 1 : syncCount + 1;
    }

    public void markFailed(String message, LocalDateTime now) {
        this.status = ConnectionStatus.ERROR;
        this.errorMessage = truncate(message);
        this.lastErrorAt = now;
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 1000) {
            return message;
        }
        return message.substring(0, 1000);
    }

    public enum ConnectionStatus {
        ACTIVE,
        ERROR,
        INACTIVE
    }
}
