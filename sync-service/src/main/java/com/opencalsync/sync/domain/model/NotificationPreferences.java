package com.opencalsync.sync.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Per-user switches deciding which sync notifications are emitted. A user with no row gets {@link #defaults(Long)}.
 */
@Entity
@Table(name = "notification_preferences", uniqueConstraints = {
        @UniqueConstraint(name = "uk_notification_preferences_user", columnNames = "user_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPreferences {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "new_booking", nullable = false)
    private boolean newBooking;

    @Column(name = "modified_booking", nullable = false)
    private boolean modifiedBooking;

    @Column(name = "cancelled_booking", nullable = false)
    private boolean cancelledBooking;

    @Column(name = "conflict", nullable = false)
    private boolean conflict;

    @Column(name = "sync_failure", nullable = false)
    private boolean syncFailure;

    @Column(name = "connection_change", nullable = false)
    private boolean connectionChange;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }

    public static NotificationPreferences defaults(Long userId) {
        return NotificationPreferences.builder()
                .userId(userId)
                .newBooking(true)
                .modifiedBooking(true)
                .cancelledBooking(true)
                .conflict(true)
                .syncFailure(true)
                .connectionChange(true)
                .build();
    }

    public boolean allows(NotificationType type) {
        switch (type) {
            case NEW_BOOKING:
                return newBooking;
            case MODIFIED_BOOKING:
                return modifiedBooking;
            case CANCELLED_BOOKING:
                return cancelledBooking;
            case CONFLICT_DETECTED:
                return conflict;
            case SYNC_FAILURE:
                return syncFailure;
            default:
                return connectionChange;
        }
    }
}
