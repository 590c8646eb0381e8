package com.opencalsync.sync.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * A booking, block or maintenance window on a property's calendar.
 * Dates are half-open: the event occupies {@code [startDate, endDate)}.
 * Feed-owned events carry the connection id and the feed UID; manual events carry neither.
 */
@Entity
@Table(name = "calendar_events", indexes = {
        @Index(name = "idx_event_property_dates", columnList = "property_id,start_date,end_date"),
        @Index(name = "idx_event_connection_uid", columnList = "connection_id,external_uid"),
        @Index(name = "idx_event_active", columnList = "is_active")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", nullable = false)
    private Long propertyId;

    @Column(name = "connection_id")
    private Long connectionId;

    @Column(name = "external_uid", length = 512)
    private String externalUid;

    @Enumerated(EnumType.STRING)
    @Column(name = "platform", nullable = false, length = 20)
    private Platform platform;

    @Column(name = "summary", length = 500)
    private String summary;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 20)
    private EventCategory category;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private EventStatus status;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = EventStatus.CONFIRMED;
        }
        if (category == null) {
            category = EventCategory.BOOKING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Only active, confirmed events take part in conflict detection.
     */
    public boolean isBlocking() {
        return active && status == EventStatus.CONFIRMED;
    }

    public long durationDays() {
        return ChronoUnit.DAYS.between(startDate, endDate);
    }

    public void cancel(LocalDateTime now) {
        this.status = EventStatus.CANCELLED;
        this.cancelledAt = now;
    }

    /** Soft-deactivate and cancel: the row stays but no longer counts as active. */
    public void retire(LocalDateTime now) {
        cancel(now);
        this.active = false;
    }

    /** Detaches the event from its feed so later syncs can never match it again. */
    public void convertToManual() {
        this.connectionId = null;
        this.externalUid = null;
        this.platform = Platform.MANUAL;
    }

    public enum EventCategory {
        BOOKING,
        BLOCKED,
        MAINTENANCE
    }

    public enum EventStatus {
        CONFIRMED,
        TENTATIVE,
        CANCELLED;

        /**
         * Canonicalizes a free-text status from a feed. Unknown or missing values are treated as confirmed.
         */
        public static EventStatus fromFeedValue(String raw) {
            if (raw == null || raw.isBlank()) {
                return CONFIRMED;
            }
            String value = raw.toLowerCase(Locale.ROOT);
            if (value.contains("confirm")) {
                return CONFIRMED;
            }
            if (value.contains("cancel")) {
                return CANCELLED;
            }
            if (value.contains("tentative")) {
                return TENTATIVE;
            }
            return CONFIRMED;
        }
    }
}
