package com.opencalsync.sync.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Derived record grouping two or more events that overlap, or that form a same-day turnover.
 * Member ids are non-owning references kept in detection order; that order is the tie-break
 * for automatic resolution.
 */
@Entity
@Table(name = "conflicts", indexes = {
        @Index(name = "idx_conflict_property", columnList = "property_id"),
        @Index(name = "idx_conflict_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conflict {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", nullable = false)
    private Long propertyId;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "conflict_events", joinColumns = @JoinColumn(name = "conflict_id"))
    @OrderColumn(name = "member_order")
    @Column(name = "event_id", nullable = false)
    private List<Long> eventIds = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private ConflictType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 20)
    private ConflictSeverity severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ConflictStatus status;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = ConflictStatus.NEW;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isOpen() {
        return status != ConflictStatus.RESOLVED;
    }

    public void resolve(LocalDateTime now) {
        this.status = ConflictStatus.RESOLVED;
        this.resolvedAt = now;
    }

    public enum ConflictType {
        OVERLAP,
        TURNOVER
    }

    public enum ConflictSeverity {
        HIGH,
        MEDIUM,
        LOW
    }

    public enum ConflictStatus {
        NEW,
        ACKNOWLEDGED,
        RESOLVED
    }
}
