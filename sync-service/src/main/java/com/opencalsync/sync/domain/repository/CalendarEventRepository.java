package com.opencalsync.sync.domain.repository;

import com.opencalsync.sync.domain.model.CalendarEvent;
import com.opencalsync.sync.domain.model.CalendarEvent.EventStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Repository for {@link CalendarEvent}.
 */
public interface CalendarEventRepository extends JpaRepository<CalendarEvent, Long> {

    List<CalendarEvent> findByConnectionIdAndActiveTrue(Long connectionId);

    List<CalendarEvent> findByConnectionId(Long connectionId);

    /**
     * Active events in the given status, ordered by start date then id so pairwise scans are deterministic.
     */
    List<CalendarEvent> findByPropertyIdAndActiveTrueAndStatusOrderByStartDateAscIdAsc(
            Long propertyId, EventStatus status);

    List<CalendarEvent> findByIdInAndActiveTrue(Collection<Long> ids);

    long countByPropertyIdAndActiveTrue(Long propertyId);

    long countByConnectionIdAndActiveTrue(Long connectionId);

    /**
     * Active confirmed events on the property whose half-open range intersects {@code [start, end)}.
     */
    @Query("""
           SELECT e FROM CalendarEvent e
           WHERE e.propertyId = :propertyId
             AND e.active = true
             AND e.status = com.opencalsync.sync.domain.model.CalendarEvent.EventStatus.CONFIRMED
             AND e.startDate < :end
             AND e.endDate > :start
           ORDER BY e.startDate ASC, e.id ASC
           """)
    List<CalendarEvent> findBlockingOverlaps(@Param("propertyId") Long propertyId,
                                             @Param("start") LocalDate start,
                                             @Param("end") LocalDate end);

    /**
     * Active events on the property touching the window {@code [from, to)}, regardless of status.
     */
    @Query("""
           SELECT e FROM CalendarEvent e
           WHERE e.propertyId = :propertyId
             AND e.active = true
             AND e.startDate < :to
             AND e.endDate > :from
           ORDER BY e.startDate ASC, e.id ASC
           """)
    List<CalendarEvent> findActiveInWindow(@Param("propertyId") Long propertyId,
                                           @Param("from") LocalDate from,
                                           @Param("to") LocalDate to);
}
