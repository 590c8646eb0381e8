package com.opencalsync.sync.domain.repository;

import com.opencalsync.sync.domain.model.Conflict;
import com.opencalsync.sync.domain.model.Conflict.ConflictStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ConflictRepository extends JpaRepository<Conflict, Long> {

    List<Conflict> findByPropertyIdOrderByStartDateAsc(Long propertyId);

    List<Conflict> findByPropertyIdAndStatusOrderByStartDateAsc(Long propertyId, ConflictStatus status);

    List<Conflict> findByPropertyIdAndStatusNot(Long propertyId, ConflictStatus status);

    Optional<Conflict> findByIdAndPropertyId(Long id, Long propertyId);

    long countByPropertyIdAndStatusNot(Long propertyId, ConflictStatus status);

    /**
     * Unresolved conflicts on the property with at least one member in {@code eventIds}.
     */
    @Query("""
           SELECT DISTINCT c FROM Conflict c JOIN c.eventIds member
           WHERE c.propertyId = :propertyId
             AND c.status <> com.opencalsync.sync.domain.model.Conflict.ConflictStatus.RESOLVED
             AND member IN :eventIds
           """)
    List<Conflict> findOpenTouching(@Param("propertyId") Long propertyId,
                                    @Param("eventIds") Collection<Long> eventIds);

    /**
     * Loads then removes each entity so the member collection rows go with it.
     */
    long deleteByPropertyId(Long propertyId);
}
