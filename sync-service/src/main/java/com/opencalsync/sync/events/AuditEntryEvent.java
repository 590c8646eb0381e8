package com.opencalsync.sync.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Payload published for the audit log service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntryEvent {
    private AuditAction action;
    private String entityType;
    private Long entityId;
    private Long actorId;
    private Long propertyId;
    private Map<String, Object> details;
    private Instant timestamp;
}
