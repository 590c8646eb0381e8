package com.opencalsync.sync.events;

import java.util.Map;

/**
 * Best-effort audit trail. Persistence is owned by a downstream consumer.
 */
public interface AuditSink {

    void record(AuditAction action, String entityType, Long entityId,
                Long actorId, Long propertyId, Map<String, Object> details);
}
