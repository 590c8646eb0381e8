package com.opencalsync.sync.events;

import com.opencalsync.sync.domain.model.NotificationType;

/**
 * Outbound "notify the owner" contract. Delivery happens elsewhere; implementations are fire-and-forget
 * and callers treat any exception as non-fatal.
 */
public interface NotificationSink {

    void send(Long propertyId, Long userId, NotificationType type,
              String title, String message, NotificationSeverity severity);
}
