package com.opencalsync.sync.events;

import com.opencalsync.sync.domain.model.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Payload published for the notification delivery service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarNotificationEvent {
    private Long propertyId;
    private Long userId;
    private NotificationType type;
    private String title;
    private String message;
    private NotificationSeverity severity;
    private Instant timestamp;
}
