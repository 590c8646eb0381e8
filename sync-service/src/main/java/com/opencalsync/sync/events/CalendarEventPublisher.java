package com.opencalsync.sync.events;

import com.opencalsync.sync.domain.model.NotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka-backed implementation of both outbound sinks.
 *
 * Topics:
 * - calendar-notifications: consumed by the notification delivery service (email, push)
 * - calendar-audit: consumed by the audit log service
 *
 * Messages are keyed by property id so all records of one property stay ordered within a partition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CalendarEventPublisher implements NotificationSink, AuditSink {

    static final String TOPIC_NOTIFICATIONS = "calendar-notifications";
    static final String TOPIC_AUDIT = "calendar-audit";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    @Override
    public void send(Long propertyId, Long userId, NotificationType type,
                     String title, String message, NotificationSeverity severity) {
        CalendarNotificationEvent event = CalendarNotificationEvent.builder()
                .propertyId(propertyId)
                .userId(userId)
                .type(type)
                .title(title)
                .message(message)
                .severity(severity)
                .timestamp(clock.instant())
                .build();

        publishEvent(TOPIC_NOTIFICATIONS, String.valueOf(propertyId), event);
    }

    @Override
    public void record(AuditAction action, String entityType, Long entityId,
                       Long actorId, Long propertyId, Map<String, Object> details) {
        AuditEntryEvent event = AuditEntryEvent.builder()
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .actorId(actorId)
                .propertyId(propertyId)
                .details(details)
                .timestamp(clock.instant())
                .build();

        publishEvent(TOPIC_AUDIT, String.valueOf(propertyId), event);
    }

    private void publishEvent(String topic, String key, Object event) {
        log.debug("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.debug("Event published to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {}", topic, ex);
            }
        });
    }
}
