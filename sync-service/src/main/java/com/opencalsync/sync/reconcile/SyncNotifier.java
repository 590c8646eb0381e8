package com.opencalsync.sync.reconcile;

import com.opencalsync.sync.domain.model.CalendarConnection;
import com.opencalsync.sync.domain.model.CalendarEvent;
import com.opencalsync.sync.domain.model.CalendarEvent.EventCategory;
import com.opencalsync.sync.domain.model.NotificationPreferences;
import com.opencalsync.sync.domain.model.NotificationType;
import com.opencalsync.sync.domain.service.NotificationPreferenceService;
import com.opencalsync.sync.events.NotificationSeverity;
import com.opencalsync.sync.events.NotificationSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns the outcome of one connection sync into owner notifications, respecting the owner's preferences.
 *
 * New bookings are announced one by one up to a cap; anything past the cap is folded into one summary.
 * Modified and cancelled events only ever produce one summary each. Delivery failures are logged and dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncNotifier {

    private final NotificationSink notificationSink;
    private final NotificationPreferenceService preferenceService;

    @Value("${calendar-sync.notifications.new-booking-cap:5}")
    private int newBookingCap = 5;

    public void notifyChanges(CalendarConnection connection, List<CalendarEvent> created, int modified, int cancelled) {
        NotificationPreferences preferences = preferences(connection.getUserId());
        if (preferences == null) {
            return;
        }
        String platform = connection.getPlatform().getDisplayName();

        if (preferences.allows(NotificationType.NEW_BOOKING)) {
            List<CalendarEvent> bookings = created.stream()
                    .filter(event -> event.getCategory() == EventCategory.BOOKING)
                    .collect(Collectors.toList());
            int individual = Math.min(bookings.size(), newBookingCap);
            for (CalendarEvent booking : bookings.subList(0, individual)) {
                send(connection, NotificationType.NEW_BOOKING, "New booking from " + platform,
                        String.format("%s: %s to %s", describe(booking), booking.getStartDate(), booking.getEndDate()),
                        NotificationSeverity.INFO);
            }
            int remainder = bookings.size() - individual;
            if (remainder > 0) {
                send(connection, NotificationType.NEW_BOOKING, "New bookings from " + platform,
                        remainder + " more new booking(s) were imported from " + platform,
                        NotificationSeverity.INFO);
            }
        }

        if (modified > 0 && preferences.allows(NotificationType.MODIFIED_BOOKING)) {
            send(connection, NotificationType.MODIFIED_BOOKING, "Bookings updated on " + platform,
                    modified + " event(s) changed on " + platform, NotificationSeverity.INFO);
        }

        if (cancelled > 0 && preferences.allows(NotificationType.CANCELLED_BOOKING)) {
            send(connection, NotificationType.CANCELLED_BOOKING, "Bookings cancelled on " + platform,
                    cancelled + " event(s) no longer appear on " + platform + " and were cancelled",
                    NotificationSeverity.WARNING);
        }
    }

    public void notifyFailure(CalendarConnection connection, String reason) {
        NotificationPreferences preferences = preferences(connection.getUserId());
        if (preferences == null || !preferences.allows(NotificationType.SYNC_FAILURE)) {
            return;
        }
        send(connection, NotificationType.SYNC_FAILURE,
                "Calendar sync failed for " + connection.getPlatform().getDisplayName(),
                "Failed to sync calendar: " + reason, NotificationSeverity.WARNING);
    }

    public void notifyConflicts(CalendarConnection connection, int newlyDetected) {
        NotificationPreferences preferences = preferences(connection.getUserId());
        if (newlyDetected <= 0 || preferences == null || !preferences.allows(NotificationType.CONFLICT_DETECTED)) {
            return;
        }
        send(connection, NotificationType.CONFLICT_DETECTED, "Booking conflict detected",
                newlyDetected + " new overlapping booking pair(s) found after syncing "
                        + connection.getPlatform().getDisplayName(),
                NotificationSeverity.CRITICAL);
    }

    private NotificationPreferences preferences(Long userId) {
        try {
            return preferenceService.forUser(userId);
        } catch (RuntimeException e) {
            log.warn("Could not load notification preferences for user {} (non-fatal)", userId, e);
            return null;
        }
    }

    private void send(CalendarConnection connection, NotificationType type, String title,
                      String message, NotificationSeverity severity) {
        try {
            notificationSink.send(connection.getPropertyId(), connection.getUserId(), type, title, message, severity);
        } catch (RuntimeException e) {
            log.warn("Failed to send {} notification for connection {} (non-fatal)", type, connection.getId(), e);
        }
    }

    private static String describe(CalendarEvent event) {
        return event.getSummary() == null ? "Booking" : event.getSummary();
    }
}
