package com.opencalsync.sync.domain.service;

import com.opencalsync.sync.api.dto.NotificationPreferencesRequest;
import com.opencalsync.sync.domain.model.NotificationPreferences;
import com.opencalsync.sync.domain.repository.NotificationPreferencesRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationPreferenceService {

    private final NotificationPreferencesRepository repository;

    /**
     * Stored preferences, or all-enabled defaults for a user who never saved any.
     */
    @Transactional(readOnly = true)
    public NotificationPreferences forUser(Long userId) {
        return repository.findByUserId(userId)
                .orElseGet(() -> NotificationPreferences.defaults(userId));
    }

    @Transactional
    public NotificationPreferences update(Long userId, NotificationPreferencesRequest request) {
        NotificationPreferences preferences = repository.findByUserId(userId)
                .orElseGet(() -> NotificationPreferences.defaults(userId));
        if (request.newBooking() != null) {
            preferences.setNewBooking(request.newBooking());
        }
        if (request.modifiedBooking() != null) {
            preferences.setModifiedBooking(request.modifiedBooking());
        }
        if (request.cancelledBooking() != null) {
            preferences.setCancelledBooking(request.cancelledBooking());
        }
        if (request.conflict() != null) {
            preferences.setConflict(request.conflict());
        }
        if (request.syncFailure() != null) {
            preferences.setSyncFailure(request.syncFailure());
        }
        if (request.connectionChange() != null) {
            preferences.setConnectionChange(request.connectionChange());
        }
        log.info("Updated notification preferences for user {}", userId);
        return repository.save(preferences);
    }
}
