package com.opencalsync.sync.api.controller;

import com.opencalsync.common.dto.BaseResponse;
import com.opencalsync.common.util.Constants;
import com.opencalsync.sync.api.dto.NotificationPreferencesRequest;
import com.opencalsync.sync.api.dto.NotificationPreferencesResponse;
import com.opencalsync.sync.domain.service.NotificationPreferenceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/notification-preferences")
@RequiredArgsConstructor
public class NotificationPreferencesController {

    private final NotificationPreferenceService preferenceService;

    @GetMapping
    public ResponseEntity<BaseResponse<NotificationPreferencesResponse>> getPreferences(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId) {
        return ResponseEntity.ok(BaseResponse.success(
                NotificationPreferencesResponse.from(preferenceService.forUser(userId))));
    }

    @PutMapping
    public ResponseEntity<BaseResponse<NotificationPreferencesResponse>> updatePreferences(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @RequestBody NotificationPreferencesRequest request) {
        NotificationPreferencesResponse response =
                NotificationPreferencesResponse.from(preferenceService.update(userId, request));
        return ResponseEntity.ok(BaseResponse.success("Notification preferences updated", response));
    }
}
