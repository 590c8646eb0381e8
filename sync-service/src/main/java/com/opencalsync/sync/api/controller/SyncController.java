package com.opencalsync.sync.api.controller;

import com.opencalsync.common.dto.BaseResponse;
import com.opencalsync.common.util.Constants;
import com.opencalsync.sync.api.dto.PropertySyncStatus;
import com.opencalsync.sync.api.dto.SyncHealthSummary;
import com.opencalsync.sync.domain.service.SyncService;
import com.opencalsync.sync.domain.service.SyncStatusService;
import com.opencalsync.sync.reconcile.SyncRunResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Manual sync triggers and sync health queries.
 */
@RestController
@RequestMapping("/api/v1/sync")
@RequiredArgsConstructor
public class SyncController {

    private final SyncService syncService;
    private final SyncStatusService statusService;

    @PostMapping("/properties/{propertyId}")
    public ResponseEntity<BaseResponse<SyncRunResult>> syncProperty(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId) {
        SyncRunResult response = syncService.syncProperty(userId, propertyId);
        return ResponseEntity.ok(BaseResponse.success(summarize(response), response));
    }

    @PostMapping("/all")
    public ResponseEntity<BaseResponse<SyncRunResult>> syncAll(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId) {
        SyncRunResult response = syncService.syncAllForUser(userId);
        return ResponseEntity.ok(BaseResponse.success(summarize(response), response));
    }

    @GetMapping("/properties/{propertyId}/status")
    public ResponseEntity<BaseResponse<PropertySyncStatus>> propertyStatus(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId) {
        return ResponseEntity.ok(BaseResponse.success(statusService.propertyStatus(userId, propertyId)));
    }

    @GetMapping("/health")
    public ResponseEntity<BaseResponse<SyncHealthSummary>> health(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId) {
        return ResponseEntity.ok(BaseResponse.success(statusService.userHealth(userId)));
    }

    private static String summarize(SyncRunResult result) {
        return String.format("Synced %d connection(s): %d succeeded, %d failed, %d skipped",
                result.results().size(), result.succeeded(), result.failed(), result.skipped());
    }
}
