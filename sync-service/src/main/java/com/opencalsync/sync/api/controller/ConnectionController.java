package com.opencalsync.sync.api.controller;

import com.opencalsync.common.dto.BaseResponse;
import com.opencalsync.common.util.Constants;
import com.opencalsync.sync.api.dto.ConnectionRegistrationResponse;
import com.opencalsync.sync.api.dto.ConnectionRemovalResponse;
import com.opencalsync.sync.api.dto.ConnectionResponse;
import com.opencalsync.sync.api.dto.ConnectionTestResponse;
import com.opencalsync.sync.api.dto.RegisterConnectionRequest;
import com.opencalsync.sync.api.dto.UpdateConnectionRequest;
import com.opencalsync.sync.domain.model.EventDisposition;
import com.opencalsync.sync.domain.service.SyncService;
import com.opencalsync.sync.lifecycle.ConnectionCheck;
import com.opencalsync.sync.lifecycle.ConnectionLifecycleOrchestrator;
import com.opencalsync.sync.lifecycle.RemovalResult;
import com.opencalsync.sync.reconcile.SyncRunResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for calendar feed connections of a property.
 */
@RestController
@RequestMapping("/api/v1/properties/{propertyId}/connections")
@RequiredArgsConstructor
public class ConnectionController {

    private final ConnectionLifecycleOrchestrator orchestrator;
    private final SyncService syncService;

    @GetMapping
    public ResponseEntity<BaseResponse<List<ConnectionResponse>>> listConnections(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId) {
        List<ConnectionResponse> response = orchestrator.list(userId, propertyId).stream()
                .map(ConnectionResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping
    public ResponseEntity<BaseResponse<ConnectionRegistrationResponse>> registerConnection(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @Valid @RequestBody RegisterConnectionRequest request) {
        ConnectionRegistrationResponse response =
                ConnectionRegistrationResponse.from(orchestrator.register(userId, propertyId, request));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Calendar connection created successfully", response));
    }

    @GetMapping("/{connectionId}")
    public ResponseEntity<BaseResponse<ConnectionResponse>> getConnection(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @PathVariable Long connectionId) {
        ConnectionResponse response = ConnectionResponse.from(orchestrator.get(userId, propertyId, connectionId));
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PatchMapping("/{connectionId}")
    public ResponseEntity<BaseResponse<ConnectionResponse>> updateConnection(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @PathVariable Long connectionId,
            @Valid @RequestBody UpdateConnectionRequest request) {
        ConnectionResponse response =
                ConnectionResponse.from(orchestrator.update(userId, propertyId, connectionId, request));
        return ResponseEntity.ok(BaseResponse.success("Calendar connection updated successfully", response));
    }

    @PostMapping("/{connectionId}/test")
    public ResponseEntity<BaseResponse<ConnectionTestResponse>> testConnection(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @PathVariable Long connectionId) {
        ConnectionCheck check = orchestrator.test(userId, propertyId, connectionId);
        ConnectionTestResponse response = new ConnectionTestResponse(
                connectionId,
                check.validation().valid(),
                check.validation().entryCount(),
                check.validation().message(),
                check.validation().errorCode(),
                check.connection().getStatus());
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/{connectionId}/sync")
    public ResponseEntity<BaseResponse<SyncRunResult>> syncConnection(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @PathVariable Long connectionId) {
        SyncRunResult response = syncService.syncConnection(userId, propertyId, connectionId);
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/{connectionId}/deactivate")
    public ResponseEntity<BaseResponse<ConnectionRemovalResponse>> deactivateConnection(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @PathVariable Long connectionId,
            @RequestParam(defaultValue = "KEEP") EventDisposition eventAction,
            @RequestParam(defaultValue = "false") boolean preserveHistory) {
        RemovalResult result = orchestrator.deactivate(userId, propertyId, connectionId, eventAction, preserveHistory);
        return ResponseEntity.ok(BaseResponse.success("Calendar connection deactivated", toResponse(result)));
    }

    @PostMapping("/{connectionId}/reactivate")
    public ResponseEntity<BaseResponse<ConnectionResponse>> reactivateConnection(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @PathVariable Long connectionId) {
        ConnectionResponse response =
                ConnectionResponse.from(orchestrator.reactivate(userId, propertyId, connectionId));
        return ResponseEntity.ok(BaseResponse.success("Calendar connection reactivated", response));
    }

    @DeleteMapping("/{connectionId}")
    public ResponseEntity<BaseResponse<ConnectionRemovalResponse>> removeConnection(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @PathVariable Long connectionId,
            @RequestParam(defaultValue = "KEEP") EventDisposition eventAction,
            @RequestParam(defaultValue = "false") boolean preserveHistory) {
        RemovalResult result = orchestrator.remove(userId, propertyId, connectionId, eventAction, preserveHistory);
        return ResponseEntity.ok(BaseResponse.success("Calendar connection removed", toResponse(result)));
    }

    private static ConnectionRemovalResponse toResponse(RemovalResult result) {
        return new ConnectionRemovalResponse(
                result.connection().getId(),
                result.disposition().disposition(),
                result.disposition().affectedEventIds().size(),
                result.cleanup().resolved(),
                result.cleanup().recalculated());
    }
}
