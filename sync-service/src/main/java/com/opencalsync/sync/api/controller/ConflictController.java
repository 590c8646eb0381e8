package com.opencalsync.sync.api.controller;

import com.opencalsync.common.dto.BaseResponse;
import com.opencalsync.common.util.Constants;
import com.opencalsync.sync.api.dto.ConflictResponse;
import com.opencalsync.sync.api.dto.ResolveConflictRequest;
import com.opencalsync.sync.conflict.RescanResult;
import com.opencalsync.sync.conflict.ResolutionResult;
import com.opencalsync.sync.domain.model.Conflict;
import com.opencalsync.sync.domain.model.ResolutionAction;
import com.opencalsync.sync.domain.service.ConflictService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/properties/{propertyId}/conflicts")
@RequiredArgsConstructor
public class ConflictController {

    private final ConflictService conflictService;

    @GetMapping
    public ResponseEntity<BaseResponse<List<ConflictResponse>>> listConflicts(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @RequestParam(required = false) Conflict.ConflictStatus status) {
        List<ConflictResponse> response = conflictService.listConflicts(userId, propertyId, status).stream()
                .map(ConflictResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/{conflictId}")
    public ResponseEntity<BaseResponse<ConflictResponse>> getConflict(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @PathVariable Long conflictId) {
        ConflictResponse response = ConflictResponse.from(conflictService.getConflict(userId, propertyId, conflictId));
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/rescan")
    public ResponseEntity<BaseResponse<RescanResult>> rescan(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId) {
        RescanResult response = conflictService.rescan(userId, propertyId);
        return ResponseEntity.ok(BaseResponse.success(
                "Found " + response.totalConflicts() + " conflict(s)", response));
    }

    @PostMapping("/{conflictId}/resolve")
    public ResponseEntity<BaseResponse<ResolutionResult>> resolveConflict(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @PathVariable Long conflictId,
            @Valid @RequestBody ResolveConflictRequest request) {
        ResolutionResult response = conflictService.resolve(
                userId, propertyId, conflictId, request.keepEventIds(), request.action());
        return ResponseEntity.ok(BaseResponse.success("Conflict resolved successfully", response));
    }

    @PostMapping("/{conflictId}/auto-resolve")
    public ResponseEntity<BaseResponse<ResolutionResult>> autoResolveConflict(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @PathVariable Long conflictId,
            @RequestParam(defaultValue = "DEACTIVATE") ResolutionAction action) {
        ResolutionResult response = conflictService.autoResolve(userId, propertyId, conflictId, action);
        return ResponseEntity.ok(BaseResponse.success("Conflict auto-resolved, kept the longest booking", response));
    }

    @PostMapping("/{conflictId}/acknowledge")
    public ResponseEntity<BaseResponse<ConflictResponse>> acknowledgeConflict(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @PathVariable Long conflictId) {
        ConflictResponse response = ConflictResponse.from(conflictService.acknowledge(userId, propertyId, conflictId));
        return ResponseEntity.ok(BaseResponse.success(response));
    }
}
