package com.opencalsync.sync.api.controller;

import com.opencalsync.common.dto.BaseResponse;
import com.opencalsync.common.util.Constants;
import com.opencalsync.sync.api.dto.AvailabilityResponse;
import com.opencalsync.sync.api.dto.CalendarEventRequest;
import com.opencalsync.sync.api.dto.CalendarEventResponse;
import com.opencalsync.sync.api.dto.EventChangeResponse;
import com.opencalsync.sync.api.dto.UpdateCalendarEventRequest;
import com.opencalsync.sync.domain.model.CalendarEvent;
import com.opencalsync.sync.domain.model.Platform;
import com.opencalsync.sync.domain.service.CalendarEventService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * REST controller for a property's calendar: queries plus manually entered events.
 */
@RestController
@RequestMapping("/api/v1/properties/{propertyId}/events")
@RequiredArgsConstructor
public class CalendarEventController {

    private final CalendarEventService eventService;

    @GetMapping
    public ResponseEntity<BaseResponse<List<CalendarEventResponse>>> listEvents(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) Set<Platform> platform,
            @RequestParam(required = false) Set<CalendarEvent.EventCategory> category) {
        List<CalendarEventResponse> response = eventService.listEvents(userId, propertyId, from, to, platform, category);
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/availability")
    public ResponseEntity<BaseResponse<AvailabilityResponse>> checkAvailability(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        AvailabilityResponse response = eventService.checkAvailability(userId, propertyId, start, end);
        String message = response.available()
                ? "Property is available for the requested period (" + response.durationDays() + " days)"
                : "Property has " + response.conflictingEvents().size() + " conflicting booking(s) during the requested period";
        return ResponseEntity.ok(BaseResponse.success(message, response));
    }

    @PostMapping
    public ResponseEntity<BaseResponse<EventChangeResponse>> createEvent(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @RequestParam(defaultValue = "false") boolean force,
            @Valid @RequestBody CalendarEventRequest request) {
        EventChangeResponse response = eventService.createManualEvent(userId, propertyId, request, force);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Event created successfully", response));
    }

    @PatchMapping("/{eventId}")
    public ResponseEntity<BaseResponse<EventChangeResponse>> updateEvent(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @PathVariable Long eventId,
            @RequestParam(defaultValue = "false") boolean force,
            @Valid @RequestBody UpdateCalendarEventRequest request) {
        EventChangeResponse response = eventService.updateEvent(userId, propertyId, eventId, request, force);
        return ResponseEntity.ok(BaseResponse.success("Event updated successfully", response));
    }

    @DeleteMapping("/{eventId}")
    public ResponseEntity<BaseResponse<Void>> removeEvent(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @PathVariable Long propertyId,
            @PathVariable Long eventId,
            @RequestParam(defaultValue = "false") boolean preserveHistory) {
        eventService.removeEvent(userId, propertyId, eventId, preserveHistory);
        return ResponseEntity.ok(BaseResponse.success(
                preserveHistory ? "Event deactivated" : "Event deleted", null));
    }
}
