package com.capacityengine.api.controller;

import com.capacityengine.events.EngineEvent;
import com.capacityengine.events.EngineEventPublisher;
import com.capacityengine.events.EngineEventType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for the notification log.
 */
@RestController
@RequestMapping("/api/v1/events")
@RequiredArgsConstructor
@Tag(name = "Events", description = "Engine notification log")
public class EventController {

    private final EngineEventPublisher eventPublisher;

    @GetMapping
    @Operation(summary = "List notifications, optionally of one type")
    public ResponseEntity<List<EngineEvent>> getEvents(@RequestParam(required = false) EngineEventType type) {
        return ResponseEntity.ok(type == null ? eventPublisher.getEvents() : eventPublisher.getEvents(type));
    }
}
