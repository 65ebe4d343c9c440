package com.devmanager.orchestrator.api.dto;

import com.devmanager.orchestrator.engine.EngineEvent;

import java.time.Instant;

/** One entry of GET /engine/events. */
public record EventResponse(String type, Object payload, Instant timestamp) {

    public static EventResponse from(EngineEvent e) {
        return new EventResponse(e.type().name(), e.payload(), e.timestamp());
    }
}
