package com.devmanager.orchestrator.engine;

import java.time.Instant;

public record EngineEvent(EngineEventType type, Object payload, Instant timestamp) {

    public static EngineEvent of(EngineEventType type, Object payload) {
        return new EngineEvent(type, payload, Instant.now());
    }
}
