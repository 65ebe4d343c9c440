package com.devmanager.orchestrator.engine;

/** Payload of an ERROR event. */
public record EngineError(EngineException.Kind kind, String message) {}
