package com.devmanager.orchestrator.engine;

/**
 * Kinds of notification the engine pushes to its {@link EngineListener}.
 */
public enum EngineEventType {
    /** payload: the new {@code EngineState} */
    STATE_CHANGE,
    /** payload: {@link EngineError} */
    ERROR,
    /** payload: human-readable status text */
    STATUS_UPDATE,
    /** payload: the appended {@code Turn} */
    NEW_MESSAGE,
    /** payload: the Manager's question */
    USER_INPUT_NEEDED,
    /** payload: the completion note */
    TASK_COMPLETE,
    /** payload: {@link ProjectLoaded} */
    PROJECT_LOADED
}
