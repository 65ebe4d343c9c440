package com.devmanager.orchestrator.model;

import java.util.Optional;

/**
 * States of the orchestration engine.
 *
 * Transitions (happy path):
 *   IDLE → LOADING_PROJECT → PROJECT_SELECTED → RUNNING_WAITING_INITIAL_BACKEND
 *        → RUNNING_WAITING_RESULT → RUNNING_PROCESSING_RESULT → RUNNING_CALLING_BACKEND
 *        → RUNNING_WAITING_RESULT → ... → TASK_COMPLETE
 *
 * The Manager can park the loop in PAUSED_WAITING_USER_INPUT at any backend
 * response. Any state can transition to ERROR. TASK_COMPLETE and ERROR accept
 * a new start, which re-arms the cycle.
 *
 * The name is persisted as ProjectState.current_status, so renaming a
 * constant breaks saved state files.
 */
public enum EngineState {
    IDLE,
    LOADING_PROJECT,
    PROJECT_SELECTED,
    RUNNING_WAITING_INITIAL_BACKEND,
    RUNNING_WAITING_RESULT,
    RUNNING_PROCESSING_RESULT,
    RUNNING_CALLING_BACKEND,
    PAUSED_WAITING_USER_INPUT,
    TASK_COMPLETE,
    ERROR;

    /** True for the four RUNNING_* states. */
    public boolean isRunning() {
        return name().startsWith("RUNNING_");
    }

    /** States from which a fresh start is accepted. */
    public boolean acceptsStart() {
        return this == IDLE || this == PROJECT_SELECTED || this == TASK_COMPLETE || this == ERROR;
    }

    /**
     * Strict lookup by canonical name.
     * Returns empty for null, blank or unknown values instead of guessing.
     */
    public static Optional<EngineState> parse(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        for (EngineState s : values()) {
            if (s.name().equals(name.strip())) return Optional.of(s);
        }
        return Optional.empty();
    }
}
