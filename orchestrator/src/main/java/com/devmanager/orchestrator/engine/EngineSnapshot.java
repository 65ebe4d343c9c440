package com.devmanager.orchestrator.engine;

import com.devmanager.orchestrator.model.EngineState;

/**
 * Read-only view of the engine, taken under the engine lock.
 * Project fields are null when no project is active.
 */
public record EngineSnapshot(
        EngineState state,
        String projectName,
        String lastError,
        String pendingUserQuestion,
        String lastInstructionSent,
        int historySize,
        boolean hasSummary
) {}
