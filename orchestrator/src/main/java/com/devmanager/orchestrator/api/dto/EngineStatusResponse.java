package com.devmanager.orchestrator.api.dto;

import com.devmanager.orchestrator.engine.EngineSnapshot;

/**
 * Response body for GET /engine/status and every engine command.
 * Commands return the status right after they finish, so a start that
 * issued an instruction already reports RUNNING_WAITING_RESULT.
 */
public record EngineStatusResponse(
        String  state,
        String  project,
        String  lastError,
        String  pendingUserQuestion,
        String  lastInstructionSent,
        int     historySize,
        boolean hasSummary
) {
    public static EngineStatusResponse from(EngineSnapshot s) {
        return new EngineStatusResponse(
                s.state().name(),
                s.projectName(),
                s.lastError(),
                s.pendingUserQuestion(),
                s.lastInstructionSent(),
                s.historySize(),
                s.hasSummary()
        );
    }
}
