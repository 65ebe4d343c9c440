package com.devmanager.orchestrator.backend;

import com.devmanager.orchestrator.model.Turn;

import java.util.List;

/**
 * Everything the Manager sees for one decision.
 *
 * @param projectGoal      the project's overall goal
 * @param recentHistory    the last max-history-turns turns, oldest first
 * @param contextSummary   compacted summary of older turns, may be null
 * @param latestResult     Worker output that triggered this call, null on start and resume
 * @param maxContextTokens prompt budget used for the size warning
 */
public record ManagerRequest(
        String projectGoal,
        List<Turn> recentHistory,
        String contextSummary,
        String latestResult,
        int maxContextTokens
) {
    public ManagerRequest {
        recentHistory = recentHistory == null ? List.of() : List.copyOf(recentHistory);
    }
}
