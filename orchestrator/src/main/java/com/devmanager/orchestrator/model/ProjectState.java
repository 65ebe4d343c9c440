package com.devmanager.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable run state for one project.
 *
 * Owned by the engine while the project is active and mutated only under the
 * engine lock. The persistence layer mirrors it to
 * {@code <workspace>/.orchestrator_state/state.json} after every change that
 * matters for crash recovery.
 *
 * conversationHistory is append-only: insertion order is causal order.
 * The manager-turn counter keeps its historical on-disk name so older state
 * files load unchanged.
 */
public class ProjectState {

    private String     projectId;
    private List<Turn> conversationHistory = new ArrayList<>();
    private String     currentStatus       = EngineState.IDLE.name();
    private String     lastInstructionSent;
    private String     contextSummary;
    private String     pendingUserQuestion;
    @JsonProperty("gemini_turns_since_last_summary")
    private int        managerTurnsSinceLastSummary;

    public ProjectState() {}   // required by Jackson

    public ProjectState(String projectId) {
        this.projectId = projectId;
    }

    // ------------------------------------------------------------------
    // History
    // ------------------------------------------------------------------

    public void append(Turn turn) {
        conversationHistory.add(turn);
        if (turn.sender() == Sender.MANAGER || turn.sender() == Sender.MANAGER_CLARIFICATION_REQUEST) {
            managerTurnsSinceLastSummary++;
        }
    }

    /** The last {@code n} turns, or the whole history if it is shorter. */
    public List<Turn> recentTurns(int n) {
        int size = conversationHistory.size();
        if (n <= 0 || n >= size) return List.copyOf(conversationHistory);
        return List.copyOf(conversationHistory.subList(size - n, size));
    }

    public int historySize() {
        return conversationHistory.size();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String     getProjectId()                    { return projectId; }
    public List<Turn> getConversationHistory()          { return Collections.unmodifiableList(conversationHistory); }
    public String     getCurrentStatus()                { return currentStatus; }
    public String     getLastInstructionSent()          { return lastInstructionSent; }
    public String     getContextSummary()               { return contextSummary; }
    public String     getPendingUserQuestion()          { return pendingUserQuestion; }
    public int        getManagerTurnsSinceLastSummary() { return managerTurnsSinceLastSummary; }

    public void setProjectId(String projectId)                { this.projectId = projectId; }
    public void setCurrentStatus(String currentStatus)        { this.currentStatus = currentStatus; }
    public void setLastInstructionSent(String v)              { this.lastInstructionSent = v; }
    public void setContextSummary(String v)                   { this.contextSummary = v; }
    public void setPendingUserQuestion(String v)              { this.pendingUserQuestion = v; }
    public void setManagerTurnsSinceLastSummary(int v)        { this.managerTurnsSinceLastSummary = v; }

    public void setConversationHistory(List<Turn> history) {
        this.conversationHistory = history == null ? new ArrayList<>() : new ArrayList<>(history);
    }
}
