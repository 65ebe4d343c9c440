package com.devmanager.orchestrator.model;

/**
 * A user-registered development project.
 *
 * workspaceRootPath is the absolute directory the Worker edits; the
 * instruction and result directories live beneath it. The id is a UUID string
 * and may be missing in hand-edited project lists, in which case the store
 * backfills it.
 */
public record Project(String id, String name, String workspaceRootPath, String overallGoal) {

    public Project withId(String newId) {
        return new Project(newId, name, workspaceRootPath, overallGoal);
    }
}
