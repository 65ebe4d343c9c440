package com.devmanager.orchestrator.persistence;

import com.devmanager.orchestrator.model.Project;
import com.devmanager.orchestrator.model.ProjectState;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for the project list and per-project run state.
 *
 * All failures surface as {@link com.devmanager.orchestrator.engine.EngineException}
 * of kind PERSISTENCE, except bad caller input to {@link #addProject} which is
 * reported as VALIDATION.
 */
public interface ProjectStore {

    List<Project> loadProjects();

    Optional<Project> findByName(String name);

    /**
     * Register a new project and write an initial state for it.
     * Names are unique; the workspace must be an existing directory.
     */
    Project addProject(String name, String workspaceRootPath, String overallGoal);

    /** Empty when the project has never been saved. */
    Optional<ProjectState> loadProjectState(Project project);

    void saveProjectState(Project project, ProjectState state);
}
