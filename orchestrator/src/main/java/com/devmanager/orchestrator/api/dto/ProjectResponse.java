package com.devmanager.orchestrator.api.dto;

import com.devmanager.orchestrator.model.Project;

public record ProjectResponse(String id, String name, String workspaceRootPath, String overallGoal) {

    public static ProjectResponse from(Project p) {
        return new ProjectResponse(p.id(), p.name(), p.workspaceRootPath(), p.overallGoal());
    }
}
