package com.devmanager.orchestrator.api.dto;

/**
 * Request body for POST /projects.
 * workspaceRootPath must be an existing directory on the orchestrator host.
 */
public record CreateProjectRequest(String name, String workspaceRootPath, String overallGoal) {}
