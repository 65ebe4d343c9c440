package com.devmanager.orchestrator.api.dto;

/** Request body for POST /engine/project. */
public record SelectProjectRequest(String name) {}
