package com.devmanager.orchestrator.api.dto;

/**
 * Request body for POST /engine/start (text optional) and
 * POST /engine/resume (text required).
 */
public record UserInputRequest(String text) {}
