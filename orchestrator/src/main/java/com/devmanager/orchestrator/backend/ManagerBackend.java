package com.devmanager.orchestrator.backend;

/**
 * The Manager: decides the Worker's next step and compacts long histories.
 *
 * Implementations block for the whole call. The engine always invokes them
 * through {@code BackendCallDispatcher}, which bounds the wait.
 * Failures are reported as {@code EngineException} of kind BACKEND_AUTH or
 * BACKEND_CALL.
 */
public interface ManagerBackend {

    BackendResponse nextStep(ManagerRequest request);

    /**
     * Compact {@code text} into a summary of at most roughly {@code maxTokens}
     * tokens.
     */
    String summarize(String text, int maxTokens);
}
