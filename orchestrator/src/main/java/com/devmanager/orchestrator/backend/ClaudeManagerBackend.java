package com.devmanager.orchestrator.backend;

import com.devmanager.orchestrator.config.OrchestratorProperties;
import com.devmanager.orchestrator.engine.EngineException;
import com.devmanager.orchestrator.engine.EngineException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@link ManagerBackend} backed by Claude.
 *
 * Each decision is a single-turn request: the SOP system prompt plus one user
 * message assembled by {@link ManagerPrompts}. Conversation memory lives in
 * the engine's history and summary, not in the API conversation.
 */
@Component
public class ClaudeManagerBackend implements ManagerBackend {

    private static final Logger log = LoggerFactory.getLogger(ClaudeManagerBackend.class);

    /** Log a warning once the prompt estimate passes this share of the budget. */
    static final double CONTEXT_WARNING_RATIO = 0.9;

    private static final String PLACEHOLDER_KEY = "YOUR_API_KEY";

    private final ClaudeClient client;
    private final int          maxTokens;

    public ClaudeManagerBackend(ClaudeClient client, OrchestratorProperties properties) {
        this.client    = client;
        this.maxTokens = properties.getAnthropic().getMaxTokens();
    }

    @Override
    public BackendResponse nextStep(ManagerRequest request) {
        requireApiKey();
        String prompt = ManagerPrompts.nextStepMessage(request);

        int estimated = estimateTokens(ManagerPrompts.MANAGER_SYSTEM_PROMPT) + estimateTokens(prompt);
        if (request.maxContextTokens() > 0 && estimated > request.maxContextTokens() * CONTEXT_WARNING_RATIO) {
            log.warn("Estimated prompt size {} tokens is close to or above the {} token budget",
                    estimated, request.maxContextTokens());
        }
        log.info("Requesting next step from {} (~{} tokens, {} history turns)",
                client.model(), estimated, request.recentHistory().size());

        String raw = call(ManagerPrompts.MANAGER_SYSTEM_PROMPT, prompt, maxTokens);
        BackendResponse response = ManagerResponseParser.parse(raw);
        log.info("Manager replied with {} ({} chars)", response.status(), response.content().length());
        return response;
    }

    @Override
    public String summarize(String text, int maxTokens) {
        requireApiKey();
        log.info("Requesting summary of {} chars (max {} tokens)", text.length(), maxTokens);
        return call(ManagerPrompts.SUMMARY_SYSTEM_PROMPT,
                ManagerPrompts.summaryMessage(text, maxTokens), maxTokens).strip();
    }

    /** chars/4, the usual rough estimate for English text. */
    static int estimateTokens(String text) {
        return text == null ? 0 : text.length() / 4;
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private String call(String system, String userMessage, int tokens) {
        try {
            return client.complete(system, List.of(new ClaudeClient.Message("user", userMessage)), tokens);
        } catch (ClaudeClient.ClaudeApiException e) {
            if (e.statusCode() == 401 || e.statusCode() == 403) {
                throw new EngineException(Kind.BACKEND_AUTH,
                        "Manager backend rejected the API key (HTTP " + e.statusCode() + ")", e);
            }
            throw new EngineException(Kind.BACKEND_CALL, "Manager backend call failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new EngineException(Kind.BACKEND_CALL, "Manager backend call failed: " + e.getMessage(), e);
        }
    }

    private void requireApiKey() {
        String key = client.apiKey();
        if (key == null || key.isBlank() || key.contains(PLACEHOLDER_KEY)) {
            throw new EngineException(Kind.BACKEND_AUTH,
                    "Anthropic API key is missing; set devmanager.anthropic.api-key or ANTHROPIC_API_KEY");
        }
    }
}
