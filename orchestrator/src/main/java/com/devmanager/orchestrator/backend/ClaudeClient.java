package com.devmanager.orchestrator.backend;

import com.devmanager.orchestrator.config.OrchestratorProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * One request per call, no retries: the engine treats any failure as the end
 * of the run and the user restarts it. Raw HttpClient keeps the wire format
 * visible when debugging a Manager that misbehaves.
 */
@Component
public class ClaudeClient {

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** A single message; role is "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Text of the first text block. */
        public String firstText() {
            if (content == null) throw new IllegalStateException("Response has no content");
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String MESSAGES_PATH = "/v1/messages";
    private static final String API_VER       = "2023-06-01";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       model;
    private final URI          endpoint;
    private final Duration     requestTimeout;

    public ClaudeClient(OrchestratorProperties properties, ObjectMapper objectMapper) {
        OrchestratorProperties.Anthropic anthropic = properties.getAnthropic();
        this.apiKey         = anthropic.getApiKey();
        this.model          = anthropic.getModel();
        this.endpoint       = URI.create(stripTrailingSlash(anthropic.getBaseUrl()) + MESSAGES_PATH);
        this.requestTimeout = properties.getBackendCallTimeout();
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send one conversation and return the assistant's text reply.
     *
     * @param system    system prompt, omitted from the request when null
     * @param messages  the conversation, alternating user and assistant
     * @param maxTokens output budget
     * @throws ClaudeApiException on any non-200 status
     */
    public String complete(String system, List<Message> messages, int maxTokens) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model",      model);
            body.put("max_tokens", maxTokens);
            if (system != null) body.put("system", system);
            body.put("messages",   messages);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(requestTimeout)
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey == null ? "" : apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new ClaudeApiException(response.statusCode(), response.body());
            }
            return json.readValue(response.body(), MessagesResponse.class).firstText();

        } catch (ClaudeApiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Claude API call interrupted", e);
        } catch (Exception e) {
            throw new RuntimeException("Claude API call failed: " + e.getMessage(), e);
        }
    }

    public String apiKey() { return apiKey; }
    public String model()  { return model; }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ClaudeApiException extends RuntimeException {
        private final int statusCode;
        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }
        public int statusCode() { return statusCode; }
    }
}
