package com.devmanager.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for the orchestration loop, bound from the {@code devmanager.*}
 * section of application.yml. Every value has a default so the engine can be
 * constructed directly in unit tests with {@code new OrchestratorProperties()}.
 */
@ConfigurationProperties(prefix = "devmanager")
public class OrchestratorProperties {

    // How long the engine waits for the Worker's result file.
    private Duration resultTimeout = Duration.ofMinutes(10);

    // Overall limit on one Manager call, enforced by the dispatcher.
    private Duration backendCallTimeout = Duration.ofMinutes(2);

    // Quiet period after the result file appears before it is read.
    private Duration fileEventDebounce = Duration.ofMillis(500);

    private int summarizationInterval = 10;
    private int maxHistoryTurns       = 20;
    private int maxContextTokens      = 30_000;
    private int summaryMaxTokens      = 1_000;

    private String instructionsDir     = "dev_instructions";
    private String logsDir             = "dev_logs";
    private String instructionFileName = "next_step.txt";
    private String resultFileName      = "worker_step_output.txt";
    private String appDataDir          = "app_data";

    private Anthropic anthropic = new Anthropic();

    public static class Anthropic {
        private String apiKey;
        private String model   = "claude-sonnet-4-6";
        private String baseUrl = "https://api.anthropic.com";
        private int    maxTokens = 4096;

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
    }

    public Duration getResultTimeout() {
        return resultTimeout;
    }

    public void setResultTimeout(Duration resultTimeout) {
        this.resultTimeout = resultTimeout;
    }

    public Duration getBackendCallTimeout() {
        return backendCallTimeout;
    }

    public void setBackendCallTimeout(Duration backendCallTimeout) {
        this.backendCallTimeout = backendCallTimeout;
    }

    public Duration getFileEventDebounce() {
        return fileEventDebounce;
    }

    public void setFileEventDebounce(Duration fileEventDebounce) {
        this.fileEventDebounce = fileEventDebounce;
    }

    public int getSummarizationInterval() {
        return summarizationInterval;
    }

    public void setSummarizationInterval(int summarizationInterval) {
        this.summarizationInterval = summarizationInterval;
    }

    public int getMaxHistoryTurns() {
        return maxHistoryTurns;
    }

    public void setMaxHistoryTurns(int maxHistoryTurns) {
        this.maxHistoryTurns = maxHistoryTurns;
    }

    public int getMaxContextTokens() {
        return maxContextTokens;
    }

    public void setMaxContextTokens(int maxContextTokens) {
        this.maxContextTokens = maxContextTokens;
    }

    public int getSummaryMaxTokens() {
        return summaryMaxTokens;
    }

    public void setSummaryMaxTokens(int summaryMaxTokens) {
        this.summaryMaxTokens = summaryMaxTokens;
    }

    public String getInstructionsDir() {
        return instructionsDir;
    }

    public void setInstructionsDir(String instructionsDir) {
        this.instructionsDir = instructionsDir;
    }

    public String getLogsDir() {
        return logsDir;
    }

    public void setLogsDir(String logsDir) {
        this.logsDir = logsDir;
    }

    public String getInstructionFileName() {
        return instructionFileName;
    }

    public void setInstructionFileName(String instructionFileName) {
        this.instructionFileName = instructionFileName;
    }

    public String getResultFileName() {
        return resultFileName;
    }

    public void setResultFileName(String resultFileName) {
        this.resultFileName = resultFileName;
    }

    public String getAppDataDir() {
        return appDataDir;
    }

    public void setAppDataDir(String appDataDir) {
        this.appDataDir = appDataDir;
    }

    public Anthropic getAnthropic() {
        return anthropic;
    }

    public void setAnthropic(Anthropic anthropic) {
        this.anthropic = anthropic;
    }
}
