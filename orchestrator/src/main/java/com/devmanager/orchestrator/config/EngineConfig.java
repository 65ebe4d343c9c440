package com.devmanager.orchestrator.config;

import com.devmanager.orchestrator.backend.ManagerBackend;
import com.devmanager.orchestrator.engine.BackendCallDispatcher;
import com.devmanager.orchestrator.engine.EngineEventLog;
import com.devmanager.orchestrator.engine.OrchestrationEngine;
import com.devmanager.orchestrator.persistence.JsonProjectStore;
import com.devmanager.orchestrator.persistence.ProjectStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the engine and its collaborators.
 *
 * The engine owns background threads (signal loop, watcher, timer), so the
 * container calls {@link OrchestrationEngine#shutdown()} on close.
 */
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public ProjectStore projectStore(ObjectMapper objectMapper, OrchestratorProperties props) {
        Path appData = Path.of(props.getAppDataDir()).toAbsolutePath();
        log.info("Project data directory: {}", appData);
        return new JsonProjectStore(objectMapper, appData);
    }

    @Bean
    public BackendCallDispatcher backendCallDispatcher(MeterRegistry meterRegistry) {
        return new BackendCallDispatcher(meterRegistry);
    }

    @Bean
    public EngineEventLog engineEventLog() {
        return new EngineEventLog();
    }

    @Bean(destroyMethod = "shutdown")
    public OrchestrationEngine orchestrationEngine(OrchestratorProperties props,
                                                   ProjectStore projectStore,
                                                   ManagerBackend managerBackend,
                                                   BackendCallDispatcher dispatcher,
                                                   EngineEventLog eventLog,
                                                   MeterRegistry meterRegistry) {
        log.info("Engine config: resultTimeout={} backendCallTimeout={} summarizationInterval={} "
                        + "maxHistoryTurns={} instructions={}/{} results={}/{}",
                props.getResultTimeout(), props.getBackendCallTimeout(), props.getSummarizationInterval(),
                props.getMaxHistoryTurns(), props.getInstructionsDir(), props.getInstructionFileName(),
                props.getLogsDir(), props.getResultFileName());
        return new OrchestrationEngine(props, projectStore, managerBackend, dispatcher, eventLog, meterRegistry);
    }
}
