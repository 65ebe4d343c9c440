package com.devmanager.orchestrator.api;

import com.devmanager.orchestrator.api.dto.CreateProjectRequest;
import com.devmanager.orchestrator.api.dto.EngineStatusResponse;
import com.devmanager.orchestrator.api.dto.EventResponse;
import com.devmanager.orchestrator.api.dto.ProjectResponse;
import com.devmanager.orchestrator.api.dto.SelectProjectRequest;
import com.devmanager.orchestrator.api.dto.UserInputRequest;
import com.devmanager.orchestrator.engine.EngineEventLog;
import com.devmanager.orchestrator.engine.EngineException;
import com.devmanager.orchestrator.engine.OrchestrationEngine;
import com.devmanager.orchestrator.model.Project;
import com.devmanager.orchestrator.model.Turn;
import com.devmanager.orchestrator.persistence.ProjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * REST surface over the orchestration engine.
 *
 * GET  /projects          list registered projects
 * POST /projects          register a project
 * POST /engine/project    make a project active
 * POST /engine/start      start a run (optional opening text)
 * POST /engine/resume     answer the Manager's question
 * POST /engine/pause      abandon the current wait, keep the project
 * POST /engine/stop       stop and return to PROJECT_SELECTED
 * GET  /engine/status     current state snapshot
 * GET  /engine/history    conversation of the active project
 * GET  /engine/events     recent engine events
 *
 * Commands run synchronously: a start or resume returns once the Manager has
 * answered and the engine has settled into its next waiting state.
 */
@RestController
public class EngineController {

    private static final Logger log = LoggerFactory.getLogger(EngineController.class);

    private final OrchestrationEngine engine;
    private final ProjectStore        projectStore;
    private final EngineEventLog      eventLog;

    public EngineController(OrchestrationEngine engine, ProjectStore projectStore, EngineEventLog eventLog) {
        this.engine       = engine;
        this.projectStore = projectStore;
        this.eventLog     = eventLog;
    }

    // ------------------------------------------------------------------
    // Projects
    // ------------------------------------------------------------------

    @GetMapping("/projects")
    public List<ProjectResponse> listProjects() {
        return projectStore.loadProjects().stream()
                .map(ProjectResponse::from)
                .toList();
    }

    @PostMapping("/projects")
    public ResponseEntity<ProjectResponse> createProject(@RequestBody CreateProjectRequest req) {
        Project created = projectStore.addProject(req.name(), req.workspaceRootPath(), req.overallGoal());
        log.info("Registered project '{}' at {}", created.name(), created.workspaceRootPath());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProjectResponse.from(created));
    }

    // ------------------------------------------------------------------
    // Engine commands
    // ------------------------------------------------------------------

    @PostMapping("/engine/project")
    public EngineStatusResponse selectProject(@RequestBody SelectProjectRequest req) {
        if (req.name() == null || req.name().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Project name is required");
        }
        Project project = projectStore.findByName(req.name())
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Project not found: " + req.name()));
        engine.setActiveProject(project);
        return status();
    }

    @PostMapping("/engine/start")
    public EngineStatusResponse start(@RequestBody(required = false) UserInputRequest req) {
        engine.startTask(req == null ? null : req.text());
        return status();
    }

    @PostMapping("/engine/resume")
    public EngineStatusResponse resume(@RequestBody UserInputRequest req) {
        engine.resumeWithUserInput(req.text());
        return status();
    }

    @PostMapping("/engine/pause")
    public EngineStatusResponse pause() {
        engine.pauseTask();
        return status();
    }

    @PostMapping("/engine/stop")
    public EngineStatusResponse stop() {
        engine.stopTask();
        return status();
    }

    // ------------------------------------------------------------------
    // Read side
    // ------------------------------------------------------------------

    @GetMapping("/engine/status")
    public EngineStatusResponse status() {
        return EngineStatusResponse.from(engine.snapshot());
    }

    @GetMapping("/engine/history")
    public List<Turn> history() {
        return engine.history();
    }

    @GetMapping("/engine/events")
    public List<EventResponse> events(@RequestParam(defaultValue = "50") int limit) {
        return eventLog.recent(limit).stream()
                .map(EventResponse::from)
                .toList();
    }

    // ------------------------------------------------------------------
    // Errors
    // ------------------------------------------------------------------

    /**
     * VALIDATION is the caller's fault. Anything else reaching here escaped
     * the engine's own error handling (e.g. a store failure while listing).
     */
    @ExceptionHandler(EngineException.class)
    public ResponseEntity<Map<String, String>> onEngineException(EngineException e) {
        HttpStatus status = e.getKind() == EngineException.Kind.VALIDATION
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.INTERNAL_SERVER_ERROR;
        if (status.is5xxServerError()) {
            log.error("Request failed [{}]: {}", e.getKind(), e.getMessage(), e);
        }
        return ResponseEntity.status(status)
                .body(Map.of("kind", e.getKind().name(), "message", String.valueOf(e.getMessage())));
    }
}
