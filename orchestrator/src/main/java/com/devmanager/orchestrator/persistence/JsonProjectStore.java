package com.devmanager.orchestrator.persistence;

import com.devmanager.orchestrator.engine.EngineException;
import com.devmanager.orchestrator.engine.EngineException.Kind;
import com.devmanager.orchestrator.model.Project;
import com.devmanager.orchestrator.model.ProjectState;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link ProjectStore} backed by plain JSON files.
 *
 * Layout:
 *   {@code <appDataDir>/projects.json}                          the project list
 *   {@code <workspace>/.orchestrator_state/state.json}          one state per project
 *
 * Keeping the state next to the workspace means a project directory can be
 * moved between machines together with its conversation history.
 *
 * Files are written to a sibling temp file and then moved over the target, so
 * a crash mid-write never leaves a truncated state.json behind.
 */
public class JsonProjectStore implements ProjectStore {

    private static final Logger log = LoggerFactory.getLogger(JsonProjectStore.class);

    static final String PROJECTS_FILE   = "projects.json";
    static final String STATE_DIR_NAME  = ".orchestrator_state";
    static final String STATE_FILE_NAME = "state.json";

    private static final TypeReference<List<Project>> PROJECT_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper json;
    private final Path         appDataDir;

    public JsonProjectStore(ObjectMapper objectMapper, Path appDataDir) {
        // Own copy: snake_case on disk must not leak into the REST layer's mapper.
        this.json = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.appDataDir = appDataDir;
    }

    // ------------------------------------------------------------------
    // Projects
    // ------------------------------------------------------------------

    @Override
    public synchronized List<Project> loadProjects() {
        Path file = appDataDir.resolve(PROJECTS_FILE);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<Project> projects;
        try {
            projects = json.readValue(file.toFile(), PROJECT_LIST_TYPE);
        } catch (IOException e) {
            throw new EngineException(Kind.PERSISTENCE,
                    "Could not read project list " + file + ": " + e.getMessage(), e);
        }

        // Hand-edited lists may omit ids; assign them once and write back.
        boolean backfilled = false;
        List<Project> result = new ArrayList<>(projects.size());
        for (Project p : projects) {
            if (p.id() == null || p.id().isBlank()) {
                p = p.withId(UUID.randomUUID().toString());
                backfilled = true;
                log.info("Backfilled id {} for project '{}'", p.id(), p.name());
            }
            result.add(p);
        }
        if (backfilled) {
            writeJson(file, result);
        }
        return List.copyOf(result);
    }

    @Override
    public synchronized Optional<Project> findByName(String name) {
        return loadProjects().stream()
                .filter(p -> p.name().equals(name))
                .findFirst();
    }

    @Override
    public synchronized Project addProject(String name, String workspaceRootPath, String overallGoal) {
        if (name == null || name.isBlank()) {
            throw EngineException.validation("Project name must not be blank");
        }
        if (workspaceRootPath == null || workspaceRootPath.isBlank()
                || !Files.isDirectory(Path.of(workspaceRootPath))) {
            throw EngineException.validation("Workspace root must be an existing directory: " + workspaceRootPath);
        }
        List<Project> projects = new ArrayList<>(loadProjects());
        if (projects.stream().anyMatch(p -> p.name().equals(name.strip()))) {
            throw EngineException.validation("A project named '" + name.strip() + "' already exists");
        }

        Project project = new Project(
                UUID.randomUUID().toString(),
                name.strip(),
                Path.of(workspaceRootPath).toAbsolutePath().normalize().toString(),
                overallGoal == null ? "" : overallGoal.strip());
        projects.add(project);
        writeJson(appDataDir.resolve(PROJECTS_FILE), projects);
        saveProjectState(project, new ProjectState(project.id()));

        log.info("Added project '{}' ({}) at {}", project.name(), project.id(), project.workspaceRootPath());
        return project;
    }

    // ------------------------------------------------------------------
    // Project state
    // ------------------------------------------------------------------

    @Override
    public Optional<ProjectState> loadProjectState(Project project) {
        Path file = stateFile(project);
        if (!Files.exists(file)) {
            log.info("No saved state for project '{}'", project.name());
            return Optional.empty();
        }
        try {
            return Optional.of(json.readValue(file.toFile(), ProjectState.class));
        } catch (IOException e) {
            throw new EngineException(Kind.PERSISTENCE,
                    "Could not read state for project '" + project.name() + "': " + e.getMessage(), e);
        }
    }

    @Override
    public void saveProjectState(Project project, ProjectState state) {
        writeJson(stateFile(project), state);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static Path stateFile(Project project) {
        if (project == null || project.workspaceRootPath() == null || project.workspaceRootPath().isBlank()) {
            throw EngineException.validation("Project has no workspace root path");
        }
        return Path.of(project.workspaceRootPath()).resolve(STATE_DIR_NAME).resolve(STATE_FILE_NAME);
    }

    private void writeJson(Path target, Object value) {
        try {
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            json.writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new EngineException(Kind.PERSISTENCE,
                    "Could not write " + target + ": " + e.getMessage(), e);
        }
    }
}
