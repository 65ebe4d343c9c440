package com.devmanager.orchestrator.api;

import com.devmanager.orchestrator.engine.EngineEvent;
import com.devmanager.orchestrator.engine.EngineEventLog;
import com.devmanager.orchestrator.engine.EngineEventType;
import com.devmanager.orchestrator.engine.EngineException;
import com.devmanager.orchestrator.engine.EngineSnapshot;
import com.devmanager.orchestrator.engine.OrchestrationEngine;
import com.devmanager.orchestrator.model.EngineState;
import com.devmanager.orchestrator.model.Project;
import com.devmanager.orchestrator.model.Sender;
import com.devmanager.orchestrator.model.Turn;
import com.devmanager.orchestrator.persistence.ProjectStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for EngineController.
 *
 * Only the web layer is started; the engine, the store and the event log are
 * mocks, so no threads, files or Manager calls are involved.
 */
@WebMvcTest(EngineController.class)
class EngineControllerTest {

    @Autowired   MockMvc             mockMvc;
    @MockitoBean OrchestrationEngine engine;
    @MockitoBean ProjectStore        projectStore;
    @MockitoBean EngineEventLog      eventLog;

    private static final Project DEMO = new Project("id-1", "demo", "/work/demo", "Build a CLI");

    private static EngineSnapshot snapshot(EngineState state) {
        return new EngineSnapshot(state, "demo", null, null, "step 1", 3, false);
    }

    // ------------------------------------------------------------------
    // Projects
    // ------------------------------------------------------------------

    @Test
    void listProjects_returnsAll() throws Exception {
        when(projectStore.loadProjects()).thenReturn(List.of(DEMO));

        mockMvc.perform(get("/projects"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("demo"))
                .andExpect(jsonPath("$[0].workspaceRootPath").value("/work/demo"));
    }

    @Test
    void createProject_valid_returns201() throws Exception {
        when(projectStore.addProject("demo", "/work/demo", "Build a CLI")).thenReturn(DEMO);

        mockMvc.perform(post("/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"demo","workspaceRootPath":"/work/demo","overallGoal":"Build a CLI"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("id-1"));
    }

    @Test
    void createProject_duplicate_returns400() throws Exception {
        when(projectStore.addProject(any(), any(), any()))
                .thenThrow(EngineException.validation("A project named 'demo' already exists"));

        mockMvc.perform(post("/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"demo","workspaceRootPath":"/work/demo","overallGoal":"x"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION"));
    }

    // ------------------------------------------------------------------
    // Engine commands
    // ------------------------------------------------------------------

    @Test
    void selectProject_known_activatesAndReturnsStatus() throws Exception {
        when(projectStore.findByName("demo")).thenReturn(Optional.of(DEMO));
        when(engine.snapshot()).thenReturn(snapshot(EngineState.PROJECT_SELECTED));

        mockMvc.perform(post("/engine/project")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"demo\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("PROJECT_SELECTED"));
        verify(engine).setActiveProject(DEMO);
    }

    @Test
    void selectProject_unknown_returns404() throws Exception {
        when(projectStore.findByName("nope")).thenReturn(Optional.empty());

        mockMvc.perform(post("/engine/project")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"nope\"}"))
                .andExpect(status().isNotFound());
        verify(engine, never()).setActiveProject(any());
    }

    @Test
    void start_withoutBody_startsWithNoText() throws Exception {
        when(engine.snapshot()).thenReturn(snapshot(EngineState.RUNNING_WAITING_RESULT));

        mockMvc.perform(post("/engine/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("RUNNING_WAITING_RESULT"))
                .andExpect(jsonPath("$.lastInstructionSent").value("step 1"));
        verify(engine).startTask(isNull());
    }

    @Test
    void start_noActiveProject_returns400() throws Exception {
        doThrow(EngineException.validation("no active project")).when(engine).startTask(any());

        mockMvc.perform(post("/engine/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"go\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("no active project"));
    }

    @Test
    void resume_passesTextToEngine() throws Exception {
        when(engine.snapshot()).thenReturn(snapshot(EngineState.RUNNING_WAITING_RESULT));

        mockMvc.perform(post("/engine/resume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Postgres\"}"))
                .andExpect(status().isOk());
        verify(engine).resumeWithUserInput("Postgres");
    }

    @Test
    void pauseAndStop_delegateToEngine() throws Exception {
        when(engine.snapshot()).thenReturn(snapshot(EngineState.IDLE));

        mockMvc.perform(post("/engine/pause")).andExpect(status().isOk());
        mockMvc.perform(post("/engine/stop")).andExpect(status().isOk());

        verify(engine).pauseTask();
        verify(engine).stopTask();
    }

    // ------------------------------------------------------------------
    // Read side
    // ------------------------------------------------------------------

    @Test
    void history_returnsTurnsWithWireSenderNames() throws Exception {
        when(engine.history()).thenReturn(List.of(Turn.of(Sender.WORKER_LOG, "created main.py")));

        mockMvc.perform(get("/engine/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].sender").value("worker_log"))
                .andExpect(jsonPath("$[0].message").value("created main.py"));
    }

    @Test
    void events_returnsRecentEvents() throws Exception {
        when(eventLog.recent(5)).thenReturn(List.of(EngineEvent.of(EngineEventType.STATUS_UPDATE, "Task stopped")));

        mockMvc.perform(get("/engine/events").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].type").value("STATUS_UPDATE"))
                .andExpect(jsonPath("$[0].payload").value("Task stopped"));
    }
}
