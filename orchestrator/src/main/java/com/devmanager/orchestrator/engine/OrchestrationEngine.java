package com.devmanager.orchestrator.engine;

import com.devmanager.orchestrator.backend.BackendResponse;
import com.devmanager.orchestrator.backend.ManagerBackend;
import com.devmanager.orchestrator.backend.ManagerRequest;
import com.devmanager.orchestrator.config.OrchestratorProperties;
import com.devmanager.orchestrator.engine.EngineException.Kind;
import com.devmanager.orchestrator.engine.EngineSignal.ResultFileCreated;
import com.devmanager.orchestrator.engine.EngineSignal.ResultTimeoutFired;
import com.devmanager.orchestrator.handshake.HandshakeFiles;
import com.devmanager.orchestrator.handshake.ResultFileWatcher;
import com.devmanager.orchestrator.handshake.TimeoutSupervisor;
import com.devmanager.orchestrator.model.EngineState;
import com.devmanager.orchestrator.model.Project;
import com.devmanager.orchestrator.model.ProjectState;
import com.devmanager.orchestrator.model.Sender;
import com.devmanager.orchestrator.model.Turn;
import com.devmanager.orchestrator.persistence.ProjectStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

import static com.devmanager.orchestrator.model.EngineState.ERROR;
import static com.devmanager.orchestrator.model.EngineState.IDLE;
import static com.devmanager.orchestrator.model.EngineState.LOADING_PROJECT;
import static com.devmanager.orchestrator.model.EngineState.PAUSED_WAITING_USER_INPUT;
import static com.devmanager.orchestrator.model.EngineState.PROJECT_SELECTED;
import static com.devmanager.orchestrator.model.EngineState.RUNNING_CALLING_BACKEND;
import static com.devmanager.orchestrator.model.EngineState.RUNNING_PROCESSING_RESULT;
import static com.devmanager.orchestrator.model.EngineState.RUNNING_WAITING_INITIAL_BACKEND;
import static com.devmanager.orchestrator.model.EngineState.RUNNING_WAITING_RESULT;
import static com.devmanager.orchestrator.model.EngineState.TASK_COMPLETE;

/**
 * The Manager/Worker loop for one active project.
 *
 * One cycle:
 *   1. Ask the Manager for the next step (start, resume, or after a result).
 *   2. Write the instruction file and wait for the Worker's result file,
 *      bounded by the result timeout.
 *   3. Read and archive the result, append it to the history, go to 1.
 * The Manager ends the loop with TASK_COMPLETE, parks it with a question for
 * the user, or fails it.
 *
 * Every transition happens under {@link #lock}. User commands take the lock on
 * the caller's thread. The file watcher and the timeout timer never touch
 * engine state: they post {@link EngineSignal}s stamped with the wait cycle,
 * and the "engine-signals" thread applies them under the lock after checking
 * that the engine is still waiting on that same cycle.
 *
 * Manager calls run through {@link BackendCallDispatcher} while the lock is
 * held, so at most one cycle is ever in flight.
 */
public class OrchestrationEngine {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationEngine.class);

    private static final Duration QUIESCE_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration SHUTDOWN_JOIN   = Duration.ofSeconds(2);

    private final OrchestratorProperties props;
    private final ProjectStore           store;
    private final ManagerBackend         backend;
    private final BackendCallDispatcher  dispatcher;
    private final EngineListener         listener;
    private final MeterRegistry          meters;

    private final ReentrantLock               lock     = new ReentrantLock();
    private final BlockingQueue<EngineSignal> signals  = new LinkedBlockingQueue<>();
    private final TimeoutSupervisor           timeouts = new TimeoutSupervisor();
    private final Thread                      signalLoop;

    // --- guarded by lock ---
    private EngineState       state = IDLE;
    private Project           project;
    private ProjectState      projectState;
    private HandshakeFiles    handshake;
    private ResultFileWatcher watcher;
    private long              waitCycle;
    private String            lastError;

    private volatile boolean running = true;

    public OrchestrationEngine(OrchestratorProperties props,
                               ProjectStore store,
                               ManagerBackend backend,
                               BackendCallDispatcher dispatcher,
                               EngineListener listener,
                               MeterRegistry meters) {
        this.props      = props;
        this.store      = store;
        this.backend    = backend;
        this.dispatcher = dispatcher;
        this.listener   = listener;
        this.meters     = meters;

        this.signalLoop = new Thread(this::drainSignals, "engine-signals");
        this.signalLoop.setDaemon(true);
        this.signalLoop.start();
    }

    // =========================================================================
    // User commands
    // =========================================================================

    /**
     * Make {@code p} the active project, quiescing whatever the previous one
     * was doing. A saved pause is restored; every other saved status resumes
     * as PROJECT_SELECTED.
     *
     * @throws EngineException VALIDATION for a null project or a workspace
     *                         that is not an existing directory
     */
    public void setActiveProject(Project p) {
        if (p == null) throw EngineException.validation("project is required");
        if (p.workspaceRootPath() == null || p.workspaceRootPath().isBlank()) {
            throw EngineException.validation("project '" + p.name() + "' has no workspace path");
        }
        Path workspace = Path.of(p.workspaceRootPath());
        if (!Files.isDirectory(workspace)) {
            throw EngineException.validation("workspace is not a directory: " + workspace);
        }

        locked(() -> {
            MDC.put("project", p.name());
            // The outgoing project keeps its last persisted status.
            project      = null;
            projectState = null;
            handshake    = null;
            lastError    = null;
            transition(LOADING_PROJECT);
            status("Loading project '" + p.name() + "'");

            stopWaiting();
            dispatcher.awaitQuiescence(QUIESCE_TIMEOUT);

            ProjectState loaded = store.loadProjectState(p).orElseGet(() -> {
                log.info("No saved state for project '{}', starting fresh", p.name());
                return new ProjectState(p.id());
            });
            if (loaded.getProjectId() == null) loaded.setProjectId(p.id());

            HandshakeFiles files = new HandshakeFiles(workspace,
                    props.getInstructionsDir(), props.getLogsDir(),
                    props.getInstructionFileName(), props.getResultFileName());
            files.ensureDirectories();

            EngineState restored = restoredState(loaded.getCurrentStatus());
            project      = p;
            projectState = loaded;
            handshake    = files;
            transition(restored);
            status("Project '" + p.name() + "' ready (" + loaded.historySize() + " turns)");
            emit(EngineEventType.PROJECT_LOADED,
                    new ProjectLoaded(p.name(), p.overallGoal(), List.copyOf(loaded.getConversationHistory()), restored));
            if (restored == PAUSED_WAITING_USER_INPUT && loaded.getPendingUserQuestion() != null) {
                emit(EngineEventType.USER_INPUT_NEEDED, loaded.getPendingUserQuestion());
            }
        });
    }

    /**
     * Start a run, optionally with an opening message from the user.
     * While paused for user input, non-blank text is treated as the answer.
     * In any other busy state the call is ignored with a status update.
     *
     * @throws EngineException VALIDATION when no project is active
     */
    public void startTask(String initialText) {
        locked(() -> {
            requireProject();
            boolean hasText = initialText != null && !initialText.isBlank();

            if (state == PAUSED_WAITING_USER_INPUT && hasText) {
                resumeLocked(initialText.strip());
                return;
            }
            if (!state.acceptsStart()) {
                log.info("Start ignored: engine busy in {}", state);
                status("Engine busy (" + state + "); start ignored");
                return;
            }

            lastError = null;
            if (hasText) {
                append(Sender.USER, initialText.strip());
            } else {
                append(Sender.SYSTEM, "Task started.");
            }
            summarizeIfDue();
            transition(RUNNING_WAITING_INITIAL_BACKEND);
            status("Asking the Manager for the first step");
            callManager(null);
        });
    }

    /**
     * Answer the Manager's pending question and continue the run.
     *
     * @throws EngineException VALIDATION for blank input or no active project
     */
    public void resumeWithUserInput(String text) {
        if (text == null || text.isBlank()) throw EngineException.validation("user input must not be blank");
        locked(() -> {
            requireProject();
            resumeLocked(text.strip());
        });
    }

    /**
     * Abandon the current wait and park the engine in IDLE, keeping the
     * project bound. The history records the pause; a later start begins a
     * new cycle.
     */
    public void pauseTask() {
        locked(() -> {
            if (state.isRunning()) {
                EngineState from = state;
                stopWaiting();
                append(Sender.SYSTEM, "Task processing paused by user.");
                transition(IDLE);
                status("Paused from " + from + "; start again to continue");
            } else if (state == PAUSED_WAITING_USER_INPUT) {
                status("Already waiting for user input");
            } else {
                status("Nothing to pause in state " + state);
            }
        });
    }

    /** Stop whatever the engine is doing and return to PROJECT_SELECTED. */
    public void stopTask() {
        locked(() -> {
            stopWaiting();
            if (projectState == null) {
                status("No active project; nothing to stop");
                return;
            }
            EngineState from = state;
            projectState.setLastInstructionSent(null);
            projectState.setPendingUserQuestion(null);
            lastError = null;
            append(Sender.SYSTEM, "Task stopped by user from state: " + from + ".");
            transition(PROJECT_SELECTED);
            status("Task stopped");
        });
    }

    /** Release the watcher, the timer and the signal thread. Idempotent. */
    public void shutdown() {
        if (!running) return;
        running = false;
        lock.lock();
        try {
            stopWaiting();
        } finally {
            lock.unlock();
        }
        timeouts.shutdown();
        signals.offer(new EngineSignal.Shutdown(0));
        try {
            signalLoop.join(SHUTDOWN_JOIN.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Orchestration engine shut down");
    }

    // =========================================================================
    // Read side
    // =========================================================================

    public EngineSnapshot snapshot() {
        lock.lock();
        try {
            return new EngineSnapshot(
                    state,
                    project == null ? null : project.name(),
                    lastError,
                    projectState == null ? null : projectState.getPendingUserQuestion(),
                    projectState == null ? null : projectState.getLastInstructionSent(),
                    projectState == null ? 0 : projectState.historySize(),
                    projectState != null && HistoryCompactor.hasSummary(projectState.getContextSummary()));
        } finally {
            lock.unlock();
        }
    }

    public EngineState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public List<Turn> history() {
        lock.lock();
        try {
            return projectState == null ? List.of() : List.copyOf(projectState.getConversationHistory());
        } finally {
            lock.unlock();
        }
    }

    public Optional<Project> activeProject() {
        lock.lock();
        try {
            return Optional.ofNullable(project);
        } finally {
            lock.unlock();
        }
    }

    // =========================================================================
    // Signals from the watcher and the timer
    // =========================================================================

    private void drainSignals() {
        while (running) {
            EngineSignal signal;
            try {
                signal = signals.take();
            } catch (InterruptedException e) {
                break;
            }
            if (signal instanceof EngineSignal.Shutdown) break;
            handleSignal(signal);
        }
        log.debug("Engine signal loop exited");
    }

    /** Apply one background signal under the lock. Package-private for tests. */
    void handleSignal(EngineSignal signal) {
        locked(() -> {
            try (MDC.MDCCloseable ignored = MDC.putCloseable("cycle", String.valueOf(signal.cycle()))) {
                if (signal instanceof ResultFileCreated created) {
                    onResultFile(created);
                } else if (signal instanceof ResultTimeoutFired fired) {
                    onResultTimeout(fired);
                }
            }
        });
    }

    /** The wait cycle currently armed (or last armed). Package-private for tests. */
    long currentWaitCycle() {
        lock.lock();
        try {
            return waitCycle;
        } finally {
            lock.unlock();
        }
    }

    private void onResultFile(ResultFileCreated signal) {
        if (state != RUNNING_WAITING_RESULT || signal.cycle() != waitCycle) {
            log.info("Ignoring result file event for cycle {} (engine in {}, cycle {})",
                    signal.cycle(), state, waitCycle);
            return;
        }
        Path path = signal.path();
        if (!handshake.isResultFile(path)) {
            log.debug("Ignoring file event for unrelated path {}", path);
            return;
        }
        if (!Files.exists(path)) {
            log.warn("Result file {} disappeared before it could be read; still waiting", path);
            return;
        }

        stopWaiting();
        transition(RUNNING_PROCESSING_RESULT);
        status("Reading the Worker's result");
        String content = handshake.readResult(path);
        append(Sender.WORKER_LOG, content);
        handshake.archiveResult(path);

        transition(RUNNING_CALLING_BACKEND);
        status("Sending the Worker's output to the Manager");
        callManager(content);
    }

    private void onResultTimeout(ResultTimeoutFired signal) {
        if (state != RUNNING_WAITING_RESULT || signal.cycle() != waitCycle) {
            log.debug("Ignoring stale result timeout for cycle {}", signal.cycle());
            return;
        }
        stopWatcher();
        meters.counter("devmanager.engine.timeouts").increment();
        fail(Kind.RESULT_TIMEOUT, "Result timeout: the Worker did not write " + handshake.resultFile()
                + " within " + props.getResultTimeout().toSeconds() + " seconds");
    }

    // =========================================================================
    // Cycle steps (lock held)
    // =========================================================================

    private void resumeLocked(String text) {
        if (state != PAUSED_WAITING_USER_INPUT) {
            fail(Kind.VALIDATION, "Cannot resume: wrong state (" + state + ")");
            return;
        }
        projectState.setPendingUserQuestion(null);
        append(Sender.USER, text);
        summarizeIfDue();
        transition(RUNNING_CALLING_BACKEND);
        status("Sending your answer to the Manager");
        callManager(null);
    }

    private void callManager(String latestResult) {
        ManagerRequest request = new ManagerRequest(
                project.overallGoal(),
                projectState.recentTurns(props.getMaxHistoryTurns()),
                projectState.getContextSummary(),
                latestResult,
                props.getMaxContextTokens());

        BackendResponse response;
        try {
            response = dispatcher.dispatch("next_step", () -> backend.nextStep(request), props.getBackendCallTimeout());
        } catch (EngineException e) {
            append(Sender.SYSTEM_ERROR, e.getMessage());
            fail(e.getKind(), e.getMessage());
            return;
        }
        interpret(response);
    }

    private void interpret(BackendResponse response) {
        String content = response.content();
        switch (response.status()) {
            case INSTRUCTION -> {
                if (content.isBlank()) {
                    String msg = "Manager returned an empty instruction";
                    append(Sender.SYSTEM_ERROR, msg);
                    fail(Kind.BACKEND_CALL, msg);
                    return;
                }
                issueInstruction(content);
            }
            case NEED_INPUT -> {
                append(Sender.MANAGER_CLARIFICATION_REQUEST, content);
                projectState.setPendingUserQuestion(content);
                transition(PAUSED_WAITING_USER_INPUT);
                status("The Manager needs your input");
                emit(EngineEventType.USER_INPUT_NEEDED, content);
            }
            case COMPLETE -> {
                String note = content.isBlank() ? "Task marked as complete." : content;
                append(Sender.MANAGER, note);
                transition(TASK_COMPLETE);
                status("Task complete");
                emit(EngineEventType.TASK_COMPLETE, note);
            }
            case ERROR -> {
                String msg = "Manager reported an error: " + content;
                append(Sender.SYSTEM_ERROR, msg);
                fail(Kind.BACKEND_CALL, msg);
            }
        }
    }

    private void issueInstruction(String instruction) {
        projectState.setLastInstructionSent(instruction);
        append(Sender.MANAGER, instruction);
        handshake.archiveStaleResult();
        handshake.writeInstruction(instruction);
        meters.counter("devmanager.engine.instructions").increment();
        awaitResult();
    }

    private void awaitResult() {
        long cycle = ++waitCycle;
        transition(RUNNING_WAITING_RESULT);
        status("Waiting for the Worker to write " + handshake.resultFile());

        watcher = new ResultFileWatcher(handshake.logsDir(), handshake.resultFileName(),
                props.getFileEventDebounce(), path -> signals.offer(new ResultFileCreated(path, cycle)));
        watcher.start();
        timeouts.arm(props.getResultTimeout(), () -> signals.offer(new ResultTimeoutFired(cycle)));
        log.info("Waiting for result (cycle {}, timeout {})", cycle, props.getResultTimeout());
    }

    private void summarizeIfDue() {
        int size = projectState.historySize();
        int interval = props.getSummarizationInterval();
        String existing = projectState.getContextSummary();
        if (!HistoryCompactor.shouldSummarize(size, interval, HistoryCompactor.hasSummary(existing))) return;

        String input = HistoryCompactor.compactionInput(existing, projectState.getConversationHistory(), interval);
        String summary;
        try {
            summary = dispatcher.dispatch("summarize",
                    () -> backend.summarize(input, props.getSummaryMaxTokens()), props.getBackendCallTimeout());
        } catch (EngineException e) {
            log.warn("Summarization failed, keeping the previous summary: {}", e.getMessage());
            return;
        }
        if (summary == null || summary.isBlank()) {
            log.warn("Summarizer returned nothing, keeping the previous summary");
            return;
        }
        int managerTurns = projectState.getManagerTurnsSinceLastSummary();
        projectState.setContextSummary(summary);
        projectState.setManagerTurnsSinceLastSummary(0);
        persist();
        log.info("Context summary updated ({} chars at {} turns, {} Manager turns since the last one)",
                summary.length(), size, managerTurns);
    }

    // =========================================================================
    // Plumbing (lock held)
    // =========================================================================

    /**
     * Run {@code body} under the lock. VALIDATION failures go back to the
     * caller; every other failure becomes an ERROR transition.
     */
    private void locked(Runnable body) {
        lock.lock();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("project", project == null ? "-" : project.name())) {
            body.run();
        } catch (EngineException e) {
            if (e.getKind() == Kind.VALIDATION) throw e;
            fail(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unhandled error in orchestration engine", e);
            fail(Kind.UNHANDLED, "Unexpected error: " + e);
        } finally {
            lock.unlock();
        }
    }

    private void transition(EngineState next) {
        EngineState previous = state;
        state = next;
        if (projectState != null) {
            projectState.setCurrentStatus(next.name());
            persist();
        }
        log.info("State {} -> {}", previous, next);
        emit(EngineEventType.STATE_CHANGE, next);
    }

    /** Enter ERROR. Never throws: a failing save is logged, not escalated. */
    private void fail(Kind kind, String message) {
        String msg = message == null || message.isBlank() ? "Unknown " + kind + " error" : message;
        stopWaiting();
        EngineState previous = state;
        state     = ERROR;
        lastError = msg;
        if (projectState != null) {
            projectState.setCurrentStatus(ERROR.name());
            try {
                persist();
            } catch (EngineException e) {
                log.error("Could not save ERROR state: {}", e.getMessage());
            }
        }
        meters.counter("devmanager.engine.errors", "kind", kind.name()).increment();
        log.error("State {} -> ERROR [{}]: {}", previous, kind, msg);
        emit(EngineEventType.STATE_CHANGE, ERROR);
        emit(EngineEventType.ERROR, new EngineError(kind, msg));
    }

    private void append(Sender sender, String message) {
        Turn turn = Turn.of(sender, message);
        projectState.append(turn);
        persist();
        emit(EngineEventType.NEW_MESSAGE, turn);
    }

    private void persist() {
        store.saveProjectState(project, projectState);
    }

    private void status(String text) {
        emit(EngineEventType.STATUS_UPDATE, text);
    }

    private void emit(EngineEventType type, Object payload) {
        try {
            listener.onEvent(EngineEvent.of(type, payload));
        } catch (RuntimeException e) {
            log.warn("Engine listener failed on {}", type, e);
        }
    }

    private void stopWaiting() {
        timeouts.cancel();
        stopWatcher();
    }

    private void stopWatcher() {
        if (watcher != null) {
            watcher.stop();
            watcher = null;
        }
    }

    private void requireProject() {
        if (project == null || projectState == null) {
            throw EngineException.validation("no active project");
        }
    }

    private static EngineState restoredState(String saved) {
        Optional<EngineState> parsed = EngineState.parse(saved);
        if (parsed.isEmpty()) {
            log.warn("Unknown saved status '{}', resetting to {}", saved, PROJECT_SELECTED);
            return PROJECT_SELECTED;
        }
        if (parsed.get() == PAUSED_WAITING_USER_INPUT) return PAUSED_WAITING_USER_INPUT;
        if (parsed.get() != PROJECT_SELECTED && parsed.get() != IDLE) {
            log.info("Saved status {} cannot be resumed, resetting to {}", parsed.get(), PROJECT_SELECTED);
        }
        return PROJECT_SELECTED;
    }
}
