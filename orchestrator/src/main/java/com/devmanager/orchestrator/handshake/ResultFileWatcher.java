package com.devmanager.orchestrator.handshake;

import com.devmanager.orchestrator.engine.EngineException;
import com.devmanager.orchestrator.engine.EngineException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Watches one logs directory (not recursively) for the Worker's result file.
 *
 * Runs a single daemon thread around a {@link WatchService}. When the result
 * filename is created the thread waits out the debounce interval, so a Worker
 * that creates the file and then fills it is read only once it has settled,
 * and hands the path to the callback. The callback must not block: the engine
 * passes one that only enqueues a signal.
 *
 * A watcher is single-use. The engine starts a fresh one for every wait and
 * stops it as soon as the wait ends.
 */
public class ResultFileWatcher {

    private static final Logger log = LoggerFactory.getLogger(ResultFileWatcher.class);

    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(5);

    private final Path           logsDir;
    private final String         resultFileName;
    private final Duration       debounce;
    private final Consumer<Path> onResultCreated;

    private WatchService     watchService;
    private Thread           thread;
    private volatile boolean running;

    public ResultFileWatcher(Path logsDir, String resultFileName, Duration debounce,
                             Consumer<Path> onResultCreated) {
        this.logsDir         = logsDir;
        this.resultFileName  = resultFileName;
        this.debounce        = debounce == null ? Duration.ZERO : debounce;
        this.onResultCreated = onResultCreated;
    }

    /**
     * Register the watch and start the observer thread.
     *
     * If the result file is already present once the watch is registered (a
     * fast Worker can finish before we get here) it is reported immediately.
     *
     * @throws EngineException of kind WATCHER if the directory cannot be watched
     */
    public synchronized void start() {
        if (running) return;
        try {
            Files.createDirectories(logsDir);
            watchService = FileSystems.getDefault().newWatchService();
            logsDir.register(watchService, StandardWatchEventKinds.ENTRY_CREATE);
        } catch (IOException | RuntimeException e) {
            closeQuietly();
            throw new EngineException(Kind.WATCHER,
                    "Failed to start file watcher on " + logsDir + ": " + e.getMessage(), e);
        }
        running = true;
        thread = new Thread(this::pollLoop, "result-watcher-" + logsDir.getFileName());
        thread.setDaemon(true);
        thread.start();
        log.info("File watcher started on {}", logsDir);
    }

    /**
     * Stop watching and join the observer thread with a bounded wait.
     * A thread that does not terminate in time is logged and left behind.
     */
    public void stop() {
        Thread t;
        synchronized (this) {
            if (!running && thread == null) return;
            running = false;
            closeQuietly();
            t = thread;
            thread = null;
        }
        if (t == null || t == Thread.currentThread()) return;
        t.interrupt();
        try {
            t.join(JOIN_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            log.warn("File watcher thread {} did not stop within {}; abandoning it", t.getName(), JOIN_TIMEOUT);
        } else {
            log.info("File watcher stopped on {}", logsDir);
        }
    }

    public boolean isRunning() {
        return running;
    }

    // ------------------------------------------------------------------
    // Observer thread
    // ------------------------------------------------------------------

    private void pollLoop() {
        Path target = logsDir.resolve(resultFileName);
        if (Files.exists(target)) {
            log.info("Result file already present when watch started: {}", target);
            fire(target);
        }
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException | ClosedWatchServiceException e) {
                break;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    // Events were dropped; fall back to checking the file directly.
                    if (Files.exists(target)) fire(target);
                    continue;
                }
                Path name = (Path) event.context();
                if (name != null && name.toString().equals(resultFileName)) {
                    fire(logsDir.resolve(name));
                } else {
                    log.debug("Ignoring file event for {}", name);
                }
            }
            if (!key.reset()) {
                log.warn("Watch key for {} is no longer valid", logsDir);
                break;
            }
        }
        log.debug("File watcher loop for {} exited", logsDir);
    }

    private void fire(Path path) {
        if (!debounce.isZero()) {
            try {
                Thread.sleep(debounce.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        if (!running) return;
        log.info("Result file detected: {}", path);
        try {
            onResultCreated.accept(path);
        } catch (RuntimeException e) {
            log.error("Result file callback failed for {}", path, e);
        }
    }

    private void closeQuietly() {
        if (watchService == null) return;
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Could not close watch service for {}: {}", logsDir, e.getMessage());
        }
    }
}
