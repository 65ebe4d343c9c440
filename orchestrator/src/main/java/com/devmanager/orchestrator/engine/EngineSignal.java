package com.devmanager.orchestrator.engine;

import java.nio.file.Path;

/**
 * Work posted by background threads (watcher, timer) for the engine's signal
 * loop. Each signal carries the wait cycle it was armed for so the loop can
 * discard signals from a wait that has already ended.
 */
sealed interface EngineSignal {

    long cycle();

    record ResultFileCreated(Path path, long cycle) implements EngineSignal {}

    record ResultTimeoutFired(long cycle) implements EngineSignal {}

    /** Wakes the loop during shutdown. */
    record Shutdown(long cycle) implements EngineSignal {}
}
