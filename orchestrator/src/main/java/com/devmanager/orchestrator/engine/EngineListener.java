package com.devmanager.orchestrator.engine;

/**
 * Receives every engine notification.
 *
 * Called on whichever thread performed the transition, with the engine lock
 * held: implementations must return quickly and must not call back into the
 * engine. Exceptions are logged and otherwise ignored.
 */
@FunctionalInterface
public interface EngineListener {

    void onEvent(EngineEvent event);
}
