package com.devmanager.orchestrator.engine;

/**
 * Failure raised anywhere inside the orchestration loop.
 *
 * Unchecked so collaborators (store, handshake files, backend) can throw it
 * without ceremony. The engine catches every kind except VALIDATION at the
 * point of occurrence and turns it into an ERROR transition; VALIDATION is
 * thrown back to the caller with no state change.
 *
 * BACKEND_AUTH and BACKEND_CALL are kept apart so a front-end can prompt for
 * new credentials instead of offering a plain retry.
 */
public class EngineException extends RuntimeException {

    public enum Kind {
        VALIDATION,
        PERSISTENCE,
        FILE_WRITE,
        FILE_READ,
        WATCHER,
        RESULT_TIMEOUT,
        BACKEND_AUTH,
        BACKEND_CALL,
        UNHANDLED
    }

    private final Kind kind;

    public EngineException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EngineException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public static EngineException validation(String message) {
        return new EngineException(Kind.VALIDATION, message);
    }
}
