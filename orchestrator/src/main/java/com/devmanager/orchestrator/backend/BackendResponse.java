package com.devmanager.orchestrator.backend;

/**
 * The Manager's decision for one step.
 *
 * content is the instruction text for INSTRUCTION, the question for
 * NEED_INPUT, the completion note for COMPLETE (may be empty) and the
 * error detail for ERROR. Markers are already stripped.
 */
public record BackendResponse(Status status, String content) {

    public enum Status {
        INSTRUCTION,
        NEED_INPUT,
        COMPLETE,
        ERROR
    }

    public BackendResponse {
        if (status == null) throw new IllegalArgumentException("status is required");
        content = content == null ? "" : content;
    }

    public static BackendResponse instruction(String text) { return new BackendResponse(Status.INSTRUCTION, text); }
    public static BackendResponse needInput(String question) { return new BackendResponse(Status.NEED_INPUT, question); }
    public static BackendResponse complete(String note)      { return new BackendResponse(Status.COMPLETE, note); }
    public static BackendResponse error(String detail)       { return new BackendResponse(Status.ERROR, detail); }
}
