package com.devmanager.orchestrator.backend;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the Manager's raw reply into a {@link BackendResponse}.
 *
 * The reply is classified by its leading marker:
 *   NEED_USER_INPUT: question   → NEED_INPUT
 *   TASK_COMPLETE note          → COMPLETE
 *   SYSTEM_ERROR: detail        → ERROR
 *   anything else               → INSTRUCTION (the whole reply)
 *
 * Models sometimes wrap a marker reply in a code fence or backticks; those
 * are peeled off before matching.
 */
public class ManagerResponseParser {

    public static final String MARKER_NEED_INPUT    = "NEED_USER_INPUT:";
    public static final String MARKER_TASK_COMPLETE = "TASK_COMPLETE";
    public static final String MARKER_SYSTEM_ERROR  = "SYSTEM_ERROR:";

    // ```text\n...\n``` around the whole reply
    private static final Pattern FENCED = Pattern.compile(
            "^```[a-zA-Z]*\\s*\\n(.*?)\\n?```$",
            Pattern.DOTALL
    );

    private ManagerResponseParser() {}

    public static BackendResponse parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return BackendResponse.error("Manager returned an empty response");
        }
        String text = unwrap(raw.strip());

        if (text.startsWith(MARKER_NEED_INPUT)) {
            String question = text.substring(MARKER_NEED_INPUT.length()).strip();
            if (question.isEmpty()) {
                return BackendResponse.error("Manager asked for user input without a question");
            }
            return BackendResponse.needInput(question);
        }
        if (text.startsWith(MARKER_TASK_COMPLETE)) {
            String note = text.substring(MARKER_TASK_COMPLETE.length()).strip();
            if (note.startsWith(":")) note = note.substring(1).strip();
            return BackendResponse.complete(note);
        }
        if (text.startsWith(MARKER_SYSTEM_ERROR)) {
            String detail = text.substring(MARKER_SYSTEM_ERROR.length()).strip();
            return BackendResponse.error(detail.isEmpty() ? "Manager reported an unspecified error" : detail);
        }
        return BackendResponse.instruction(raw.strip());
    }

    private static String unwrap(String text) {
        Matcher m = FENCED.matcher(text);
        if (m.matches()) text = m.group(1).strip();
        if (text.length() > 1 && text.startsWith("`") && text.endsWith("`")) {
            text = text.substring(1, text.length() - 1).strip();
        }
        return text;
    }
}
