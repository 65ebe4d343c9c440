package com.devmanager.orchestrator.backend;

import com.devmanager.orchestrator.model.Turn;

import java.util.ArrayList;
import java.util.List;

import static com.devmanager.orchestrator.backend.ManagerResponseParser.MARKER_NEED_INPUT;
import static com.devmanager.orchestrator.backend.ManagerResponseParser.MARKER_SYSTEM_ERROR;
import static com.devmanager.orchestrator.backend.ManagerResponseParser.MARKER_TASK_COMPLETE;

/**
 * Prompt text for the Manager.
 *
 * The system prompt is the standing operating procedure: one instruction per
 * reply, or exactly one of the three markers. The user message is rebuilt on
 * every call from the goal, the compacted summary, the recent history and the
 * Worker's latest output.
 */
public class ManagerPrompts {

    private ManagerPrompts() {}

    public static final String MANAGER_SYSTEM_PROMPT = """
            You are the Manager in a development loop. You break the user's overall goal
            into a sequence of precise, self-contained instructions for the Worker, a
            code-editing tool that reads one instruction file, carries it out, and writes
            a plain-text log of what it did.

            WORKFLOW
              1. Read the overall goal, the summary of earlier conversation (if any),
                 the recent history and the Worker's latest output.
              2. Decide the single most logical next step.
              3. Reply in exactly ONE of the formats below.

            REPLY FORMATS
              - An instruction for the Worker: output the instruction text only.
                This is the most common reply. Instructions must be explicit and
                self-contained; the Worker does not remember earlier instructions.
                Include complete code when you provide code.
              - A question for the user: start with `NEED_USER_INPUT:` followed by
                one clear, concise question.
              - The overall goal is done: start with `TASK_COMPLETE` followed by a
                short confirmation.
              - You cannot continue: start with `SYSTEM_ERROR:` followed by a short
                description. Use this for your own failures, not for Worker errors.

            RULES
              - When the Worker reports a failure, analyse its output and decide whether
                to retry, change the instruction, or ask the user.
              - Prefer instructions that are safe to run twice.
              - No conversational filler outside a NEED_USER_INPUT question.
              - Prefer the recent history over the summary when they disagree.
            """;

    public static final String SUMMARY_SYSTEM_PROMPT = """
            You summarize a long Manager/Worker development conversation so it can be
            continued with less context. Keep decisions, file names, open problems and
            the current step. Drop pleasantries and repeated output. Reply with the
            summary text only.
            """;

    /** Build the per-call user message for a next-step decision. */
    public static String nextStepMessage(ManagerRequest request) {
        List<String> parts = new ArrayList<>();
        parts.add("Overall project goal: " + nullToEmpty(request.projectGoal()));

        if (request.contextSummary() != null && !request.contextSummary().isBlank()) {
            parts.add("\n--- Summary of earlier conversation ---\n" + request.contextSummary());
        }

        parts.add("\n--- Recent conversation history (oldest to newest) ---");
        for (Turn turn : request.recentHistory()) {
            parts.add(describe(turn));
        }

        if (request.latestResult() != null) {
            String result = request.latestResult().isBlank() ? "[No output from the Worker]" : request.latestResult();
            parts.add("\n--- Output from the Worker's last step ---\n" + result);
        }

        parts.add("\n--- Your next step ---");
        parts.add("Based on all of the above, give the next instruction or use one of the markers ("
                + MARKER_NEED_INPUT + ", " + MARKER_TASK_COMPLETE + ", " + MARKER_SYSTEM_ERROR + ").");
        return String.join("\n", parts);
    }

    /** Build the user message for a summarization call. */
    public static String summaryMessage(String text, int maxTokens) {
        return text
                + "\n\n--- End of conversation ---\n"
                + "Write the new, comprehensive summary (at most " + maxTokens + " tokens).";
    }

    private static String describe(Turn turn) {
        String label = switch (turn.sender()) {
            case USER                          -> "User";
            case MANAGER                       -> "Your previous instruction";
            case MANAGER_CLARIFICATION_REQUEST -> "Your previous question to the user";
            case WORKER_LOG                    -> "Worker output";
            case SYSTEM                        -> "System message";
            case SYSTEM_ERROR                  -> "System error";
        };
        return label + ": " + turn.message();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
