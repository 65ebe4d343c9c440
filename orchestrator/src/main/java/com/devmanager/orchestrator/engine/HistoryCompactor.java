package com.devmanager.orchestrator.engine;

import com.devmanager.orchestrator.model.Turn;

import java.util.List;
import java.util.stream.Collectors;

/**
 * When to compact the conversation and what to feed the summarizer.
 */
public class HistoryCompactor {

    private HistoryCompactor() {}

    /** A summary counts as present only when it has non-blank text. */
    public static boolean hasSummary(String summary) {
        return summary != null && !summary.isBlank();
    }

    /**
     * Summarize when the history length lands on a multiple of the interval,
     * or when there is no summary yet and more than one turn.
     *
     * @param historySize current number of turns
     * @param interval    summarization interval; 0 or less disables the periodic trigger
     * @param hasSummary  whether a context summary already exists
     */
    public static boolean shouldSummarize(int historySize, int interval, boolean hasSummary) {
        boolean periodic = interval > 0 && historySize > 0 && historySize % interval == 0;
        return periodic || (!hasSummary && historySize > 1);
    }

    /**
     * The summarizer's input: the existing summary followed by the last
     * {@code interval} turns, or the whole history when there is no summary.
     */
    public static String compactionInput(String existingSummary, List<Turn> history, int interval) {
        boolean hasSummary = hasSummary(existingSummary);
        List<Turn> turns = history;
        if (hasSummary && interval > 0 && history.size() > interval) {
            turns = history.subList(history.size() - interval, history.size());
        }
        String rendered = turns.stream()
                .map(t -> "[" + t.sender().wireName() + "]: " + t.message())
                .collect(Collectors.joining("\n"));
        if (!hasSummary) {
            return "--- Conversation ---\n" + rendered;
        }
        return "--- Existing summary ---\n" + existingSummary
                + "\n\n--- New conversation turns ---\n" + rendered;
    }
}
