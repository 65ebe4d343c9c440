package com.devmanager.orchestrator.engine;

import com.devmanager.orchestrator.model.Sender;
import com.devmanager.orchestrator.model.Turn;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HistoryCompactorTest {

    // ------------------------------------------------------------------
    // shouldSummarize()
    // ------------------------------------------------------------------

    @Test
    void shouldSummarize_matchesTriggerForAllSmallInputs() {
        for (int interval = -1; interval <= 5; interval++) {
            for (int size = 0; size <= 25; size++) {
                for (boolean hasSummary : new boolean[]{true, false}) {
                    boolean expected = (interval > 0 && size > 0 && size % interval == 0)
                            || (!hasSummary && size > 1);
                    assertThat(HistoryCompactor.shouldSummarize(size, interval, hasSummary))
                            .as("size=%d interval=%d hasSummary=%s", size, interval, hasSummary)
                            .isEqualTo(expected);
                }
            }
        }
    }

    @Test
    void shouldSummarize_emptyOrSingleTurnWithoutSummary_isFalse() {
        assertThat(HistoryCompactor.shouldSummarize(0, 10, false)).isFalse();
        assertThat(HistoryCompactor.shouldSummarize(1, 10, false)).isFalse();
    }

    @Test
    void shouldSummarize_disabledIntervalWithSummary_neverFires() {
        assertThat(HistoryCompactor.shouldSummarize(20, 0, true)).isFalse();
    }

    @Test
    void hasSummary_blankCountsAsAbsent() {
        assertThat(HistoryCompactor.hasSummary(null)).isFalse();
        assertThat(HistoryCompactor.hasSummary("  \n")).isFalse();
        assertThat(HistoryCompactor.hasSummary("earlier work")).isTrue();
    }

    // ------------------------------------------------------------------
    // compactionInput()
    // ------------------------------------------------------------------

    @Test
    void compactionInput_noSummary_usesWholeHistory() {
        List<Turn> history = turns(12);

        String input = HistoryCompactor.compactionInput(null, history, 10);

        assertThat(input).contains("[user]: turn 0").contains("[user]: turn 11");
        assertThat(input).doesNotContain("Existing summary");
    }

    @Test
    void compactionInput_withSummary_usesSummaryAndLastIntervalTurns() {
        List<Turn> history = turns(12);

        String input = HistoryCompactor.compactionInput("earlier work", history, 10);

        assertThat(input).startsWith("--- Existing summary ---\nearlier work");
        assertThat(input).doesNotContain("turn 1\n").contains("turn 2").contains("turn 11");
    }

    @Test
    void compactionInput_blankSummary_isTreatedAsNoSummary() {
        List<Turn> history = turns(12);

        String input = HistoryCompactor.compactionInput("   ", history, 10);

        assertThat(input).startsWith("--- Conversation ---").contains("[user]: turn 0");
    }

    private static List<Turn> turns(int n) {
        List<Turn> list = new ArrayList<>();
        for (int i = 0; i < n; i++) list.add(Turn.of(Sender.USER, "turn " + i));
        return list;
    }
}
