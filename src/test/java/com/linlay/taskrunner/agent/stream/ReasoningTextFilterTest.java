package com.linlay.taskrunner.agent.stream;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReasoningTextFilterTest {

    @Test
    void markerSplitAcrossChunksShouldStillBeRecognized() {
        ReasoningTextFilter filter = new ReasoningTextFilter();

        String visible = filter.feed("a<th") + filter.feed("ink>b</think>c") + filter.flush();

        assertThat(visible).isEqualTo("ac");
        assertThat(filter.drainReasoning()).isEqualTo("b");
    }

    @Test
    void outputShouldNotDependOnChunkBoundaries() {
        String text = "Hi <think>plan the answer</think>there!";
        for (int size = 1; size <= text.length(); size++) {
            ReasoningTextFilter filter = new ReasoningTextFilter();
            StringBuilder visible = new StringBuilder();
            for (int start = 0; start < text.length(); start += size) {
                visible.append(filter.feed(text.substring(start, Math.min(text.length(), start + size))));
            }
            visible.append(filter.flush());

            assertThat(visible.toString()).as("chunk size %d", size).isEqualTo("Hi there!");
            assertThat(filter.drainReasoning()).as("chunk size %d", size)
                    .isEqualTo("plan the answer");
        }
    }

    @Test
    void loneClosingMarkerShouldTurnPrecedingTextIntoReasoning() {
        ReasoningTextFilter filter = new ReasoningTextFilter();

        String visible = filter.feed("checking the units</think>42 km") + filter.flush();

        assertThat(visible).isEqualTo("42 km");
        assertThat(filter.drainReasoning()).isEqualTo("checking the units");
    }

    @Test
    void reasoningShouldStayHiddenAcrossChunks() {
        ReasoningTextFilter filter = new ReasoningTextFilter();

        assertThat(filter.feed("<think>Let me")).isEmpty();
        assertThat(filter.inside()).isTrue();
        assertThat(filter.feed(" think</think>")).isEmpty();
        assertThat(filter.feed("Answer: 42")).isEqualTo("Answer: 42");
        assertThat(filter.flush()).isEmpty();
        assertThat(filter.drainReasoning()).isEqualTo("Let me think");
        assertThat(filter.drainReasoning()).isEmpty();
    }

    @Test
    void flushInsideReasoningShouldDropUnterminatedText() {
        ReasoningTextFilter filter = new ReasoningTextFilter();

        assertThat(filter.feed("ok <think>never closed")).isEqualTo("ok ");
        assertThat(filter.flush()).isEmpty();
        assertThat(filter.inside()).isFalse();
        assertThat(filter.drainReasoning()).isEqualTo("never closed");
    }

    @Test
    void flushShouldStripDanglingPartialMarker() {
        ReasoningTextFilter filter = new ReasoningTextFilter();

        assertThat(filter.feed("done <thi")).isEqualTo("done ");
        assertThat(filter.flush()).isEmpty();
    }

    @Test
    void customMarkersShouldBeHonoured() {
        ReasoningTextFilter filter = new ReasoningTextFilter("[[", "]]");

        String visible = filter.feed("x[[hidden]") + filter.feed("]y") + filter.flush();

        assertThat(visible).isEqualTo("xy");
        assertThat(filter.drainReasoning()).isEqualTo("hidden");
    }

    @Test
    void identicalMarkersShouldBeRejected() {
        assertThatThrownBy(() -> new ReasoningTextFilter("|", "|"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void heldSuffixShouldBeLongestStrictMarkerPrefix() {
        assertThat(ReasoningTextFilter.heldSuffixLength("abc<thi", "<think>")).isEqualTo(4);
        assertThat(ReasoningTextFilter.heldSuffixLength("abc", "<think>")).isZero();
        assertThat(ReasoningTextFilter.heldSuffixLength("<think>", "<think>")).isEqualTo(0);
    }
}
