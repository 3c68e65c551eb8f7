package org.calista.steer.generate;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SequenceStateTest {

    @Test
    void append_shouldTrackNewTokensAndLeaveOriginalUntouched() {
        SequenceState s0 = SequenceState.start("tell me");
        SequenceState s1 = s0.append(Continuation.of("hello"));
        SequenceState s2 = s1.append(new Continuation(List.of("big", "world"), false, 0.0));

        assertThat(s0.tokens()).isEmpty();
        assertThat(s0.prompt()).containsExactly("tell", "me");
        assertThat(s2.text()).isEqualTo("hello big world");
        assertThat(s2.appended()).containsExactly("big", "world");
        assertThat(s2.appendedText()).isEqualTo("big world");
        assertThat(s2.lastToken()).isEqualTo("world");
        assertThat(s2.length()).isEqualTo(3);
    }

    @Test
    void append_shouldRejectFinishedSequence() {
        SequenceState done = SequenceState.start(List.of()).append(Continuation.of("x")).finish();

        assertThat(done.done()).isTrue();
        assertThatThrownBy(() -> done.append(Continuation.of("y"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void append_shouldCarryEndOfSequenceFlag() {
        SequenceState s = SequenceState.start("").append(Continuation.endOfSequence());

        assertThat(s.endOfSequence()).isTrue();
        assertThat(s.done()).isFalse();
        assertThat(StopCondition.endOfSequence().isDone(s)).isTrue();
    }

    @Test
    void stopConditions_shouldCombine() {
        SequenceState s = SequenceState.start("").append(Continuation.of("hi")).append(Continuation.of("."));

        assertThat(StopCondition.terminalPunctuation().isDone(s)).isTrue();
        assertThat(StopCondition.maxTokens(3).isDone(s)).isFalse();
        assertThat(StopCondition.never().or(StopCondition.maxTokens(2)).isDone(s)).isTrue();
        assertThat(StopCondition.stopTokens(Set.of("hi")).isDone(s)).isFalse();
        assertThat(StopCondition.endsWithTerminalPunctuation("done?  ")).isTrue();
        assertThat(StopCondition.endsWithTerminalPunctuation("")).isFalse();
    }
}
