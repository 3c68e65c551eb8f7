package org.calista.steer.generate.potential.impl;

import org.calista.steer.generate.Continuation;
import org.calista.steer.generate.SequenceState;
import org.calista.steer.generate.potential.PotentialScope;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs real JavaScript through GraalVM; interpreter mode is enough.
 */
@Tag("integration")
class ScriptPotentialTest {

    private static SequenceState seq(String... tokens) {
        SequenceState s = SequenceState.start(List.of());
        for (String t : tokens) s = s.append(Continuation.of(t));
        return s;
    }

    @Test
    void score_shouldCallScriptFunction() {
        String js = "function score(text, appendedText, done) { return text.indexOf('rain') >= 0 ? 1.0 : 0.5; }";
        try (ScriptPotential p = ScriptPotential.standalone("rain", PotentialScope.COMPLETE, js)) {
            assertThat(p.score(seq("light", "rain"))).isEqualTo(1.0);
            assertThat(p.score(seq("sunny"))).isEqualTo(0.5);
        }
    }

    @Test
    void score_shouldSeeAppendedTextAndDoneFlag() {
        String js = "function score(text, appendedText, done) { return (done ? 10 : 0) + appendedText.length; }";
        try (ScriptPotential p = ScriptPotential.standalone("probe", PotentialScope.INCREMENTAL, js)) {
            assertThat(p.score(seq("ab", "cde"))).isEqualTo(3.0);
            assertThat(p.score(seq("ab", "cde").finish())).isEqualTo(13.0);
        }
    }

    @Test
    void standalone_shouldRejectScriptWithoutScoreFunction() {
        assertThatThrownBy(() -> ScriptPotential.standalone("bad", PotentialScope.COMPLETE, "var x = 1;"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void score_shouldFailOnNonNumericResult() {
        String js = "function score(text, appendedText, done) { return 'yes'; }";
        try (ScriptPotential p = ScriptPotential.standalone("str", PotentialScope.COMPLETE, js)) {
            assertThatThrownBy(() -> p.score(seq("a"))).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void score_shouldWrapScriptErrors() {
        String js = "function score(text, appendedText, done) { throw new Error('boom'); }";
        try (ScriptPotential p = ScriptPotential.standalone("thrower", PotentialScope.COMPLETE, js)) {
            assertThatThrownBy(() -> p.score(seq("a"))).isInstanceOf(IllegalStateException.class).hasMessageContaining("boom");
        }
    }
}
