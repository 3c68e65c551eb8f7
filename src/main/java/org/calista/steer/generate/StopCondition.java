package org.calista.steer.generate;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides when a particle's sequence is complete. Evaluated after every append.
 */
@FunctionalInterface
public interface StopCondition {

    Set<String> TERMINAL_PUNCTUATION = Set.of(".", "!", "?");

    boolean isDone(SequenceState state);

    default StopCondition or(StopCondition other) {
        Objects.requireNonNull(other, "other");
        return s -> isDone(s) || other.isDone(s);
    }

    /** The generator signalled end of sequence. */
    static StopCondition endOfSequence() {
        return SequenceState::endOfSequence;
    }

    static StopCondition maxTokens(int n) {
        if (n < 1) throw new IllegalArgumentException("maxTokens must be >= 1: " + n);
        return s -> s.length() >= n;
    }

    /** Text ends with '.', '!' or '?'. */
    static StopCondition terminalPunctuation() {
        return s -> endsWithTerminalPunctuation(s.text());
    }

    static StopCondition stopTokens(Set<String> tokens) {
        Set<String> stop = Set.copyOf(tokens);
        return s -> {
            List<String> added = s.appended();
            for (String t : added) if (stop.contains(t)) return true;
            return false;
        };
    }

    static StopCondition never() {
        return s -> false;
    }

    static boolean endsWithTerminalPunctuation(String text) {
        if (text == null) return false;
        String t = text.stripTrailing();
        if (t.isEmpty()) return false;
        return TERMINAL_PUNCTUATION.contains(t.substring(t.length() - 1));
    }
}
