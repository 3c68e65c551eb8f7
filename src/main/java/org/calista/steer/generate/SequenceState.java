package org.calista.steer.generate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SequenceState: the value carried by one generation particle.
 *
 * <p>Immutable. {@link #append(Continuation)} returns a new state and records where the newly
 * appended tokens start, so potentials can score only {@link #appended()}.</p>
 */
public final class SequenceState {

    private final List<String> prompt;
    private final List<String> tokens;
    private final int appendedFrom;
    private final boolean endOfSequence;
    private final boolean done;

    private SequenceState(List<String> prompt, List<String> tokens, int appendedFrom, boolean endOfSequence, boolean done) {
        this.prompt = prompt;
        this.tokens = tokens;
        this.appendedFrom = appendedFrom;
        this.endOfSequence = endOfSequence;
        this.done = done;
    }

    public static SequenceState start(List<String> promptTokens) {
        Objects.requireNonNull(promptTokens, "promptTokens");
        return new SequenceState(List.copyOf(promptTokens), List.of(), 0, false, false);
    }

    /** Whitespace-separated prompt. */
    public static SequenceState start(String prompt) {
        if (prompt == null || prompt.isBlank()) return start(List.of());
        return start(List.of(prompt.trim().split("\\s+")));
    }

    public SequenceState append(Continuation c) {
        Objects.requireNonNull(c, "continuation");
        if (done) throw new IllegalStateException("Cannot append to a finished sequence");
        ArrayList<String> next = new ArrayList<>(tokens.size() + c.tokens().size());
        next.addAll(tokens);
        next.addAll(c.tokens());
        return new SequenceState(prompt, Collections.unmodifiableList(next), tokens.size(), c.isEndOfSequence(), false);
    }

    /** Marks the sequence complete; later steps leave it untouched. */
    public SequenceState finish() {
        if (done) return this;
        return new SequenceState(prompt, tokens, appendedFrom, endOfSequence, true);
    }

    public List<String> prompt() {
        return prompt;
    }

    /** Generated tokens, prompt excluded. */
    public List<String> tokens() {
        return tokens;
    }

    /** Tokens added by the most recent {@link #append(Continuation)}. */
    public List<String> appended() {
        return tokens.subList(appendedFrom, tokens.size());
    }

    public String text() {
        return String.join(" ", tokens);
    }

    public String appendedText() {
        return String.join(" ", appended());
    }

    public int length() {
        return tokens.size();
    }

    public String lastToken() {
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    }

    public boolean endOfSequence() {
        return endOfSequence;
    }

    public boolean done() {
        return done;
    }

    @Override
    public String toString() {
        return "SequenceState{'" + text() + "'" + (done ? ", done" : "") + "}";
    }
}
