package org.calista.steer.generate;

import java.util.List;
import java.util.Objects;

/**
 * One proposal from the token generator: the tokens to append and whether the generator
 * considers the sequence finished.
 */
public final class Continuation {

    private final List<String> tokens;
    private final boolean endOfSequence;
    private final double logProb;

    public Continuation(List<String> tokens, boolean endOfSequence, double logProb) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        this.endOfSequence = endOfSequence;
        this.logProb = logProb;
    }

    public static Continuation of(String token) {
        return new Continuation(List.of(token), false, 0.0);
    }

    public static Continuation of(String token, double logProb) {
        return new Continuation(List.of(token), false, logProb);
    }

    public static Continuation endOfSequence() {
        return new Continuation(List.of(), true, 0.0);
    }

    public List<String> tokens() {
        return tokens;
    }

    public boolean isEndOfSequence() {
        return endOfSequence;
    }

    /** log q of the proposal under the generator; informational. */
    public double logProb() {
        return logProb;
    }

    @Override
    public String toString() {
        return endOfSequence ? tokens + "<eos>" : tokens.toString();
    }
}
