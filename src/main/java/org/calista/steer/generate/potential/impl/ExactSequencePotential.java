package org.calista.steer.generate.potential.impl;

import org.calista.steer.generate.SequenceState;
import org.calista.steer.generate.potential.AbstractPotential;
import org.calista.steer.generate.potential.PotentialScope;

import java.util.List;
import java.util.Objects;

/** Only one finished token sequence is acceptable. */
public final class ExactSequencePotential extends AbstractPotential {

    private final List<String> target;

    public ExactSequencePotential(List<String> target) {
        super("exact:" + String.join(" ", target), PotentialScope.COMPLETE, false);
        this.target = List.copyOf(Objects.requireNonNull(target, "target"));
    }

    public static ExactSequencePotential of(String... tokens) {
        return new ExactSequencePotential(List.of(tokens));
    }

    @Override
    public boolean isSatisfied(SequenceState state) {
        return state.length() == target.size();
    }

    @Override
    public double score(SequenceState state) {
        return state.tokens().equals(target) ? 1.0 : 0.0;
    }
}
