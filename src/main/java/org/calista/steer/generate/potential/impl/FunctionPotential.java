package org.calista.steer.generate.potential.impl;

import org.calista.steer.generate.SequenceState;
import org.calista.steer.generate.potential.AbstractPotential;
import org.calista.steer.generate.potential.PotentialScope;

import java.util.Objects;
import java.util.function.ToDoubleFunction;

/** Potential backed by a caller-supplied scorer. The scorer must be thread-safe. */
public final class FunctionPotential extends AbstractPotential {

    private final ToDoubleFunction<SequenceState> scorer;

    public FunctionPotential(String name, PotentialScope scope, boolean fatalOnError, ToDoubleFunction<SequenceState> scorer) {
        super(name, scope, fatalOnError);
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    public static FunctionPotential incremental(String name, ToDoubleFunction<SequenceState> scorer) {
        return new FunctionPotential(name, PotentialScope.INCREMENTAL, false, scorer);
    }

    public static FunctionPotential complete(String name, ToDoubleFunction<SequenceState> scorer) {
        return new FunctionPotential(name, PotentialScope.COMPLETE, false, scorer);
    }

    @Override
    public double score(SequenceState state) {
        return scorer.applyAsDouble(state);
    }
}
