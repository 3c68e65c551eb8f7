package org.calista.steer.generate.potential;

import org.calista.steer.generate.SequenceState;

import java.util.Objects;

/**
 * Shared name/scope/fatal plumbing for the shipped potentials.
 */
public abstract class AbstractPotential implements Potential {

    private final String name;
    private final PotentialScope scope;
    private final boolean fatalOnError;

    protected AbstractPotential(String name, PotentialScope scope, boolean fatalOnError) {
        this.name = Objects.requireNonNull(name, "name");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.fatalOnError = fatalOnError;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final PotentialScope scope() {
        return scope;
    }

    @Override
    public final boolean fatalOnError() {
        return fatalOnError;
    }

    /** Text this potential judges: the new tokens for INCREMENTAL, the whole sequence for COMPLETE. */
    protected String subject(SequenceState state) {
        return scope == PotentialScope.INCREMENTAL ? state.appendedText() : state.text();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + ", " + scope + "}";
    }
}
