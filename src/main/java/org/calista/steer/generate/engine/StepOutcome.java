package org.calista.steer.generate.engine;

import org.calista.steer.generate.SequenceState;

import java.util.Objects;

/** Advanced state of one particle plus the log-weight increment it earned this step. */
public final class StepOutcome {

    private final int index;
    private final SequenceState state;
    private final double logWeightDelta;

    public StepOutcome(int index, SequenceState state, double logWeightDelta) {
        this.index = index;
        this.state = Objects.requireNonNull(state, "state");
        this.logWeightDelta = logWeightDelta;
    }

    /** Particle whose proposal failed twice: state unchanged, weight zeroed. */
    public static StepOutcome failed(ProposalRequest r) {
        return new StepOutcome(r.index(), r.state(), Double.NEGATIVE_INFINITY);
    }

    public int index() {
        return index;
    }

    public SequenceState state() {
        return state;
    }

    public double logWeightDelta() {
        return logWeightDelta;
    }
}
