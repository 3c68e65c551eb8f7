package org.calista.steer.generate.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.steer.generate.Continuation;
import org.calista.steer.generate.PotentialFailureException;
import org.calista.steer.generate.SequenceState;
import org.calista.steer.generate.StopCondition;
import org.calista.steer.generate.TokenGenerator;
import org.calista.steer.generate.potential.Potential;
import org.calista.steer.generate.potential.PotentialScope;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * One particle, one step: propose, append, decide done-ness, score.
 *
 * <p>Shared by both propagators so batched and per-particle runs weight identically. Stateless
 * apart from its collaborators; safe to call from any worker.</p>
 */
public final class ParticleAdvancer {

    private static final Logger log = LogManager.getLogger(ParticleAdvancer.class);

    private final TokenGenerator generator;
    private final List<Potential> incremental;
    private final List<Potential> complete;
    private final StopCondition stop;

    public ParticleAdvancer(TokenGenerator generator, List<Potential> potentials, StopCondition stop) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.stop = Objects.requireNonNull(stop, "stop");
        Objects.requireNonNull(potentials, "potentials");
        ArrayList<Potential> inc = new ArrayList<>();
        ArrayList<Potential> cmp = new ArrayList<>();
        for (Potential p : potentials) {
            Objects.requireNonNull(p, "potential");
            if (p.scope() == PotentialScope.INCREMENTAL) inc.add(p);
            else cmp.add(p);
        }
        this.incremental = List.copyOf(inc);
        this.complete = List.copyOf(cmp);
    }

    public TokenGenerator generator() {
        return generator;
    }

    /** Calls the generator for one particle. Generator exceptions propagate to the caller. */
    public StepOutcome advance(ProposalRequest r, StepContext ctx) {
        RandomGenerator rng = ctx.rng(r.stream());
        Continuation c = generator.propose(r.state(), rng);
        if (c == null) throw new IllegalStateException(generator.name() + " returned no continuation");
        return settle(r, c, ctx.lastStep());
    }

    /** Applies a continuation that was already proposed (the batched path). */
    public StepOutcome settle(ProposalRequest r, Continuation c, boolean lastStep) {
        SequenceState next = extend(r.state(), c, lastStep);
        return new StepOutcome(r.index(), next, logScore(next));
    }

    SequenceState extend(SequenceState state, Continuation c, boolean lastStep) {
        SequenceState next = state.append(c);
        if (lastStep || next.endOfSequence() || stop.isDone(next)) next = next.finish();
        return next;
    }

    /**
     * Σ log potential over INCREMENTAL potentials, plus COMPLETE potentials when the state is done.
     * Returns -∞ as soon as one potential rules the state out.
     */
    public double logScore(SequenceState state) {
        double sum = 0.0;
        for (Potential p : incremental) {
            sum += logPotential(p, state);
            if (sum == Double.NEGATIVE_INFINITY) return sum;
        }
        if (state.done()) {
            for (Potential p : complete) {
                sum += logPotential(p, state);
                if (sum == Double.NEGATIVE_INFINITY) return sum;
            }
        }
        return sum;
    }

    private double logPotential(Potential p, SequenceState state) {
        double s;
        try {
            if (!p.isSatisfied(state)) return Double.NEGATIVE_INFINITY;
            s = p.score(state);
        } catch (RuntimeException e) {
            if (p.fatalOnError()) throw new PotentialFailureException(p.name(), e);
            log.warn("potential.fail name={} text='{}'", p.name(), state.text(), e);
            return Double.NEGATIVE_INFINITY;
        }
        if (Double.isNaN(s)) {
            log.warn("potential.nan name={} text='{}' -> -inf", p.name(), state.text());
            return Double.NEGATIVE_INFINITY;
        }
        if (s <= 0.0) return Double.NEGATIVE_INFINITY;
        return Math.log(s);
    }
}
