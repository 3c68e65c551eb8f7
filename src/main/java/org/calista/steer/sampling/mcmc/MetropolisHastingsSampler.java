package org.calista.steer.sampling.mcmc;

import org.calista.steer.sampling.LogDensity;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Metropolis-Hastings: accept x' ~ q(·|x) with probability
 * min(1, π(x')q(x|x') / π(x)q(x'|x)).
 */
public final class MetropolisHastingsSampler<T> extends MarkovChainSampler<T> {

    private final ProposalKernel<T> proposal;

    public MetropolisHastingsSampler(LogDensity<T> target, ProposalKernel<T> proposal) {
        super(target);
        this.proposal = Objects.requireNonNull(proposal, "proposal");
    }

    @Override
    protected Step<T> step(T current, double currentLogDensity, boolean inBurnIn, RandomGenerator rng) {
        T candidate = proposal.propose(current, rng);
        double lpNew = target.logDensity(candidate);

        boolean ok;
        if (lpNew == Double.NEGATIVE_INFINITY || Double.isNaN(lpNew)) {
            ok = false;
        } else {
            double logRatio = lpNew - currentLogDensity;
            if (!proposal.symmetric()) {
                logRatio += proposal.logDensity(current, candidate) - proposal.logDensity(candidate, current);
            }
            ok = accept(logRatio, rng);
        }

        if (inBurnIn) proposal.adapt(ok);
        return new Step<>(candidate, lpNew, ok);
    }

    public ProposalKernel<T> proposal() {
        return proposal;
    }
}
