package org.calista.steer.generate.engine;

import org.calista.steer.sampling.Weights;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Several continuations per particle in one step.
 *
 * <p>{@link #expand} turns each live request into {@code k} candidate requests on distinct random
 * streams; {@link #reduce} keeps one outcome per particle, drawn in proportion to the incremental
 * weights of its candidates. The kept outcome carries log(mean exp(delta)) over the candidates so
 * that the population weights stay properly corrected for the choice.</p>
 */
final class CandidateSelection {

    private CandidateSelection() {}

    /** Candidate {@code j} of particle {@code i} draws from stream {@code i * k + j}. */
    static List<ProposalRequest> expand(List<ProposalRequest> live, int k) {
        if (k == 1) return live;
        ArrayList<ProposalRequest> out = new ArrayList<>(live.size() * k);
        for (ProposalRequest r : live) {
            for (int j = 0; j < k; j++) {
                out.add(new ProposalRequest(r.index(), r.index() * k + j, r.state()));
            }
        }
        return out;
    }

    /**
     * One outcome per consecutive group of {@code k}. A group whose candidates all scored zero
     * keeps its first candidate with weight zero.
     */
    static List<StepOutcome> reduce(List<StepOutcome> outcomes, int k, RandomGenerator rng) {
        if (k == 1) return outcomes;
        if (outcomes.size() % k != 0) {
            throw new IllegalArgumentException("outcomes (" + outcomes.size() + ") not a multiple of k=" + k);
        }

        ArrayList<StepOutcome> kept = new ArrayList<>(outcomes.size() / k);
        double[] deltas = new double[k];
        for (int from = 0; from < outcomes.size(); from += k) {
            for (int j = 0; j < k; j++) deltas[j] = outcomes.get(from + j).logWeightDelta();

            // group g always consumes draw g
            double u = rng.nextDouble();
            if (Weights.collapsed(deltas)) {
                StepOutcome first = outcomes.get(from);
                kept.add(new StepOutcome(first.index(), first.state(), Double.NEGATIVE_INFINITY));
                continue;
            }

            int pick = Weights.search(Weights.cumulative(Weights.normalize(deltas)), u);
            StepOutcome chosen = outcomes.get(from + pick);
            double logMean = Weights.logSumExp(deltas) - Math.log(k);
            kept.add(new StepOutcome(chosen.index(), chosen.state(), logMean));
        }
        return kept;
    }
}
