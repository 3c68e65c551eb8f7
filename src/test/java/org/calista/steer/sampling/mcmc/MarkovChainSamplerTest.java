package org.calista.steer.sampling.mcmc;

import org.calista.steer.sampling.distribution.impl.GaussianDistribution;
import org.calista.steer.sampling.mcmc.impl.AdaptiveProposal;
import org.calista.steer.sampling.mcmc.impl.GaussianProposal;
import org.calista.steer.sampling.mcmc.impl.GaussianVectorProposal;
import org.calista.steer.sampling.mcmc.impl.LogNormalProposal;
import org.calista.steer.sampling.mcmc.impl.UniformProposal;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class MarkovChainSamplerTest {

    private static final GaussianDistribution TARGET = new GaussianDistribution(2.0, 1.0);

    @Test
    void metropolisHastings_shouldRecoverGaussianMean() {
        MetropolisHastingsSampler<Double> mh = new MetropolisHastingsSampler<>(TARGET::logPdf, new GaussianProposal(1.5));

        ChainResult<Double> r = mh.sample(0.0, 20_000, 2_000, 1, new SplittableRandom(1));

        assertThat(r.size()).isEqualTo(20_000);
        assertThat(r.mean(x -> x)).isCloseTo(2.0, within(0.1));
        assertThat(r.acceptanceRate()).isBetween(0.2, 0.9);
        assertThat(r.effectiveSampleSize(x -> x)).isLessThanOrEqualTo(20_000.0);
    }

    @Test
    void metropolisHastings_shouldNeverLeaveSupport() {
        MetropolisHastingsSampler<Double> mh = new MetropolisHastingsSampler<>(
                x -> (x >= 0.0 && x <= 1.0) ? 0.0 : Double.NEGATIVE_INFINITY, new UniformProposal(0.3));

        ChainResult<Double> r = mh.sample(0.5, 5_000, 0, 1, new SplittableRandom(3));

        assertThat(r.samples()).allSatisfy(x -> assertThat(x).isBetween(0.0, 1.0));
        assertThat(r.mean(x -> x)).isCloseTo(0.5, within(0.05));
    }

    @Test
    void sample_shouldThinAndRejectZeroDensityStart() {
        MetropolisHastingsSampler<Double> mh = new MetropolisHastingsSampler<>(TARGET::logPdf, new GaussianProposal(1.0));

        assertThat(mh.sample(0.0, 100, 10, 5, new SplittableRandom(2)).proposals()).isEqualTo(510L);

        MetropolisHastingsSampler<Double> bounded = new MetropolisHastingsSampler<>(
                x -> x > 0 ? 0.0 : Double.NEGATIVE_INFINITY, new GaussianProposal(1.0));
        assertThatThrownBy(() -> bounded.sample(-1.0, 10, 0, 1, new SplittableRandom(2)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void adaptiveProposal_shouldMoveTowardsTargetAcceptance() {
        AdaptiveProposal kernel = new AdaptiveProposal(50.0);
        MetropolisHastingsSampler<Double> mh = new MetropolisHastingsSampler<>(TARGET::logPdf, kernel);

        mh.sample(2.0, 1_000, 5_000, 1, new SplittableRandom(4));

        assertThat(kernel.scale()).isLessThan(50.0);
        assertThat(kernel.observedAcceptance()).isBetween(0.0, 1.0);
    }

    @Test
    void gibbs_shouldSampleIndependentCoordinates() {
        GibbsSampler.FullConditional first = (x, i, rng) -> 1.0 + rng.nextGaussian();
        GibbsSampler.FullConditional second = (x, i, rng) -> -1.0 + rng.nextGaussian();
        GibbsSampler gibbs = new GibbsSampler(List.of(first, second));

        ChainResult<double[]> r = gibbs.sample(new double[]{0.0, 0.0}, 10_000, 100, 1, new SplittableRandom(5));

        assertThat(gibbs.dimension()).isEqualTo(2);
        assertThat(r.acceptanceRate()).isEqualTo(1.0);
        assertThat(r.mean(x -> x[0])).isCloseTo(1.0, within(0.05));
        assertThat(r.mean(x -> x[1])).isCloseTo(-1.0, within(0.05));
    }

    @Test
    void hamiltonian_shouldRecoverStandardNormalMean() {
        HamiltonianSampler hmc = new HamiltonianSampler(
                x -> -0.5 * (x[0] - 1.0) * (x[0] - 1.0),
                x -> new double[]{-(x[0] - 1.0)},
                0.2, 10);

        ChainResult<double[]> r = hmc.sample(new double[]{0.0}, 5_000, 500, 1, new SplittableRandom(6));

        assertThat(r.mean(x -> x[0])).isCloseTo(1.0, within(0.1));
        assertThat(r.acceptanceRate()).isGreaterThan(0.8);
    }

    @Test
    void logNormalProposal_shouldStayPositiveAndCorrectAsymmetry() {
        // Exponential(1): log density -x on x > 0, mean 1
        MetropolisHastingsSampler<Double> mh = new MetropolisHastingsSampler<>(
                x -> x > 0 ? -x : Double.NEGATIVE_INFINITY, new LogNormalProposal(0.8));

        ChainResult<Double> r = mh.sample(1.0, 30_000, 2_000, 1, new SplittableRandom(8));

        assertThat(r.samples()).allSatisfy(x -> assertThat(x).isPositive());
        assertThat(r.mean(x -> x)).isCloseTo(1.0, within(0.1));
    }

    @Test
    void gaussianVectorProposal_shouldSampleCorrelatedFreeTarget() {
        MetropolisHastingsSampler<double[]> mh = new MetropolisHastingsSampler<>(
                x -> -0.5 * ((x[0] - 1.0) * (x[0] - 1.0) + (x[1] + 2.0) * (x[1] + 2.0)),
                new GaussianVectorProposal(0.8));

        ChainResult<double[]> r = mh.sample(new double[]{0.0, 0.0}, 20_000, 1_000, 1, new SplittableRandom(9));

        assertThat(r.mean(x -> x[0])).isCloseTo(1.0, within(0.15));
        assertThat(r.mean(x -> x[1])).isCloseTo(-2.0, within(0.15));
    }
}
