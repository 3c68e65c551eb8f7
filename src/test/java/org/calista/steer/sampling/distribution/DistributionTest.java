package org.calista.steer.sampling.distribution;

import org.calista.steer.sampling.distribution.impl.DiscreteDistribution;
import org.calista.steer.sampling.distribution.impl.GaussianDistribution;
import org.calista.steer.sampling.distribution.impl.MixtureDistribution;
import org.calista.steer.sampling.distribution.impl.UniformDistribution;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class DistributionTest {

    @Test
    void discrete_shouldMergeDuplicatesAndNormalize() {
        DiscreteDistribution<String> d = new DiscreteDistribution<>(List.of("a", "b", "a"), new double[]{1.0, 2.0, 1.0});

        assertThat(d.values()).containsExactly("a", "b");
        assertThat(d.probability("a")).isCloseTo(0.5, within(1e-12));
        assertThat(d.logPdf("c")).isEqualTo(Double.NEGATIVE_INFINITY);
    }

    @Test
    void discrete_shouldNeverSampleZeroProbabilityValue() {
        Map<String, Double> w = new LinkedHashMap<>();
        w.put("never", 0.0);
        w.put("yes", 1.0);
        w.put("also-never", 0.0);
        DiscreteDistribution<String> d = DiscreteDistribution.of(w);

        SplittableRandom rng = new SplittableRandom(1);
        for (int i = 0; i < 1000; i++) assertThat(d.sample(rng)).isEqualTo("yes");
    }

    @Test
    void discrete_shouldRejectNegativeOrZeroMass() {
        assertThatThrownBy(() -> new DiscreteDistribution<>(List.of("a"), new double[]{-1.0}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DiscreteDistribution<>(List.of("a"), new double[]{0.0}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void gaussian_shouldMatchClosedFormDensity() {
        GaussianDistribution g = GaussianDistribution.standard();

        assertThat(g.logPdf(0.0)).isCloseTo(-0.5 * Math.log(2 * Math.PI), within(1e-12));
        assertThatThrownBy(() -> new GaussianDistribution(0.0, 0.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void uniform_shouldBeZeroOutsideSupport() {
        UniformDistribution u = new UniformDistribution(1.0, 3.0);

        assertThat(u.logPdf(2.0)).isCloseTo(-Math.log(2.0), within(1e-12));
        assertThat(u.logPdf(5.0)).isEqualTo(Double.NEGATIVE_INFINITY);
    }

    @Test
    void mixture_shouldSplitResponsibilitiesBySymmetry() {
        List<Distribution<Double>> parts = List.of(new GaussianDistribution(-1.0, 1.0), new GaussianDistribution(1.0, 1.0));
        MixtureDistribution<Double> m = MixtureDistribution.equal(parts);

        double[] r = m.responsibilities(0.0);
        assertThat(r[0]).isCloseTo(0.5, within(1e-12));
        assertThat(m.withWeights(new double[]{3.0, 1.0}).weights()[0]).isCloseTo(0.75, within(1e-12));
    }

    @Test
    void pdf_shouldBeZeroOutsideSupport() {
        UniformDistribution u = new UniformDistribution(0.0, 2.0);

        assertThat(u.pdf(1.0)).isCloseTo(0.5, within(1e-12));
        assertThat(u.pdf(3.0)).isZero();
        assertThat(new GaussianDistribution(0.0, 1.0).pdf(0.0)).isCloseTo(1.0 / Math.sqrt(2.0 * Math.PI), within(1e-12));
    }

    @Test
    void discrete_shouldGiveFiniteDensityInSupportWithoutTouchingCallerMasses() {
        Map<String, Double> w = new LinkedHashMap<>();
        w.put("a", 1.0);
        w.put("b", 1.0);
        w.put("c", 2.0);
        double[] masses = {3.0, 1.0};

        DiscreteDistribution<String> d = DiscreteDistribution.of(w);
        DiscreteDistribution<String> direct = new DiscreteDistribution<>(List.of("x", "y"), masses);

        assertThat(d.logPdf("b")).isCloseTo(Math.log(0.25), within(1e-12));
        assertThat(d.probability("c")).isCloseTo(0.5, within(1e-12));
        assertThat(w).containsEntry("a", 1.0).containsEntry("b", 1.0).containsEntry("c", 2.0);
        assertThat(direct.probability("x")).isCloseTo(0.75, within(1e-12));
        assertThat(masses).containsExactly(3.0, 1.0);
    }

    @Test
    void discrete_uniformShouldSpreadMassEvenly() {
        DiscreteDistribution<String> d = DiscreteDistribution.uniform(List.of("x", "y"));

        assertThat(d.probabilities()).containsExactly(0.5, 0.5);
        assertThat(d.logPdf("y")).isCloseTo(Math.log(0.5), within(1e-12));
    }

    @Test
    void discrete_shouldSampleOnlyMergedValues() {
        DiscreteDistribution<String> d = new DiscreteDistribution<>(List.of("a", "a", "a", "b"), new double[]{1.0, 1.0, 1.0, 1.0});
        SplittableRandom rng = new SplittableRandom(7);

        int as = 0;
        for (int i = 0; i < 4_000; i++) {
            if (d.sample(rng).equals("a")) as++;
        }

        assertThat(d.size()).isEqualTo(2);
        assertThat(as / 4_000.0).isCloseTo(0.75, within(0.03));
    }
}
