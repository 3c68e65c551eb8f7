package org.calista.steer.sampling.filter;

import org.calista.steer.sampling.distribution.impl.GaussianDistribution;
import org.calista.steer.sampling.distribution.impl.UniformDistribution;
import org.calista.steer.sampling.filter.impl.GaussianObservationModel;
import org.calista.steer.sampling.filter.impl.LinearGaussianSystemModel;
import org.calista.steer.sampling.filter.impl.RandomWalkModel;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class ParticleFilterTest {

    private static ObservationModel<Double, Double> gaussianObservation(double std) {
        GaussianDistribution noise = new GaussianDistribution(0.0, std);
        return (obs, state) -> noise.logPdf(obs - state);
    }

    @Test
    void step_shouldTrackStationaryTarget() {
        ParticleFilter<Double, Double> pf = ParticleFilter.builder(new RandomWalkModel(0.0, 0.2), gaussianObservation(0.5))
                .numParticles(500)
                .seed(11L)
                .build();
        pf.initialize(new UniformDistribution(-10.0, 10.0));

        for (int t = 0; t < 30; t++) pf.step(3.0, 1.0);

        assertThat(pf.estimate(x -> x)).isCloseTo(3.0, within(0.5));
        assertThat(pf.steps()).isEqualTo(30);
        assertThat(pf.resampleCount()).isPositive();
    }

    @Test
    void update_shouldKeepWeightsNormalized() {
        ParticleFilter<Double, Double> pf = ParticleFilter.builder(new RandomWalkModel(0.0, 1.0), gaussianObservation(1.0))
                .numParticles(50)
                .essThreshold(0.0)
                .build();
        pf.initialize(new GaussianDistribution(0.0, 2.0));

        pf.step(1.0, 1.0);

        double sum = 0.0;
        for (double w : pf.population().normalizedWeights()) sum += w;
        assertThat(sum).isCloseTo(1.0, within(1e-9));
        assertThat(pf.resampleCount()).isZero();
    }

    @Test
    void seed_shouldMakeRunsReproducible() {
        double a = runOnce(5L);
        double b = runOnce(5L);

        assertThat(a).isEqualTo(b);
    }

    private static double runOnce(long seed) {
        ParticleFilter<Double, Double> pf = ParticleFilter.builder(new RandomWalkModel(0.1, 0.5), gaussianObservation(1.0))
                .numParticles(100)
                .seed(seed)
                .build();
        pf.initialize(new UniformDistribution(-5.0, 5.0));
        for (int t = 0; t < 10; t++) pf.step(t * 0.3, 1.0);
        return pf.estimate(x -> x);
    }

    @Test
    void update_shouldFailWhenNoParticleExplainsObservation() {
        ObservationModel<Double, Double> impossible = (obs, state) -> Double.NEGATIVE_INFINITY;
        ParticleFilter<Double, Double> pf = ParticleFilter.builder(new RandomWalkModel(0.0, 1.0), impossible)
                .numParticles(10)
                .build();
        pf.initialize(List.of(0.0));

        assertThatThrownBy(() -> pf.update(1.0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void population_shouldRequireInitialization() {
        ParticleFilter<Double, Double> pf = ParticleFilter.builder(new RandomWalkModel(0.0, 1.0), gaussianObservation(1.0)).build();

        assertThatThrownBy(pf::population).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void constantVelocity_shouldRecoverHiddenVelocity() {
        ParticleFilter<double[], double[]> pf = ParticleFilter.builder(
                        LinearGaussianSystemModel.constantVelocity(0.1, 0.05),
                        GaussianObservationModel.firstCoordinate(2, 1.0))
                .numParticles(500)
                .seed(21L)
                .build();
        List<double[]> prior = new ArrayList<>();
        for (int i = 0; i < 500; i++) prior.add(new double[]{0.0, -5.0 + 10.0 * i / 499.0});
        pf.initialize(prior);

        for (int t = 1; t <= 30; t++) pf.step(new double[]{2.0 * t}, 1.0);

        assertThat(pf.estimate(x -> x[1])).isCloseTo(2.0, within(0.5));
        assertThat(pf.mostLikely()[0]).isCloseTo(60.0, within(5.0));
    }

    @Test
    void gaussianObservationModel_shouldRejectWrongDimensions() {
        GaussianObservationModel obs = GaussianObservationModel.firstCoordinate(2, 1.0);

        assertThat(obs.logLikelihood(new double[]{1.0}, new double[]{1.0, 9.0}))
                .isGreaterThan(obs.logLikelihood(new double[]{1.0}, new double[]{3.0, 0.0}));
        assertThatThrownBy(() -> obs.logLikelihood(new double[]{1.0, 2.0}, new double[]{0.0, 0.0}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LinearGaussianSystemModel(new double[][]{{1.0, 0.0}}, new double[]{0.1}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
