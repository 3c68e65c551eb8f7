package org.calista.steer.sampling.particle;

import org.calista.steer.sampling.Seeds;
import org.calista.steer.sampling.Weights;
import org.calista.steer.sampling.resample.ResamplingScheme;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class ParticlePopulationTest {

    private static ParticlePopulation<String> weighted(double... logWeights) {
        List<Particle<String>> ps = new ArrayList<>();
        for (int i = 0; i < logWeights.length; i++) {
            ps.add(Particle.root(i, "s" + i).withLogWeight(logWeights[i]));
        }
        return ParticlePopulation.of(ps);
    }

    @Test
    void uniform_shouldGiveEqualWeights() {
        ParticlePopulation<String> pop = ParticlePopulation.uniform("x", 5);

        assertThat(pop.size()).isEqualTo(5);
        assertThat(pop.normalizedWeights()).containsOnly(0.2);
        assertThat(pop.relativeEss()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void of_shouldClipNanWeights() {
        ParticlePopulation<String> pop = weighted(0.0, Double.NaN);

        assertThat(pop.get(1).logWeight()).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(pop.aliveCount()).isEqualTo(1);
    }

    @Test
    void normalizedLogSpace_shouldKeepRelativeWeights() {
        ParticlePopulation<String> pop = weighted(-100.0, -100.0 + Math.log(4.0)).normalizedLogSpace();

        assertThat(Weights.logSumExp(pop.logWeights())).isCloseTo(0.0, within(1e-12));
        assertThat(pop.normalizedWeights()[1]).isCloseTo(0.8, within(1e-12));
    }

    @Test
    void resample_shouldResetWeightsToOneOverN() {
        AtomicLong ids = new AtomicLong(100);
        ParticlePopulation<String> pop = weighted(0.0, Double.NEGATIVE_INFINITY, Math.log(3.0), Double.NEGATIVE_INFINITY);

        ParticlePopulation<String> next = pop.resample(ResamplingScheme.SYSTEMATIC.strategy(), Seeds.global(1L, 1), ids::getAndIncrement);

        assertThat(next.size()).isEqualTo(4);
        assertThat(next.normalizedWeights()).containsOnly(0.25);
        for (Particle<String> p : next.particles()) {
            assertThat(p.state()).isIn("s0", "s2");
            assertThat(p.parentId()).isIn(0L, 2L);
            assertThat(p.id()).isGreaterThanOrEqualTo(100L);
        }
    }

    @Test
    void best_shouldReturnHighestWeightFirstOnTies() {
        ParticlePopulation<String> pop = weighted(-2.0, -1.0, -1.0);

        assertThat(pop.best().state()).isEqualTo("s1");
    }

    @Test
    void replace_shouldRejectSizeChange() {
        ParticlePopulation<String> pop = ParticlePopulation.uniform("x", 3);

        assertThatThrownBy(() -> pop.replace(List.of(Particle.root(0, "y"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void normalizedWeights_shouldFailWhenCollapsed() {
        ParticlePopulation<String> pop = weighted(Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY);

        assertThat(pop.collapsed()).isTrue();
        assertThatThrownBy(pop::normalizedWeights).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void normalizedWeights_shouldBeStableAcrossThreadsAndCallers() throws Exception {
        ParticlePopulation<String> pop = weighted(0.0, Math.log(3.0));
        ExecutorService exec = Executors.newFixedThreadPool(4);
        try {
            List<Future<double[]>> reads = new ArrayList<>();
            for (int i = 0; i < 32; i++) reads.add(exec.submit(pop::normalizedWeights));
            for (Future<double[]> f : reads) {
                double[] w = f.get(10, TimeUnit.SECONDS);
                assertThat(w[0]).isCloseTo(0.25, within(1e-12));
                assertThat(w[1]).isCloseTo(0.75, within(1e-12));
                w[0] = 99.0;
            }
        } finally {
            exec.shutdownNow();
        }

        assertThat(pop.normalizedWeights()[0]).isCloseTo(0.25, within(1e-12));
    }

    @Test
    void offspring_shouldKeepMetadataAndLinkParent() {
        Particle<String> p = Particle.root(4, "s").withMeta("origin", "prompt").withLogWeight(-2.0);

        Particle<String> child = p.offspring(9);

        assertThat(child.parentId()).isEqualTo(4L);
        assertThat(child.logWeight()).isZero();
        assertThat(child.metadata()).containsEntry("origin", "prompt");
        assertThat(p.reweighted(Double.NEGATIVE_INFINITY).alive()).isFalse();
    }
}
