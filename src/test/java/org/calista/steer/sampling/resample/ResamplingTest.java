package org.calista.steer.sampling.resample;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Contract checks shared by every resampling scheme.
 */
@Tag("unit")
class ResamplingTest {

    private static final double[] WEIGHTS = {0.1, 0.0, 0.4, 0.0, 0.3, 0.2, 0.0, 0.0};

    @ParameterizedTest
    @EnumSource(ResamplingScheme.class)
    void resample_shouldReturnNValidIndices(ResamplingScheme scheme) {
        int[] idx = scheme.strategy().resample(WEIGHTS, new SplittableRandom(3));

        assertThat(idx).hasSize(WEIGHTS.length);
        for (int j : idx) assertThat(j).isBetween(0, WEIGHTS.length - 1);
    }

    @ParameterizedTest
    @EnumSource(ResamplingScheme.class)
    void resample_shouldNeverChooseZeroWeightIndices(ResamplingScheme scheme) {
        SplittableRandom rng = new SplittableRandom(17);
        for (int round = 0; round < 200; round++) {
            for (int j : scheme.strategy().resample(WEIGHTS, rng)) {
                assertThat(WEIGHTS[j]).as("index %d chosen by %s", j, scheme).isGreaterThan(0.0);
            }
        }
    }

    @ParameterizedTest
    @EnumSource(ResamplingScheme.class)
    void resample_shouldBeDeterministicForSameSeed(ResamplingScheme scheme) {
        int[] a = scheme.strategy().resample(WEIGHTS, new SplittableRandom(99));
        int[] b = scheme.strategy().resample(WEIGHTS, new SplittableRandom(99));

        assertThat(a).containsExactly(b);
    }

    @ParameterizedTest
    @EnumSource(ResamplingScheme.class)
    void resample_shouldReproduceWeightsOnAverage(ResamplingScheme scheme) {
        double[] w = {0.5, 0.25, 0.125, 0.125};
        int[] counts = new int[w.length];
        SplittableRandom rng = new SplittableRandom(5);
        int rounds = 4000;
        for (int r = 0; r < rounds; r++) {
            for (int j : scheme.strategy().resample(w, rng)) counts[j]++;
        }
        for (int i = 0; i < w.length; i++) {
            assertThat(counts[i] / (double) (rounds * w.length)).isCloseTo(w[i], within(0.02));
        }
    }

    @ParameterizedTest
    @EnumSource(ResamplingScheme.class)
    void resample_shouldKeepDegenerateWeightOnSingleIndex(ResamplingScheme scheme) {
        int[] idx = scheme.strategy().resample(new double[]{0.0, 0.0, 1.0}, new SplittableRandom(1));

        assertThat(idx).containsOnly(2);
    }

    @Test
    void parse_shouldAcceptAnyCaseAndDefaultToSystematic() {
        assertThat(ResamplingScheme.parse("residual")).isEqualTo(ResamplingScheme.RESIDUAL);
        assertThat(ResamplingScheme.parse(null)).isEqualTo(ResamplingScheme.SYSTEMATIC);
        assertThatThrownBy(() -> ResamplingScheme.parse("bogus"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
