package org.calista.steer.sampling;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.random.RandomGenerator;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SeedsTest {

    @Test
    void stream_shouldBeReproducibleForSameCoordinates() {
        long a = Seeds.stream(7L, 3, 11).nextLong();
        long b = Seeds.stream(7L, 3, 11).nextLong();

        assertThat(a).isEqualTo(b);
    }

    @Test
    void stream_shouldDifferAcrossStepsAndIndices() {
        long base = Seeds.stream(7L, 3, 11).nextLong();

        assertThat(Seeds.stream(7L, 4, 11).nextLong()).isNotEqualTo(base);
        assertThat(Seeds.stream(7L, 3, 12).nextLong()).isNotEqualTo(base);
        assertThat(Seeds.stream(8L, 3, 11).nextLong()).isNotEqualTo(base);
    }

    @Test
    void global_shouldNotCoincideWithParticleStreams() {
        assertThat(Seeds.global(7L, 1).nextLong()).isNotEqualTo(Seeds.stream(7L, 1, 0).nextLong());
    }

    @Test
    void parallelStreams_shouldBeIndependentAndReproducible() {
        RandomGenerator[] a = Seeds.parallelStreams(3L, 4);
        RandomGenerator[] b = Seeds.parallelStreams(3L, 4);

        assertThat(a).hasSize(4);
        assertThat(a[0].nextLong()).isEqualTo(b[0].nextLong());
        assertThat(a[1].nextLong()).isNotEqualTo(a[2].nextLong());
    }
}
