package org.calista.steer.generate;

import org.calista.steer.sampling.resample.ResamplingScheme;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GenerationTaskTest {

    @Test
    void of_shouldApplyDefaults() {
        GenerationTask t = GenerationTask.of("hello");

        assertThat(t.query()).isEqualTo("hello");
        assertThat(t.particleCount()).isEqualTo(GenerationTask.DEFAULT_PARTICLES);
        assertThat(t.timeout()).isEqualTo(GenerationTask.DEFAULT_TIMEOUT);
        assertThat(t.resamplingThreshold()).isEqualTo(0.5);
        assertThat(t.resamplingScheme()).isEqualTo(ResamplingScheme.SYSTEMATIC);
        assertThat(t.outputSelection()).isEqualTo(OutputSelection.MAX_WEIGHT);
        assertThat(t.batchFailurePolicy()).isEqualTo(BatchFailurePolicy.FALLBACK_TO_TASK_PARALLEL);
        assertThat(t.workerCountPolicy()).isEqualTo(WorkerCountPolicy.PREFER_GPU_DEVICES);
        assertThat(t.useParallel()).isTrue();
        assertThat(t.useGpu()).isFalse();
        assertThat(t.bounded()).isTrue();
        assertThat(t.candidatesPerStep()).isEqualTo(1);
    }

    @Test
    void build_shouldDrawFreshSeedUnlessOneIsGiven() {
        GenerationTask a = GenerationTask.of("same");
        GenerationTask b = GenerationTask.of("same");

        assertThat(a.seed()).isNotEqualTo(b.seed());
        assertThat(GenerationTask.builder("same").seed(42L).build().seed()).isEqualTo(42L);
        assertThat(a.toBuilder().build().seed()).isEqualTo(a.seed());
    }

    @Test
    void build_shouldRejectInvalidValues() {
        assertThatThrownBy(() -> GenerationTask.builder("q").particleCount(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GenerationTask.builder("q").resamplingThreshold(1.5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GenerationTask.builder("q").timeout(Duration.ofSeconds(-1)).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GenerationTask.builder("q").maxSteps(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GenerationTask.builder("q").workers(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GenerationTask.builder("q").candidatesPerStep(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GenerationTask.builder("q").candidatesPerStep(GenerationTask.MAX_CANDIDATES_PER_STEP + 1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void timeoutZero_shouldMeanUnbounded() {
        assertThat(GenerationTask.builder("q").timeout(Duration.ZERO).build().bounded()).isFalse();
    }

    @Test
    void toBuilder_shouldCopyEveryField() {
        GenerationTask t = GenerationTask.builder("q").particleCount(3).seed(9L).useGpu(true).batchSize(2).candidatesPerStep(4).build();

        GenerationTask copy = t.toBuilder().build();

        assertThat(copy.particleCount()).isEqualTo(3);
        assertThat(copy.seed()).isEqualTo(9L);
        assertThat(copy.useGpu()).isTrue();
        assertThat(copy.batchSize()).isEqualTo(2);
        assertThat(copy.candidatesPerStep()).isEqualTo(4);
    }

    @Test
    void enumParsers_shouldDefaultOnBlankAndRejectUnknown() {
        assertThat(OutputSelection.parse(" weighted_sample ")).isEqualTo(OutputSelection.WEIGHTED_SAMPLE);
        assertThat(BatchFailurePolicy.parse(null)).isEqualTo(BatchFailurePolicy.FALLBACK_TO_TASK_PARALLEL);
        assertThat(WorkerCountPolicy.parse("")).isEqualTo(WorkerCountPolicy.PREFER_GPU_DEVICES);
        assertThatThrownBy(() -> OutputSelection.parse("best")).isInstanceOf(IllegalArgumentException.class);
    }
}
