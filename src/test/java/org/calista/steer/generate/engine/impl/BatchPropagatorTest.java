package org.calista.steer.generate.engine.impl;

import org.calista.steer.generate.BatchFailurePolicy;
import org.calista.steer.generate.Continuation;
import org.calista.steer.generate.GenerationFailedException;
import org.calista.steer.generate.SequenceState;
import org.calista.steer.generate.StopCondition;
import org.calista.steer.generate.TokenGenerator;
import org.calista.steer.generate.engine.ParticleAdvancer;
import org.calista.steer.generate.engine.ProposalRequest;
import org.calista.steer.generate.engine.StepContext;
import org.calista.steer.generate.engine.StepOutcome;
import org.calista.steer.generate.engine.WorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.random.RandomGenerator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class BatchPropagatorTest {

    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        pool = new WorkerPool(3, 32, "batch-test-", 500);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private StepContext ctx() {
        return new StepContext(1, 42L, StepContext.UNBOUNDED, false, pool);
    }

    private static List<ProposalRequest> requests(int n) {
        List<ProposalRequest> out = new ArrayList<>();
        for (int i = 0; i < n; i++) out.add(new ProposalRequest(i, SequenceState.start("")));
        return out;
    }

    @Test
    void propagate_shouldSplitIntoBatchesOfAtMostBatchSize() throws Exception {
        RecordingGenerator g = new RecordingGenerator(false);
        BatchPropagator p = new BatchPropagator(new ParticleAdvancer(g, List.of(), StopCondition.never()), 4, BatchFailurePolicy.FAIL);

        List<StepOutcome> out = p.propagate(requests(10), ctx());

        assertThat(out).hasSize(10);
        assertThat(out).extracting(StepOutcome::index).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        assertThat(g.batchSizes).containsExactlyInAnyOrder(4, 4, 2);
        assertThat(p.degraded()).isFalse();
        assertThat(p.name()).isEqualTo("batch");
    }

    @Test
    void propagate_shouldSendWholePopulationWhenBatchSizeIsZero() throws Exception {
        RecordingGenerator g = new RecordingGenerator(false);
        BatchPropagator p = new BatchPropagator(new ParticleAdvancer(g, List.of(), StopCondition.never()), 0, BatchFailurePolicy.FAIL);

        p.propagate(requests(7), ctx());

        assertThat(g.batchSizes).containsExactly(7);
    }

    @Test
    void propagate_shouldDegradeOnceAndStayDegraded() throws Exception {
        RecordingGenerator g = new RecordingGenerator(true);
        BatchPropagator p = new BatchPropagator(new ParticleAdvancer(g, List.of(), StopCondition.never()), 0,
                BatchFailurePolicy.FALLBACK_TO_TASK_PARALLEL);

        List<StepOutcome> first = p.propagate(requests(5), ctx());
        List<StepOutcome> second = p.propagate(requests(5), ctx());

        assertThat(first).hasSize(5);
        assertThat(second).allSatisfy(o -> assertThat(o.state().tokens()).containsExactly("single"));
        assertThat(p.degraded()).isTrue();
        assertThat(g.batchSizes).hasSize(1);
    }

    @Test
    void propagate_shouldFailUnderFailPolicy() {
        BatchPropagator p = new BatchPropagator(new ParticleAdvancer(new RecordingGenerator(true), List.of(), StopCondition.never()), 0,
                BatchFailurePolicy.FAIL);

        assertThatThrownBy(() -> p.propagate(requests(3), ctx()))
                .isInstanceOf(GenerationFailedException.class)
                .hasRootCauseMessage("batch down");
    }

    @Test
    void propagate_shouldRejectShortBatchOutput() {
        TokenGenerator shortBatch = new TokenGenerator() {
            @Override
            public Continuation propose(SequenceState state, RandomGenerator rng) {
                return Continuation.of("x");
            }

            @Override
            public boolean supportsBatch() {
                return true;
            }

            @Override
            public List<Continuation> proposeBatch(List<SequenceState> states, List<RandomGenerator> rngs) {
                return List.of(Continuation.of("x"));
            }
        };
        BatchPropagator p = new BatchPropagator(new ParticleAdvancer(shortBatch, List.of(), StopCondition.never()), 0, BatchFailurePolicy.FAIL);

        assertThatThrownBy(() -> p.propagate(requests(3), ctx())).isInstanceOf(GenerationFailedException.class);
    }

    /** Records every batched call; optionally fails them. */
    private static final class RecordingGenerator implements TokenGenerator {
        final List<Integer> batchSizes = new CopyOnWriteArrayList<>();
        private final boolean failBatches;

        RecordingGenerator(boolean failBatches) {
            this.failBatches = failBatches;
        }

        @Override
        public Continuation propose(SequenceState state, RandomGenerator rng) {
            return Continuation.of("single");
        }

        @Override
        public boolean supportsBatch() {
            return true;
        }

        @Override
        public List<Continuation> proposeBatch(List<SequenceState> states, List<RandomGenerator> rngs) {
            batchSizes.add(states.size());
            if (failBatches) throw new IllegalStateException("batch down");
            List<Continuation> out = new ArrayList<>();
            for (int i = 0; i < states.size(); i++) out.add(Continuation.of("batched"));
            return out;
        }
    }
}
