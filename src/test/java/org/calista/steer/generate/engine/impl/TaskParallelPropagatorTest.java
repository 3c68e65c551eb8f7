package org.calista.steer.generate.engine.impl;

import org.calista.steer.generate.Continuation;
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
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TaskParallelPropagatorTest {

    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        pool = new WorkerPool(4, 32, "tp-test-", 500);
    }

    @AfterEach
    void tearDown() {
        if (!pool.aborted()) pool.close();
    }

    private static List<ProposalRequest> requests(String... prompts) {
        List<ProposalRequest> out = new ArrayList<>();
        for (int i = 0; i < prompts.length; i++) out.add(new ProposalRequest(i * 10, SequenceState.start(prompts[i])));
        return out;
    }

    @Test
    void propagate_shouldKeepRequestOrder() throws Exception {
        TokenGenerator echo = (state, rng) -> Continuation.of(state.prompt().get(0));
        TaskParallelPropagator p = new TaskParallelPropagator(new ParticleAdvancer(echo, List.of(), StopCondition.never()));

        List<StepOutcome> out = p.propagate(requests("a", "b", "c", "d", "e", "f", "g"),
                new StepContext(1, 1L, StepContext.UNBOUNDED, false, pool));

        assertThat(out).extracting(o -> o.state().lastToken()).containsExactly("a", "b", "c", "d", "e", "f", "g");
        assertThat(out).extracting(StepOutcome::index).containsExactly(0, 10, 20, 30, 40, 50, 60);
    }

    @Test
    void propagate_shouldDrawFromTheRequestStream() throws Exception {
        TokenGenerator roll = (state, rng) -> Continuation.of(Long.toString(rng.nextLong()));
        TaskParallelPropagator p = new TaskParallelPropagator(new ParticleAdvancer(roll, List.of(), StopCondition.never()));
        StepContext ctx = new StepContext(2, 5L, StepContext.UNBOUNDED, false, pool);
        SequenceState start = SequenceState.start("");

        List<StepOutcome> out = p.propagate(List.of(
                new ProposalRequest(1, 3, start),
                new ProposalRequest(1, 4, start)), ctx);

        assertThat(out).extracting(StepOutcome::index).containsExactly(1, 1);
        assertThat(out.get(0).state().lastToken()).isEqualTo(Long.toString(ctx.rng(3).nextLong()));
        assertThat(out.get(1).state().lastToken()).isEqualTo(Long.toString(ctx.rng(4).nextLong()));
    }

    @Test
    void propagate_shouldZeroParticleThatFailsTwice() throws Exception {
        Map<String, Integer> attempts = new ConcurrentHashMap<>();
        TokenGenerator g = (state, rng) -> {
            String who = state.prompt().get(0);
            attempts.merge(who, 1, Integer::sum);
            if (who.equals("bad")) throw new IllegalStateException("always");
            return Continuation.of(who);
        };
        TaskParallelPropagator p = new TaskParallelPropagator(new ParticleAdvancer(g, List.of(), StopCondition.never()));

        List<StepOutcome> out = p.propagate(requests("ok", "bad", "fine"), new StepContext(1, 1L, StepContext.UNBOUNDED, false, pool));

        assertThat(out.get(1).logWeightDelta()).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(out.get(0).logWeightDelta()).isZero();
        assertThat(attempts).containsEntry("bad", 2).containsEntry("ok", 1);
    }

    @Test
    void propagate_shouldTimeOutAgainstDeadline() {
        TokenGenerator slow = (state, rng) -> {
            try {
                Thread.sleep(5_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
            return Continuation.of("late");
        };
        TaskParallelPropagator p = new TaskParallelPropagator(new ParticleAdvancer(slow, List.of(), StopCondition.never()));
        long deadline = System.nanoTime() + 200_000_000L;

        assertThatThrownBy(() -> p.propagate(requests("x", "y"), new StepContext(1, 1L, deadline, false, pool)))
                .isInstanceOf(TimeoutException.class);
        pool.abort();
    }
}
