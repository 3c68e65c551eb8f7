package org.calista.steer.generate.engine.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.steer.generate.BatchFailurePolicy;
import org.calista.steer.generate.Continuation;
import org.calista.steer.generate.GenerationFailedException;
import org.calista.steer.generate.SequenceState;
import org.calista.steer.generate.engine.ParticleAdvancer;
import org.calista.steer.generate.engine.Propagator;
import org.calista.steer.generate.engine.ProposalRequest;
import org.calista.steer.generate.engine.StepBarrier;
import org.calista.steer.generate.engine.StepContext;
import org.calista.steer.generate.engine.StepOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.random.RandomGenerator;

/**
 * Batched stepping for generators with a batched path (GPU-assisted scoring).
 *
 * <p>Live states go to {@code proposeBatch} in batches of at most {@code batchSize} (0 = one call
 * for the whole population). Pool threads only wait on those calls; once every continuation is
 * in, potentials are evaluated concurrently on the pool.</p>
 *
 * <p>If a batched call fails, {@link BatchFailurePolicy#FAIL} aborts the run, while
 * {@link BatchFailurePolicy#FALLBACK_TO_TASK_PARALLEL} redoes the step per particle and keeps
 * using the per-particle path until the run ends. One instance per run.</p>
 */
public final class BatchPropagator implements Propagator {

    private static final Logger log = LogManager.getLogger(BatchPropagator.class);

    private final ParticleAdvancer advancer;
    private final TaskParallelPropagator fallback;
    private final int batchSize;
    private final BatchFailurePolicy failurePolicy;

    private boolean degraded;

    public BatchPropagator(ParticleAdvancer advancer, int batchSize, BatchFailurePolicy failurePolicy) {
        this.advancer = Objects.requireNonNull(advancer, "advancer");
        if (batchSize < 0) throw new IllegalArgumentException("batchSize must be >= 0: " + batchSize);
        this.batchSize = batchSize;
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.fallback = new TaskParallelPropagator(advancer);
    }

    @Override
    public String name() {
        return degraded ? "batch(degraded->task-parallel)" : "batch";
    }

    /** True once a batched call failed and the run switched to per-particle stepping. */
    public boolean degraded() {
        return degraded;
    }

    @Override
    public List<StepOutcome> propagate(List<ProposalRequest> requests, StepContext ctx) throws TimeoutException, InterruptedException {
        if (requests.isEmpty()) return List.of();
        if (degraded) return fallback.propagate(requests, ctx);

        List<Continuation> continuations;
        try {
            continuations = proposeAll(requests, ctx);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (failurePolicy == BatchFailurePolicy.FAIL) {
                throw new GenerationFailedException("Batched proposal failed at step " + ctx.step(), cause);
            }
            log.warn("batch.fail step={} live={} -> task-parallel for the rest of the run", ctx.step(), requests.size(), cause);
            degraded = true;
            return fallback.propagate(requests, ctx);
        }

        return scoreAll(requests, continuations, ctx);
    }

    private List<Continuation> proposeAll(List<ProposalRequest> requests, StepContext ctx)
            throws TimeoutException, InterruptedException, ExecutionException {
        int size = batchSize == 0 ? requests.size() : batchSize;
        StepBarrier<List<Continuation>> barrier = new StepBarrier<>(ctx);
        for (int from = 0; from < requests.size(); from += size) {
            List<ProposalRequest> slice = requests.subList(from, Math.min(requests.size(), from + size));
            barrier.submit(() -> proposeSlice(slice, ctx));
        }
        log.debug("batch.propose step={} live={} calls={}", ctx.step(), requests.size(), barrier.size());

        ArrayList<Continuation> all = new ArrayList<>(requests.size());
        for (List<Continuation> part : barrier.await()) all.addAll(part);
        return all;
    }

    private List<Continuation> proposeSlice(List<ProposalRequest> slice, StepContext ctx) {
        ArrayList<SequenceState> states = new ArrayList<>(slice.size());
        ArrayList<RandomGenerator> rngs = new ArrayList<>(slice.size());
        for (ProposalRequest r : slice) {
            states.add(r.state());
            rngs.add(ctx.rng(r.stream()));
        }
        List<Continuation> out = advancer.generator().proposeBatch(states, rngs);
        if (out == null || out.size() != slice.size()) {
            throw new IllegalStateException("proposeBatch returned " + (out == null ? "null" : out.size())
                    + " continuations for " + slice.size() + " states");
        }
        for (Continuation c : out) {
            if (c == null) throw new IllegalStateException("proposeBatch returned a null continuation");
        }
        return out;
    }

    private List<StepOutcome> scoreAll(List<ProposalRequest> requests, List<Continuation> continuations, StepContext ctx)
            throws TimeoutException, InterruptedException {
        int chunks = Math.min(ctx.pool().workers(), requests.size());
        StepBarrier<List<StepOutcome>> barrier = new StepBarrier<>(ctx);
        for (int c = 0; c < chunks; c++) {
            int from = (int) ((long) requests.size() * c / chunks);
            int to = (int) ((long) requests.size() * (c + 1) / chunks);
            barrier.submit(() -> {
                ArrayList<StepOutcome> out = new ArrayList<>(to - from);
                for (int i = from; i < to; i++) {
                    out.add(advancer.settle(requests.get(i), continuations.get(i), ctx.lastStep()));
                }
                return out;
            });
        }
        try {
            ArrayList<StepOutcome> all = new ArrayList<>(requests.size());
            for (List<StepOutcome> part : barrier.await()) all.addAll(part);
            return all;
        } catch (ExecutionException e) {
            throw StepBarrier.unwrap(e, "scoring at step " + ctx.step());
        }
    }
}
