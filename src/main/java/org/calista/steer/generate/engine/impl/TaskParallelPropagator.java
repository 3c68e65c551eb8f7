package org.calista.steer.generate.engine.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.steer.generate.PotentialFailureException;
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

/**
 * Splits the live particles into contiguous chunks, one pool task per chunk. Each task proposes
 * and scores its particles independently.
 *
 * <p>A particle whose proposal throws is retried once as its own task, with the same random
 * stream; a second failure leaves it with weight zero.</p>
 */
public final class TaskParallelPropagator implements Propagator {

    private static final Logger log = LogManager.getLogger(TaskParallelPropagator.class);

    private final ParticleAdvancer advancer;

    public TaskParallelPropagator(ParticleAdvancer advancer) {
        this.advancer = Objects.requireNonNull(advancer, "advancer");
    }

    @Override
    public String name() {
        return "task-parallel";
    }

    @Override
    public List<StepOutcome> propagate(List<ProposalRequest> requests, StepContext ctx) throws TimeoutException, InterruptedException {
        if (requests.isEmpty()) return List.of();

        int chunks = Math.min(ctx.pool().workers(), requests.size());
        StepBarrier<List<StepOutcome>> barrier = new StepBarrier<>(ctx);
        for (int c = 0; c < chunks; c++) {
            int from = (int) ((long) requests.size() * c / chunks);
            int to = (int) ((long) requests.size() * (c + 1) / chunks);
            List<ProposalRequest> slice = requests.subList(from, to);
            barrier.submit(() -> runChunk(slice, ctx));
        }

        List<List<StepOutcome>> parts;
        try {
            parts = barrier.await();
        } catch (ExecutionException e) {
            throw StepBarrier.unwrap(e, "step " + ctx.step());
        }

        StepOutcome[] byPosition = new StepOutcome[requests.size()];
        List<Integer> failed = new ArrayList<>();
        int pos = 0;
        for (List<StepOutcome> part : parts) {
            for (StepOutcome o : part) {
                if (o == null) failed.add(pos);
                byPosition[pos++] = o;
            }
        }

        if (!failed.isEmpty()) retry(requests, failed, byPosition, ctx);

        return List.of(byPosition);
    }

    private List<StepOutcome> runChunk(List<ProposalRequest> slice, StepContext ctx) {
        ArrayList<StepOutcome> out = new ArrayList<>(slice.size());
        for (ProposalRequest r : slice) {
            if (Thread.currentThread().isInterrupted()) break;
            try {
                out.add(advancer.advance(r, ctx));
            } catch (PotentialFailureException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("propose.fail step={} particle={} attempt=1", ctx.step(), r.index(), e);
                out.add(null);
            }
        }
        // interrupted chunks pad with nulls; the barrier has already been cancelled in that case
        while (out.size() < slice.size()) out.add(null);
        return out;
    }

    private void retry(List<ProposalRequest> requests, List<Integer> failed, StepOutcome[] byPosition, StepContext ctx)
            throws TimeoutException, InterruptedException {
        StepBarrier<StepOutcome> barrier = new StepBarrier<>(ctx);
        for (int p : failed) {
            ProposalRequest r = requests.get(p);
            barrier.submit(() -> {
                try {
                    return advancer.advance(r, ctx);
                } catch (PotentialFailureException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.warn("propose.fail step={} particle={} attempt=2 -> weight zero", ctx.step(), r.index(), e);
                    return StepOutcome.failed(r);
                }
            });
        }
        List<StepOutcome> retried;
        try {
            retried = barrier.await();
        } catch (ExecutionException e) {
            throw StepBarrier.unwrap(e, "retry at step " + ctx.step());
        }
        for (int k = 0; k < failed.size(); k++) byPosition[failed.get(k)] = retried.get(k);
    }
}
