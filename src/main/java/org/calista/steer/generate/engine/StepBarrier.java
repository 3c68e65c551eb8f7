package org.calista.steer.generate.engine;

import org.calista.steer.generate.GenerationFailedException;
import org.calista.steer.generate.PotentialFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Futures of one step, joined against the run deadline. Any failure to join cancels the rest.
 */
public final class StepBarrier<T> {

    private final StepContext ctx;
    private final List<Future<T>> futures = new ArrayList<>();

    public StepBarrier(StepContext ctx) {
        this.ctx = ctx;
    }

    public void submit(Callable<T> work) {
        futures.add(ctx.pool().submit(work));
    }

    public int size() {
        return futures.size();
    }

    /**
     * Results in submission order.
     *
     * @throws ExecutionException with the first failing task's cause
     */
    public List<T> await() throws TimeoutException, InterruptedException, ExecutionException {
        ArrayList<T> out = new ArrayList<>(futures.size());
        try {
            for (Future<T> f : futures) {
                if (ctx.bounded()) {
                    out.add(f.get(Math.max(0L, ctx.remainingNanos()), TimeUnit.NANOSECONDS));
                } else {
                    out.add(f.get());
                }
            }
            return out;
        } catch (TimeoutException | InterruptedException | ExecutionException e) {
            cancelAll();
            throw e;
        }
    }

    public void cancelAll() {
        for (Future<T> f : futures) f.cancel(true);
    }

    /** Re-raises a task failure as the unchecked exception the engine reports. */
    public static RuntimeException unwrap(ExecutionException e, String what) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        if (cause instanceof PotentialFailureException) return (PotentialFailureException) cause;
        if (cause instanceof GenerationFailedException) return (GenerationFailedException) cause;
        return new GenerationFailedException(what + " failed: " + cause, cause);
    }
}
