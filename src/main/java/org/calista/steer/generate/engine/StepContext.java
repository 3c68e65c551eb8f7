package org.calista.steer.generate.engine;

import org.calista.steer.sampling.Seeds;

import java.time.Duration;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Per-step facts shared by the propagators: step number, seed, deadline and the run's pool.
 */
public final class StepContext {

    /** Deadline value for unbounded runs. */
    public static final long UNBOUNDED = Long.MAX_VALUE;

    private final int step;
    private final long seed;
    private final long deadlineNanos;
    private final boolean lastStep;
    private final WorkerPool pool;

    public StepContext(int step, long seed, long deadlineNanos, boolean lastStep, WorkerPool pool) {
        this.step = step;
        this.seed = seed;
        this.deadlineNanos = deadlineNanos;
        this.lastStep = lastStep;
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    /** Absolute {@link System#nanoTime()} deadline; {@link Duration#ZERO} gives {@link #UNBOUNDED}. */
    public static long deadline(long startNanos, Duration timeout) {
        if (timeout.isZero()) return UNBOUNDED;
        long budget = timeout.getSeconds() >= Long.MAX_VALUE / 1_000_000_000L / 2 ? Long.MAX_VALUE / 2 : timeout.toNanos();
        return startNanos + budget;
    }

    public int step() {
        return step;
    }

    /** The step that caps the run; particles still running are finished after it. */
    public boolean lastStep() {
        return lastStep;
    }

    public WorkerPool pool() {
        return pool;
    }

    public boolean bounded() {
        return deadlineNanos != UNBOUNDED;
    }

    public long remainingNanos() {
        return bounded() ? deadlineNanos - System.nanoTime() : Long.MAX_VALUE;
    }

    public boolean expired() {
        return bounded() && remainingNanos() <= 0L;
    }

    /** Random stream of particle {@code index} at this step. Same inputs, same stream. */
    public RandomGenerator rng(int index) {
        return Seeds.stream(seed, step, index);
    }
}
