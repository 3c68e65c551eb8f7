package org.calista.steer.generate.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.calista.steer.generate.GenerationTask;
import org.calista.steer.generate.WorkerCountPolicy;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * WorkerPool: the fixed-size executor owned by one engine run.
 *
 * <p>Created when a run starts and closed when it ends; runs never share threads. Submitted work
 * inherits the caller's log4j {@link ThreadContext} so worker log lines carry the request id.</p>
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(WorkerPool.class);

    private final ThreadPoolExecutor executor;
    private final int workers;
    private final long shutdownTimeoutMs;
    private volatile boolean aborted;

    public WorkerPool(int workers, int queueCapacity, String threadNamePrefix, long shutdownTimeoutMs) {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1: " + workers);
        if (queueCapacity < 1) throw new IllegalArgumentException("queueCapacity must be >= 1: " + queueCapacity);
        Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
        this.workers = workers;
        this.shutdownTimeoutMs = Math.max(0L, shutdownTimeoutMs);

        final AtomicLong tid = new AtomicLong(1);
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, threadNamePrefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        // bounded queue; a full queue runs the task on the submitting thread
        this.executor = new ThreadPoolExecutor(
                workers,
                workers,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                tf,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    /**
     * Worker count for a task. Explicit {@code workers} wins; then two workers per GPU device when
     * GPU scoring is on; then every core but one. {@code useParallel = false} always gives 1.
     */
    public static int resolveWorkers(GenerationTask task, int availableCores) {
        Objects.requireNonNull(task, "task");
        if (!task.useParallel()) return 1;
        if (task.workers() > 0) return task.workers();
        if (task.workerCountPolicy() == WorkerCountPolicy.PREFER_GPU_DEVICES && task.useGpu() && task.gpuDevices() > 0) {
            return 2 * task.gpuDevices();
        }
        return Math.max(1, availableCores - 1);
    }

    public int workers() {
        return workers;
    }

    public <T> Future<T> submit(Callable<T> work) {
        Objects.requireNonNull(work, "work");
        final Map<String, String> mdc = ThreadContext.getImmutableContext();
        return executor.submit(() -> {
            if (mdc != null && !mdc.isEmpty()) ThreadContext.putAll(mdc);
            try {
                return work.call();
            } finally {
                ThreadContext.clearMap();
            }
        });
    }

    /** Interrupts running work and stops without waiting. Used when the run's budget is spent. */
    public void abort() {
        aborted = true;
        executor.shutdownNow();
    }

    public boolean aborted() {
        return aborted;
    }

    @Override
    public void close() {
        if (aborted) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("pool.close timeout={}ms, interrupting workers", shutdownTimeoutMs);
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
