package org.calista.steer.generate;

import org.calista.steer.sampling.Seeds;
import org.calista.steer.sampling.resample.ResamplingScheme;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * GenerationTask: one request to the SMC engine: the query plus every knob of the run.
 *
 * <p>Immutable; build with {@link #builder(String)}. Defaults: 16 particles, auto worker count,
 * parallel on, GPU off, 30s budget, resampling below relative ESS 0.5 with the systematic scheme,
 * max-weight selection, 64 steps, one candidate per particle and step. Without an explicit seed
 * each built task gets a fresh one.</p>
 */
public final class GenerationTask {

    public static final int DEFAULT_PARTICLES = 16;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final double DEFAULT_RESAMPLING_THRESHOLD = 0.5;
    public static final int DEFAULT_MAX_STEPS = 64;
    public static final int MAX_CANDIDATES_PER_STEP = 64;

    private static final AtomicLong SEED_SEQ = new AtomicLong();

    private final String query;
    private final int particleCount;
    private final int workers;
    private final boolean useParallel;
    private final boolean useGpu;
    private final int gpuDevices;
    private final int batchSize;
    private final Duration timeout;
    private final double resamplingThreshold;
    private final ResamplingScheme resamplingScheme;
    private final OutputSelection outputSelection;
    private final int maxSteps;
    private final int candidatesPerStep;
    private final long seed;
    private final boolean includePopulation;
    private final BatchFailurePolicy batchFailurePolicy;
    private final WorkerCountPolicy workerCountPolicy;

    private GenerationTask(Builder b) {
        this.query = b.query;
        this.particleCount = b.particleCount;
        this.workers = b.workers;
        this.useParallel = b.useParallel;
        this.useGpu = b.useGpu;
        this.gpuDevices = b.gpuDevices;
        this.batchSize = b.batchSize;
        this.timeout = b.timeout;
        this.resamplingThreshold = b.resamplingThreshold;
        this.resamplingScheme = b.resamplingScheme;
        this.outputSelection = b.outputSelection;
        this.maxSteps = b.maxSteps;
        this.candidatesPerStep = b.candidatesPerStep;
        this.seed = b.seed != null ? b.seed : Seeds.mix(System.nanoTime(), SEED_SEQ.incrementAndGet());
        this.includePopulation = b.includePopulation;
        this.batchFailurePolicy = b.batchFailurePolicy;
        this.workerCountPolicy = b.workerCountPolicy;
    }

    public static Builder builder(String query) {
        return new Builder(query);
    }

    public static GenerationTask of(String query) {
        return builder(query).build();
    }

    public Builder toBuilder() {
        return new Builder(query)
                .particleCount(particleCount)
                .workers(workers)
                .useParallel(useParallel)
                .useGpu(useGpu)
                .gpuDevices(gpuDevices)
                .batchSize(batchSize)
                .timeout(timeout)
                .resamplingThreshold(resamplingThreshold)
                .resamplingScheme(resamplingScheme)
                .outputSelection(outputSelection)
                .maxSteps(maxSteps)
                .candidatesPerStep(candidatesPerStep)
                .seed(seed)
                .includePopulation(includePopulation)
                .batchFailurePolicy(batchFailurePolicy)
                .workerCountPolicy(workerCountPolicy);
    }

    public String query() { return query; }
    public int particleCount() { return particleCount; }
    /** Explicit worker count; 0 means derive from {@link #workerCountPolicy()}. */
    public int workers() { return workers; }
    public boolean useParallel() { return useParallel; }
    public boolean useGpu() { return useGpu; }
    public int gpuDevices() { return gpuDevices; }
    /** Maximum states per batched generator call; 0 puts the whole live population in one call. */
    public int batchSize() { return batchSize; }
    /** {@link Duration#ZERO} means unbounded. */
    public Duration timeout() { return timeout; }
    public boolean bounded() { return !timeout.isZero(); }
    public double resamplingThreshold() { return resamplingThreshold; }
    public ResamplingScheme resamplingScheme() { return resamplingScheme; }
    public OutputSelection outputSelection() { return outputSelection; }
    public int maxSteps() { return maxSteps; }
    /** Continuations proposed per live particle each step; the engine keeps one of them. */
    public int candidatesPerStep() { return candidatesPerStep; }
    public long seed() { return seed; }
    public boolean includePopulation() { return includePopulation; }
    public BatchFailurePolicy batchFailurePolicy() { return batchFailurePolicy; }
    public WorkerCountPolicy workerCountPolicy() { return workerCountPolicy; }

    @Override
    public String toString() {
        return "GenerationTask{query='" + SteerLogFmt.clip(query, 40) + "', particles=" + particleCount
                + ", workers=" + workers + ", parallel=" + useParallel + ", gpu=" + useGpu + "/" + gpuDevices
                + ", batchSize=" + batchSize + ", timeout=" + timeout.toMillis() + "ms"
                + ", threshold=" + resamplingThreshold + ", scheme=" + resamplingScheme
                + ", selection=" + outputSelection + ", maxSteps=" + maxSteps + ", candidates=" + candidatesPerStep + ", seed=" + seed + "}";
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private final String query;
        private int particleCount = DEFAULT_PARTICLES;
        private int workers = 0;
        private boolean useParallel = true;
        private boolean useGpu = false;
        private int gpuDevices = 0;
        private int batchSize = 0;
        private Duration timeout = DEFAULT_TIMEOUT;
        private double resamplingThreshold = DEFAULT_RESAMPLING_THRESHOLD;
        private ResamplingScheme resamplingScheme = ResamplingScheme.SYSTEMATIC;
        private OutputSelection outputSelection = OutputSelection.MAX_WEIGHT;
        private int maxSteps = DEFAULT_MAX_STEPS;
        private int candidatesPerStep = 1;
        private Long seed = null;
        private boolean includePopulation = false;
        private BatchFailurePolicy batchFailurePolicy = BatchFailurePolicy.FALLBACK_TO_TASK_PARALLEL;
        private WorkerCountPolicy workerCountPolicy = WorkerCountPolicy.PREFER_GPU_DEVICES;

        private Builder(String query) {
            this.query = Objects.requireNonNull(query, "query");
        }

        public Builder particleCount(int v) { this.particleCount = v; return this; }
        public Builder workers(int v) { this.workers = v; return this; }
        public Builder useParallel(boolean v) { this.useParallel = v; return this; }
        public Builder useGpu(boolean v) { this.useGpu = v; return this; }
        public Builder gpuDevices(int v) { this.gpuDevices = v; return this; }
        public Builder batchSize(int v) { this.batchSize = v; return this; }
        public Builder timeout(Duration v) { this.timeout = Objects.requireNonNull(v, "timeout"); return this; }
        public Builder resamplingThreshold(double v) { this.resamplingThreshold = v; return this; }
        public Builder resamplingScheme(ResamplingScheme v) { this.resamplingScheme = Objects.requireNonNull(v, "resamplingScheme"); return this; }
        public Builder outputSelection(OutputSelection v) { this.outputSelection = Objects.requireNonNull(v, "outputSelection"); return this; }
        public Builder maxSteps(int v) { this.maxSteps = v; return this; }
        public Builder candidatesPerStep(int v) { this.candidatesPerStep = v; return this; }
        public Builder seed(long v) { this.seed = v; return this; }
        public Builder includePopulation(boolean v) { this.includePopulation = v; return this; }
        public Builder batchFailurePolicy(BatchFailurePolicy v) { this.batchFailurePolicy = Objects.requireNonNull(v, "batchFailurePolicy"); return this; }
        public Builder workerCountPolicy(WorkerCountPolicy v) { this.workerCountPolicy = Objects.requireNonNull(v, "workerCountPolicy"); return this; }

        public GenerationTask build() {
            if (particleCount < 1) throw new IllegalArgumentException("particleCount must be >= 1: " + particleCount);
            if (workers < 0) throw new IllegalArgumentException("workers must be >= 0: " + workers);
            if (gpuDevices < 0) throw new IllegalArgumentException("gpuDevices must be >= 0: " + gpuDevices);
            if (batchSize < 0) throw new IllegalArgumentException("batchSize must be >= 0: " + batchSize);
            if (timeout.isNegative()) throw new IllegalArgumentException("timeout must not be negative: " + timeout);
            if (!(resamplingThreshold >= 0.0 && resamplingThreshold <= 1.0)) {
                throw new IllegalArgumentException("resamplingThreshold must be in [0,1]: " + resamplingThreshold);
            }
            if (maxSteps < 1) throw new IllegalArgumentException("maxSteps must be >= 1: " + maxSteps);
            if (candidatesPerStep < 1 || candidatesPerStep > MAX_CANDIDATES_PER_STEP) {
                throw new IllegalArgumentException("candidatesPerStep must be in [1," + MAX_CANDIDATES_PER_STEP + "]: " + candidatesPerStep);
            }
            return new GenerationTask(this);
        }
    }
}
