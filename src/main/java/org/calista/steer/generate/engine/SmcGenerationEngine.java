package org.calista.steer.generate.engine;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.steer.generate.ConstraintUnsatisfiableException;
import org.calista.steer.generate.GenerationFailedException;
import org.calista.steer.generate.GenerationResult;
import org.calista.steer.generate.GenerationResult.ParticleView;
import org.calista.steer.generate.GenerationTask;
import org.calista.steer.generate.GenerationTimeoutException;
import org.calista.steer.generate.OutputSelection;
import org.calista.steer.generate.SequenceState;
import org.calista.steer.generate.SteerLogFmt;
import org.calista.steer.generate.StopCondition;
import org.calista.steer.generate.TokenGenerator;
import org.calista.steer.generate.engine.impl.BatchPropagator;
import org.calista.steer.generate.engine.impl.TaskParallelPropagator;
import org.calista.steer.generate.potential.Potential;
import org.calista.steer.sampling.Seeds;
import org.calista.steer.sampling.Weights;
import org.calista.steer.sampling.particle.Particle;
import org.calista.steer.sampling.particle.ParticlePopulation;
import org.calista.steer.sampling.resample.ResamplingStrategy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SmcGenerationEngine: guided generation by sequential Monte Carlo.
 *
 * <p>A population of candidate sequences is extended one step at a time by the
 * {@link TokenGenerator}. Each extension is weighted by the potentials, weights are normalized,
 * and the population is resampled whenever its relative effective sample size drops below the
 * task's threshold. The run ends when every particle is done, the step cap is reached, or the
 * time budget is spent.</p>
 *
 * <h3>Determinism</h3>
 * Every particle draws from a stream derived from (seed, step, index), and resampling from a
 * stream derived from (seed, step). With several candidates per particle, candidate j of
 * particle i uses stream i*k+j and the kept candidate is drawn from a salted (seed, step) stream.
 * Results therefore do not depend on thread scheduling.
 *
 * <h3>Threading</h3>
 * Each {@link #generate(GenerationTask)} call owns a {@link WorkerPool} for its duration. The
 * engine itself is immutable and may serve concurrent runs.
 */
public final class SmcGenerationEngine {

    private static final Logger log = LogManager.getLogger(SmcGenerationEngine.class);

    private static final AtomicLong RUN_SEQ = new AtomicLong();
    private static final long SELECTION_SALT = 0x5E1EC7L;
    private static final long CANDIDATE_SALT = 0xCA4D1DL;

    private final TokenGenerator generator;
    private final List<Potential> potentials;
    private final StopCondition stopCondition;
    private final ParticleAdvancer advancer;
    private final StepListener stepListener;

    private final String threadNamePrefix;
    private final long shutdownTimeoutMs;
    private final int availableCores;

    public SmcGenerationEngine(TokenGenerator generator, List<Potential> potentials, StopCondition stopCondition) {
        this(builder(generator).potentials(potentials).stopCondition(stopCondition));
    }

    private SmcGenerationEngine(Builder b) {
        this.generator = b.generator;
        this.potentials = List.copyOf(b.potentials);
        this.stopCondition = b.stopCondition;
        this.threadNamePrefix = b.threadNamePrefix;
        this.shutdownTimeoutMs = b.shutdownTimeoutMs;
        this.availableCores = b.availableCores;
        this.stepListener = b.stepListener;
        this.advancer = new ParticleAdvancer(generator, potentials, stopCondition);
        logCreation();
    }

    public static Builder builder(TokenGenerator generator) {
        return new Builder(generator);
    }

    public TokenGenerator generator() {
        return generator;
    }

    public List<Potential> potentials() {
        return potentials;
    }

    // ---------------------------------------------------------------------
    // Run
    // ---------------------------------------------------------------------

    public GenerationResult generate(GenerationTask task) {
        Objects.requireNonNull(task, "task");
        final long t0 = System.nanoTime();
        final long deadline = StepContext.deadline(t0, task.timeout());
        final String reqId = "smc-" + RUN_SEQ.incrementAndGet();

        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put("req", reqId)) {
            int workers = WorkerPool.resolveWorkers(task, availableCores);
            int queueCapacity = Math.max(64, 2 * task.particleCount() * task.candidatesPerStep() + workers);
            Propagator propagator = propagatorFor(task);

            log.info("smc.start particles={} candidates={} workers={} mode={} maxSteps={} timeoutMs={} query='{}'",
                    task.particleCount(), task.candidatesPerStep(), workers, propagator.name(), task.maxSteps(),
                    task.bounded() ? task.timeout().toMillis() : "unbounded", SteerLogFmt.clip(task.query(), 60));

            WorkerPool pool = new WorkerPool(workers, queueCapacity, threadNamePrefix + reqId + "-", shutdownTimeoutMs);
            try {
                GenerationResult r = run(task, pool, propagator, t0, deadline);
                log.info("smc.done steps={} resamples={} timedOut={} elapsedMs={} logW={} best='{}'",
                        r.stepsCompleted(), r.resampleCount(), r.timedOut(), r.elapsed().toMillis(),
                        SteerLogFmt.num(r.bestLogWeight()), SteerLogFmt.clip(r.bestSequence(), 80));
                return r;
            } finally {
                pool.close();
            }
        }
    }

    private Propagator propagatorFor(GenerationTask task) {
        if (task.useGpu() && generator.supportsBatch()) {
            return new BatchPropagator(advancer, task.batchSize(), task.batchFailurePolicy());
        }
        if (task.useGpu()) {
            log.info("smc.batch unavailable generator={} -> task-parallel", generator.name());
        }
        return new TaskParallelPropagator(advancer);
    }

    private GenerationResult run(GenerationTask task, WorkerPool pool, Propagator propagator, long t0, long deadline) {
        final int n = task.particleCount();
        final int k = task.candidatesPerStep();
        final ResamplingStrategy strategy = task.resamplingScheme().strategy();
        final AtomicLong ids = new AtomicLong(n);

        ParticlePopulation<SequenceState> pop = ParticlePopulation.uniform(generator.start(task.query()), n);
        List<Double> essHistory = new ArrayList<>();
        int completed = 0;
        int resamples = 0;
        boolean timedOut = false;

        for (int step = 1; step <= task.maxSteps(); step++) {
            List<ProposalRequest> live = liveRequests(pop);
            if (live.isEmpty()) break;

            StepContext ctx = new StepContext(step, task.seed(), deadline, step == task.maxSteps(), pool);
            if (ctx.expired()) {
                timedOut = true;
                break;
            }

            List<StepOutcome> outcomes;
            try {
                outcomes = propagator.propagate(CandidateSelection.expand(live, k), ctx);
            } catch (TimeoutException e) {
                log.warn("smc.timeout step={} completed={} budgetMs={}", step, completed, task.timeout().toMillis());
                pool.abort();
                timedOut = true;
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GenerationFailedException("Generation interrupted at step " + step, e);
            }

            outcomes = CandidateSelection.reduce(outcomes, k, Seeds.global(task.seed() ^ CANDIDATE_SALT, step));

            ArrayList<Particle<SequenceState>> next = new ArrayList<>(pop.particles());
            for (StepOutcome o : outcomes) {
                Particle<SequenceState> p = next.get(o.index());
                next.set(o.index(), p.withState(o.state()).reweighted(o.logWeightDelta()));
            }
            ParticlePopulation<SequenceState> weighted = pop.replace(next);
            if (weighted.collapsed()) {
                log.warn("smc.collapse step={} live={}", step, live.size());
                throw new ConstraintUnsatisfiableException(step);
            }

            weighted = weighted.normalizedLogSpace();
            double rel = weighted.relativeEss();
            essHistory.add(rel);

            // a finished population keeps its weights for output selection
            boolean resampled = n > 1 && rel < task.resamplingThreshold() && anyLive(weighted);
            stepListener.onStep(step, weighted, resampled);
            if (resampled) {
                weighted = weighted.resample(strategy, Seeds.global(task.seed(), step), ids::getAndIncrement);
                resamples++;
            }

            pop = weighted;
            completed = step;

            if (log.isDebugEnabled()) {
                log.debug("smc.step t={} live={} alive={} ess={} resampled={}",
                        step, live.size(), pop.aliveCount(), SteerLogFmt.num(rel), resampled);
            }
        }

        if (timedOut && completed == 0) {
            throw new GenerationTimeoutException(task.timeout());
        }

        Particle<SequenceState> chosen = select(pop, task, completed);
        List<ParticleView> views = task.includePopulation() ? views(pop) : null;
        Duration elapsed = Duration.ofNanos(System.nanoTime() - t0);

        return new GenerationResult(chosen.state().tokens(), chosen.logWeight(), views, elapsed,
                completed, timedOut, resamples, essHistory);
    }

    private static List<ProposalRequest> liveRequests(ParticlePopulation<SequenceState> pop) {
        ArrayList<ProposalRequest> live = new ArrayList<>(pop.size());
        for (int i = 0; i < pop.size(); i++) {
            Particle<SequenceState> p = pop.get(i);
            if (p.alive() && !p.state().done()) live.add(new ProposalRequest(i, p.state()));
        }
        return live;
    }

    private static boolean anyLive(ParticlePopulation<SequenceState> pop) {
        for (Particle<SequenceState> p : pop.particles()) {
            if (p.alive() && !p.state().done()) return true;
        }
        return false;
    }

    private static Particle<SequenceState> select(ParticlePopulation<SequenceState> pop, GenerationTask task, int step) {
        if (task.outputSelection() == OutputSelection.WEIGHTED_SAMPLE) {
            double u = Seeds.global(task.seed() ^ SELECTION_SALT, step).nextDouble();
            return pop.get(Weights.search(Weights.cumulative(pop.normalizedWeights()), u));
        }
        return pop.best();
    }

    private static List<ParticleView> views(ParticlePopulation<SequenceState> pop) {
        double[] w = pop.normalizedWeights();
        ArrayList<ParticleView> out = new ArrayList<>(pop.size());
        for (int i = 0; i < pop.size(); i++) {
            Particle<SequenceState> p = pop.get(i);
            out.add(new ParticleView(p.id(), p.parentId(), p.state().text(), p.logWeight(), w[i], p.state().done()));
        }
        return out;
    }

    private void logCreation() {
        if (!log.isInfoEnabled()) return;
        log.info("\n{}", SteerLogFmt.box("SmcGenerationEngine", b -> {
            b.kv("generator", generator.name());
            b.kv("batched", generator.supportsBatch());
            b.kv("stopCondition", stopCondition.getClass().getSimpleName());
            b.sep();
            for (Potential p : potentials) b.kv("potential", p.name() + " [" + p.scope() + (p.fatalOnError() ? ", fatal" : "") + "]");
            if (potentials.isEmpty()) b.kv("potential", "<none>");
            b.sep();
            b.kv("threadNamePrefix", threadNamePrefix);
            b.kv("availableCores", availableCores);
            b.kv("shutdownTimeoutMs", shutdownTimeoutMs);
            b.kv("stepListener", stepListener == StepListener.NONE ? "<none>" : stepListener.getClass().getSimpleName());
        }));
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private final TokenGenerator generator;
        private List<Potential> potentials = List.of();
        private StopCondition stopCondition = StopCondition.endOfSequence();
        private String threadNamePrefix = "smc-";
        private long shutdownTimeoutMs = 1_000L;
        private int availableCores = Runtime.getRuntime().availableProcessors();
        private StepListener stepListener = StepListener.NONE;

        private Builder(TokenGenerator generator) {
            this.generator = Objects.requireNonNull(generator, "generator");
        }

        public Builder potentials(List<Potential> potentials) {
            this.potentials = Objects.requireNonNull(potentials, "potentials");
            return this;
        }

        public Builder stopCondition(StopCondition stopCondition) {
            this.stopCondition = Objects.requireNonNull(stopCondition, "stopCondition");
            return this;
        }

        public Builder threadNamePrefix(String prefix) {
            this.threadNamePrefix = Objects.requireNonNull(prefix, "threadNamePrefix");
            return this;
        }

        public Builder shutdownTimeoutMs(long ms) {
            this.shutdownTimeoutMs = Math.max(0L, ms);
            return this;
        }

        /** Core count used for the automatic worker count. */
        public Builder availableCores(int cores) {
            if (cores < 1) throw new IllegalArgumentException("cores must be >= 1: " + cores);
            this.availableCores = cores;
            return this;
        }

        public Builder stepListener(StepListener listener) {
            this.stepListener = Objects.requireNonNull(listener, "stepListener");
            return this;
        }

        public SmcGenerationEngine build() {
            return new SmcGenerationEngine(this);
        }
    }
}
