package org.calista.steer.generate;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one engine run.
 *
 * <p>When {@link #timedOut()} is true the fields describe the last fully completed step.</p>
 */
public final class GenerationResult {

    private final String bestSequence;
    private final List<String> bestTokens;
    private final double bestLogWeight;
    private final List<ParticleView> finalPopulation;
    private final Duration elapsed;
    private final int stepsCompleted;
    private final boolean timedOut;
    private final int resampleCount;
    private final List<Double> essHistory;

    public GenerationResult(List<String> bestTokens,
                            double bestLogWeight,
                            List<ParticleView> finalPopulation,
                            Duration elapsed,
                            int stepsCompleted,
                            boolean timedOut,
                            int resampleCount,
                            List<Double> essHistory) {
        this.bestTokens = List.copyOf(Objects.requireNonNull(bestTokens, "bestTokens"));
        this.bestSequence = String.join(" ", this.bestTokens);
        this.bestLogWeight = bestLogWeight;
        this.finalPopulation = finalPopulation == null ? null : List.copyOf(finalPopulation);
        this.elapsed = Objects.requireNonNull(elapsed, "elapsed");
        this.stepsCompleted = stepsCompleted;
        this.timedOut = timedOut;
        this.resampleCount = resampleCount;
        this.essHistory = List.copyOf(Objects.requireNonNull(essHistory, "essHistory"));
    }

    public String bestSequence() { return bestSequence; }
    public List<String> bestTokens() { return bestTokens; }
    public double bestLogWeight() { return bestLogWeight; }
    /** Present only when the task asked for it. */
    public Optional<List<ParticleView>> finalPopulation() { return Optional.ofNullable(finalPopulation); }
    public Duration elapsed() { return elapsed; }
    public int stepsCompleted() { return stepsCompleted; }
    public boolean timedOut() { return timedOut; }
    public int resampleCount() { return resampleCount; }
    /** Relative ESS after each completed step, before any resampling. */
    public List<Double> essHistory() { return essHistory; }

    @Override
    public String toString() {
        return "GenerationResult{best='" + SteerLogFmt.clip(bestSequence, 60) + "', logW=" + SteerLogFmt.num(bestLogWeight)
                + ", steps=" + stepsCompleted + ", timedOut=" + timedOut + ", resamples=" + resampleCount
                + ", elapsed=" + elapsed.toMillis() + "ms}";
    }

    /** Read-only snapshot of one particle at the end of the run. */
    public static final class ParticleView {
        private final long id;
        private final long parentId;
        private final String text;
        private final double logWeight;
        private final double weight;
        private final boolean done;

        public ParticleView(long id, long parentId, String text, double logWeight, double weight, boolean done) {
            this.id = id;
            this.parentId = parentId;
            this.text = Objects.requireNonNull(text, "text");
            this.logWeight = logWeight;
            this.weight = weight;
            this.done = done;
        }

        public long id() { return id; }
        public long parentId() { return parentId; }
        public String text() { return text; }
        public double logWeight() { return logWeight; }
        /** Normalized weight. */
        public double weight() { return weight; }
        public boolean done() { return done; }

        @Override
        public String toString() {
            return "#" + id + "(" + SteerLogFmt.num(weight) + ") '" + text + "'";
        }
    }
}
