package org.calista.steer.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.steer.generate.BatchFailurePolicy;
import org.calista.steer.generate.GenerationTask;
import org.calista.steer.generate.OutputSelection;
import org.calista.steer.generate.WorkerCountPolicy;
import org.calista.steer.generate.potential.impl.StylePotential;
import org.calista.steer.io.FileIO;
import org.calista.steer.sampling.resample.ResamplingScheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * SteerConfig: plain Jackson-bound configuration.
 *
 * <ul>
 *   <li>defaults live in field initializers</li>
 *   <li>{@link #loadOrCreate} writes a default file when none exists</li>
 *   <li>{@link #validate()} clamps and normalizes every value</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SteerConfig {

    private static final Logger log = LoggerFactory.getLogger(SteerConfig.class);

    public String baseDir = "data";
    public Generation generation = new Generation();
    public Parallel parallel = new Parallel();
    public Resampling resampling = new Resampling();
    public Output output = new Output();
    public Stop stop = new Stop();
    public Potentials potentials = new Potentials();
    public Corpus corpus = new Corpus();
    public Journal journal = new Journal();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Generation {
        /** "fast", "balanced" or "thorough"; scales particles and budget in the plan script. */
        public String profile = "balanced";
        public int particleCount = 16;
        public int maxSteps = 64;
        /** Continuations proposed per particle and step; one is kept, drawn by weight. */
        public int candidatesPerStep = 1;
        /** 0 = unbounded. */
        public long timeoutMs = 30_000;
        /** null = fresh seed per run. */
        public Long seed = null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Parallel {
        public boolean useParallel = true;
        /** 0 = auto. */
        public int workers = 0;
        public boolean useGpu = false;
        public int gpuDevices = 0;
        /** Max states per batched call; 0 = whole population. */
        public int batchSize = 0;
        public String batchFailurePolicy = BatchFailurePolicy.FALLBACK_TO_TASK_PARALLEL.name();
        public String workerCountPolicy = WorkerCountPolicy.PREFER_GPU_DEVICES.name();
        public String threadNamePrefix = "smc-";
        public long shutdownTimeoutMs = 1_000;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Resampling {
        public double threshold = 0.5;
        public String scheme = ResamplingScheme.SYSTEMATIC.name();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Output {
        public String selection = OutputSelection.MAX_WEIGHT.name();
        public boolean includePopulation = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Stop {
        public boolean terminalPunctuation = true;
        /** 0 = only the step cap limits length. */
        public int maxTokens = 0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Potentials {
        /** Finished sequences must end in . ! or ? */
        public boolean terminalPunctuation = true;
        /** Score for unpunctuated endings; 0 = hard constraint. */
        public double terminalPunctuationOtherwise = 0.0;
        /** FORMAL, CONVERSATIONAL, TECHNICAL, CREATIVE or null. */
        public String style = null;
        public List<String> forbiddenTokens = new ArrayList<>();
        public List<String> requiredElements = new ArrayList<>();
        public int requiredThreshold = 1;
        /** Character bounds; 0/0 disables. */
        public int minLength = 0;
        public int maxLength = 0;
        public List<Script> scripts = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Script {
        public String name;
        public String scope = "COMPLETE";
        public boolean fatalOnError = false;
        /** JavaScript defining score(text, appendedText, done). */
        public String source;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Corpus {
        /** Path under baseDir; when missing the bundled corpus is used. */
        public String file = "corpus.txt";
        public double smoothing = 0.01;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Journal {
        public boolean enabled = true;
        public String logFile = "runs.jsonl";
        /** Appends take an exclusive file lock so concurrent writers never interleave records. */
        public boolean lockWrites = true;
        public long lockTimeoutMs = 3_000;
    }

    // -------------------- Load / Create --------------------

    /**
     * Reads the config; when the file is missing or blank, writes and returns the defaults.
     */
    public static SteerConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            SteerConfig created = new SteerConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            SteerConfig created = new SteerConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        SteerConfig cfg = mapper.readValue(json, SteerConfig.class);
        if (cfg == null) cfg = new SteerConfig();
        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, SteerConfig cfg) throws IOException {
        Objects.requireNonNull(cfg, "cfg");
        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, SteerConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (generation == null) generation = new Generation();
        generation.profile = normalizeProfile(generation.profile);
        if (generation.particleCount < 1) generation.particleCount = 1;
        if (generation.particleCount > 100_000) generation.particleCount = 100_000;
        if (generation.maxSteps < 1) generation.maxSteps = 1;
        if (generation.candidatesPerStep < 1) generation.candidatesPerStep = 1;
        if (generation.candidatesPerStep > GenerationTask.MAX_CANDIDATES_PER_STEP) generation.candidatesPerStep = GenerationTask.MAX_CANDIDATES_PER_STEP;
        if (generation.timeoutMs < 0) generation.timeoutMs = 0;

        if (parallel == null) parallel = new Parallel();
        if (parallel.workers < 0) parallel.workers = 0;
        if (parallel.gpuDevices < 0) parallel.gpuDevices = 0;
        if (parallel.batchSize < 0) parallel.batchSize = 0;
        parallel.batchFailurePolicy = BatchFailurePolicy.parse(parallel.batchFailurePolicy).name();
        parallel.workerCountPolicy = WorkerCountPolicy.parse(parallel.workerCountPolicy).name();
        if (parallel.threadNamePrefix == null || parallel.threadNamePrefix.isBlank()) parallel.threadNamePrefix = "smc-";
        if (parallel.shutdownTimeoutMs < 100) parallel.shutdownTimeoutMs = 100;

        if (resampling == null) resampling = new Resampling();
        if (!Double.isFinite(resampling.threshold)) resampling.threshold = 0.5;
        if (resampling.threshold < 0.0) resampling.threshold = 0.0;
        if (resampling.threshold > 1.0) resampling.threshold = 1.0;
        resampling.scheme = ResamplingScheme.parse(resampling.scheme).name();

        if (output == null) output = new Output();
        output.selection = OutputSelection.parse(output.selection).name();

        if (stop == null) stop = new Stop();
        if (stop.maxTokens < 0) stop.maxTokens = 0;

        if (potentials == null) potentials = new Potentials();
        if (!Double.isFinite(potentials.terminalPunctuationOtherwise)) potentials.terminalPunctuationOtherwise = 0.0;
        potentials.terminalPunctuationOtherwise = Math.max(0.0, Math.min(1.0, potentials.terminalPunctuationOtherwise));
        if (potentials.style != null && potentials.style.isBlank()) potentials.style = null;
        if (potentials.style != null) potentials.style = StylePotential.Style.parse(potentials.style).name();
        if (potentials.forbiddenTokens == null) potentials.forbiddenTokens = new ArrayList<>();
        if (potentials.requiredElements == null) potentials.requiredElements = new ArrayList<>();
        if (potentials.requiredThreshold < 1) potentials.requiredThreshold = 1;
        if (potentials.minLength < 0) potentials.minLength = 0;
        if (potentials.maxLength < potentials.minLength) potentials.maxLength = potentials.minLength;
        if (potentials.scripts == null) potentials.scripts = new ArrayList<>();
        potentials.scripts.removeIf(s -> s == null || s.source == null || s.source.isBlank());
        for (int i = 0; i < potentials.scripts.size(); i++) {
            Script s = potentials.scripts.get(i);
            if (s.name == null || s.name.isBlank()) s.name = "script-" + i;
            s.scope = "INCREMENTAL".equalsIgnoreCase(s.scope) ? "INCREMENTAL" : "COMPLETE";
        }

        if (corpus == null) corpus = new Corpus();
        if (corpus.file != null && corpus.file.isBlank()) corpus.file = null;
        if (!(corpus.smoothing > 0.0) || !Double.isFinite(corpus.smoothing)) corpus.smoothing = 0.01;

        if (journal == null) journal = new Journal();
        if (journal.logFile == null || journal.logFile.isBlank()) journal.logFile = "runs.jsonl";
        if (journal.lockTimeoutMs < 10) journal.lockTimeoutMs = 10;
    }

    private static String normalizeProfile(String p) {
        if (p == null) return "balanced";
        String s = p.trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "fast":
            case "balanced":
            case "thorough":
                return s;
            default:
                log.warn("Unknown generation profile '{}', using 'balanced'", p);
                return "balanced";
        }
    }
}
