package org.calista.steer.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.calista.steer.generate.BatchFailurePolicy;
import org.calista.steer.generate.GenerationTask;
import org.calista.steer.generate.OutputSelection;
import org.calista.steer.generate.StopCondition;
import org.calista.steer.generate.TokenGenerator;
import org.calista.steer.generate.WorkerCountPolicy;
import org.calista.steer.generate.engine.SmcGenerationEngine;
import org.calista.steer.generate.generator.BigramTokenGenerator;
import org.calista.steer.generate.potential.Potential;
import org.calista.steer.generate.potential.PotentialScope;
import org.calista.steer.generate.potential.impl.ConstraintPotential;
import org.calista.steer.generate.potential.impl.ForbiddenTokenPotential;
import org.calista.steer.generate.potential.impl.ScriptPotential;
import org.calista.steer.generate.potential.impl.StylePotential;
import org.calista.steer.generate.potential.impl.TerminalPunctuationPotential;
import org.calista.steer.sampling.resample.ResamplingScheme;
import org.calista.steer.text.SimpleTokenizer;
import org.calista.steer.text.Tokenizer;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * SteerComposer: turns the kernel's configuration into runnable pieces: the token generator,
 * the potentials, the stop condition, the engine, and one {@link GenerationTask} per query.
 *
 * <p>Run parameters come from the JS plan script ({@value #PLAN_SCRIPT}) when the kernel has a
 * JS context, otherwise straight from the config.</p>
 */
public final class SteerComposer {

    private static final Logger log = LoggerFactory.getLogger(SteerComposer.class);

    public static final String PLAN_SCRIPT = "script/steer_plan.js";
    public static final String BUNDLED_CORPUS = "corpus/default.txt";

    private final SteerKernel kernel;
    private final Value buildPlan;

    public SteerComposer(SteerKernel kernel) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
        if (!kernel.jsEnabled()) {
            this.buildPlan = null;
            log.info("SteerComposer: JS disabled, plan taken from config directly");
            return;
        }

        Context context = kernel.jsContext();
        String script = readResource(PLAN_SCRIPT);
        synchronized (context) {
            context.eval(Source.create("js", script));
            Value fn = context.getBindings("js").getMember("buildPlan");
            if (fn == null || !fn.canExecute()) {
                throw new IllegalStateException("JS buildPlan not found in " + PLAN_SCRIPT);
            }
            this.buildPlan = fn;
        }
    }

    // ---------------------------------------------------------------------
    // Task
    // ---------------------------------------------------------------------

    public GenerationTask taskFor(String query) {
        Objects.requireNonNull(query, "query");
        Map<String, Object> plan = plan(query);

        GenerationTask.Builder builder = GenerationTask.builder(query)
                .particleCount(i(plan, "particleCount"))
                .maxSteps(i(plan, "maxSteps"))
                .candidatesPerStep(i(plan, "candidatesPerStep"))
                .timeout(Duration.ofMillis(l(plan, "timeoutMs")))
                .useParallel(b(plan, "useParallel"))
                .workers(i(plan, "workers"))
                .useGpu(b(plan, "useGpu"))
                .gpuDevices(i(plan, "gpuDevices"))
                .batchSize(i(plan, "batchSize"))
                .batchFailurePolicy(BatchFailurePolicy.parse(s(plan, "batchFailurePolicy", null)))
                .workerCountPolicy(WorkerCountPolicy.parse(s(plan, "workerCountPolicy", null)))
                .resamplingThreshold(d(plan, "resamplingThreshold"))
                .resamplingScheme(ResamplingScheme.parse(s(plan, "resamplingScheme", null)))
                .outputSelection(OutputSelection.parse(s(plan, "outputSelection", null)))
                .includePopulation(b(plan, "includePopulation"));

        // JS numbers are doubles, so the seed bypasses the plan script; unset means fresh per task
        Long configured = kernel.config().generation.seed;
        if (configured != null) builder.seed(configured);
        return builder.build();
    }

    private Map<String, Object> plan(String query) {
        if (buildPlan == null) return javaPlan(kernel.config());

        String cfgJson;
        try {
            cfgJson = kernel.mapper().writeValueAsString(kernel.config());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize config for the plan script", e);
        }

        String planJson;
        Context context = kernel.jsContext();
        synchronized (context) {
            try {
                planJson = buildPlan.execute(cfgJson, query).asString();
            } catch (PolyglotException e) {
                throw new IllegalStateException("Plan script failed: " + e.getMessage(), e);
            }
        }

        try {
            return kernel.mapper().readValue(planJson, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Plan script returned invalid JSON: " + planJson, e);
        }
    }

    /** Same mapping as the plan script, without profile scaling. */
    static Map<String, Object> javaPlan(SteerConfig cfg) {
        LinkedHashMap<String, Object> m = new LinkedHashMap<>();
        m.put("particleCount", cfg.generation.particleCount);
        m.put("maxSteps", cfg.generation.maxSteps);
        m.put("candidatesPerStep", cfg.generation.candidatesPerStep);
        m.put("timeoutMs", cfg.generation.timeoutMs);
        m.put("useParallel", cfg.parallel.useParallel);
        m.put("workers", cfg.parallel.workers);
        m.put("useGpu", cfg.parallel.useGpu);
        m.put("gpuDevices", cfg.parallel.gpuDevices);
        m.put("batchSize", cfg.parallel.batchSize);
        m.put("batchFailurePolicy", cfg.parallel.batchFailurePolicy);
        m.put("workerCountPolicy", cfg.parallel.workerCountPolicy);
        m.put("resamplingThreshold", cfg.resampling.threshold);
        m.put("resamplingScheme", cfg.resampling.scheme);
        m.put("outputSelection", cfg.output.selection);
        m.put("includePopulation", cfg.output.includePopulation);
        return m;
    }

    // ---------------------------------------------------------------------
    // Engine parts
    // ---------------------------------------------------------------------

    public SmcGenerationEngine buildEngine() throws IOException {
        SteerConfig cfg = kernel.config();
        return SmcGenerationEngine.builder(buildGenerator(new SimpleTokenizer()))
                .potentials(buildPotentials())
                .stopCondition(buildStopCondition())
                .threadNamePrefix(cfg.parallel.threadNamePrefix)
                .shutdownTimeoutMs(cfg.parallel.shutdownTimeoutMs)
                .build();
    }

    /** Bigram generator over the corpus file under baseDir, or the bundled corpus when absent. */
    public TokenGenerator buildGenerator(Tokenizer tokenizer) throws IOException {
        SteerConfig.Corpus c = kernel.config().corpus;
        List<String> docs = null;
        if (c.file != null) {
            Path file = kernel.io().resolve(c.file);
            if (kernel.io().exists(file)) {
                docs = kernel.io().readLines(file);
                log.info("corpus: {} ({} lines)", file, docs.size());
            }
        }
        if (docs == null) {
            docs = List.of(readResource(BUNDLED_CORPUS).split("\\R"));
            log.info("corpus: bundled {} ({} lines)", BUNDLED_CORPUS, docs.size());
        }
        return BigramTokenGenerator.train(tokenizer, docs, c.smoothing);
    }

    public List<Potential> buildPotentials() {
        SteerConfig.Potentials p = kernel.config().potentials;
        ArrayList<Potential> out = new ArrayList<>();

        if (p.terminalPunctuation) out.add(new TerminalPunctuationPotential(p.terminalPunctuationOtherwise));
        if (p.style != null) out.add(StylePotential.of(StylePotential.Style.parse(p.style)));
        if (!p.forbiddenTokens.isEmpty()) out.add(new ForbiddenTokenPotential(new HashSet<>(p.forbiddenTokens), true));

        List<ToDoubleFunction<String>> constraints = new ArrayList<>();
        if (p.maxLength > 0) constraints.add(ConstraintPotential.lengthConstraint(p.minLength, p.maxLength));
        if (!p.requiredElements.isEmpty()) constraints.add(ConstraintPotential.requiredElements(p.requiredElements, p.requiredThreshold));
        if (!constraints.isEmpty()) out.add(new ConstraintPotential("constraints", PotentialScope.COMPLETE, constraints));

        for (SteerConfig.Script s : p.scripts) {
            if (!kernel.jsEnabled()) {
                throw new IllegalStateException("Script potential '" + s.name + "' configured but JS is disabled");
            }
            PotentialScope scope = PotentialScope.valueOf(s.scope);
            out.add(new ScriptPotential(s.name, scope, s.fatalOnError, kernel.jsContext(), s.source));
        }
        return out;
    }

    public StopCondition buildStopCondition() {
        SteerConfig.Stop st = kernel.config().stop;
        StopCondition c = StopCondition.endOfSequence();
        if (st.terminalPunctuation) c = c.or(StopCondition.terminalPunctuation());
        if (st.maxTokens > 0) c = c.or(StopCondition.maxTokens(st.maxTokens));
        return c;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static String readResource(String name) {
        try (InputStream in = SteerComposer.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) throw new IllegalStateException("Missing classpath resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource " + name, e);
        }
    }

    private static int i(Map<String, Object> m, String k) {
        Object v = m.get(k);
        if (v instanceof Number) return ((Number) v).intValue();
        throw new IllegalStateException("plan." + k + " is not a number: " + v);
    }

    private static long l(Map<String, Object> m, String k) {
        Object v = m.get(k);
        if (v instanceof Number) return ((Number) v).longValue();
        throw new IllegalStateException("plan." + k + " is not a number: " + v);
    }

    private static double d(Map<String, Object> m, String k) {
        Object v = m.get(k);
        if (v instanceof Number) return ((Number) v).doubleValue();
        throw new IllegalStateException("plan." + k + " is not a number: " + v);
    }

    private static boolean b(Map<String, Object> m, String k) {
        Object v = m.get(k);
        if (v instanceof Boolean) return (Boolean) v;
        throw new IllegalStateException("plan." + k + " is not a boolean: " + v);
    }

    private static String s(Map<String, Object> m, String k, String def) {
        Object v = m.get(k);
        return v == null ? def : v.toString();
    }
}
