package org.calista.steer.generate.generator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.steer.generate.Continuation;
import org.calista.steer.generate.SequenceState;
import org.calista.steer.generate.TokenGenerator;
import org.calista.steer.sampling.Weights;
import org.calista.steer.text.Tokenizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * BigramTokenGenerator: next-token sampling from corpus bigram counts.
 *
 * <p>p(next | prev) = (count(prev, next) + α) / (count(prev) + α·V). A previous token never seen
 * in the corpus falls back to smoothed unigram frequencies. The tables are built once and read
 * only, so concurrent proposals are safe.</p>
 */
public final class BigramTokenGenerator implements TokenGenerator {

    private static final Logger log = LogManager.getLogger(BigramTokenGenerator.class);

    public static final double DEFAULT_SMOOTHING = 0.01;

    private final Tokenizer tokenizer;
    private final double alpha;

    private final List<String> vocabulary;
    private final Row unigrams;
    private final Map<String, Row> bigrams;

    private BigramTokenGenerator(Tokenizer tokenizer, double alpha, List<String> vocabulary, Row unigrams, Map<String, Row> bigrams) {
        this.tokenizer = tokenizer;
        this.alpha = alpha;
        this.vocabulary = vocabulary;
        this.unigrams = unigrams;
        this.bigrams = bigrams;
    }

    /**
     * Trains on the given documents. Each document is tokenized separately, so no bigram spans two
     * documents.
     */
    public static BigramTokenGenerator train(Tokenizer tokenizer, List<String> documents, double smoothing) {
        Objects.requireNonNull(tokenizer, "tokenizer");
        Objects.requireNonNull(documents, "documents");
        if (!(smoothing > 0.0) || Double.isInfinite(smoothing)) {
            throw new IllegalArgumentException("smoothing must be > 0: " + smoothing);
        }

        LinkedHashMap<String, Integer> freq = new LinkedHashMap<>();
        LinkedHashMap<String, LinkedHashMap<String, Integer>> next = new LinkedHashMap<>();
        int docs = 0;
        for (String doc : documents) {
            List<String> t = tokenizer.tokenize(doc);
            if (t.isEmpty()) continue;
            docs++;
            for (int i = 0; i < t.size(); i++) {
                String a = t.get(i);
                freq.merge(a, 1, Integer::sum);
                if (i + 1 < t.size()) {
                    next.computeIfAbsent(a, k -> new LinkedHashMap<>()).merge(t.get(i + 1), 1, Integer::sum);
                }
            }
        }
        if (freq.isEmpty()) throw new IllegalArgumentException("corpus has no tokens");

        LinkedHashMap<String, Row> rows = new LinkedHashMap<>();
        for (Map.Entry<String, LinkedHashMap<String, Integer>> e : next.entrySet()) rows.put(e.getKey(), Row.of(e.getValue()));

        log.info("bigram.train docs={} vocab={} rows={} alpha={}", docs, freq.size(), rows.size(), smoothing);
        return new BigramTokenGenerator(tokenizer, smoothing, List.copyOf(freq.keySet()), Row.of(freq), Map.copyOf(rows));
    }

    public static BigramTokenGenerator train(Tokenizer tokenizer, List<String> documents) {
        return train(tokenizer, documents, DEFAULT_SMOOTHING);
    }

    @Override
    public Continuation propose(SequenceState state, RandomGenerator rng) {
        String prev = previous(state);
        Row row = prev == null ? null : bigrams.get(prev);
        if (row == null) row = unigrams;

        double smoothingMass = alpha * vocabulary.size();
        double total = row.total + smoothingMass;
        double u = rng.nextDouble() * total;

        String token;
        if (u < row.total) {
            token = row.tokens.get(Weights.search(row.cumulative, u / row.total));
        } else {
            token = vocabulary.get(Math.min(vocabulary.size() - 1, (int) ((u - row.total) / alpha)));
        }
        return Continuation.of(token, Math.log((row.count(token) + alpha) / total));
    }

    @Override
    public boolean supportsBatch() {
        return true;
    }

    /** Tokenizes the prompt the same way the corpus was tokenized. */
    @Override
    public SequenceState start(String query) {
        return SequenceState.start(tokenizer.tokenize(query));
    }

    public List<String> vocabulary() {
        return vocabulary;
    }

    public double probability(String prev, String next) {
        Row row = prev == null ? null : bigrams.get(prev.toLowerCase(Locale.ROOT));
        if (row == null) row = unigrams;
        return (row.count(next) + alpha) / (row.total + alpha * vocabulary.size());
    }

    private static String previous(SequenceState state) {
        String last = state.lastToken();
        if (last != null) return last;
        List<String> prompt = state.prompt();
        return prompt.isEmpty() ? null : prompt.get(prompt.size() - 1).toLowerCase(Locale.ROOT);
    }

    // ---------------------------------------------------------------------
    // Count table
    // ---------------------------------------------------------------------

    private static final class Row {
        final List<String> tokens;
        final Map<String, Integer> counts;
        final double[] cumulative;
        final double total;

        private Row(List<String> tokens, Map<String, Integer> counts, double[] cumulative, double total) {
            this.tokens = tokens;
            this.counts = counts;
            this.cumulative = cumulative;
            this.total = total;
        }

        static Row of(Map<String, Integer> counts) {
            ArrayList<String> tokens = new ArrayList<>(counts.size());
            double[] w = new double[counts.size()];
            double total = 0.0;
            int i = 0;
            for (Map.Entry<String, Integer> e : counts.entrySet()) {
                tokens.add(e.getKey());
                w[i++] = e.getValue();
                total += e.getValue();
            }
            for (int k = 0; k < w.length; k++) w[k] /= total;
            return new Row(List.copyOf(tokens), Map.copyOf(counts), Weights.cumulative(w), total);
        }

        int count(String token) {
            return counts.getOrDefault(token, 0);
        }
    }
}
