package org.calista.steer.generate.generator;

import org.calista.steer.generate.Continuation;
import org.calista.steer.generate.SequenceState;
import org.calista.steer.generate.TokenGenerator;
import org.calista.steer.sampling.distribution.impl.DiscreteDistribution;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Context-free generator: every step draws one token from a fixed distribution.
 */
public final class VocabularyTokenGenerator implements TokenGenerator {

    private final DiscreteDistribution<String> vocabulary;

    public VocabularyTokenGenerator(DiscreteDistribution<String> vocabulary) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
    }

    public static VocabularyTokenGenerator uniform(String... tokens) {
        return new VocabularyTokenGenerator(DiscreteDistribution.uniform(List.of(tokens)));
    }

    public static VocabularyTokenGenerator weighted(Map<String, Double> weights) {
        return new VocabularyTokenGenerator(DiscreteDistribution.of(weights));
    }

    @Override
    public Continuation propose(SequenceState state, RandomGenerator rng) {
        String token = vocabulary.sample(rng);
        return Continuation.of(token, vocabulary.logPdf(token));
    }

    @Override
    public boolean supportsBatch() {
        return true;
    }

    public DiscreteDistribution<String> vocabulary() {
        return vocabulary;
    }
}
