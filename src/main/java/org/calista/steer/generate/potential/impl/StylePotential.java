package org.calista.steer.generate.potential.impl;

import org.calista.steer.generate.SequenceState;
import org.calista.steer.generate.potential.AbstractPotential;
import org.calista.steer.generate.potential.PotentialScope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Scores how much of a writing style shows up in the text: matched pattern weight over total
 * weight, never below {@code floor}.
 */
public final class StylePotential extends AbstractPotential {

    public static final double DEFAULT_FLOOR = 0.1;

    public enum Style {
        FORMAL(patterns(
                "\\b(therefore|consequently|thus|hence|accordingly)\\b",
                "\\b(furthermore|moreover|additionally|in addition)\\b",
                "\\b(however|nevertheless|nonetheless|conversely)\\b",
                "\\b(it is|there are|one must|it should be noted)\\b",
                "[^.!?]+[.][^.!?]+[.][^.!?]+[.]")),
        CONVERSATIONAL(patterns(
                "\\b(I think|I believe|I feel|I'd say)\\b",
                "\\b(you know|right|actually|basically|honestly)\\b",
                "\\b(like|so|well|anyway|I mean)\\b",
                "[!?]{1,3}",
                "\\b(can't|won't|don't|isn't|aren't|wasn't|weren't)\\b")),
        TECHNICAL(patterns(
                "\\b(algorithm|function|method|implementation|system)\\b",
                "\\b(data|input|output|parameter|variable)\\b",
                "\\b(analysis|performance|efficiency|optimization)\\b",
                "\\b(technical|specification|requirement|documentation)\\b",
                "[a-zA-Z]+\\([^)]*\\)")),
        CREATIVE(patterns(
                "\\b(beautiful|stunning|gorgeous|magnificent|breathtaking)\\b",
                "\\b(imagine|dream|wonder|fantasy|magical)\\b",
                "[a-zA-Z]+ing [a-zA-Z]+ (like|as) [a-zA-Z]+",
                "[a-zA-Z]+ (is|was|are|were) [a-zA-Z]+",
                "[a-zA-Z]+, [a-zA-Z]+, and [a-zA-Z]+"));

        private final Map<String, Double> patterns;

        Style(Map<String, Double> patterns) {
            this.patterns = patterns;
        }

        public Map<String, Double> patterns() {
            return patterns;
        }

        public static Style parse(String s) {
            Objects.requireNonNull(s, "style");
            try {
                return valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown style: " + s, e);
            }
        }

        private static Map<String, Double> patterns(String... regexes) {
            LinkedHashMap<String, Double> m = new LinkedHashMap<>();
            for (String r : regexes) m.put(r, 0.2);
            return Map.copyOf(m);
        }
    }

    private final List<Pattern> patterns = new ArrayList<>();
    private final List<Double> weights = new ArrayList<>();
    private final double totalWeight;
    private final double floor;

    public StylePotential(String name, PotentialScope scope, Map<String, Double> stylePatterns, double floor) {
        super(name, scope, false);
        Objects.requireNonNull(stylePatterns, "stylePatterns");
        if (stylePatterns.isEmpty()) throw new IllegalArgumentException("stylePatterns must not be empty");
        if (!(floor >= 0.0 && floor <= 1.0)) throw new IllegalArgumentException("floor must be in [0,1]: " + floor);
        double total = 0.0;
        for (Map.Entry<String, Double> e : stylePatterns.entrySet()) {
            double w = e.getValue();
            if (!(w >= 0.0) || Double.isInfinite(w)) throw new IllegalArgumentException("bad weight for " + e.getKey() + ": " + w);
            patterns.add(Pattern.compile(e.getKey()));
            weights.add(w);
            total += w;
        }
        this.totalWeight = total;
        this.floor = floor;
    }

    public static StylePotential of(Style style) {
        return new StylePotential("style:" + style.name().toLowerCase(Locale.ROOT), PotentialScope.COMPLETE, style.patterns(), DEFAULT_FLOOR);
    }

    @Override
    public double score(SequenceState state) {
        if (totalWeight <= 0.0) return 1.0;
        String text = subject(state);
        double matched = 0.0;
        for (int i = 0; i < patterns.size(); i++) {
            if (patterns.get(i).matcher(text).find()) matched += weights.get(i);
        }
        return Math.max(floor, matched / totalWeight);
    }
}
