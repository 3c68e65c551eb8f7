package org.calista.steer.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lower-cases, keeps runs of letters, digits and apostrophes as words, and emits sentence
 * punctuation ({@code . ! ? ,}) as tokens of its own. Everything else separates tokens.
 */
public final class SimpleTokenizer implements Tokenizer {

    private final boolean keepPunctuation;

    public SimpleTokenizer() {
        this(true);
    }

    public SimpleTokenizer(boolean keepPunctuation) {
        this.keepPunctuation = keepPunctuation;
    }

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();
        String s = text.toLowerCase(Locale.ROOT);

        ArrayList<String> out = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isLetterOrDigit(c) || (c == '\'' && word.length() > 0)) {
                word.append(c);
                continue;
            }
            flush(word, out);
            if (keepPunctuation && isPunctuation(c)) out.add(String.valueOf(c));
        }
        flush(word, out);
        return out;
    }

    private static boolean isPunctuation(char c) {
        return c == '.' || c == '!' || c == '?' || c == ',';
    }

    private static void flush(StringBuilder word, List<String> out) {
        if (word.length() == 0) return;
        out.add(word.toString());
        word.setLength(0);
    }
}
