package org.calista.streetsense.ai.tokenizer.impl;

import org.calista.streetsense.ai.tokenizer.Tokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lower-cased word tokens (letters/digits/_), punctuation and whitespace dropped.
 * Tokens shorter than {@code minLength} are skipped.
 */
public final class WordTokenizer implements Tokenizer {

    /** words (letters/digits/_), unicode aware */
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{Nd}_]+");

    private final int minLength;

    public WordTokenizer() {
        this(1);
    }

    public WordTokenizer(int minLength) {
        this.minLength = Math.max(1, minLength);
    }

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();
        String s = text.toLowerCase(Locale.ROOT);

        ArrayList<String> out = new ArrayList<>(Math.max(4, s.length() / 5));
        Matcher m = WORD.matcher(s);
        while (m.find()) {
            String w = m.group();
            if (w.length() >= minLength) out.add(w);
        }
        return out;
    }
}
