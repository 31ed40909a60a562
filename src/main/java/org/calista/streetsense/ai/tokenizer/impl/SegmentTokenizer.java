package org.calista.streetsense.ai.tokenizer.impl;

import org.calista.streetsense.ai.tokenizer.Tokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Lossless segmenter: splits text into runs of word characters, runs of punctuation and runs of
 * whitespace. Concatenating the segments gives back the input, case preserved.
 * - Fast: single pass, no regex
 */
public final class SegmentTokenizer implements Tokenizer {

    private static final int WORD = 0;
    private static final int SPACE = 1;
    private static final int PUNCT = 2;

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) return List.of();

        ArrayList<String> out = new ArrayList<>(Math.max(4, text.length() / 3));
        int start = 0;
        int kind = kindOf(text.charAt(0));

        for (int i = 1; i < text.length(); i++) {
            int k = kindOf(text.charAt(i));
            if (k != kind) {
                out.add(text.substring(start, i));
                start = i;
                kind = k;
            }
        }
        out.add(text.substring(start));
        return out;
    }

    /** True when the segment is a word run (the only kind a corrector should touch). */
    public static boolean isWord(String segment) {
        return segment != null && !segment.isEmpty() && kindOf(segment.charAt(0)) == WORD;
    }

    private static int kindOf(char c) {
        if (Character.isLetterOrDigit(c) || c == '_') return WORD;
        if (Character.isWhitespace(c)) return SPACE;
        return PUNCT;
    }
}
