package org.calista.streetsense.ai.typo;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.streetsense.ai.cache.FifoCache;
import org.calista.streetsense.ai.core.EngineConfig;
import org.calista.streetsense.ai.tokenizer.Tokenizer;
import org.calista.streetsense.ai.tokenizer.impl.SegmentTokenizer;
import org.calista.streetsense.ai.vocab.VocabularyStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * TypoCorrector: vocabulary-driven correction of misspelled words.
 *
 * Goals:
 * - deterministic: nearest vocabulary word by strict Damerau-Levenshtein, vocabulary order breaks ties
 * - bounded: a word is only replaced by a vocabulary word within {@code maxDistance} edits
 * - lossless layout: punctuation and whitespace segments pass through untouched
 *
 * <p>Known words, very short tokens and pure numbers are never touched. Nearest-word lookups are cached
 * per (maxDistance, token); the cache is dropped when the vocabulary changes.
 *
 * <p>The weighted distance (keyboard/phonetic aware) only ranks {@link #getSuggestions(String)}.
 */
public final class TypoCorrector {
    private static final Logger log = LogManager.getLogger(TypoCorrector.class);

    private final VocabularyStore store;
    private final EngineConfig.Typo cfg;
    private final EditDistance weighted;
    private final Tokenizer segments = new SegmentTokenizer();

    private final FifoCache<String, Nearest> cache;
    private long cacheRevision;

    public TypoCorrector(VocabularyStore store, EngineConfig.Typo cfg) {
        this.store = Objects.requireNonNull(store, "store");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.weighted = new EditDistance(cfg.adjacentKeyCost, cfg.phoneticCost, cfg.transpositionCost);
        this.cache = new FifoCache<>(cfg.cacheSize);
        this.cacheRevision = store.revision();
    }

    // ---------------------------------------------------------------------
    // Correction
    // ---------------------------------------------------------------------

    public CorrectionResult correct(String text) {
        return correct(text, cfg.maxDistance);
    }

    public CorrectionResult correct(String text, int maxDistance) {
        if (text == null || text.isEmpty()) return new CorrectionResult(text, "", List.of());
        final int max = Math.max(0, maxDistance);

        StringBuilder out = new StringBuilder(text.length() + 8);
        ArrayList<Correction> corrections = new ArrayList<>(2);

        for (String seg : segments.tokenize(text)) {
            if (!SegmentTokenizer.isWord(seg)) {
                out.append(seg);
                continue;
            }

            String lower = seg.toLowerCase(Locale.ROOT);
            if (!isCandidate(lower)) {
                out.append(seg);
                continue;
            }

            Nearest n = nearest(lower, max);
            if (n.word != null) {
                out.append(n.word);
                corrections.add(new Correction(seg, n.word, n.distance));
            } else {
                out.append(seg);
            }
        }

        if (log.isDebugEnabled() && !corrections.isEmpty()) {
            log.debug("correct: '{}' -> '{}' {}", text, out, corrections);
        }
        return new CorrectionResult(text, out.toString(), corrections);
    }

    // ---------------------------------------------------------------------
    // Suggestions
    // ---------------------------------------------------------------------

    /**
     * Vocabulary words close to {@code word} under the weighted distance, nearest first.
     * Equal distances keep vocabulary order.
     */
    public List<Suggestion> getSuggestions(String word) {
        return getSuggestions(word, cfg.maxSuggestions);
    }

    public List<Suggestion> getSuggestions(String word, int max) {
        if (word == null || word.isBlank() || max < 1) return List.of();
        String w = word.trim().toLowerCase(Locale.ROOT);

        ArrayList<Suggestion> found = new ArrayList<>();
        for (String v : store.vocabulary()) {
            if (Math.abs(v.length() - w.length()) > cfg.suggestionMaxLengthDiff) continue;
            double d = weighted.weighted(w, v);
            if (d <= cfg.suggestionMaxDistance) found.add(new Suggestion(v, d));
        }
        found.sort(Comparator.comparingDouble(s -> s.distance));
        return found.size() > max ? List.copyOf(found.subList(0, max)) : List.copyOf(found);
    }

    /** Unknown word with a vocabulary word within the strict correction distance. */
    public boolean mightBeTypo(String word) {
        if (word == null || word.isBlank()) return false;
        String w = word.trim().toLowerCase(Locale.ROOT);
        if (store.isKnownWord(w)) return false;
        return nearest(w, cfg.maxDistance).word != null;
    }

    public boolean isKnown(String word) {
        return store.isKnownWord(word);
    }

    // ---------------------------------------------------------------------
    // Vocabulary / cache
    // ---------------------------------------------------------------------

    public boolean addWord(String word) {
        return store.addWord(word);
    }

    public int addWords(Collection<String> words) {
        return store.addWords(words);
    }

    public void clearCache() {
        cache.clear();
        cacheRevision = store.revision();
    }

    public int cacheSize() {
        syncCache();
        return cache.size();
    }

    public int vocabularySize() {
        return store.vocabularySize();
    }

    public static final class Suggestion {
        public final String word;
        public final double distance;

        public Suggestion(String word, double distance) {
            this.word = Objects.requireNonNull(word, "word");
            this.distance = distance;
        }

        @Override
        public String toString() {
            return word + String.format(Locale.ROOT, "(%.2f)", distance);
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private boolean isCandidate(String lower) {
        if (lower.length() < cfg.minWordLength) return false;
        if (isNumeric(lower)) return false;
        return !store.isKnownWord(lower);
    }

    private Nearest nearest(String token, int max) {
        syncCache();
        String key = max + ":" + token;
        Nearest hit = cache.get(key);
        if (hit != null) return hit;

        String best = null;
        int bestDistance = max + 1;
        for (String v : store.vocabulary()) {
            if (Math.abs(v.length() - token.length()) > max) continue;
            int d = EditDistance.damerauLevenshtein(token, v);
            if (d < bestDistance) {
                best = v;
                bestDistance = d;
            }
            if (d == 1) break;
        }

        Nearest n = (best == null) ? Nearest.NONE : new Nearest(best, bestDistance);
        cache.put(key, n);
        return n;
    }

    private void syncCache() {
        long rev = store.revision();
        if (rev != cacheRevision) {
            cache.clear();
            cacheRevision = rev;
        }
    }

    private static boolean isNumeric(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }

    private record Nearest(String word, int distance) {
        static final Nearest NONE = new Nearest(null, -1);
    }
}
