package org.calista.streetsense.ai.hybrid;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.streetsense.ai.cache.FifoCache;
import org.calista.streetsense.ai.core.EngineConfig;
import org.calista.streetsense.ai.intent.ExtractedEntities;
import org.calista.streetsense.ai.intent.IntentClassifier;
import org.calista.streetsense.ai.intent.IntentMatch;
import org.calista.streetsense.ai.intent.IntentPrediction;
import org.calista.streetsense.ai.semantic.SemanticEngine;
import org.calista.streetsense.ai.text.NormalizationResult;
import org.calista.streetsense.ai.text.Substitution;
import org.calista.streetsense.ai.text.SubstitutionType;
import org.calista.streetsense.ai.text.TextNormalizer;
import org.calista.streetsense.ai.typo.Correction;
import org.calista.streetsense.ai.typo.CorrectionResult;
import org.calista.streetsense.ai.typo.TypoCorrector;
import org.calista.streetsense.ai.vocab.IntentCatalog;
import org.calista.streetsense.ai.vocab.VocabularyStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * HybridIntentClassifier: single entry point of the pipeline.
 *
 * Flow per call:
 * 1) trim; empty input is {@code unknown} and is not cached
 * 2) cache lookup by lower-cased trimmed input
 * 3) normalize, then typo-correct
 * 4) pattern classifier; a decisive pattern result short-circuits
 * 5) semantic classifier on the same text
 * 6) {@link ConfidenceCombiner} merges both, result is cached
 *
 * <p>Classification never throws on user text. A failing pattern classifier is logged and counted as a
 * zero-confidence prediction so the semantic path still answers.
 */
public final class HybridIntentClassifier {
    private static final Logger log = LogManager.getLogger(HybridIntentClassifier.class);

    private static final int SUGGESTION_COUNT = 4;
    private static final String DEFAULT_HINT = "Try rephrasing your question";

    private final VocabularyStore store;
    private final TextNormalizer normalizer;
    private final TypoCorrector corrector;
    private final IntentClassifier pattern;
    private final SemanticEngine semantic;
    private final ConfidenceCombiner combiner;

    private final FifoCache<String, Summary> cache;
    private long cacheRevision;

    private final ClassifierStats stats = new ClassifierStats();

    public HybridIntentClassifier(VocabularyStore store,
                                  TextNormalizer normalizer,
                                  TypoCorrector corrector,
                                  IntentClassifier pattern,
                                  SemanticEngine semantic,
                                  ConfidenceCombiner combiner,
                                  EngineConfig.Hybrid cfg) {
        this.store = Objects.requireNonNull(store, "store");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.corrector = Objects.requireNonNull(corrector, "corrector");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.semantic = Objects.requireNonNull(semantic, "semantic");
        this.combiner = Objects.requireNonNull(combiner, "combiner");
        Objects.requireNonNull(cfg, "cfg");
        this.cache = new FifoCache<>(cfg.cacheSize);
        this.cacheRevision = store.revision();
    }

    // ---------------------------------------------------------------------
    // Classification
    // ---------------------------------------------------------------------

    public ClassificationResult classify(String rawInput) {
        String trimmed = rawInput == null ? "" : rawInput.trim();
        if (trimmed.isEmpty()) {
            stats.recordEmpty();
            return ClassificationResult.empty(rawInput);
        }

        String key = trimmed.toLowerCase(Locale.ROOT);
        syncCache();
        Summary hit = cache.get(key);
        if (hit != null) {
            stats.recordCacheHit();
            return new ClassificationResult(hit.intent(), hit.confidence(), hit.friendlyName(), hit.source(),
                    null, List.of(), ExtractedEntities.NONE, true);
        }

        Preprocessed pre = preprocess(trimmed);
        IntentPrediction p = safePattern(pre.text());

        ClassificationResult result;
        if (combiner.isDecisive(p)) {
            ConfidenceCombiner.Decision d = combiner.decisive(p);
            result = toResult(d, pre, List.of(), p.entities);
        } else {
            IntentPrediction s = semantic.classify(pre.text());
            ConfidenceCombiner.Decision d = combiner.combine(p, s);
            result = toResult(d, pre, s.topMatches, p.entities);
        }

        cache.put(key, new Summary(result.intent, result.confidence, result.friendlyName, result.source));
        stats.recordComputed(result.source);

        if (log.isDebugEnabled()) {
            log.debug("classify: '{}' -> '{}' => {}", trimmed, pre.text(), result);
        }
        return result;
    }

    // ---------------------------------------------------------------------
    // Secondary operations
    // ---------------------------------------------------------------------

    /** Semantic ranking of the preprocessed text. */
    public List<IntentMatch> getTopMatches(String text, int n) {
        if (text == null || text.isBlank()) return List.of();
        return semantic.topMatches(preprocess(text.trim()).text(), n);
    }

    public List<String> getConcepts(String text) {
        if (text == null || text.isBlank()) return List.of();
        return semantic.extractConcepts(preprocess(text.trim()).text());
    }

    public boolean isSimilarTo(String text, String reference, double threshold) {
        if (text == null || reference == null) return false;
        return semantic.areSimilar(preprocess(text.trim()).text(), preprocess(reference.trim()).text(), threshold);
    }

    /** Likely intents with their hint texts, for clarification prompts. */
    public List<Suggestion> getSuggestions(String text) {
        IntentCatalog catalog = store.intents();
        ArrayList<Suggestion> out = new ArrayList<>(SUGGESTION_COUNT);
        for (IntentMatch m : getTopMatches(text, SUGGESTION_COUNT)) {
            String hint = catalog.hint(m.intent);
            out.add(new Suggestion(m.intent, m.friendlyName, m.score, hint.isBlank() ? DEFAULT_HINT : hint));
        }
        return out;
    }

    /**
     * Runs every stage on the input and reports them side by side.
     * The final result goes through {@link #classify(String)} (and its cache).
     */
    public Analysis analyze(String text) {
        String t = text == null ? "" : text.trim();
        NormalizationResult n = normalizer.normalize(t);
        CorrectionResult c = corrector.correct(n.normalized);
        IntentPrediction p = safePattern(c.corrected);
        IntentPrediction s = semantic.classify(c.corrected);
        List<String> concepts = semantic.extractConcepts(c.corrected);
        return new Analysis(t, n, c, p, s, concepts, classify(t));
    }

    public void clearCache() {
        cache.clear();
        corrector.clearCache();
        semantic.clearCache();
        log.debug("Caches cleared");
    }

    public int cacheSize() {
        syncCache();
        return cache.size();
    }

    public ClassifierStats.Snapshot stats() {
        return stats.snapshot(cacheSize());
    }

    public void resetStats() {
        stats.reset();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private Preprocessed preprocess(String text) {
        NormalizationResult n = normalizer.normalize(text);
        CorrectionResult c = corrector.correct(n.normalized);

        ArrayList<Substitution> changes = new ArrayList<>(n.changes.size() + c.corrections.size());
        changes.addAll(n.changes);
        for (Correction k : c.corrections) changes.add(Substitution.of(k.from, k.to, SubstitutionType.TYPO));

        return new Preprocessed(c.corrected, new PreprocessTrace(text, c.corrected, changes));
    }

    private IntentPrediction safePattern(String text) {
        try {
            IntentPrediction p = pattern.classify(text);
            return p == null ? IntentPrediction.unknown() : p;
        } catch (RuntimeException e) {
            log.warn("Pattern classifier failed on '{}', continuing with semantic only", text, e);
            return IntentPrediction.unknown();
        }
    }

    private ClassificationResult toResult(ConfidenceCombiner.Decision d, Preprocessed pre,
                                          List<IntentMatch> topMatches, ExtractedEntities entities) {
        String friendly = store.intents().friendlyName(d.intent);
        return new ClassificationResult(d.intent, d.confidence, friendly, d.source, pre.trace(), topMatches, entities, false);
    }

    private void syncCache() {
        long rev = store.revision();
        if (rev != cacheRevision) {
            cache.clear();
            cacheRevision = rev;
        }
    }

    private record Preprocessed(String text, PreprocessTrace trace) {}

    private record Summary(String intent, double confidence, String friendlyName, ClassificationSource source) {}
}
