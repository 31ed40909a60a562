package org.calista.streetsense.ai.semantic;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.streetsense.ai.cache.FifoCache;
import org.calista.streetsense.ai.core.EngineConfig;
import org.calista.streetsense.ai.intent.IntentClassifier;
import org.calista.streetsense.ai.intent.IntentMatch;
import org.calista.streetsense.ai.intent.IntentPrediction;
import org.calista.streetsense.ai.text.TextNormalizer;
import org.calista.streetsense.ai.tokenizer.Tokenizer;
import org.calista.streetsense.ai.tokenizer.impl.WordTokenizer;
import org.calista.streetsense.ai.typo.TypoCorrector;
import org.calista.streetsense.ai.util.Scored;
import org.calista.streetsense.ai.vocab.IntentDefinition;
import org.calista.streetsense.ai.vocab.VocabularyStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * SemanticEngine: bag-of-concepts vector space over the word clusters.
 *
 * Goals:
 * - one dimension per cluster; a word adds its importance to every cluster it belongs to
 * - each intent is positioned by the normalized mean of its exemplar vectors (centroid)
 * - ranking blends centroid similarity with the best single-exemplar similarity
 * - deterministic: stable sort, catalog order on ties
 *
 * <p>Phrase vectors are memoized by exact phrase text. Centroids are built lazily and rebuilt only
 * when the vocabulary revision moves; the phrase cache is dropped at the same moment.
 */
public final class SemanticEngine implements IntentClassifier {
    private static final Logger log = LogManager.getLogger(SemanticEngine.class);

    private final VocabularyStore store;
    private final TextNormalizer normalizer;
    private final TypoCorrector corrector;
    private final EngineConfig.Semantic cfg;
    private final Tokenizer words;

    private final FifoCache<String, double[]> phraseCache;

    private List<IntentVectors> intentVectors = List.of();
    private long builtRevision = -1L;
    private long cacheRevision = -1L;

    public SemanticEngine(VocabularyStore store, TextNormalizer normalizer, TypoCorrector corrector,
                          EngineConfig.Semantic cfg) {
        this.store = Objects.requireNonNull(store, "store");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.corrector = Objects.requireNonNull(corrector, "corrector");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.words = new WordTokenizer(cfg.minTokenLength);
        this.phraseCache = new FifoCache<>(cfg.phraseCacheSize);
    }

    // ---------------------------------------------------------------------
    // Vectors
    // ---------------------------------------------------------------------

    /**
     * Unit concept vector of the phrase (zero vector when no clustered word occurs).
     * The returned array is a copy.
     */
    public double[] phraseToVector(String phrase) {
        return vector(phrase).clone();
    }

    public double phraseSimilarity(String a, String b) {
        return Vectors.cosine(vector(a), vector(b));
    }

    public boolean areSimilar(String a, String b) {
        return areSimilar(a, b, cfg.similarityThreshold);
    }

    public boolean areSimilar(String a, String b, double threshold) {
        return phraseSimilarity(a, b) >= threshold;
    }

    /**
     * Distinct cluster names hit by the phrase words, in first-hit order.
     */
    public List<String> extractConcepts(String phrase) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        List<String> names = store.clusterNames();
        for (String w : words.tokenize(preprocess(phrase))) {
            for (int dim : store.clustersOf(w)) out.add(names.get(dim));
        }
        return List.copyOf(out);
    }

    /**
     * Candidates ranked by similarity to {@code phrase}; only positive similarities, at most {@code topK}.
     */
    public List<Scored<String>> findSimilar(String phrase, Collection<String> candidates, int topK) {
        if (candidates == null || candidates.isEmpty() || topK < 1) return List.of();
        double[] v = vector(phrase);
        if (Vectors.isZero(v)) return List.of();

        ArrayList<Scored<String>> scored = new ArrayList<>(candidates.size());
        for (String c : candidates) {
            if (c == null) continue;
            double s = Vectors.cosine(v, vector(c));
            if (s > 0.0) scored.add(Scored.of(c, s));
        }
        scored.sort(Scored.descending());
        return scored.size() > topK ? List.copyOf(scored.subList(0, topK)) : List.copyOf(scored);
    }

    // ---------------------------------------------------------------------
    // Classification
    // ---------------------------------------------------------------------

    @Override
    public IntentPrediction classify(String text) {
        return classifyIntent(text);
    }

    /**
     * score of the prediction is the raw top similarity.
     */
    public IntentPrediction classifyIntent(String phrase) {
        double[] v = vector(phrase);
        if (Vectors.isZero(v)) return IntentPrediction.unknown();

        List<Scored<IntentVectors>> ranked = rank(v);
        if (ranked.isEmpty()) return IntentPrediction.unknown();

        double top = ranked.get(0).score;
        double second = ranked.size() > 1 ? ranked.get(1).score : 0.0;
        List<IntentMatch> matches = toMatches(ranked, cfg.topMatches);

        if (!(top > 0.0)) {
            return new IntentPrediction(IntentDefinition.UNKNOWN, 0.0, 0.0, matches, null);
        }

        double confidence = cfg.absoluteWeight * top + cfg.separationWeight * (top - second) / top;
        confidence = Math.max(0.0, Math.min(1.0, confidence));

        IntentDefinition best = ranked.get(0).item.definition();
        if (log.isDebugEnabled()) {
            log.debug("semantic: '{}' -> {} conf={} top={}", phrase, best.id, confidence, matches);
        }
        return new IntentPrediction(best.id, confidence, top, matches, null);
    }

    /** Semantic ranking of the phrase, best first, at most {@code n}. */
    public List<IntentMatch> topMatches(String phrase, int n) {
        if (n < 1) return List.of();
        double[] v = vector(phrase);
        if (Vectors.isZero(v)) return List.of();
        return toMatches(rank(v), n);
    }

    // ---------------------------------------------------------------------
    // Mutation (delegates to the store; derived state follows the revision)
    // ---------------------------------------------------------------------

    public boolean addWordToCluster(String word, String cluster) {
        return store.addWordToCluster(word, cluster);
    }

    public void setWordImportance(String word, double weight) {
        store.setWordImportance(word, weight);
    }

    public void clearCache() {
        phraseCache.clear();
    }

    public Stats stats() {
        ensureBuilt();
        return new Stats(store.dimensions(), intentVectors.size(), phraseCache.size());
    }

    public static final class Stats {
        public final int dimensions;
        public final int intents;
        public final int cachedPhrases;

        public Stats(int dimensions, int intents, int cachedPhrases) {
            this.dimensions = dimensions;
            this.intents = intents;
            this.cachedPhrases = cachedPhrases;
        }

        @Override
        public String toString() {
            return "dimensions=" + dimensions + ", intents=" + intents + ", cachedPhrases=" + cachedPhrases;
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private List<Scored<IntentVectors>> rank(double[] v) {
        ensureBuilt();
        ArrayList<Scored<IntentVectors>> out = new ArrayList<>(intentVectors.size());
        for (IntentVectors iv : intentVectors) {
            double centroidSim = Vectors.cosine(v, iv.centroid());
            double bestExemplar = 0.0;
            for (double[] e : iv.exemplars()) {
                double s = Vectors.cosine(v, e);
                if (s > bestExemplar) bestExemplar = s;
            }
            out.add(Scored.of(iv, cfg.centroidWeight * centroidSim + cfg.exemplarWeight * bestExemplar));
        }
        out.sort(Scored.descending());
        return out;
    }

    private static List<IntentMatch> toMatches(List<Scored<IntentVectors>> ranked, int n) {
        int k = Math.min(n, ranked.size());
        ArrayList<IntentMatch> out = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            IntentDefinition d = ranked.get(i).item.definition();
            out.add(new IntentMatch(d.id, d.friendlyName, ranked.get(i).score));
        }
        return out;
    }

    private double[] vector(String phrase) {
        String key = phrase == null ? "" : phrase;
        syncRevision();
        double[] cached = phraseCache.get(key);
        if (cached != null) return cached;

        double[] v = new double[store.dimensions()];
        for (String w : words.tokenize(preprocess(key))) {
            int[] dims = store.clustersOf(w);
            if (dims.length == 0) continue;
            double weight = store.importance(w);
            for (int d : dims) v[d] += weight;
        }
        Vectors.normalize(v);

        phraseCache.put(key, v);
        return v;
    }

    private String preprocess(String phrase) {
        if (phrase == null || phrase.isBlank()) return "";
        String normalized = normalizer.normalize(phrase).normalized;
        return corrector.correct(normalized).corrected.toLowerCase(Locale.ROOT);
    }

    private void ensureBuilt() {
        syncRevision();
        if (builtRevision == store.revision()) return;

        ArrayList<IntentVectors> built = new ArrayList<>();
        int dims = store.dimensions();
        for (IntentDefinition d : store.intents().all()) {
            if (d.exemplars.isEmpty()) continue;
            ArrayList<double[]> ex = new ArrayList<>(d.exemplars.size());
            for (String e : d.exemplars) ex.add(vector(e));
            built.add(new IntentVectors(d, Vectors.centroid(ex, dims), List.copyOf(ex)));
        }
        intentVectors = List.copyOf(built);
        builtRevision = store.revision();

        log.debug("SemanticEngine: centroids built for {} intents over {} dimensions (revision={})",
                intentVectors.size(), dims, builtRevision);
    }

    private void syncRevision() {
        long rev = store.revision();
        if (rev != cacheRevision) {
            phraseCache.clear();
            cacheRevision = rev;
        }
    }

    private record IntentVectors(IntentDefinition definition, double[] centroid, List<double[]> exemplars) {}
}
