package org.calista.streetsense.ai.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.streetsense.ai.bootstrap.CatalogBootstrapper;
import org.calista.streetsense.ai.hybrid.Analysis;
import org.calista.streetsense.ai.hybrid.ClassificationResult;
import org.calista.streetsense.ai.hybrid.ClassifierStats;
import org.calista.streetsense.ai.hybrid.ConfidenceCombiner;
import org.calista.streetsense.ai.hybrid.HybridIntentClassifier;
import org.calista.streetsense.ai.hybrid.Suggestion;
import org.calista.streetsense.ai.intent.IntentClassifier;
import org.calista.streetsense.ai.intent.IntentMatch;
import org.calista.streetsense.ai.intent.impl.PatternIntentClassifier;
import org.calista.streetsense.ai.semantic.SemanticEngine;
import org.calista.streetsense.ai.text.TextNormalizer;
import org.calista.streetsense.ai.typo.TypoCorrector;
import org.calista.streetsense.ai.vocab.VocabularyStore;
import org.calista.streetsense.io.ResourceIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * ClassifierEngine: instance-owned classification runtime.
 *
 * Lifecycle:
 *   1) builder()...build() -> config, catalog, every component wired once
 *   2) classify(...) and the secondary operations
 *   3) optional in-memory vocabulary mutation (immediate effect, never persisted)
 *
 * No statics singletons: several isolated engines can live side by side.
 * Not thread-safe; callers synchronize externally.
 */
public final class ClassifierEngine {

    private static final Logger log = LoggerFactory.getLogger(ClassifierEngine.class);

    private final EngineConfig cfg;
    private final VocabularyStore store;
    private final TextNormalizer normalizer;
    private final TypoCorrector corrector;
    private final SemanticEngine semantic;
    private final PatternIntentClassifier patternMatcher;
    private final HybridIntentClassifier hybrid;

    private ClassifierEngine(EngineConfig cfg, VocabularyStore store, IntentClassifier patternOverride) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.store = Objects.requireNonNull(store, "store");

        this.normalizer = new TextNormalizer(store, cfg.normalizer.maxPasses);
        this.corrector = new TypoCorrector(store, cfg.typo);
        this.semantic = new SemanticEngine(store, normalizer, corrector, cfg.semantic);
        this.patternMatcher = new PatternIntentClassifier(store, cfg.pattern);
        IntentClassifier pattern = patternOverride != null ? patternOverride : patternMatcher;
        this.hybrid = new HybridIntentClassifier(store, normalizer, corrector, pattern, semantic,
                new ConfidenceCombiner(cfg.hybrid), cfg.hybrid);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;
        private Path baseDir = Path.of(".");
        private ObjectMapper mapper;

        private EngineConfig config;
        private Path configFile;
        private VocabularyStore vocabulary;
        private IntentClassifier patternClassifier;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        /** Directory relative catalog locations and config files resolve against. */
        public Builder baseDir(Path baseDir) {
            this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder config(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /**
         * Config file to load (created with defaults when missing). Ignored when {@link #config} is set.
         */
        public Builder configFile(Path configFile) {
            this.configFile = Objects.requireNonNull(configFile, "configFile");
            return this;
        }

        /** Ready store; skips catalog bootstrapping. */
        public Builder vocabulary(VocabularyStore vocabulary) {
            this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
            return this;
        }

        /** Replaces the rule-based pattern classifier inside the hybrid pipeline. */
        public Builder patternClassifier(IntentClassifier patternClassifier) {
            this.patternClassifier = Objects.requireNonNull(patternClassifier, "patternClassifier");
            return this;
        }

        /**
         * @throws CatalogException when config or catalog cannot be read
         */
        public ClassifierEngine build() {
            ObjectMapper om = (mapper != null) ? mapper : EngineConfig.defaultMapper();
            ResourceIO io = new ResourceIO(baseDir, charset, true);

            EngineConfig cfg;
            try {
                cfg = resolveConfig(io, om);
            } catch (IOException e) {
                throw new CatalogException("Cannot load engine config: " + e.getMessage(), e);
            }
            cfg.validate();

            VocabularyStore store = vocabulary;
            if (store == null) {
                try {
                    store = new CatalogBootstrapper(io, om).load(cfg.catalog).store;
                } catch (IOException e) {
                    throw new CatalogException("Cannot load catalog from " + cfg.catalog.location + ": " + e.getMessage(), e);
                }
            }

            ClassifierEngine engine = new ClassifierEngine(cfg, store, patternClassifier);
            if (log.isInfoEnabled()) {
                log.info("ClassifierEngine created: intents={}, dimensions={}, vocabulary={}, customPattern={}",
                        store.intents().size(), store.dimensions(), store.vocabularySize(), patternClassifier != null);
            }
            return engine;
        }

        private EngineConfig resolveConfig(ResourceIO io, ObjectMapper om) throws IOException {
            if (config != null) return config;
            if (configFile != null) {
                Path p = configFile.isAbsolute() ? configFile : baseDir.resolve(configFile);
                return EngineConfig.loadOrCreate(io, p, om);
            }
            return EngineConfig.fromClasspath(io, EngineConfig.DEFAULT_RESOURCE, om);
        }
    }

    // ---------------------------------------------------------------------
    // Classification
    // ---------------------------------------------------------------------

    public ClassificationResult classify(String rawInput) {
        return hybrid.classify(rawInput);
    }

    public List<IntentMatch> getTopMatches(String text, int n) {
        return hybrid.getTopMatches(text, n);
    }

    public List<String> getConcepts(String text) {
        return hybrid.getConcepts(text);
    }

    public boolean isSimilarTo(String text, String reference) {
        return hybrid.isSimilarTo(text, reference, cfg.semantic.similarityThreshold);
    }

    public boolean isSimilarTo(String text, String reference, double threshold) {
        return hybrid.isSimilarTo(text, reference, threshold);
    }

    public List<Suggestion> getSuggestions(String text) {
        return hybrid.getSuggestions(text);
    }

    public Analysis analyze(String text) {
        return hybrid.analyze(text);
    }

    public void clearCache() {
        hybrid.clearCache();
    }

    public ClassifierStats.Snapshot stats() {
        return hybrid.stats();
    }

    public void resetStats() {
        hybrid.resetStats();
    }

    // ---------------------------------------------------------------------
    // Vocabulary mutation (in-memory only)
    // ---------------------------------------------------------------------

    public boolean addWord(String word) {
        return store.addWord(word);
    }

    public int addWords(Collection<String> words) {
        return store.addWords(words);
    }

    public void addSlang(String term, String canonical) {
        store.addSlang(term, canonical);
    }

    public void addAbbreviation(String term, String canonical) {
        store.addAbbreviation(term, canonical);
    }

    public void addContraction(String term, String canonical) {
        store.addContraction(term, canonical);
    }

    /** Multi-word idiom. */
    public void addPhrase(String phrase, String canonical) {
        store.addIdiom(phrase, canonical);
    }

    public boolean addExemplar(String intentId, String phrase) {
        return store.addExemplar(intentId, phrase);
    }

    public boolean addWordToCluster(String word, String cluster) {
        return store.addWordToCluster(word, cluster);
    }

    public void setWordImportance(String word, double weight) {
        store.setWordImportance(word, weight);
    }

    // ---------------------------------------------------------------------
    // Components
    // ---------------------------------------------------------------------

    public EngineConfig config() {
        return cfg;
    }

    public VocabularyStore vocabulary() {
        return store;
    }

    public TextNormalizer normalizer() {
        return normalizer;
    }

    public TypoCorrector typoCorrector() {
        return corrector;
    }

    public SemanticEngine semanticEngine() {
        return semantic;
    }

    /** The rule-based matcher, also when the hybrid pipeline runs a replacement. */
    public PatternIntentClassifier patternMatcher() {
        return patternMatcher;
    }

    public HybridIntentClassifier hybrid() {
        return hybrid;
    }
}
