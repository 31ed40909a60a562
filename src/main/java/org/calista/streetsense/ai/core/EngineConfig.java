package org.calista.streetsense.ai.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.streetsense.io.ResourceIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * EngineConfig: простой POJO конфиг:
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует значения
 *
 * Every threshold of the classification pipeline lives here; nothing is read from statics.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_RESOURCE = "streetsense/config.json";

    public Catalog catalog = new Catalog();
    public Normalizer normalizer = new Normalizer();
    public Typo typo = new Typo();
    public Semantic semantic = new Semantic();
    public PatternMatch pattern = new PatternMatch();
    public Hybrid hybrid = new Hybrid();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Catalog {
        /** Directory holding the catalog files: {@code classpath:...} or a filesystem path. */
        public String location = "classpath:streetsense";
        public String intents = "intents.json";
        public String lexicon = "lexicon.json";
        public String concepts = "concepts.json";
        public String vocabulary = "vocabulary.json";
        public String entities = "entities.json";
        public boolean failFast = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Normalizer {
        /** Upper bound of re-normalization passes used to reach a fixed point. */
        public int maxPasses = 4;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Typo {
        public int maxDistance = 2;
        public int minWordLength = 2;
        public int cacheSize = 1000;

        // weighted (suggestion) distance
        public double suggestionMaxDistance = 2.5;
        public int suggestionMaxLengthDiff = 2;
        public int maxSuggestions = 5;
        public double adjacentKeyCost = 0.5;
        public double phoneticCost = 0.7;
        public double transpositionCost = 0.5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Semantic {
        public double centroidWeight = 0.6;
        public double exemplarWeight = 0.4;
        public int topMatches = 3;

        // confidence = absoluteWeight * top + separationWeight * (top - second) / top
        public double absoluteWeight = 0.7;
        public double separationWeight = 0.3;

        public int phraseCacheSize = 500;
        public int minTokenLength = 2;
        public double similarityThreshold = 0.5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PatternMatch {
        public double triggerScore = 3.0;
        public double confidenceScale = 6.0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Hybrid {
        public double highConfidence = 0.7;
        public double patternThreshold = 0.4;
        public double semanticThreshold = 0.25;
        public double fallbackSimilarity = 0.15;
        public double agreementDivisor = 1.5;
        public double disagreementPenalty = 0.9;
        public int cacheSize = 200;
    }

    // -------------------- Load / Create --------------------

    public static EngineConfig defaults() {
        EngineConfig cfg = new EngineConfig();
        cfg.validate();
        return cfg;
    }

    public static ObjectMapper defaultMapper() {
        ObjectMapper om = new ObjectMapper();
        om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return om;
    }

    /**
     * Reads a bundled config; falls back to defaults when the resource is absent.
     */
    public static EngineConfig fromClasspath(ResourceIO io, String resource, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(mapper, "mapper");

        Optional<String> json = io.readClasspath(resource);
        if (json.isEmpty() || json.get().isBlank()) {
            log.debug("Config resource {} not found, using defaults", resource);
            return defaults();
        }

        EngineConfig cfg = mapper.readValue(json.get(), EngineConfig.class);
        if (cfg == null) cfg = new EngineConfig();
        cfg.validate();
        return cfg;
    }

    /**
     * Загружает конфиг. Если файла нет (или он пустой), создаёт дефолтный и пишет на диск.
     */
    public static EngineConfig loadOrCreate(ResourceIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            EngineConfig created = defaults();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            EngineConfig created = defaults();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        EngineConfig cfg = mapper.readValue(json, EngineConfig.class);
        if (cfg == null) cfg = new EngineConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(ResourceIO io, Path configFile, ObjectMapper mapper, EngineConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(ResourceIO io, Path configFile, ObjectMapper mapper, EngineConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (catalog == null) catalog = new Catalog();
        if (catalog.location == null || catalog.location.isBlank()) catalog.location = "classpath:streetsense";
        if (catalog.intents == null || catalog.intents.isBlank()) catalog.intents = "intents.json";
        if (catalog.lexicon == null || catalog.lexicon.isBlank()) catalog.lexicon = "lexicon.json";
        if (catalog.concepts == null || catalog.concepts.isBlank()) catalog.concepts = "concepts.json";
        if (catalog.vocabulary == null || catalog.vocabulary.isBlank()) catalog.vocabulary = "vocabulary.json";
        if (catalog.entities == null || catalog.entities.isBlank()) catalog.entities = "entities.json";

        if (normalizer == null) normalizer = new Normalizer();
        if (normalizer.maxPasses < 1) normalizer.maxPasses = 1;

        if (typo == null) typo = new Typo();
        if (typo.maxDistance < 0) typo.maxDistance = 2;
        if (typo.minWordLength < 1) typo.minWordLength = 1;
        if (typo.cacheSize < 1) typo.cacheSize = 1000;
        if (!(typo.suggestionMaxDistance > 0.0)) typo.suggestionMaxDistance = 2.5;
        if (typo.suggestionMaxLengthDiff < 0) typo.suggestionMaxLengthDiff = 2;
        if (typo.maxSuggestions < 1) typo.maxSuggestions = 5;
        typo.adjacentKeyCost = clampCost(typo.adjacentKeyCost, 0.5);
        typo.phoneticCost = clampCost(typo.phoneticCost, 0.7);
        typo.transpositionCost = clampCost(typo.transpositionCost, 0.5);

        if (semantic == null) semantic = new Semantic();
        if (!isUnit(semantic.centroidWeight)) semantic.centroidWeight = 0.6;
        if (!isUnit(semantic.exemplarWeight)) semantic.exemplarWeight = 0.4;
        if (semantic.topMatches < 1) semantic.topMatches = 3;
        if (!isUnit(semantic.absoluteWeight)) semantic.absoluteWeight = 0.7;
        if (!isUnit(semantic.separationWeight)) semantic.separationWeight = 0.3;
        if (semantic.phraseCacheSize < 1) semantic.phraseCacheSize = 500;
        if (semantic.minTokenLength < 1) semantic.minTokenLength = 1;
        if (!isUnit(semantic.similarityThreshold)) semantic.similarityThreshold = 0.5;

        if (pattern == null) pattern = new PatternMatch();
        if (!(pattern.triggerScore > 0.0) || !Double.isFinite(pattern.triggerScore)) pattern.triggerScore = 3.0;
        if (!(pattern.confidenceScale > 0.0) || !Double.isFinite(pattern.confidenceScale)) pattern.confidenceScale = 6.0;

        if (hybrid == null) hybrid = new Hybrid();
        if (!isUnit(hybrid.highConfidence)) hybrid.highConfidence = 0.7;
        if (!isUnit(hybrid.patternThreshold)) hybrid.patternThreshold = 0.4;
        if (!isUnit(hybrid.semanticThreshold)) hybrid.semanticThreshold = 0.25;
        if (!isUnit(hybrid.fallbackSimilarity)) hybrid.fallbackSimilarity = 0.15;
        if (!(hybrid.agreementDivisor > 0.0) || !Double.isFinite(hybrid.agreementDivisor)) hybrid.agreementDivisor = 1.5;
        if (!isUnit(hybrid.disagreementPenalty)) hybrid.disagreementPenalty = 0.9;
        if (hybrid.cacheSize < 1) hybrid.cacheSize = 200;
    }

    private static boolean isUnit(double v) {
        return Double.isFinite(v) && v >= 0.0 && v <= 1.0;
    }

    private static double clampCost(double v, double def) {
        if (!Double.isFinite(v) || v <= 0.0) return def;
        return Math.min(1.0, v);
    }
}
