package org.calista.streetsense.ai.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.streetsense.io.ResourceIO;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    private final ObjectMapper mapper = EngineConfig.defaultMapper();

    @Test
    @DisplayName("missing file is created with defaults")
    void loadOrCreateWritesDefaults(@TempDir Path dir) throws Exception {
        ResourceIO io = new ResourceIO(dir);
        Path file = dir.resolve("conf/engine.json");

        EngineConfig cfg = EngineConfig.loadOrCreate(io, file, mapper);
        assertTrue(Files.exists(file));
        assertEquals(0.7, cfg.hybrid.highConfidence);
        assertEquals("classpath:streetsense", cfg.catalog.location);

        EngineConfig again = EngineConfig.loadOrCreate(io, file, mapper);
        assertEquals(cfg.typo.maxDistance, again.typo.maxDistance);
        assertEquals(cfg.semantic.centroidWeight, again.semantic.centroidWeight);
    }

    @Test
    void emptyFileIsRecreated(@TempDir Path dir) throws Exception {
        ResourceIO io = new ResourceIO(dir);
        Path file = dir.resolve("engine.json");
        Files.writeString(file, "  ");

        EngineConfig cfg = EngineConfig.loadOrCreate(io, file, mapper);
        assertEquals(200, cfg.hybrid.cacheSize);
        assertFalse(Files.readString(file).isBlank());
    }

    @Test
    @DisplayName("partial files keep defaults, out of range values are reset")
    void partialAndInvalidValues(@TempDir Path dir) throws Exception {
        ResourceIO io = new ResourceIO(dir);
        Path file = dir.resolve("engine.json");
        Files.writeString(file, "{\"hybrid\":{\"highConfidence\":5.0,\"cacheSize\":0,\"patternThreshold\":0.5},"
                + "\"typo\":{\"maxDistance\":1,\"adjacentKeyCost\":3.0},\"somethingElse\":true}");

        EngineConfig cfg = EngineConfig.loadOrCreate(io, file, mapper);
        assertEquals(0.7, cfg.hybrid.highConfidence);
        assertEquals(200, cfg.hybrid.cacheSize);
        assertEquals(0.5, cfg.hybrid.patternThreshold);
        assertEquals(1, cfg.typo.maxDistance);
        assertEquals(1.0, cfg.typo.adjacentKeyCost);
        assertEquals(0.4, cfg.semantic.exemplarWeight);
    }

    @Test
    void validateRestoresNullSections() {
        EngineConfig cfg = new EngineConfig();
        cfg.hybrid = null;
        cfg.catalog.intents = " ";
        cfg.normalizer.maxPasses = 0;
        cfg.validate();

        assertNotNull(cfg.hybrid);
        assertEquals("intents.json", cfg.catalog.intents);
        assertEquals(1, cfg.normalizer.maxPasses);
    }

    @Test
    void saveRoundTrip(@TempDir Path dir) throws Exception {
        ResourceIO io = new ResourceIO(dir);
        Path file = dir.resolve("engine.json");
        EngineConfig cfg = EngineConfig.defaults();
        cfg.semantic.topMatches = 5;

        EngineConfig.save(io, file, mapper, cfg);
        assertEquals(5, EngineConfig.loadOrCreate(io, file, mapper).semantic.topMatches);
    }

    @Test
    void bundledResource(@TempDir Path dir) throws Exception {
        ResourceIO io = new ResourceIO(dir);
        EngineConfig cfg = EngineConfig.fromClasspath(io, EngineConfig.DEFAULT_RESOURCE, mapper);
        assertEquals(0.25, cfg.hybrid.semanticThreshold);
        assertEquals(6.0, cfg.pattern.confidenceScale);

        EngineConfig missing = EngineConfig.fromClasspath(io, "streetsense/no-such-config.json", mapper);
        assertEquals(0.15, missing.hybrid.fallbackSimilarity);
    }

    @Test
    @DisplayName("builder creates the config file it was pointed at")
    void builderUsesConfigFile(@TempDir Path dir) {
        ClassifierEngine engine = ClassifierEngine.builder()
                .baseDir(dir)
                .configFile(Path.of("engine.json"))
                .build();

        assertTrue(Files.exists(dir.resolve("engine.json")));
        assertEquals("money_advice", engine.classify("how do i make money").intent);
    }

    @Test
    void builderRejectsUnreadableConfig(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("engine.json"), "{ not json");
        ClassifierEngine.Builder b = ClassifierEngine.builder().baseDir(dir).configFile(Path.of("engine.json"));
        assertThrows(CatalogException.class, b::build);
    }
}
