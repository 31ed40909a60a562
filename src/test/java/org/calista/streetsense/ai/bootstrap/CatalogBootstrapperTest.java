package org.calista.streetsense.ai.bootstrap;

import org.calista.streetsense.ai.core.CatalogException;
import org.calista.streetsense.ai.core.ClassifierEngine;
import org.calista.streetsense.ai.core.EngineConfig;
import org.calista.streetsense.ai.vocab.VocabularyStore;
import org.calista.streetsense.io.ResourceIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CatalogBootstrapperTest {

    private static final String INTENTS = """
            [
              {"id": "money_advice", "friendlyName": "Money Advice",
               "exemplars": ["how do i make money"], "keywords": {"money": 2.0},
               "triggers": ["\\\\bmake\\\\s+money\\\\b"]},
              {"id": "heat_advice", "exemplars": ["cops everywhere"], "keywords": {"cops": 1.5}},
              {"id": "broken", "triggers": ["(unclosed"]},
              {"id": "Money_Advice", "friendlyName": "Duplicate"}
            ]
            """;

    private static final String CONCEPTS = """
            {"clusters": {"money": ["money", "cash"], "police": ["cops", "police"]},
             "importance": {"cash": 1.2}}
            """;

    @TempDir
    Path dir;

    private EngineConfig.Catalog catalog;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(dir.resolve("intents.json"), INTENTS);
        Files.writeString(dir.resolve("concepts.json"), CONCEPTS);
        catalog = new EngineConfig.Catalog();
        catalog.location = dir.toString();
    }

    private CatalogBootstrapper bootstrapper() {
        return new CatalogBootstrapper(new ResourceIO(dir), EngineConfig.defaultMapper());
    }

    @Nested
    @DisplayName("lenient mode")
    class Lenient {

        @Test
        @DisplayName("bad entries are skipped and counted")
        void skipsBadEntries() throws IOException {
            CatalogBootstrapper.Result r = bootstrapper().load(catalog);

            VocabularyStore store = r.store;
            assertTrue(store.intents().contains("money_advice"));
            assertTrue(store.intents().contains("heat_advice"));
            assertFalse(store.intents().contains("broken"));
            assertEquals("Money Advice", store.intents().friendlyName("money_advice"));
            assertEquals(3, store.intents().size());
            assertEquals(2, r.badEntries());
            assertEquals(2, store.dimensions());
        }

        @Test
        @DisplayName("lexicon, vocabulary and entities are optional")
        void optionalFiles() throws IOException {
            CatalogBootstrapper.Result r = bootstrapper().load(catalog);
            assertTrue(r.store.slang().isEmpty());
            assertTrue(r.store.entities().districts.isEmpty());
            assertEquals(5, r.reports.size());
        }

        @Test
        void optionalFilesAreReadWhenPresent() throws IOException {
            Files.writeString(dir.resolve("lexicon.json"), "{\"slang\": {\"Paper\": \"money\"}}");
            Files.writeString(dir.resolve("vocabulary.json"), "[\"yorkville\", 7, \" \"]");
            Files.writeString(dir.resolve("entities.json"),
                    "{\"districts\": [\"Yorkville\"], \"playerNamePatterns\": [\"about (\\\\w+)\", \"([bad\"]}");

            CatalogBootstrapper.Result r = bootstrapper().load(catalog);
            assertEquals("money", r.store.slang().get("paper"));
            assertTrue(r.store.isKnownWord("yorkville"));
            assertEquals(1, r.store.entities().playerNamePatterns.size());
            assertEquals("yorkville", r.store.entities().districts.get(0));
            assertEquals(2 + 2 + 1, r.badEntries());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        void failFastStopsAtFirstBadIntent() {
            catalog.failFast = true;
            IOException e = assertThrows(IOException.class, () -> bootstrapper().load(catalog));
            assertTrue(e.getMessage().contains("Bad intent"));
        }

        @Test
        void intentsAreRequired() throws IOException {
            Files.delete(dir.resolve("intents.json"));
            assertThrows(NoSuchFileException.class, () -> bootstrapper().load(catalog));
        }

        @Test
        void conceptsAreRequired() throws IOException {
            Files.writeString(dir.resolve("concepts.json"), "{\"clusters\": {}}");
            assertThrows(IOException.class, () -> bootstrapper().load(catalog));
        }

        @Test
        void malformedJsonIsAnIOException() throws IOException {
            Files.writeString(dir.resolve("intents.json"), "[{");
            assertThrows(IOException.class, () -> bootstrapper().load(catalog));
        }

        @Test
        @DisplayName("engine builder wraps catalog errors")
        void builderWrapsErrors() throws IOException {
            Files.delete(dir.resolve("concepts.json"));
            EngineConfig cfg = EngineConfig.defaults();
            cfg.catalog = catalog;

            ClassifierEngine.Builder b = ClassifierEngine.builder().baseDir(dir).config(cfg);
            CatalogException e = assertThrows(CatalogException.class, b::build);
            assertInstanceOf(NoSuchFileException.class, e.getCause());
        }
    }

    @Test
    @DisplayName("custom catalog drives a working engine")
    void customCatalogEngine() {
        EngineConfig cfg = EngineConfig.defaults();
        cfg.catalog = catalog;

        ClassifierEngine engine = ClassifierEngine.builder().baseDir(dir).config(cfg).build();
        assertEquals(3, engine.vocabulary().intents().size());
        assertEquals("heat_advice", engine.classify("cops everywhere").intent);
    }
}
