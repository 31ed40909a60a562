package org.calista.streetsense.ai.core;

import org.calista.streetsense.ai.TestCatalog;
import org.calista.streetsense.ai.hybrid.ClassificationResult;
import org.calista.streetsense.ai.hybrid.ClassificationSource;
import org.calista.streetsense.ai.intent.IntentMatch;
import org.calista.streetsense.ai.vocab.IntentDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClassifierEngineTest {

    private ClassifierEngine engine;

    @BeforeEach
    void setUp() {
        engine = TestCatalog.engine();
    }

    @Nested
    @DisplayName("end to end")
    class EndToEnd {

        @Test
        void plainQuestion() {
            ClassificationResult r = engine.classify("how do i make money");
            assertEquals("money_advice", r.intent);
            assertEquals(0.8333, r.confidence, 1e-3);
            assertEquals(ClassificationSource.PATTERN_HIGH, r.source);
        }

        @Test
        @DisplayName("slang and abbreviations are rewritten before matching")
        void slang() {
            ClassificationResult r = engine.classify("need that paper rn");
            assertEquals("money_advice", r.intent);
            assertEquals(ClassificationSource.PATTERN_HIGH, r.source);
            assertEquals("need money right now", r.preprocessed.normalized);
        }

        @Test
        void typos() {
            ClassificationResult r = engine.classify("wat crme shud i do");
            assertEquals("crime_advice", r.intent);
            assertEquals(ClassificationSource.PATTERN_HIGH, r.source);
            assertEquals("what crime should i do", r.preprocessed.normalized);
        }

        @Test
        void emptyInput() {
            ClassificationResult r = engine.classify("");
            assertEquals("unknown", r.intent);
            assertEquals(0.0, r.confidence);
            assertEquals(ClassificationSource.EMPTY_INPUT, r.source);
        }

        @Test
        void gibberish() {
            ClassificationResult r = engine.classify("xyzzy plugh");
            assertEquals("unknown", r.intent);
            assertEquals(ClassificationSource.NO_MATCH, r.source);
        }

        @Test
        @DisplayName("semantic stage resolves what rules miss")
        void semanticResolution() {
            ClassificationResult r = engine.classify("market prices for crimes");
            assertEquals("market_analysis", r.intent);
            assertEquals(ClassificationSource.SEMANTIC_ONLY, r.source);
            assertEquals(0.5739, r.confidence, 1e-3);

            List<String> top = new ArrayList<>();
            for (IntentMatch m : r.topMatches) top.add(m.intent);
            assertEquals(List.of("market_analysis", "crime_advice", "equipment_advice"), top.subList(0, 3));
        }

        @Test
        @DisplayName("every bundled exemplar classifies to its own intent")
        void exemplarsClassifyToTheirIntent() {
            List<String> failures = new ArrayList<>();
            for (IntentDefinition d : engine.vocabulary().intents().all()) {
                for (String e : d.exemplars) {
                    engine.clearCache();
                    ClassificationResult r = engine.classify(e);
                    if (!d.id.equals(r.intent) || r.confidence < 0.7) {
                        failures.add(d.id + ": '" + e + "' -> " + r);
                    }
                }
            }
            assertTrue(failures.isEmpty(), () -> String.join("\n", failures));
        }

        @Test
        void confidenceStaysInRange() {
            for (String s : List.of("hey thanks", "where is the police heat", "any delivery jobs", "i need 500 dollars")) {
                ClassificationResult r = engine.classify(s);
                assertTrue(r.confidence >= 0.0 && r.confidence <= 1.0, s);
                assertNotNull(r.friendlyName);
            }
        }
    }

    @Nested
    @DisplayName("vocabulary mutation")
    class Mutation {

        @Test
        void addedSlangIsUsedImmediately() {
            engine.classify("how do i make zorbax");
            engine.addSlang("zorbax", "money");

            ClassificationResult r = engine.classify("how do i make zorbax");
            assertFalse(r.fromCache);
            assertEquals("money_advice", r.intent);
            assertEquals(ClassificationSource.PATTERN_HIGH, r.source);
        }

        @Test
        void addedWordsStopTypoCorrection() {
            assertFalse(engine.typoCorrector().isKnown("blingz"));
            assertTrue(engine.addWord("blingz"));
            assertTrue(engine.typoCorrector().isKnown("blingz"));
            assertEquals(1, engine.addWords(List.of("blingz", "polize")));
            assertEquals("polize", engine.typoCorrector().correct("polize").corrected);
        }

        @Test
        void phrasesAndAbbreviations() {
            engine.addPhrase("stack it high", "make money");
            engine.addAbbreviation("zq", "right now");
            engine.addContraction("coulda", "could have");

            assertEquals("make money", engine.normalizer().normalize("stack it high").normalized);
            assertEquals("right now", engine.normalizer().normalize("zq").normalized);
            assertEquals("could have", engine.normalizer().normalize("coulda").normalized);
        }

        @Test
        void clusterAndImportance() {
            assertTrue(engine.addWordToCluster("zorbux", "money"));
            assertFalse(engine.addWordToCluster("zorbux", "no_such_cluster"));
            assertTrue(engine.getConcepts("show me the zorbux").contains("money"));

            engine.setWordImportance("zorbux", 3.0);
            assertEquals(3.0, engine.vocabulary().importance("zorbux"));
            assertThrows(IllegalArgumentException.class, () -> engine.setWordImportance("zorbux", -1.0));
        }

        @Test
        void exemplarRegistration() {
            assertTrue(engine.addExemplar("heat_advice", "dollars police"));
            assertFalse(engine.addExemplar("no_such_intent", "dollars police"));
        }

        @Test
        @DisplayName("engines do not share vocabulary")
        void instancesAreIsolated() {
            ClassifierEngine other = TestCatalog.engine();
            engine.addSlang("zorbax", "money");

            assertEquals("money", engine.normalizer().normalize("zorbax").normalized);
            assertEquals("zorbax", other.normalizer().normalize("zorbax").normalized);
        }
    }

    @Nested
    @DisplayName("secondary operations")
    class Secondary {

        @Test
        void similarityDefaultThreshold() {
            assertTrue(engine.isSimilarTo("how do i get cash", "how can i make money"));
            assertFalse(engine.isSimilarTo("how do i get cash", "where are the cops"));
        }

        @Test
        void statsAndReset() {
            engine.classify("how do i make money");
            engine.classify("how do i make money");
            assertEquals(2, engine.stats().requests);
            assertEquals(1, engine.stats().cacheHits);

            engine.resetStats();
            engine.clearCache();
            assertEquals(0, engine.stats().requests);
            assertEquals(0, engine.stats().cacheSize);
        }

        @Test
        void analyze() {
            assertEquals("money_advice", engine.analyze("need that paper rn").result.intent);
        }

        @Test
        void suggestions() {
            assertFalse(engine.getSuggestions("where do the cops patrol downtown").isEmpty());
            assertTrue(engine.getTopMatches("", 3).isEmpty());
        }
    }
}
