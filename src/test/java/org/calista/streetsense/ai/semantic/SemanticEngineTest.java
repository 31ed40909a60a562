package org.calista.streetsense.ai.semantic;

import org.calista.streetsense.ai.TestCatalog;
import org.calista.streetsense.ai.core.EngineConfig;
import org.calista.streetsense.ai.intent.IntentMatch;
import org.calista.streetsense.ai.intent.IntentPrediction;
import org.calista.streetsense.ai.text.TextNormalizer;
import org.calista.streetsense.ai.typo.TypoCorrector;
import org.calista.streetsense.ai.util.Scored;
import org.calista.streetsense.ai.vocab.VocabularyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SemanticEngineTest {

    private VocabularyStore store;
    private SemanticEngine engine;

    @BeforeEach
    void setUp() {
        EngineConfig cfg = EngineConfig.defaults();
        store = TestCatalog.store();
        TextNormalizer normalizer = new TextNormalizer(store, cfg.normalizer.maxPasses);
        TypoCorrector corrector = new TypoCorrector(store, cfg.typo);
        engine = new SemanticEngine(store, normalizer, corrector, cfg.semantic);
    }

    @Nested
    @DisplayName("vectors")
    class Vectors_ {

        @Test
        @DisplayName("vectors are unit length over one dimension per cluster")
        void unitLength() {
            double[] v = engine.phraseToVector("how do i make money");
            assertEquals(store.dimensions(), v.length);
            assertEquals(1.0, Vectors.norm(v), 1e-9);
        }

        @Test
        @DisplayName("unknown words give the zero vector")
        void zeroVector() {
            double[] v = engine.phraseToVector("xyzzy plugh");
            assertTrue(Vectors.isZero(v));
            assertEquals(0.0, engine.phraseSimilarity("xyzzy", "money"));
        }

        @Test
        @DisplayName("words of a single shared cluster point the same way")
        void sameClusterSimilarity() {
            assertTrue(engine.phraseSimilarity("money", "dollars") > 0.9);
            assertEquals(0.0, engine.phraseSimilarity("money", "police"), 1e-9);
        }

        @Test
        @DisplayName("importance scales a word's contribution")
        void importanceWeights() {
            double[] before = engine.phraseToVector("money police");
            assertEquals(before[0], before[3], 1e-9);

            engine.setWordImportance("money", 3.0);

            double[] after = engine.phraseToVector("money police");
            assertTrue(after[0] > after[3]);
        }

        @Test
        void returnedVectorIsACopy() {
            double[] v = engine.phraseToVector("money");
            v[0] = 42.0;
            assertEquals(1.0, engine.phraseToVector("money")[0], 1e-9);
        }

        @Test
        @DisplayName("slang and typos are resolved before vectorizing")
        void preprocessesInput() {
            assertEquals(1.0, engine.phraseSimilarity("polise", "police"), 1e-9);
            assertFalse(engine.extractConcepts("where can i hide from the cops").isEmpty());
        }
    }

    @Nested
    @DisplayName("classification")
    class Classification {

        @Test
        void classifiesExemplarPhrase() {
            IntentPrediction p = engine.classifyIntent("how do i make money");
            assertEquals("money_advice", p.intent);
            assertTrue(p.confidence >= 0.7);
            assertEquals(3, p.topMatches.size());
            assertEquals(p.score, p.topMatches.get(0).score, 1e-12);
        }

        @Test
        @DisplayName("two evenly blended concepts give a narrow gap and lower confidence")
        void blendedConcepts() {
            IntentPrediction p = engine.classifyIntent("market prices for crimes");

            assertEquals("market_analysis", p.intent);
            List<IntentMatch> top = p.topMatches;
            assertEquals("market_analysis", top.get(0).intent);
            assertEquals("crime_advice", top.get(1).intent);
            assertEquals(0.7504, top.get(0).score, 1e-3);
            assertEquals(0.6286, top.get(1).score, 1e-3);
            assertEquals(0.5739, p.confidence, 1e-3);
        }

        @Test
        void zeroVectorIsUnknown() {
            IntentPrediction p = engine.classifyIntent("xyzzy plugh");
            assertTrue(p.isUnknown());
            assertEquals(0.0, p.confidence);
            assertTrue(p.topMatches.isEmpty());
        }

        @Test
        void ranksAreSortedDescending() {
            List<IntentMatch> m = engine.topMatches("where do the cops patrol downtown", 5);
            assertEquals(5, m.size());
            for (int i = 1; i < m.size(); i++) assertTrue(m.get(i - 1).score >= m.get(i).score);
        }

        @Test
        @DisplayName("new exemplars move centroids")
        void exemplarsRebuildCentroids() {
            EngineConfig.Semantic cfg = EngineConfig.defaults().semantic;
            assertEquals(19, engine.stats().intents);
            double before = engine.classifyIntent("dollars police").score;

            assertTrue(store.addExemplar("heat_advice", "dollars police"));

            double after = engine.classifyIntent("dollars police").score;
            assertNotEquals(before, after);
            assertEquals(cfg.topMatches, engine.classifyIntent("dollars police").topMatches.size());
        }
    }

    @Nested
    @DisplayName("concepts and similarity helpers")
    class Helpers {

        @Test
        void conceptsInFirstHitOrder() {
            assertEquals(List.of("question", "action", "money"), engine.extractConcepts("how do i make money"));
            assertEquals(List.of("trade", "crime"), engine.extractConcepts("market prices for crimes"));
            assertTrue(engine.extractConcepts("xyzzy plugh").isEmpty());
        }

        @Test
        void findSimilarKeepsPositiveOnly() {
            List<Scored<String>> r = engine.findSimilar("need cash",
                    List.of("cops everywhere", "money is tight", "xyzzy"), 3);

            assertEquals(1, r.size());
            assertEquals("money is tight", r.get(0).item);
        }

        @Test
        void areSimilar() {
            assertTrue(engine.areSimilar("how do i get cash", "how can i make money"));
            assertFalse(engine.areSimilar("how do i get cash", "where are the cops"));
        }

        @Test
        void addWordToCluster() {
            assertEquals(0.0, engine.phraseSimilarity("bling", "money"));
            assertTrue(engine.addWordToCluster("bling", "money"));
            assertFalse(engine.addWordToCluster("bling", "no_such_cluster"));
            assertTrue(engine.phraseSimilarity("bling", "money") > 0.9);
        }

        @Test
        void stats() {
            SemanticEngine.Stats s = engine.stats();
            assertEquals(18, s.dimensions);
            assertEquals(19, s.intents);
            assertTrue(s.cachedPhrases > 0);
        }
    }
}
