package org.calista.streetsense.ai.vocab;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VocabularyStoreTest {

    private VocabularyStore store;

    @BeforeEach
    void setUp() {
        IntentDefinition money = new IntentDefinition("money_advice", "Money Advice");
        money.exemplars.add("how do i make money");
        money.keywords.put("money", 2.0);

        Lexicon lex = new Lexicon();
        lex.slang.put("paper", "money");
        lex.contractions.put("i'm", "i am");

        ConceptTable concepts = new ConceptTable();
        concepts.clusters.put("money", List.of("money", "cash"));
        concepts.clusters.put("police", List.of("police", "cops"));
        concepts.importance.put("cash", 1.5);

        store = new VocabularyStore(new IntentCatalog(List.of(money)), lex, concepts, List.of("yorkville"), null);
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        void catalogAlwaysHasUnknown() {
            assertTrue(store.intents().contains("unknown"));
            assertEquals(2, store.intents().size());
            assertEquals("Money Advice", store.intents().friendlyName("money_advice"));
        }

        @Test
        @DisplayName("vocabulary collects words from every source")
        void vocabularySources() {
            assertTrue(store.isKnownWord("yorkville"));
            assertTrue(store.isKnownWord("cops"));
            assertTrue(store.isKnownWord("make"));
            assertTrue(store.isKnownWord("AM"));
            assertFalse(store.isKnownWord("paper"));
            assertEquals("yorkville", store.vocabulary().iterator().next());
        }

        @Test
        void clustersAreDimensions() {
            assertEquals(List.of("money", "police"), store.clusterNames());
            assertEquals(2, store.dimensions());
            assertArrayEquals(new int[]{1}, store.clustersOf("cops"));
            assertEquals(0, store.clustersOf("yorkville").length);
            assertEquals(1.5, store.importance("cash"));
            assertEquals(1.0, store.importance("cops"));
        }

        @Test
        @DisplayName("cluster indexes are handed out as copies")
        void clustersOfReturnsCopy() {
            int[] dims = store.clustersOf("cash");
            dims[0] = 1;
            assertArrayEquals(new int[]{0}, store.clustersOf("cash"));
        }

        @Test
        void duplicateIntentIdsAreRejected() {
            List<IntentDefinition> dup = List.of(new IntentDefinition("a", "A"), new IntentDefinition("A", "a again"));
            assertThrows(IllegalArgumentException.class, () -> new IntentCatalog(dup));
        }

        @Test
        void readViewsAreUnmodifiable() {
            assertThrows(UnsupportedOperationException.class, () -> store.slang().put("x", "y"));
            assertThrows(UnsupportedOperationException.class, () -> store.vocabulary().add("x"));
        }
    }

    @Nested
    @DisplayName("mutation")
    class Mutation {

        @Test
        @DisplayName("each effective change bumps the revision")
        void revisionBumps() {
            long r0 = store.revision();

            assertTrue(store.addWord("Blingz"));
            assertEquals(r0 + 1, store.revision());
            assertFalse(store.addWord("blingz"));
            assertEquals(r0 + 1, store.revision());

            store.addSlang("Moolah", "MONEY");
            assertEquals("money", store.slang().get("moolah"));
            assertEquals(r0 + 2, store.revision());

            assertEquals(2, store.addWords(List.of("alpha", "beta", "alpha")));
            assertEquals(r0 + 4, store.revision());
        }

        @Test
        void rewritesRequireBothSides() {
            assertThrows(IllegalArgumentException.class, () -> store.addAbbreviation(" ", "x"));
            assertThrows(IllegalArgumentException.class, () -> store.addContraction("x", null));
            assertThrows(IllegalArgumentException.class, () -> store.addIdiom(null, "x"));
        }

        @Test
        void idiomKeysAreCollapsed() {
            store.addIdiom("  on   the  run ", "hiding");
            assertEquals("hiding", store.idioms().get("on the run"));
            assertTrue(store.isKnownWord("hiding"));
        }

        @Test
        void clusterMembership() {
            assertTrue(store.addWordToCluster("Dollars", "money"));
            assertArrayEquals(new int[]{0}, store.clustersOf("dollars"));
            assertTrue(store.isKnownWord("dollars"));

            assertFalse(store.addWordToCluster("dollars", "money"));
            assertFalse(store.addWordToCluster("dollars", "weather"));
            assertEquals(2, store.dimensions());

            assertTrue(store.addWordToCluster("cash", "police"));
            assertArrayEquals(new int[]{0, 1}, store.clustersOf("cash"));
        }

        @Test
        void importanceMustBePositive() {
            store.setWordImportance("Cops", 2.5);
            assertEquals(2.5, store.importance("cops"));

            assertThrows(IllegalArgumentException.class, () -> store.setWordImportance("cops", 0.0));
            assertThrows(IllegalArgumentException.class, () -> store.setWordImportance("cops", Double.NaN));
            assertThrows(IllegalArgumentException.class, () -> store.setWordImportance("", 1.0));
        }

        @Test
        void exemplars() {
            long r0 = store.revision();
            assertTrue(store.addExemplar("money_advice", "  need some fast cash "));
            assertEquals(r0 + 1, store.revision());
            assertTrue(store.intents().find("money_advice").orElseThrow().exemplars.contains("need some fast cash"));
            assertTrue(store.isKnownWord("fast"));

            assertFalse(store.addExemplar("money_advice", "need some fast cash"));
            assertFalse(store.addExemplar("no_such_intent", "anything"));
            assertFalse(store.addExemplar("unknown", "anything"));
            assertFalse(store.addExemplar("money_advice", " "));
            assertEquals(r0 + 1, store.revision());
        }
    }
}
