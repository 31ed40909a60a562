package org.calista.streetsense.ai.typo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EditDistanceTest {

    @Nested
    @DisplayName("strict Damerau-Levenshtein")
    class Strict {

        @Test
        void basicEdits() {
            assertEquals(0, EditDistance.damerauLevenshtein("heist", "heist"));
            assertEquals(1, EditDistance.damerauLevenshtein("crme", "crime"));
            assertEquals(1, EditDistance.damerauLevenshtein("monet", "money"));
            assertEquals(1, EditDistance.damerauLevenshtein("moneyy", "money"));
            assertEquals(2, EditDistance.damerauLevenshtein("shud", "should"));
            assertEquals(5, EditDistance.damerauLevenshtein("xyz", "money"));
        }

        @Test
        @DisplayName("adjacent transposition costs one")
        void transposition() {
            assertEquals(1, EditDistance.damerauLevenshtein("ca", "ac"));
            assertEquals(1, EditDistance.damerauLevenshtein("crmie", "crime"));
        }

        @Test
        void emptySides() {
            assertEquals(3, EditDistance.damerauLevenshtein("", "abc"));
            assertEquals(4, EditDistance.damerauLevenshtein("heat", ""));
        }

        @Test
        void symmetric() {
            assertEquals(EditDistance.damerauLevenshtein("polise", "police"),
                    EditDistance.damerauLevenshtein("police", "polise"));
        }
    }

    @Nested
    @DisplayName("weighted")
    class Weighted {

        private final EditDistance d = new EditDistance();

        @Test
        @DisplayName("keyboard neighbours are cheap")
        void adjacentKeys() {
            assertEquals(0.5, d.weighted("monry", "money"), 1e-9);
            assertEquals(0.5, d.weighted("mpney", "money"), 1e-9);
            assertTrue(EditDistance.isAdjacentKey('e', 'r'));
            assertFalse(EditDistance.isAdjacentKey('e', 'p'));
        }

        @Test
        @DisplayName("phonetic look-alikes cost less than a full substitution")
        void phonetic() {
            assertEquals(0.7, d.weighted("kash", "cash"), 1e-9);
            assertEquals(0.7, d.weighted("polise", "police"), 1e-9);
            assertTrue(EditDistance.isPhoneticallySimilar('c', 'k'));
            assertTrue(EditDistance.isPhoneticallySimilar('S', 'z'));
            assertFalse(EditDistance.isPhoneticallySimilar('a', 'k'));
        }

        @Test
        void transpositionIsDiscounted() {
            assertEquals(0.5, d.weighted("crmie", "crime"), 1e-9);
            assertEquals(0.5, d.weighted("monye", "money"), 1e-9);
        }

        @Test
        void neverAboveStrict() {
            String[][] pairs = {{"wat", "what"}, {"shud", "should"}, {"xyz", "money"}, {"", "abc"}};
            for (String[] p : pairs) {
                assertTrue(d.weighted(p[0], p[1]) <= EditDistance.damerauLevenshtein(p[0], p[1]));
            }
        }

        @Test
        void customCosts() {
            EditDistance flat = new EditDistance(1.0, 1.0, 1.0);
            assertEquals(1.0, flat.weighted("monry", "money"), 1e-9);
        }
    }
}
