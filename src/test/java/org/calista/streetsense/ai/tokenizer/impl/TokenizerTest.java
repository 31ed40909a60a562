package org.calista.streetsense.ai.tokenizer.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    @Nested
    @DisplayName("WordTokenizer")
    class Words {

        @Test
        void lowercasesAndDropsPunctuation() {
            assertEquals(List.of("where", "s", "the", "heat", "at"),
                    new WordTokenizer().tokenize("Where's the HEAT at?!"));
        }

        @Test
        void minLengthSkipsShortTokens() {
            assertEquals(List.of("am", "broke"), new WordTokenizer(2).tokenize("i am broke"));
        }

        @Test
        void keepsDigitsAndUnicodeLetters() {
            assertEquals(List.of("need", "500", "долларов"), new WordTokenizer().tokenize("need 500 долларов"));
        }

        @Test
        void blankGivesNothing() {
            assertTrue(new WordTokenizer().tokenize("   ").isEmpty());
            assertTrue(new WordTokenizer().tokenize(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("SegmentTokenizer")
    class Segments {

        private final SegmentTokenizer t = new SegmentTokenizer();

        @Test
        @DisplayName("segments concatenate back to the input")
        void lossless() {
            String text = "wat  crme, shud i do?!";
            List<String> segs = t.tokenize(text);
            assertEquals(text, String.join("", segs));
            assertEquals(List.of("wat", "  ", "crme", ",", " ", "shud", " ", "i", " ", "do", "?!"), segs);
        }

        @Test
        void classifiesWordSegments() {
            assertTrue(SegmentTokenizer.isWord("crme"));
            assertTrue(SegmentTokenizer.isWord("42"));
            assertFalse(SegmentTokenizer.isWord("?!"));
            assertFalse(SegmentTokenizer.isWord(" "));
            assertFalse(SegmentTokenizer.isWord(""));
        }
    }
}
