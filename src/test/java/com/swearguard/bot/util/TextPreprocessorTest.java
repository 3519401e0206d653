package com.swearguard.bot.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextPreprocessorTest {
    private final TextPreprocessor preprocessor = new TextPreprocessor(GlyphTables.defaults());

    @Test
    void removesZeroWidthSeparatorsInsideWords() {
        assertEquals("fuck", preprocessor.preprocess("f\u200Buck"));
        assertEquals("fuck", preprocessor.preprocess("f\u00ADu\u2060c\uFEFFk"));
    }

    @Test
    void squashesEveryRunToOneCharacter() {
        assertEquals("helo", preprocessor.preprocess("heeellooo"));
        assertEquals("abca", preprocessor.preprocess("aaabbbcccaaa"));
    }

    @Test
    void collapsesSpacedOutLetters() {
        assertEquals("fuck", preprocessor.preprocess("f u c k"));
        assertEquals("fuck you", preprocessor.preprocess("F U C K you"));
    }

    @Test
    void stripsPunctuationAndLowercases() {
        assertEquals("helo world", preprocessor.preprocess("Hello, World!"));
        assertEquals("fuck", preprocessor.preprocess("f.u.c.k"));
    }

    @Test
    void foldsCompatibilityFormsAndHomoglyphs() {
        assertEquals("fuck", preprocessor.preprocess("\uFF26\uFF35\uFF23\uFF2B"));
        assertEquals("cat", preprocessor.preprocess("\u0441\u0430t"));
    }

    @Test
    void emptyAndNullInputsYieldEmptyText() {
        assertEquals("", preprocessor.preprocess(""));
        assertEquals("", preprocessor.preprocess(null));
        assertEquals("", preprocessor.preprocess("!!! ..."));
    }

    @Test
    void preprocessIsIdempotent() {
        List<String> samples = List.of(
                "a.a",
                "aA",
                "a . a . a",
                "f u c k",
                "x \t y",
                "h e l l o",
                "Hello, World!",
                "\uFF26\uFF35\uFF23\uFF2B",
                "\uD83C\uDD75\uD83C\uDD84\uD83C\uDD72\uD83C\uDD7A",
                "s\u200Bh\u200Ci\u200Dt",
                "mIxEd CaSe  and   SPACES",
                "b.b.b a-a-a c c c",
                "\u00C5ngstr\u00F6m \u2126"
        );
        for (String sample : samples) {
            String once = preprocessor.preprocess(sample);
            assertEquals(once, preprocessor.preprocess(once), "not idempotent for: " + sample);
        }
    }

    @Test
    void outputContainsNoRepeatedCharacters() {
        String output = preprocessor.preprocess("zzz!!zz yyy.y a a a a bb-bb");
        for (int index = 1; index < output.length(); index++) {
            assertTrue(output.charAt(index) != output.charAt(index - 1), "run left in: " + output);
        }
    }

    @Test
    void tokenizeSplitsOnWhitespace() {
        assertEquals(List.of("foo", "bar"), preprocessor.tokenize("  foo   bar "));
        assertEquals(List.of(), preprocessor.tokenize(" "));
    }
}
