package com.swearguard.bot.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class WordListsTest {

    @Test
    void splitsOnCommasAndWhitespaceAndDeduplicates() {
        assertEquals(List.of("word1", "word2", "word3"), WordLists.splitWords("Word1, word2  word3,word1!"));
        assertEquals(List.of("a", "b"), WordLists.splitWords("a,b"));
    }

    @Test
    void blankInputYieldsNoWords() {
        assertEquals(List.of(), WordLists.splitWords(null));
        assertEquals(List.of(), WordLists.splitWords(" , ,, "));
        assertEquals(List.of(), WordLists.splitWords("!!!"));
    }

    @Test
    void normalizeTermsTrimsLowercasesAndDropsBlanks() {
        Set<String> terms = WordLists.normalizeTerms(Arrays.asList(" FUCK ", "fuck", "", null, "Shit"));
        assertEquals(List.of("fuck", "shit"), List.copyOf(terms));
    }
}
