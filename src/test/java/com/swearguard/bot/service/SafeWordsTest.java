package com.swearguard.bot.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.swearguard.bot.util.GlyphTables;
import com.swearguard.bot.util.TextPreprocessor;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SafeWordsTest {
    private final TextPreprocessor preprocessor = new TextPreprocessor(GlyphTables.defaults());

    @TempDir
    Path tempDir;

    @Test
    void defaultsHoldTheBuiltInWords() {
        SafeWords safeWords = SafeWords.defaults();
        assertTrue(safeWords.contains("classic"));
        assertTrue(safeWords.contains("scrotum"));
        assertEquals(SafeWords.COMMON_SAFE_WORDS.size(), safeWords.size());
    }

    @Test
    void normalizedWordsMatchPreprocessedTokens() {
        Set<String> normalized = SafeWords.of(List.of("Assassin", "classic"))
                .normalizedFor(Set.of("ass"), preprocessor);
        assertTrue(normalized.contains("asasin"));
        assertTrue(normalized.contains("clasic"));
    }

    @Test
    void loadedListSkipsBannedTermsAndTheirShortVariants() throws IOException {
        Path list = tempDir.resolve("english-words.txt");
        Files.write(list, List.of("Grass", "fuck", "fucker", "fuckingly", "", "beaver"), StandardCharsets.ISO_8859_1);

        SafeWords safeWords = SafeWords.load(list);
        assertTrue(safeWords.contains("grass"));
        assertTrue(safeWords.contains("fucker"));

        Set<String> normalized = safeWords.normalizedFor(Set.of("fuck"), preprocessor);
        assertTrue(normalized.contains("gras"));
        assertTrue(normalized.contains("fuckingly"));
        assertFalse(normalized.contains("fuck"));
        assertFalse(normalized.contains("fucker"));
    }

    @Test
    void missingListFallsBackToBuiltIns() {
        SafeWords safeWords = SafeWords.load(tempDir.resolve("missing.txt"));
        assertEquals(SafeWords.defaults().words(), safeWords.words());
    }

    @Test
    void emptySetHasNoWords() {
        assertTrue(SafeWords.empty().normalizedFor(Set.of(), preprocessor).isEmpty());
    }
}
