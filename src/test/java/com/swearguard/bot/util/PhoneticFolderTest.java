package com.swearguard.bot.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class PhoneticFolderTest {
    private final PhoneticFolder folder = new PhoneticFolder(GlyphTables.defaults());

    @Test
    void misspellingsShareTheKeyOfTheWord() {
        assertEquals("fuk", folder.key("fuck"));
        assertEquals("fuk", folder.key("fukc"));
        assertEquals("fuk", folder.key("phuck"));
    }

    @Test
    void leetspeakIsNormalizedBeforeKeying() {
        assertEquals(folder.key("shit"), folder.key("5h1t"));
        assertEquals("shit", folder.key("shit"));
    }

    @Test
    void middleLettersAreSortedSoTranspositionsCollapse() {
        assertEquals("sotp", folder.key("stop"));
        assertEquals(folder.key("stop"), folder.key("sotp"));
    }

    @Test
    void duplicatesAreDroppedAndShortKeysKeepTheirOrder() {
        assertEquals("hel", folder.key("hell"));
        assertEquals("helo", folder.key("hello"));
        assertEquals("as", folder.key("ass"));
    }

    @Test
    void keysAreTruncatedToConfiguredLength() {
        PhoneticFolder shortKeys = new PhoneticFolder(GlyphTables.defaults(), 4);
        assertEquals("abde", shortKeys.key("abcdefgh"));
        assertEquals(8, folder.key("pleasesubmittheassignment").length());
    }

    @Test
    void emptyInputsHaveEmptyKeys() {
        assertEquals("", folder.key(""));
        assertEquals("", folder.key(null));
        assertEquals("", folder.key("%%%"));
    }

    @Test
    void rejectsNonPositiveKeyLength() {
        assertThrows(IllegalArgumentException.class, () -> new PhoneticFolder(GlyphTables.defaults(), 0));
    }
}
