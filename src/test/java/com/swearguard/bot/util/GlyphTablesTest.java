package com.swearguard.bot.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class GlyphTablesTest {
    private final GlyphTables tables = GlyphTables.defaults();

    @Test
    void ambiguousGlyphsResolveToFirstRegisteredCanonical() {
        assertEquals(Optional.of('a'), tables.canonicalOf("*"));
        assertEquals(Optional.of('a'), tables.canonicalOf("@"));
        assertEquals(Optional.of('u'), tables.canonicalOf("v"));
        assertEquals(Optional.of('i'), tables.canonicalOf("1"));
        assertEquals(Optional.of('a'), tables.canonicalOf("A"));
        assertEquals(Optional.empty(), tables.canonicalOf("%"));
    }

    @Test
    void reverseSubstitutionsKeepEveryCandidateSorted() {
        assertEquals(List.of("4", "a", "u"), tables.candidatesFor('@'));
        assertEquals(List.of("9", "q"), tables.candidatesFor('q'));
        assertEquals(List.of("2", "z"), tables.candidatesFor('Z'));
        assertEquals(List.of("h"), tables.candidatesFor('#'));
        assertEquals(13, tables.candidatesFor('*').size());
    }

    @Test
    void aliasesWidenCandidatesWithoutChangingNormalization() {
        assertEquals(List.of("1", "i", "l"), tables.candidatesFor('l'));
        assertEquals(List.of("1", "i", "l"), tables.candidatesFor('I'));
        assertEquals(Optional.of('l'), tables.canonicalOf("l"));
        assertEquals(Optional.of('i'), tables.canonicalOf("I"));
        assertEquals("shlt", tables.normalizeToBase("shlt"));
        assertEquals("hello", tables.normalizeToBase("heLLo"));
    }

    @Test
    void unregisteredCodePointStandsForItself() {
        assertEquals(List.of("%"), tables.candidatesFor('%'));
        assertEquals(List.of("\uD83D\uDE00"), tables.candidatesFor(0x1F600));
    }

    @Test
    void normalizeToBasePrefersLongestGlyph() {
        assertEquals("d", tables.normalizeToBase("|)"));
        assertEquals("o", tables.normalizeToBase("()"));
        assertEquals("hello", tables.normalizeToBase("h3ll0"));
        assertEquals("h", tables.normalizeToBase("\uFF28"));
        assertEquals("fuck", tables.normalizeToBase("\uD83C\uDD75\uD83C\uDD84\uD83C\uDD72\uD83C\uDD7A"));
    }

    @Test
    void describeSubstitutionsReportsPositionAndCodePoint() {
        List<GlyphTables.Substitution> found = tables.describeSubstitutions("h@t");
        assertEquals(1, found.size());
        GlyphTables.Substitution substitution = found.get(0);
        assertEquals(1, substitution.position());
        assertEquals("@", substitution.glyph());
        assertEquals('a', substitution.canonical());
        assertEquals("U+0040", substitution.codePoint());
        assertTrue(tables.describeSubstitutions("plain").isEmpty());
    }

    @Test
    void foldsCrossScriptHomoglyphs() {
        assertEquals("pay", tables.foldHomoglyphs("\u0440\u0430\u0443"));
        assertEquals("ok", tables.foldHomoglyphs("ok"));
    }

    @Test
    void customTablesAreIndependentOfDefaults() {
        SubstitutionTable table = SubstitutionTable.builder()
                .add('x', "x", "%")
                .build();
        GlyphTables custom = new GlyphTables(table, Map.of());
        assertEquals(Optional.of('x'), custom.canonicalOf("%"));
        assertEquals(List.of("x"), custom.candidatesFor('%'));
        assertEquals("@", custom.normalizeToBase("@"));
    }
}
