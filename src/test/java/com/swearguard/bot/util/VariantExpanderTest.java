package com.swearguard.bot.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class VariantExpanderTest {
    private final VariantExpander expander = new VariantExpander(GlyphTables.defaults());

    @Test
    void expandsAmbiguousGlyphsInSortedProductOrder() {
        assertEquals(List.of("f4ck", "fack", "fuck"), List.copyOf(expander.expand("f@ck", 100)));
    }

    @Test
    void characterWithoutSubstitutionMapsToItself() {
        assertEquals(Set.of("%"), expander.expand("%", 10));
    }

    @Test
    void pathologicalTokenStopsAtCap() {
        String token = "*".repeat(30);
        Set<String> variants = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> expander.expand(token, 50_000));
        assertEquals(50_000, variants.size());
        assertEquals(1_000, expander.expand(token, 1_000).size());
    }

    @Test
    void containsAgreesWithCappedEnumeration() {
        List<String> all = List.copyOf(expander.expand("**", 1_000));
        assertEquals(169, all.size());
        Set<String> firstTwenty = expander.expand("**", 20);
        for (String candidate : all) {
            assertEquals(firstTwenty.contains(candidate), expander.contains("**", candidate, 20), candidate);
        }
        assertTrue(expander.contains("**", "bo", 20));
        assertFalse(expander.contains("**", "bs", 20));
    }

    @Test
    void containsRejectsUnreachableCandidates() {
        assertTrue(expander.contains("5h1t", "shit", 50_000));
        assertTrue(expander.contains("fuck", "fuck", 1));
        assertFalse(expander.contains("f@ck", "fick", 50_000));
        assertFalse(expander.contains("f@ck", "fuc", 50_000));
        assertFalse(expander.contains("f@ck", "fuck", 0));
    }

    @Test
    void lowercaseLAndCapitalIStandInForEachOther() {
        assertTrue(expander.contains("shlt", "shit", 50_000));
        assertTrue(expander.contains("bltch", "bitch", 50_000));
        assertTrue(expander.contains("sIut", "slut", 50_000));
        assertTrue(expander.contains("5hlt", "shit", 50_000));
        Set<String> variants = expander.expand("shlt", 100);
        assertEquals(12, variants.size());
        assertTrue(variants.contains("shit"));
    }

    @Test
    void containsOnPathologicalTokenIsImmediate() {
        String token = "*".repeat(30);
        assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
            assertTrue(expander.contains(token, "a".repeat(30), 50_000));
            assertFalse(expander.contains(token, "z".repeat(30), 50_000));
        });
    }

    @Test
    void enumerateStopsWhenVisitorDeclines() {
        int produced = expander.enumerate("**", 1_000, variant -> !variant.equals("ac"));
        assertEquals(3, produced);
    }
}
