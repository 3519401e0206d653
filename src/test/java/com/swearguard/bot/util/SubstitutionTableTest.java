package com.swearguard.bot.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SubstitutionTableTest {

    @Test
    void variantsAreDeduplicatedAndSortedByLengthThenCodePoint() {
        SubstitutionTable table = SubstitutionTable.builder()
                .add('a', "bb", "a", "a", "@")
                .build();
        assertEquals(List.of("@", "a", "bb"), table.variantsOf('a'));
    }

    @Test
    void blankGlyphsAreSkipped() {
        SubstitutionTable table = SubstitutionTable.builder()
                .add('a', " ", "a", "")
                .build();
        assertEquals(List.of("a"), table.variantsOf('a'));
    }

    @Test
    void rejectsCanonicalWithoutVariants() {
        SubstitutionTable.Builder builder = SubstitutionTable.builder().add('a');
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void rejectsNonCanonicalKeys() {
        assertThrows(IllegalArgumentException.class, () -> SubstitutionTable.builder().add('A', "x"));
        assertThrows(IllegalArgumentException.class, () -> SubstitutionTable.builder().add('-', "x"));
    }

    @Test
    void skipsUnassignedCodePoints() {
        SubstitutionTable table = SubstitutionTable.builder()
                .add('e', "e")
                .addCodePoints('e', 0x1D455, 0x110000)
                .build();
        assertEquals(List.of("e"), table.variantsOf('e'));
    }

    @Test
    void defaultTableCoversLettersAndDigitsWithoutDuplicates() {
        SubstitutionTable table = GlyphTables.defaults().substitutions();
        assertEquals(36, table.size());
        for (char canonical = 'a'; canonical <= 'z'; canonical++) {
            assertTrue(table.contains(canonical));
        }
        for (char canonical : table.canonicals()) {
            List<String> variants = table.variantsOf(canonical);
            assertEquals(variants.size(), new HashSet<>(variants).size(), "duplicates for " + canonical);
        }
    }

    @Test
    void lettersAreRegisteredBeforeDigits() {
        List<Character> order = List.copyOf(GlyphTables.defaults().substitutions().canonicals());
        assertEquals('a', order.get(0));
        assertEquals('z', order.get(25));
        assertEquals('0', order.get(26));
    }

    @Test
    void aliasesAreKeptApartFromVariants() {
        SubstitutionTable table = SubstitutionTable.builder()
                .add('x', "x", "%")
                .add('y', "y")
                .addAlias('y', "x", " ")
                .build();
        assertEquals(List.of("%", "x"), table.variantsOf('x'));
        assertEquals(List.of("y"), table.variantsOf('y'));
        assertEquals(List.of("x"), table.aliasesOf('y'));
        assertEquals(List.of(), table.aliasesOf('x'));

        GlyphTables tables = new GlyphTables(table, Map.of());
        assertEquals(Optional.of('x'), tables.canonicalOf("x"));
        assertEquals(List.of("x", "y"), tables.candidatesFor('x'));
    }
}
