package com.swearguard.bot.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonical character to the glyphs that can impersonate it.
 *
 * <p>Canonical keys are ASCII lowercase letters or digits. Keys keep their registration order, and
 * each variant list is de-duplicated and sorted by {@link #GLYPH_ORDER}. Instances are immutable.
 *
 * <p>Aliases are glyphs that may stand for a canonical character during expansion but never
 * normalize to it, such as {@code l} read as {@code i}.
 */
public final class SubstitutionTable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SubstitutionTable.class);

    /** Shorter glyphs first, then code point order. */
    public static final Comparator<String> GLYPH_ORDER = Comparator
            .comparingInt((String glyph) -> glyph.codePointCount(0, glyph.length()))
            .thenComparing(SubstitutionTable::compareCodePoints);

    private final Map<Character, List<String>> variants;
    private final Map<Character, List<String>> aliases;

    private SubstitutionTable(Map<Character, List<String>> variants, Map<Character, List<String>> aliases) {
        this.variants = variants;
        this.aliases = aliases;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> variantsOf(char canonical) {
        return variants.getOrDefault(canonical, List.of());
    }

    public List<String> aliasesOf(char canonical) {
        return aliases.getOrDefault(canonical, List.of());
    }

    /** Canonical characters that have aliases, in registration order. */
    public Set<Character> aliasedCanonicals() {
        return aliases.keySet();
    }

    public boolean contains(char canonical) {
        return variants.containsKey(canonical);
    }

    /** Canonical characters in registration order. */
    public Set<Character> canonicals() {
        return variants.keySet();
    }

    public int size() {
        return variants.size();
    }

    static int compareCodePoints(String left, String right) {
        int leftIndex = 0;
        int rightIndex = 0;
        while (leftIndex < left.length() && rightIndex < right.length()) {
            int leftCodePoint = left.codePointAt(leftIndex);
            int rightCodePoint = right.codePointAt(rightIndex);
            if (leftCodePoint != rightCodePoint) {
                return Integer.compare(leftCodePoint, rightCodePoint);
            }
            leftIndex += Character.charCount(leftCodePoint);
            rightIndex += Character.charCount(rightCodePoint);
        }
        return Integer.compare(left.length() - leftIndex, right.length() - rightIndex);
    }

    private static boolean isCanonical(char value) {
        return (value >= 'a' && value <= 'z') || (value >= '0' && value <= '9');
    }

    public static final class Builder {
        private final Map<Character, Set<String>> entries = new LinkedHashMap<>();
        private final Map<Character, Set<String>> aliasEntries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(char canonical, String... glyphs) {
            Set<String> target = entry(canonical);
            if (glyphs == null) {
                return this;
            }
            for (String glyph : glyphs) {
                if (glyph == null || glyph.isBlank()) {
                    LOGGER.warn("Skipping blank glyph registered for '{}'", canonical);
                    continue;
                }
                target.add(glyph);
            }
            return this;
        }

        public Builder addAlias(char canonical, String... glyphs) {
            checkCanonical(canonical);
            Set<String> target = aliasEntries.computeIfAbsent(canonical, ignored -> new LinkedHashSet<>());
            if (glyphs == null) {
                return this;
            }
            for (String glyph : glyphs) {
                if (glyph == null || glyph.isBlank()) {
                    LOGGER.warn("Skipping blank alias registered for '{}'", canonical);
                    continue;
                }
                target.add(glyph);
            }
            return this;
        }

        /** Registers single code points; unassigned ones (holes in styled alphabets) are skipped. */
        public Builder addCodePoints(char canonical, int... codePoints) {
            Set<String> target = entry(canonical);
            for (int codePoint : codePoints) {
                if (!Character.isValidCodePoint(codePoint) || !Character.isDefined(codePoint)) {
                    LOGGER.debug("Skipping unassigned code point U+{} for '{}'",
                            Integer.toHexString(codePoint).toUpperCase(Locale.ROOT), canonical);
                    continue;
                }
                target.add(new String(Character.toChars(codePoint)));
            }
            return this;
        }

        public SubstitutionTable build() {
            Map<Character, List<String>> built = new LinkedHashMap<>();
            for (Map.Entry<Character, Set<String>> entry : entries.entrySet()) {
                if (entry.getValue().isEmpty()) {
                    throw new IllegalArgumentException("No variants registered for '" + entry.getKey() + "'");
                }
                List<String> sorted = new ArrayList<>(entry.getValue());
                sorted.sort(GLYPH_ORDER);
                built.put(entry.getKey(), List.copyOf(sorted));
            }
            Map<Character, List<String>> builtAliases = new LinkedHashMap<>();
            aliasEntries.forEach((canonical, glyphs) -> {
                if (!glyphs.isEmpty()) {
                    List<String> sorted = new ArrayList<>(glyphs);
                    sorted.sort(GLYPH_ORDER);
                    builtAliases.put(canonical, List.copyOf(sorted));
                }
            });
            return new SubstitutionTable(Collections.unmodifiableMap(built),
                    Collections.unmodifiableMap(builtAliases));
        }

        private Set<String> entry(char canonical) {
            checkCanonical(canonical);
            return entries.computeIfAbsent(canonical, ignored -> new LinkedHashSet<>());
        }

        private static void checkCanonical(char canonical) {
            if (!isCanonical(canonical)) {
                throw new IllegalArgumentException(
                        "Canonical character must be a lowercase ASCII letter or digit: '" + canonical + "'");
            }
        }
    }
}
