package com.swearguard.bot.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Immutable glyph configuration shared by every filter instance: the substitution table, the
 * normalization map derived from it, the reverse substitutions and the homoglyph table.
 *
 * <p>The normalization map keeps the first canonical character a glyph was registered under,
 * walking canonicals in table order and variants in {@link SubstitutionTable#GLYPH_ORDER}. With the
 * default table that means letters win over digits and earlier letters win over later ones
 * ({@code *} resolves to {@code a}, {@code v} to {@code u}). Aliases only widen the reverse
 * substitutions and never enter the normalization map.
 */
public final class GlyphTables {
    public record Substitution(int position, String glyph, char canonical, String codePoint) {}

    private static final class DefaultsHolder {
        private static final GlyphTables DEFAULTS =
                new GlyphTables(DefaultGlyphs.substitutions(), DefaultGlyphs.homoglyphs());
    }

    private final SubstitutionTable substitutions;
    private final Map<String, Character> normalizationMap;
    private final Map<String, List<String>> reverseSubstitutions;
    private final Map<Integer, Character> homoglyphs;
    private final int longestGlyph;

    public GlyphTables(SubstitutionTable substitutions, Map<Integer, Character> homoglyphs) {
        this.substitutions = Objects.requireNonNull(substitutions, "substitutions");
        this.homoglyphs = Map.copyOf(Objects.requireNonNull(homoglyphs, "homoglyphs"));
        this.normalizationMap = buildNormalizationMap(substitutions);
        this.reverseSubstitutions = buildReverseSubstitutions(substitutions);
        this.longestGlyph = normalizationMap.keySet().stream()
                .mapToInt(glyph -> glyph.codePointCount(0, glyph.length()))
                .max()
                .orElse(1);
    }

    public static GlyphTables defaults() {
        return DefaultsHolder.DEFAULTS;
    }

    public SubstitutionTable substitutions() {
        return substitutions;
    }

    public Optional<Character> canonicalOf(String glyph) {
        return Optional.ofNullable(normalizationMap.get(glyph));
    }

    /**
     * Canonical characters a single code point may stand for, sorted. A code point without a
     * registered substitution stands only for itself.
     */
    public List<String> candidatesFor(int codePoint) {
        String glyph = new String(Character.toChars(codePoint));
        List<String> candidates = reverseSubstitutions.get(glyph);
        return candidates == null ? List.of(glyph) : candidates;
    }

    public String foldHomoglyphs(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder folded = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            Character latin = homoglyphs.get(codePoint);
            if (latin == null) {
                folded.appendCodePoint(codePoint);
            } else {
                folded.append(latin.charValue());
            }
        });
        return folded.toString();
    }

    /**
     * Replaces every registered glyph with its canonical character, trying the longest glyph first
     * at each position so multi-character glyphs such as {@code |)} win over {@code |}.
     */
    public String normalizeToBase(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        int[] ends = new int[longestGlyph];
        int index = 0;
        while (index < text.length()) {
            int count = 0;
            for (int end = index; count < longestGlyph && end < text.length(); count++) {
                end += Character.charCount(text.codePointAt(end));
                ends[count] = end;
            }
            Character canonical = null;
            int matchedEnd = index;
            for (int candidate = count - 1; candidate >= 0 && canonical == null; candidate--) {
                canonical = lookup(text.substring(index, ends[candidate]));
                matchedEnd = ends[candidate];
            }
            if (canonical == null) {
                int codePoint = text.codePointAt(index);
                normalized.appendCodePoint(codePoint);
                index += Character.charCount(codePoint);
            } else {
                normalized.append(canonical.charValue());
                index = matchedEnd;
            }
        }
        return normalized.toString();
    }

    /** Lists each character that the normalization map would replace, for diagnostics. */
    public List<Substitution> describeSubstitutions(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Substitution> substitutionsFound = new ArrayList<>();
        int position = 0;
        for (int index = 0; index < text.length(); position++) {
            int codePoint = text.codePointAt(index);
            String glyph = new String(Character.toChars(codePoint));
            Character canonical = normalizationMap.get(glyph);
            if (canonical != null && !glyph.equals(String.valueOf(canonical))) {
                substitutionsFound.add(new Substitution(
                        position,
                        glyph,
                        canonical,
                        String.format(Locale.ROOT, "U+%04X", codePoint)
                ));
            }
            index += Character.charCount(codePoint);
        }
        return substitutionsFound;
    }

    private Character lookup(String window) {
        Character canonical = normalizationMap.get(window);
        if (canonical == null) {
            canonical = normalizationMap.get(window.toLowerCase(Locale.ROOT));
        }
        return canonical;
    }

    private static Map<String, Character> buildNormalizationMap(SubstitutionTable table) {
        Map<String, Character> map = new LinkedHashMap<>();
        for (char canonical : table.canonicals()) {
            for (String variant : table.variantsOf(canonical)) {
                for (String form : caseForms(variant)) {
                    map.putIfAbsent(form, canonical);
                }
            }
        }
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, List<String>> buildReverseSubstitutions(SubstitutionTable table) {
        Map<String, TreeSet<String>> reverse = new LinkedHashMap<>();
        for (char canonical : table.canonicals()) {
            for (String variant : table.variantsOf(canonical)) {
                for (String form : caseForms(variant)) {
                    reverse.computeIfAbsent(form, ignored -> new TreeSet<>(SubstitutionTable.GLYPH_ORDER))
                            .add(String.valueOf(canonical));
                }
            }
        }
        for (char canonical : table.aliasedCanonicals()) {
            for (String alias : table.aliasesOf(canonical)) {
                for (String form : caseForms(alias)) {
                    reverse.computeIfAbsent(form, ignored -> new TreeSet<>(SubstitutionTable.GLYPH_ORDER))
                            .add(String.valueOf(canonical));
                }
            }
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        reverse.forEach((glyph, canonicals) -> frozen.put(glyph, List.copyOf(canonicals)));
        return Collections.unmodifiableMap(frozen);
    }

    // Case forms that change length (the upper case of 'ß' is "SS") are not separate glyphs.
    private static List<String> caseForms(String variant) {
        int length = variant.codePointCount(0, variant.length());
        List<String> forms = new ArrayList<>(3);
        forms.add(variant);
        for (String form : List.of(variant.toLowerCase(Locale.ROOT), variant.toUpperCase(Locale.ROOT))) {
            if (!forms.contains(form) && form.codePointCount(0, form.length()) == length) {
                forms.add(form);
            }
        }
        return forms;
    }
}
