package com.swearguard.bot.util;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reduces text to a coarse phonetic key so that misspellings such as "fukc" or "phuck" share a key
 * with the word they imitate.
 *
 * <p>The key is built from the glyph-normalized letters: silent letters and common digraphs are
 * folded, adjacent duplicates dropped, and for keys of four or more letters the middle letters are
 * sorted so that transpositions collapse. The result is truncated to the configured length.
 */
public final class PhoneticFolder {
    public static final int DEFAULT_KEY_LENGTH = 8;

    private record Rule(Pattern pattern, String replacement) {
        static Rule of(String regex, String replacement) {
            return new Rule(Pattern.compile(regex), replacement);
        }

        String apply(String input) {
            return pattern.matcher(input).replaceAll(replacement);
        }
    }

    // Applied in order; later rules see the output of earlier ones.
    private static final List<Rule> RULES = List.of(
            Rule.of("[^a-z]", ""),
            Rule.of("([aeiou])h", "$1"),
            Rule.of("gh(?=[iey])", ""),
            Rule.of("ck", "k"),
            Rule.of("c(?!e|i|y)", "k"),
            Rule.of("ph", "f"),
            Rule.of("qu", "kw"),
            Rule.of("x", "ks"),
            Rule.of("(\\w)\\1+", "$1"),
            Rule.of("sch", "sk"),
            Rule.of("th", "t"),
            Rule.of("^kn", "n"),
            Rule.of("^gn", "n"),
            Rule.of("^pn", "n"),
            Rule.of("^wr", "r"),
            Rule.of("mb$", "m"),
            Rule.of("([^s]|^)c(?=[iey])", "$1s"),
            Rule.of("([^f]|^)gh", "$1g"),
            Rule.of("([^t]|^)ch", "$1k")
    );

    private final GlyphTables glyphTables;
    private final int keyLength;

    public PhoneticFolder(GlyphTables glyphTables) {
        this(glyphTables, DEFAULT_KEY_LENGTH);
    }

    public PhoneticFolder(GlyphTables glyphTables, int keyLength) {
        if (keyLength < 1) {
            throw new IllegalArgumentException("keyLength must be positive: " + keyLength);
        }
        this.glyphTables = Objects.requireNonNull(glyphTables, "glyphTables");
        this.keyLength = keyLength;
    }

    public String key(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String folded = glyphTables.normalizeToBase(text.toLowerCase(Locale.ROOT));
        for (Rule rule : RULES) {
            folded = rule.apply(folded);
        }
        if (folded.length() >= 4) {
            char[] middle = folded.substring(1, folded.length() - 1).toCharArray();
            Arrays.sort(middle);
            folded = folded.charAt(0) + new String(middle) + folded.charAt(folded.length() - 1);
        }
        return folded.length() > keyLength ? folded.substring(0, keyLength) : folded;
    }

    public int keyLength() {
        return keyLength;
    }
}
