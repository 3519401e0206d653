package com.swearguard.bot.util;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic clean-up applied before the normalized matching stages.
 *
 * <p>Order: strip invisible separators, NFKC, fold homoglyphs, squash repeated characters, join
 * spaced-out single letters, drop everything but ASCII letters, digits and whitespace, lowercase and
 * trim. Squashing is lossy: a word that legitimately doubles a letter ("assassin") comes out with
 * the letter once ("asasin").
 */
public final class TextPreprocessor {
    private static final String HIDDEN_SEPARATORS = "\u200B\u200C\u200D\u2060" // zero-width
            + "\u034F\u180E\uFEFF" // grapheme joiner, Mongolian vowel separator, BOM
            + "\u00AD" // soft hyphen
            + "\u17B5\u17B6" // Khmer vowel signs
            + "\u2028\u2029" // line and paragraph separators
            + "\u1160\u3164"; // Hangul fillers
    private static final Pattern REPEATED = Pattern.compile("(.)\\1+");
    private static final Pattern SPACED_LETTERS = Pattern.compile("\\b(?:[a-z]\\s+){2,}[a-z]\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern INNER_WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-zA-Z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final GlyphTables glyphTables;

    public TextPreprocessor(GlyphTables glyphTables) {
        this.glyphTables = Objects.requireNonNull(glyphTables, "glyphTables");
    }

    public String preprocess(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        String visible = removeHiddenSeparators(input);
        String folded = Normalizer.normalize(visible, Normalizer.Form.NFKC);
        folded = glyphTables.foldHomoglyphs(folded);
        String squashed = squashRepeats(folded);
        String collapsed = collapseSpacedLetters(squashed);
        String stripped = NON_ALNUM.matcher(collapsed).replaceAll("");
        return settle(stripped.toLowerCase(Locale.ROOT).trim());
    }

    /** Splits preprocessed text into its word tokens. */
    public List<String> tokenize(String preprocessed) {
        if (preprocessed == null || preprocessed.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : WHITESPACE.split(preprocessed.trim())) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public static String removeHiddenSeparators(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        StringBuilder visible = new StringBuilder(input.length());
        for (int index = 0; index < input.length(); index++) {
            char value = input.charAt(index);
            if (HIDDEN_SEPARATORS.indexOf(value) < 0) {
                visible.append(value);
            }
        }
        return visible.toString();
    }

    public static String squashRepeats(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        return REPEATED.matcher(input).replaceAll("$1");
    }

    public static String collapseSpacedLetters(String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        Matcher matcher = SPACED_LETTERS.matcher(input);
        StringBuilder collapsed = new StringBuilder(input.length());
        while (matcher.find()) {
            String joined = INNER_WHITESPACE.matcher(matcher.group()).replaceAll("");
            matcher.appendReplacement(collapsed, Matcher.quoteReplacement(joined));
        }
        matcher.appendTail(collapsed);
        return collapsed.toString();
    }

    // Stripping and lowercasing can line up new repeats ("a.a", "aA") or spaced letters, so the
    // squash and collapse steps run again until the text stops changing. Each pass only shrinks it.
    private static String settle(String text) {
        String current = text;
        while (true) {
            String next = collapseSpacedLetters(squashRepeats(current)).trim();
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
    }
}
