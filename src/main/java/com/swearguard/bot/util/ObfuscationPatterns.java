package com.swearguard.bot.util;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds one regex per banned term that tolerates glyph substitutions and separators between
 * letters, for masking matched spans in text shown back to moderators.
 */
public final class ObfuscationPatterns {
    private static final Logger LOGGER = LoggerFactory.getLogger(ObfuscationPatterns.class);
    private static final String NON_ALNUM = "[^\\p{Alnum}]*";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final Comparator<String> LONGEST_FIRST = Comparator
            .comparingInt((String glyph) -> glyph.codePointCount(0, glyph.length()))
            .reversed()
            .thenComparing(SubstitutionTable::compareCodePoints);

    private ObfuscationPatterns() {
    }

    /**
     * Compiles the pattern for {@code term}. A term that fails to compile falls back to a quoted,
     * case-insensitive literal.
     *
     * @param maxSuffixLength how many trailing letters or digits a match may carry ("fuckers")
     */
    public static Pattern compileTermPattern(String term, GlyphTables glyphTables, int maxSuffixLength) {
        String trimmed = term == null ? "" : term.trim();
        if (trimmed.isEmpty()) {
            return Pattern.compile("$a");
        }
        String regex = buildRegex(trimmed, glyphTables, maxSuffixLength);
        try {
            return Pattern.compile(regex, FLAGS);
        } catch (PatternSyntaxException ex) {
            LOGGER.warn("Falling back to a literal pattern for '{}': {}", trimmed, ex.getDescription());
            return Pattern.compile(Pattern.quote(trimmed), FLAGS);
        }
    }

    /** Replaces every code point of every match with {@code *}. */
    public static String mask(String text, Iterable<Pattern> patterns) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String masked = text;
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(masked);
            StringBuilder result = new StringBuilder(masked.length());
            boolean found = false;
            while (matcher.find()) {
                if (matcher.end() == matcher.start()) {
                    continue;
                }
                found = true;
                String span = matcher.group();
                matcher.appendReplacement(result, "*".repeat(span.codePointCount(0, span.length())));
            }
            if (found) {
                matcher.appendTail(result);
                masked = result.toString();
            }
        }
        return masked;
    }

    static String buildRegex(String term, GlyphTables glyphTables, int maxSuffixLength) {
        StringBuilder regex = new StringBuilder();
        regex.append("(?<!\\p{Alnum})");
        boolean first = true;
        boolean pendingSpace = false;
        for (int index = 0; index < term.length(); ) {
            int codePoint = term.codePointAt(index);
            index += Character.charCount(codePoint);
            if (Character.isWhitespace(codePoint)) {
                pendingSpace = true;
                continue;
            }
            if (pendingSpace) {
                regex.append("\\s+");
                pendingSpace = false;
            } else if (!first) {
                regex.append(NON_ALNUM);
            }
            regex.append(characterPattern(codePoint, glyphTables));
            first = false;
        }
        if (maxSuffixLength > 0) {
            regex.append("\\p{Alnum}{0,").append(maxSuffixLength).append('}');
        }
        regex.append("(?!\\p{Alnum})");
        return regex.toString();
    }

    private static String characterPattern(int codePoint, GlyphTables glyphTables) {
        String literal = new String(Character.toChars(codePoint));
        if (codePoint > 0x7F || !glyphTables.substitutions().contains((char) codePoint)) {
            return Pattern.quote(literal);
        }
        List<String> glyphs = new ArrayList<>(glyphTables.substitutions().variantsOf((char) codePoint));
        glyphs.addAll(glyphTables.substitutions().aliasesOf((char) codePoint));
        glyphs.sort(LONGEST_FIRST);
        StringBuilder alternation = new StringBuilder("(?:");
        for (int index = 0; index < glyphs.size(); index++) {
            if (index > 0) {
                alternation.append('|');
            }
            alternation.append(Pattern.quote(glyphs.get(index)));
        }
        return alternation.append(')').toString();
    }
}
