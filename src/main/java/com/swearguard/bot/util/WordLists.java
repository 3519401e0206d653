package com.swearguard.bot.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class WordLists {
    private static final Pattern DISALLOWED = Pattern.compile("[^a-z0-9,\\s]");
    private static final Pattern SEPARATORS = Pattern.compile("[,\\s]+");

    private WordLists() {
    }

    /**
     * Splits user input such as {@code "word1, word2 word3"} into lowercase words, dropping
     * punctuation and duplicates. Order of first appearance is kept.
     */
    public static List<String> splitWords(String input) {
        if (input == null || input.isBlank()) {
            return List.of();
        }
        String cleaned = DISALLOWED.matcher(input.toLowerCase(Locale.ROOT)).replaceAll("");
        Set<String> words = new LinkedHashSet<>();
        for (String word : SEPARATORS.split(cleaned)) {
            String trimmed = word.trim();
            if (!trimmed.isEmpty()) {
                words.add(trimmed);
            }
        }
        return new ArrayList<>(words);
    }

    /** Lowercases, trims and de-duplicates banned terms, dropping blanks. */
    public static Set<String> normalizeTerms(Iterable<String> terms) {
        Set<String> normalized = new LinkedHashSet<>();
        if (terms == null) {
            return normalized;
        }
        for (String term : terms) {
            if (term == null) {
                continue;
            }
            String cleaned = term.trim().toLowerCase(Locale.ROOT);
            if (!cleaned.isEmpty()) {
                normalized.add(cleaned);
            }
        }
        return normalized;
    }
}
