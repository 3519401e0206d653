package com.swearguard.bot.service;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit inflection rules: a token is a banned term plus a known suffix or prefix. Used only in
 * strict mode.
 */
public final class SuffixRules {
    public record SuffixRule(String suffix, int minLength, Set<String> exceptions) {}

    public static final List<SuffixRule> SUFFIX_RULES = List.of(
            new SuffixRule("ing", 4, Set.of("ring", "king", "sing")),
            new SuffixRule("er", 3, Set.of("her", "per")),
            new SuffixRule("ed", 3, Set.of("red", "bed")),
            new SuffixRule("a", 4, Set.of("banana")),
            new SuffixRule("s", 3, Set.of("is", "as", "us")),
            new SuffixRule("es", 4, Set.of("yes", "res", "des"))
    );

    public static final List<String> PREFIXES = List.of("re", "un", "de", "in", "pre", "pro");

    private SuffixRules() {
    }

    /** Returns the banned term {@code word} inflects, if any. */
    public static Optional<String> match(String word, Set<String> bannedTerms) {
        if (word == null || word.isEmpty() || bannedTerms == null || bannedTerms.isEmpty()) {
            return Optional.empty();
        }
        for (SuffixRule rule : SUFFIX_RULES) {
            if (word.length() >= rule.minLength()
                    && word.endsWith(rule.suffix())
                    && !rule.exceptions().contains(word)) {
                String root = word.substring(0, word.length() - rule.suffix().length());
                if (bannedTerms.contains(root)) {
                    return Optional.of(root);
                }
            }
        }
        for (String prefix : PREFIXES) {
            if (word.startsWith(prefix)) {
                String root = word.substring(prefix.length());
                if (bannedTerms.contains(root)) {
                    return Optional.of(root);
                }
            }
        }
        return Optional.empty();
    }
}
