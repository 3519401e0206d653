package com.swearguard.bot.service;

import com.swearguard.bot.util.TextPreprocessor;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Allow-list of legitimate words that contain banned substrings. A message holding any of them
 * (and not the banned term itself) is allowed as a whole.
 */
public final class SafeWords {
    private static final Logger LOGGER = LoggerFactory.getLogger(SafeWords.class);
    private static final int MAX_VARIANT_EXTRA_LETTERS = 3;

    public static final List<String> COMMON_SAFE_WORDS = List.of(
            // place names
            "penistone", "lightwater", "cockburn", "mianus", "hello", "tatsuki", "cumming",
            "clitheroe", "twatt", "fanny", "assington", "bitchfield", "titcomb", "rape",
            "shitterton", "prickwillow",
            // everyday words
            "whale", "beaver", "cocktail", "passage", "classic", "grassland", "bassist",
            "butterfly", "shipment", "shooting", "language", "counting", "cluster", "glassware",
            // medical and scientific
            "testes", "scrotum", "vaginal", "urethra", "mastectomy", "vasectomy", "nucleus",
            "molecular", "pascal", "vascular", "fascial",
            "cockermouth", "cockbridge"
    );

    private final Set<String> builtIn;
    private final Set<String> external;

    private SafeWords(Set<String> builtIn, Set<String> external) {
        this.builtIn = Collections.unmodifiableSet(builtIn);
        this.external = Collections.unmodifiableSet(external);
    }

    public static SafeWords defaults() {
        return new SafeWords(new LinkedHashSet<>(COMMON_SAFE_WORDS), new LinkedHashSet<>());
    }

    public static SafeWords empty() {
        return new SafeWords(new LinkedHashSet<>(), new LinkedHashSet<>());
    }

    public static SafeWords of(Collection<String> words) {
        Set<String> cleaned = new LinkedHashSet<>();
        for (String word : words) {
            if (word != null && !word.isBlank()) {
                cleaned.add(word.trim().toLowerCase(Locale.ROOT));
            }
        }
        return new SafeWords(cleaned, new LinkedHashSet<>());
    }

    /**
     * Built-in words plus one word per line from {@code path}. A missing or unreadable file leaves
     * only the built-in words.
     */
    public static SafeWords load(Path path) {
        Set<String> loaded = new LinkedHashSet<>();
        if (path == null || !Files.exists(path)) {
            LOGGER.warn("Safe word list {} not found, using built-in safe words only", path);
            return new SafeWords(new LinkedHashSet<>(COMMON_SAFE_WORDS), loaded);
        }
        // SCOWL word lists are Latin-1.
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.ISO_8859_1)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String word = line.trim().toLowerCase(Locale.ROOT);
                if (!word.isEmpty()) {
                    loaded.add(word);
                }
            }
        } catch (IOException e) {
            LOGGER.error("Failed to read safe word list {}: {}", path, e.getMessage());
        }
        LOGGER.info("Loaded {} safe words from {}", loaded.size(), path);
        return new SafeWords(new LinkedHashSet<>(COMMON_SAFE_WORDS), loaded);
    }

    /**
     * The safe words for one banned-term list, run through the preprocessor so they compare equal
     * to preprocessed tokens. Loaded words that are a banned term, or a banned term followed by at
     * most three letters, are left out.
     */
    public Set<String> normalizedFor(Set<String> bannedTerms, TextPreprocessor preprocessor) {
        Set<String> banned = bannedTerms == null ? Set.of() : bannedTerms;
        Set<String> normalized = new LinkedHashSet<>();
        for (String word : builtIn) {
            addNormalized(normalized, word, preprocessor);
        }
        for (String word : external) {
            if (!banned.contains(word) && !isBannedVariant(word, banned)) {
                addNormalized(normalized, word, preprocessor);
            }
        }
        return normalized;
    }

    public Set<String> words() {
        Set<String> all = new LinkedHashSet<>(builtIn);
        all.addAll(external);
        return Collections.unmodifiableSet(all);
    }

    public boolean contains(String word) {
        return builtIn.contains(word) || external.contains(word);
    }

    public int size() {
        return words().size();
    }

    private static void addNormalized(Set<String> target, String word, TextPreprocessor preprocessor) {
        String cleaned = preprocessor.preprocess(word);
        if (!cleaned.isEmpty()) {
            target.add(cleaned);
        }
    }

    private static boolean isBannedVariant(String word, Set<String> bannedTerms) {
        for (String banned : bannedTerms) {
            if (word.startsWith(banned) && word.length() - banned.length() <= MAX_VARIANT_EXTRA_LETTERS) {
                return true;
            }
        }
        return false;
    }
}
