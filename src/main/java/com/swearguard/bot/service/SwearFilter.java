package com.swearguard.bot.service;

import com.swearguard.bot.service.Verdict.Stage;
import com.swearguard.bot.util.GlyphTables;
import com.swearguard.bot.util.ObfuscationPatterns;
import com.swearguard.bot.util.PhoneticFolder;
import com.swearguard.bot.util.TextPreprocessor;
import com.swearguard.bot.util.VariantExpander;
import com.swearguard.bot.util.WordLists;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a message contains one of a community's banned terms, looking through glyph
 * substitutions, invisible separators, repeated letters, spacing and phonetic misspellings.
 *
 * <p>Stages run in a fixed order and the first one that decides wins: raw-token variants, safe-word
 * veto, direct match, root plus short suffix, strict-mode inflection rules, short forms, phonetic
 * key. Every decision is cached by exact message text. One instance serves one banned-term list;
 * build a new instance when the list changes.
 *
 * <p>Instances are safe for concurrent use. The public methods never throw.
 */
public class SwearFilter {
    private static final Logger LOGGER = LoggerFactory.getLogger(SwearFilter.class);
    private static final Pattern RAW_TOKEN = Pattern.compile("\\S+");
    private static final Pattern LEET_CHARACTERS = Pattern.compile("[1378245609@#$+*]");
    private static final int SHORT_FORM_MAX_LENGTH = 3;

    public static final Set<String> SHORT_SWEARS = Set.of(
            "fx", "fk", "sht", "wtf", "ffs", "ngr", "bch", "cnt", "dck", "fck", "sh1", "5ht", "vgn",
            "prn", "f4n", "n1g", "k3k", "fku", "ass", "fuk", "fuc", "fgs", "wth", "dmn", "prk", "twt"
    );

    private final Set<String> bannedTerms;
    private final Set<Integer> termLengths;
    private final Set<String> safeWords;
    private final Map<String, String> phoneticKeys;
    private final Map<String, Pattern> termPatterns;
    private final TextPreprocessor preprocessor;
    private final VariantExpander expander;
    private final PhoneticFolder phoneticFolder;
    private final ContextWhitelist whitelist;
    private final FilterOptions options;
    private final ResultCache cache;

    public SwearFilter(Collection<String> bannedTerms) {
        this(bannedTerms, SafeWords.defaults(), ContextWhitelist.defaults(), FilterOptions.defaults());
    }

    public SwearFilter(
            Collection<String> bannedTerms,
            SafeWords safeWords,
            ContextWhitelist whitelist,
            FilterOptions options
    ) {
        this(bannedTerms, GlyphTables.defaults(), safeWords, whitelist, options);
    }

    public SwearFilter(
            Collection<String> bannedTerms,
            GlyphTables glyphTables,
            SafeWords safeWords,
            ContextWhitelist whitelist,
            FilterOptions options
    ) {
        Objects.requireNonNull(glyphTables, "glyphTables");
        this.options = Objects.requireNonNull(options, "options");
        this.whitelist = Objects.requireNonNull(whitelist, "whitelist");
        this.bannedTerms = Collections.unmodifiableSet(WordLists.normalizeTerms(bannedTerms));
        this.preprocessor = new TextPreprocessor(glyphTables);
        this.expander = new VariantExpander(glyphTables);
        this.phoneticFolder = new PhoneticFolder(glyphTables, options.phoneticKeyLength());
        this.safeWords = Collections.unmodifiableSet(
                Objects.requireNonNull(safeWords, "safeWords").normalizedFor(this.bannedTerms, preprocessor));
        this.cache = new ResultCache(options.cacheMaxSize());

        Set<Integer> lengths = new LinkedHashSet<>();
        Map<String, String> keys = new LinkedHashMap<>();
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (String term : this.bannedTerms) {
            lengths.add(term.codePointCount(0, term.length()));
            String key = phoneticFolder.key(term);
            if (!key.isEmpty()) {
                keys.put(term, key);
            }
            patterns.put(term, ObfuscationPatterns.compileTermPattern(term, glyphTables, options.maxSuffixLength()));
        }
        this.termLengths = Collections.unmodifiableSet(lengths);
        this.phoneticKeys = Collections.unmodifiableMap(keys);
        this.termPatterns = Collections.unmodifiableMap(patterns);
        LOGGER.debug("Built filter with {} banned terms and {} safe words (strict mode {})",
                this.bannedTerms.size(), this.safeWords.size(), options.strictMode());
    }

    public boolean containsBannedTerm(String message) {
        return evaluate(message).blocked();
    }

    /** Like {@link #containsBannedTerm(String)}, naming the stage and term that decided. */
    public Verdict evaluate(String message) {
        String key = message == null ? "" : message;
        Optional<Boolean> cached = cache.get(key);
        if (cached.isPresent()) {
            return new Verdict(cached.get(), Stage.CACHE, null);
        }
        Verdict verdict;
        try {
            verdict = runPipeline(key);
        } catch (RuntimeException e) {
            LOGGER.error("Filter pipeline failed for a message of length {}", key.length(), e);
            return Verdict.allowed(Stage.NONE);
        }
        cache.put(key, verdict.blocked());
        return verdict;
    }

    /** Verdicts for each message; iteration follows input order, duplicates collapse. */
    public Map<String, Boolean> testBatch(List<String> messages) {
        Map<String, Boolean> results = new LinkedHashMap<>();
        if (messages == null) {
            return results;
        }
        for (String message : messages) {
            String key = message == null ? "" : message;
            results.put(key, containsBannedTerm(key));
        }
        return results;
    }

    /** Masks every span matching a banned term's obfuscation pattern with {@code *}. */
    public String censor(String message) {
        if (message == null || message.isEmpty()) {
            return "";
        }
        try {
            return ObfuscationPatterns.mask(message, termPatterns.values());
        } catch (RuntimeException e) {
            LOGGER.error("Censoring failed for a message of length {}", message.length(), e);
            return message;
        }
    }

    public Set<String> bannedTerms() {
        return bannedTerms;
    }

    public FilterOptions options() {
        return options;
    }

    public String preprocess(String message) {
        return preprocessor.preprocess(message);
    }

    public void clearCache() {
        cache.clear();
    }

    ResultCache cache() {
        return cache;
    }

    Map<String, String> phoneticKeys() {
        return phoneticKeys;
    }

    private Verdict runPipeline(String message) {
        if (message.isEmpty() || bannedTerms.isEmpty()) {
            return Verdict.allowed(Stage.EMPTY);
        }

        Optional<String> rawMatch = matchRawTokens(message);
        if (rawMatch.isPresent()) {
            return Verdict.blocked(Stage.RAW_VARIANT, rawMatch.get());
        }

        String normalized = preprocessor.preprocess(message);
        List<String> tokens = preprocessor.tokenize(normalized);

        for (String token : tokens) {
            if (safeWords.contains(token) && !bannedTerms.contains(token)) {
                return Verdict.allowed(Stage.SAFE_WORD);
            }
        }

        for (String token : tokens) {
            if (bannedTerms.contains(token) && !whitelist.isWhitelisted(message, token)) {
                return Verdict.blocked(Stage.DIRECT, token);
            }
        }

        for (String token : tokens) {
            Optional<String> root = matchRootWithSuffix(message, token);
            if (root.isPresent()) {
                return Verdict.blocked(Stage.ROOT_SUFFIX, root.get());
            }
        }

        if (options.strictMode()) {
            for (String token : tokens) {
                Optional<String> inflected = SuffixRules.match(token, bannedTerms)
                        .filter(term -> !whitelist.isWhitelisted(message, term));
                if (inflected.isPresent()) {
                    return Verdict.blocked(Stage.SUFFIX_RULE, inflected.get());
                }
            }
        }

        if (tokens.size() == 1) {
            Optional<String> shortForm = matchShortForm(tokens.get(0));
            if (shortForm.isPresent()) {
                return Verdict.blocked(Stage.SHORT_FORM, shortForm.get());
            }
        }

        String messageKey = phoneticFolder.key(normalized);
        if (!messageKey.isEmpty()) {
            for (Map.Entry<String, String> entry : phoneticKeys.entrySet()) {
                if (messageKey.contains(entry.getValue()) && !whitelist.isWhitelisted(message, entry.getKey())) {
                    return Verdict.blocked(Stage.PHONETIC, entry.getKey());
                }
            }
        }

        return Verdict.allowed(Stage.NONE);
    }

    private Optional<String> matchRawTokens(String message) {
        Matcher matcher = RAW_TOKEN.matcher(message);
        while (matcher.find()) {
            String token = matcher.group();
            int length = token.codePointCount(0, token.length());
            if (!termLengths.contains(length)) {
                continue;
            }
            for (String term : bannedTerms) {
                if (term.codePointCount(0, term.length()) == length
                        && expander.contains(token, term, options.expansionCap())) {
                    return Optional.of(term);
                }
            }
        }
        return Optional.empty();
    }

    // Preprocessed tokens are ASCII, so char and code point lengths agree.
    private Optional<String> matchRootWithSuffix(String message, String token) {
        for (String term : bannedTerms) {
            int termLength = term.length();
            if (termLength < options.minRootLength() || termLength > token.length()) {
                continue;
            }
            for (int start = 0; start + termLength <= token.length(); start++) {
                int suffixLength = token.length() - (start + termLength);
                if (suffixLength > options.maxSuffixLength()) {
                    continue;
                }
                String window = token.substring(start, start + termLength);
                if (expander.contains(window, term, options.expansionCap())
                        && !whitelist.isWhitelisted(message, term)) {
                    return Optional.of(term);
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<String> matchShortForm(String token) {
        String lowered = token.toLowerCase(Locale.ROOT);
        if (lowered.length() <= SHORT_FORM_MAX_LENGTH && SHORT_SWEARS.contains(lowered)) {
            return Optional.of(lowered);
        }
        String stripped = LEET_CHARACTERS.matcher(lowered).replaceAll("");
        if (!stripped.isEmpty() && stripped.length() <= SHORT_FORM_MAX_LENGTH && SHORT_SWEARS.contains(stripped)) {
            return Optional.of(stripped);
        }
        return Optional.empty();
    }
}
