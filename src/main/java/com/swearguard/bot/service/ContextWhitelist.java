package com.swearguard.bot.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-term regex rules that mark a match as legitimate usage ("assignment" for "ass").
 *
 * <p>Rules are scanned in order against the original message. A scan stops early once it has run
 * longer than the timeout, keeping whatever result it had (normally "not whitelisted").
 */
public final class ContextWhitelist {
    public static final String DEFAULT_RESOURCE = "context-whitelist.json";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1);

    private static final Logger LOGGER = LoggerFactory.getLogger(ContextWhitelist.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final class DefaultRulesHolder {
        private static final Map<String, List<String>> RULES = loadRules(DEFAULT_RESOURCE);
    }

    private final Map<String, List<Pattern>> rules;
    private final long timeoutNanos;
    private final LongSupplier nanoTime;

    public ContextWhitelist(Map<String, List<String>> rules, Duration timeout) {
        this(rules, timeout, System::nanoTime);
    }

    ContextWhitelist(Map<String, List<String>> rules, Duration timeout, LongSupplier nanoTime) {
        this.rules = compile(rules == null ? Map.of() : rules);
        this.timeoutNanos = Objects.requireNonNull(timeout, "timeout").toNanos();
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
    }

    /** Rules from {@link #DEFAULT_RESOURCE}, read once per process. */
    public static ContextWhitelist defaults() {
        return new ContextWhitelist(DefaultRulesHolder.RULES, DEFAULT_TIMEOUT);
    }

    public static ContextWhitelist empty() {
        return new ContextWhitelist(Map.of(), DEFAULT_TIMEOUT);
    }

    /**
     * Loads rules from a classpath JSON object of term to pattern list. A missing or unreadable
     * resource yields a whitelist without rules.
     */
    public static ContextWhitelist fromResource(String resourcePath, Duration timeout) {
        Map<String, List<String>> rules = DEFAULT_RESOURCE.equals(stripLeadingSlash(resourcePath))
                ? DefaultRulesHolder.RULES
                : loadRules(resourcePath);
        return new ContextWhitelist(rules, timeout);
    }

    public boolean isWhitelisted(String message, String term) {
        if (message == null || term == null) {
            return false;
        }
        List<Pattern> patterns = rules.get(term);
        if (patterns == null) {
            return false;
        }
        long start = nanoTime.getAsLong();
        for (Pattern pattern : patterns) {
            if (pattern.matcher(message).find()) {
                return true;
            }
            if (nanoTime.getAsLong() - start > timeoutNanos) {
                LOGGER.debug("Whitelist scan for '{}' abandoned after {} ms", term,
                        Duration.ofNanos(timeoutNanos).toMillis());
                break;
            }
        }
        return false;
    }

    public Set<String> terms() {
        return rules.keySet();
    }

    public int ruleCount(String term) {
        List<Pattern> patterns = rules.get(term);
        return patterns == null ? 0 : patterns.size();
    }

    private static Map<String, List<Pattern>> compile(Map<String, List<String>> source) {
        Map<String, List<Pattern>> compiled = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : source.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank() || entry.getValue() == null) {
                continue;
            }
            String term = entry.getKey().trim().toLowerCase(Locale.ROOT);
            List<Pattern> patterns = new ArrayList<>();
            for (String regex : entry.getValue()) {
                if (regex == null || regex.isBlank()) {
                    continue;
                }
                try {
                    patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
                } catch (PatternSyntaxException ex) {
                    LOGGER.warn("Invalid whitelist pattern for '{}' ignored: {}", term, regex);
                }
            }
            if (!patterns.isEmpty()) {
                compiled.computeIfAbsent(term, ignored -> new ArrayList<>()).addAll(patterns);
            }
        }
        Map<String, List<Pattern>> frozen = new LinkedHashMap<>();
        compiled.forEach((term, patterns) -> frozen.put(term, List.copyOf(patterns)));
        return Collections.unmodifiableMap(frozen);
    }

    private static Map<String, List<String>> loadRules(String resourcePath) {
        if (resourcePath == null || resourcePath.isBlank()) {
            LOGGER.warn("No whitelist resource given, whitelist is empty");
            return Map.of();
        }
        try (InputStream inputStream = ContextWhitelist.class.getClassLoader()
                .getResourceAsStream(stripLeadingSlash(resourcePath))) {
            if (inputStream == null) {
                LOGGER.warn("Whitelist resource not found: {}, whitelist is empty", resourcePath);
                return Map.of();
            }
            Map<String, List<String>> rules = MAPPER.readValue(inputStream,
                    new TypeReference<LinkedHashMap<String, List<String>>>() {});
            return rules == null ? Map.of() : rules;
        } catch (IOException e) {
            LOGGER.warn("Failed to read whitelist resource {}: {}", resourcePath, e.getMessage());
            return Map.of();
        }
    }

    private static String stripLeadingSlash(String resourcePath) {
        if (resourcePath == null) {
            return null;
        }
        return resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
    }
}
