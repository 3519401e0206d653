package com.swearguard.bot.config;

import com.swearguard.bot.service.FilterOptions;
import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

public record BotConfig(
        String discordToken,
        String guildId,
        Path swearDataPath,
        Path safeWordsPath,
        int cacheSize,
        int expansionCap,
        Duration whitelistTimeout
) {
    private static final Pattern ENV_KEY_PATTERN = Pattern.compile("[A-Z0-9_]+");
    private static final String DEFAULT_SWEAR_DATA_PATH = "data/swear-data.json";

    public static BotConfig fromEnvironment() {
        Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();
        return fromLookup(key -> {
            String value = dotenv.get(key);
            if (value == null || value.isBlank()) {
                return System.getenv(key);
            }
            return value;
        });
    }

    static BotConfig fromLookup(UnaryOperator<String> env) {
        String token = getRequiredEnv(env, "DISCORD_TOKEN");
        String safeWords = env.apply("SAFE_WORDS_PATH");

        return new BotConfig(
                token,
                blankToNull(env.apply("GUILD_ID")),
                Path.of(orDefault(env.apply("SWEAR_DATA_PATH"), DEFAULT_SWEAR_DATA_PATH)),
                safeWords == null || safeWords.isBlank() ? null : Path.of(safeWords.trim()),
                parsePositiveInt(env.apply("FILTER_CACHE_SIZE"), FilterOptions.DEFAULT_CACHE_SIZE),
                parsePositiveInt(env.apply("FILTER_EXPANSION_CAP"), FilterOptions.DEFAULT_EXPANSION_CAP),
                Duration.ofMillis(parsePositiveInt(env.apply("FILTER_WHITELIST_TIMEOUT_MS"), 1000))
        );
    }

    public FilterOptions filterOptions() {
        return FilterOptions.defaults()
                .withCacheMaxSize(cacheSize)
                .withExpansionCap(expansionCap);
    }

    private static String getRequiredEnv(UnaryOperator<String> env, String key) {
        String value = env.apply(key);
        if (value == null || value.isBlank()) {
            String safeKey = ENV_KEY_PATTERN.matcher(key).matches()
                    ? key
                    : "required environment variable";
            throw new IllegalStateException(safeKey + " must be set in the environment");
        }
        return value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int parsePositiveInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed >= 1) {
                return parsed;
            }
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
        return defaultValue;
    }
}
