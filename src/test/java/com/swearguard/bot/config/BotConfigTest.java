package com.swearguard.bot.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.swearguard.bot.service.FilterOptions;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BotConfigTest {
    @Test
    void readsAllSettings() {
        Map<String, String> env = Map.of(
                "DISCORD_TOKEN", "token",
                "GUILD_ID", " 123 ",
                "SWEAR_DATA_PATH", "/tmp/swears.json",
                "SAFE_WORDS_PATH", "words.txt",
                "FILTER_CACHE_SIZE", "250",
                "FILTER_EXPANSION_CAP", "9000",
                "FILTER_WHITELIST_TIMEOUT_MS", "300"
        );
        BotConfig config = BotConfig.fromLookup(env::get);

        assertEquals("token", config.discordToken());
        assertEquals("123", config.guildId());
        assertEquals(Path.of("/tmp/swears.json"), config.swearDataPath());
        assertEquals(Path.of("words.txt"), config.safeWordsPath());
        assertEquals(Duration.ofMillis(300), config.whitelistTimeout());

        FilterOptions options = config.filterOptions();
        assertEquals(250, options.cacheMaxSize());
        assertEquals(9000, options.expansionCap());
        assertFalse(options.strictMode());
    }

    @Test
    void missingTokenIsRejected() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> BotConfig.fromLookup(key -> null));
        assertEquals("DISCORD_TOKEN must be set in the environment", error.getMessage());
    }

    @Test
    void invalidNumbersFallBackToDefaults() {
        Map<String, String> env = Map.of(
                "DISCORD_TOKEN", "token",
                "FILTER_CACHE_SIZE", "lots",
                "FILTER_EXPANSION_CAP", "-5",
                "FILTER_WHITELIST_TIMEOUT_MS", "0"
        );
        BotConfig config = BotConfig.fromLookup(env::get);

        assertNull(config.guildId());
        assertNull(config.safeWordsPath());
        assertEquals(Path.of("data/swear-data.json"), config.swearDataPath());
        assertEquals(FilterOptions.DEFAULT_CACHE_SIZE, config.cacheSize());
        assertEquals(FilterOptions.DEFAULT_EXPANSION_CAP, config.expansionCap());
        assertEquals(Duration.ofSeconds(1), config.whitelistTimeout());
    }
}
