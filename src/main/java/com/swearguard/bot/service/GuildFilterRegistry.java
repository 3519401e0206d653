package com.swearguard.bot.service;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One {@link SwearFilter} per guild, built on first use from the guild's stored settings. A change
 * to the guild's banned words or strict mode replaces the filter, which discards its cache.
 */
public class GuildFilterRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(GuildFilterRegistry.class);

    private final SwearDataStore store;
    private final SafeWords safeWords;
    private final ContextWhitelist whitelist;
    private final FilterOptions baseOptions;
    private final Map<String, SwearFilter> filters = new ConcurrentHashMap<>();

    public GuildFilterRegistry(
            SwearDataStore store,
            SafeWords safeWords,
            ContextWhitelist whitelist,
            FilterOptions baseOptions
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.safeWords = Objects.requireNonNull(safeWords, "safeWords");
        this.whitelist = Objects.requireNonNull(whitelist, "whitelist");
        this.baseOptions = Objects.requireNonNull(baseOptions, "baseOptions");
    }

    public SwearFilter filterFor(String guildId) {
        return filters.computeIfAbsent(guildId, id -> build(id, store.get(id)));
    }

    public GuildSwearData settings(String guildId) {
        return store.get(guildId);
    }

    /** Persists a settings change and rebuilds the guild's filter when matching inputs changed. */
    public synchronized GuildSwearData update(String guildId, UnaryOperator<GuildSwearData> change) {
        GuildSwearData before = store.get(guildId);
        GuildSwearData after = store.update(guildId, change);
        if (!before.swearWords().equals(after.swearWords()) || before.strictMode() != after.strictMode()) {
            filters.put(guildId, build(guildId, after));
        }
        return after;
    }

    public void invalidate(String guildId) {
        filters.remove(guildId);
    }

    private SwearFilter build(String guildId, GuildSwearData data) {
        SwearFilter filter = new SwearFilter(
                data.swearWords(),
                safeWords,
                whitelist,
                baseOptions.withStrictMode(data.strictMode())
        );
        LOGGER.info("Built swear filter for guild {} with {} terms (strict mode {})",
                guildId, filter.bannedTerms().size(), data.strictMode());
        return filter;
    }
}
