package com.swearguard.bot;

import com.swearguard.bot.config.BotConfig;
import com.swearguard.bot.listener.MessageModerationListener;
import com.swearguard.bot.listener.SlashCommandListener;
import com.swearguard.bot.service.ContextWhitelist;
import com.swearguard.bot.service.GuildFilterRegistry;
import com.swearguard.bot.service.SafeWords;
import com.swearguard.bot.service.SwearDataStore;
import com.swearguard.bot.util.GlyphTables;
import java.util.List;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.utils.MemberCachePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class BotLauncher {
    private static final Logger LOGGER = LoggerFactory.getLogger(BotLauncher.class);

    public static void main(String[] args) throws InterruptedException {
        BotConfig config;
        try {
            config = BotConfig.fromEnvironment();
        } catch (IllegalStateException error) {
            LOGGER.error("Bot configuration error: {}", error.getMessage());
            LOGGER.error("Set DISCORD_TOKEN before launching the bot.");
            return;
        }
        GlyphTables glyphTables = GlyphTables.defaults();
        SwearDataStore store = new SwearDataStore(config.swearDataPath());
        store.load();
        SafeWords safeWords = config.safeWordsPath() == null
                ? SafeWords.defaults()
                : SafeWords.load(config.safeWordsPath());
        ContextWhitelist whitelist = ContextWhitelist.fromResource(
                ContextWhitelist.DEFAULT_RESOURCE,
                config.whitelistTimeout()
        );
        GuildFilterRegistry registry = new GuildFilterRegistry(store, safeWords, whitelist, config.filterOptions());

        JDA jda = JDABuilder.createDefault(config.discordToken())
                .enableIntents(List.of(
                        GatewayIntent.GUILD_MESSAGES,
                        GatewayIntent.MESSAGE_CONTENT,
                        GatewayIntent.GUILD_MEMBERS
                ))
                .setMemberCachePolicy(MemberCachePolicy.ONLINE)
                .addEventListeners(
                        new MessageModerationListener(registry),
                        new SlashCommandListener(config, registry, glyphTables)
                )
                .build();

        jda.awaitReady();
        LOGGER.info("SwearGuard ready in {} guilds", jda.getGuilds().size());
    }
}
