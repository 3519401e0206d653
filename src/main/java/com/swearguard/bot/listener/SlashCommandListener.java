package com.swearguard.bot.listener;

import com.swearguard.bot.config.BotConfig;
import com.swearguard.bot.service.GuildFilterRegistry;
import com.swearguard.bot.service.GuildSwearData;
import com.swearguard.bot.service.Verdict;
import com.swearguard.bot.util.GlyphTables;
import com.swearguard.bot.util.WordLists;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.entities.channel.middleman.GuildChannel;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.events.session.ReadyEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.DefaultMemberPermissions;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.CommandData;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.SlashCommandData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SlashCommandListener extends ListenerAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(SlashCommandListener.class);
    private static final int MAX_LISTED_CHARACTERS = 1800;
    private static final int MAX_LISTED_SUBSTITUTIONS = 10;

    private final BotConfig config;
    private final GuildFilterRegistry registry;
    private final GlyphTables glyphTables;

    public SlashCommandListener(BotConfig config, GuildFilterRegistry registry, GlyphTables glyphTables) {
        this.config = config;
        this.registry = registry;
        this.glyphTables = glyphTables;
    }

    @Override
    public void onReady(ReadyEvent event) {
        JDA jda = event.getJDA();
        List<CommandData> commands = List.of(
                managed(Commands.slash("addswear", "Add words to the swear filter.")
                        .addOption(OptionType.STRING, "words", "Words separated by spaces or commas", true)),
                managed(Commands.slash("removeswear", "Remove words from the swear filter.")
                        .addOption(OptionType.STRING, "words", "Words separated by spaces or commas", true)),
                managed(Commands.slash("listswears", "View all filtered words.")),
                Commands.slash("testswear", "Test if a message would be filtered.")
                        .addOption(OptionType.STRING, "message", "Message to test", true),
                managed(Commands.slash("setallowedswear", "Allow swearing in a channel.")
                        .addOption(OptionType.CHANNEL, "channel", "Channel to allow", true)),
                managed(Commands.slash("unsetallowedswear", "Stop allowing swearing in a channel.")
                        .addOption(OptionType.CHANNEL, "channel", "Channel to restrict", true)),
                managed(Commands.slash("addimmunerole", "Add a role that bypasses the filter.")
                        .addOption(OptionType.ROLE, "role", "Role to make immune", true)),
                managed(Commands.slash("removeimmunerole", "Remove a role's filter immunity.")
                        .addOption(OptionType.ROLE, "role", "Role to remove", true)),
                managed(Commands.slash("setlog", "Set the channel for logging filtered messages.")
                        .addOption(OptionType.CHANNEL, "channel", "Log channel", true)),
                managed(Commands.slash("strictmode", "Also match banned words with common prefixes and suffixes.")
                        .addOption(OptionType.BOOLEAN, "enabled", "Turn strict mode on or off", true))
        );

        if (config.guildId() != null) {
            Guild guild = jda.getGuildById(config.guildId());
            if (guild != null) {
                guild.updateCommands().addCommands(commands).queue();
                return;
            }
            LOGGER.warn("Guild {} not found, registering commands globally", config.guildId());
        }
        jda.updateCommands().addCommands(commands).queue();
    }

    @Override
    public void onSlashCommandInteraction(SlashCommandInteractionEvent event) {
        Guild guild = event.getGuild();
        if (guild == null) {
            event.reply("These commands only work inside a server.").setEphemeral(true).queue();
            return;
        }
        if (!"testswear".equals(event.getName()) && !canManage(event.getMember())) {
            event.reply("You do not have permission to use this command.").setEphemeral(true).queue();
            return;
        }
        switch (event.getName()) {
            case "addswear" -> handleAddSwear(event, guild);
            case "removeswear" -> handleRemoveSwear(event, guild);
            case "listswears" -> handleListSwears(event, guild);
            case "testswear" -> handleTestSwear(event, guild);
            case "setallowedswear" -> handleAllowedChannel(event, guild, true);
            case "unsetallowedswear" -> handleAllowedChannel(event, guild, false);
            case "addimmunerole" -> handleImmuneRole(event, guild, true);
            case "removeimmunerole" -> handleImmuneRole(event, guild, false);
            case "setlog" -> handleSetLog(event, guild);
            case "strictmode" -> handleStrictMode(event, guild);
            default -> event.reply("Unknown command.").setEphemeral(true).queue();
        }
    }

    private void handleAddSwear(SlashCommandInteractionEvent event, Guild guild) {
        List<String> words = WordLists.splitWords(Objects.requireNonNull(event.getOption("words")).getAsString());
        List<String> current = registry.settings(guild.getId()).swearWords();
        List<String> added = words.stream().filter(word -> !current.contains(word)).toList();
        if (added.isEmpty()) {
            event.reply("All specified words are already in the filter.").setEphemeral(true).queue();
            return;
        }
        registry.update(guild.getId(), data -> data.withSwearWords(GuildSwearData.union(data.swearWords(), added)));
        LOGGER.info("Guild {} added {} swear words", guild.getId(), added.size());
        event.reply("Added `" + String.join(", ", added) + "` to the swear word list.").setEphemeral(true).queue();
    }

    private void handleRemoveSwear(SlashCommandInteractionEvent event, Guild guild) {
        List<String> words = WordLists.splitWords(Objects.requireNonNull(event.getOption("words")).getAsString());
        List<String> current = registry.settings(guild.getId()).swearWords();
        List<String> removed = words.stream().filter(current::contains).toList();
        if (removed.isEmpty()) {
            event.reply("No matching words found in the filter.").setEphemeral(true).queue();
            return;
        }
        registry.update(guild.getId(), data -> data.withSwearWords(GuildSwearData.without(data.swearWords(), removed)));
        LOGGER.info("Guild {} removed {} swear words", guild.getId(), removed.size());
        event.reply("Removed `" + String.join(", ", removed) + "`.").setEphemeral(true).queue();
    }

    private void handleListSwears(SlashCommandInteractionEvent event, Guild guild) {
        List<String> words = registry.settings(guild.getId()).swearWords();
        if (words.isEmpty()) {
            event.reply("The swear word list is currently empty.").setEphemeral(true).queue();
            return;
        }
        List<String> shown = new ArrayList<>();
        int length = 0;
        for (String word : words) {
            if (length + word.length() + 2 > MAX_LISTED_CHARACTERS) {
                break;
            }
            shown.add(word);
            length += word.length() + 2;
        }
        EmbedBuilder builder = new EmbedBuilder()
                .setTitle("Filtered words")
                .setDescription("||" + String.join(", ", shown) + "||")
                .setFooter(shown.size() + " of " + words.size() + " words shown")
                .setColor(0xFF8906);
        event.replyEmbeds(builder.build()).setEphemeral(true).queue();
    }

    private void handleTestSwear(SlashCommandInteractionEvent event, Guild guild) {
        String message = Objects.requireNonNull(event.getOption("message")).getAsString();
        Verdict verdict = registry.filterFor(guild.getId()).evaluate(message);
        String substitutions = glyphTables.describeSubstitutions(message).stream()
                .limit(MAX_LISTED_SUBSTITUTIONS)
                .map(found -> "`" + found.glyph() + "` (" + found.codePoint() + ") -> `" + found.canonical() + "`")
                .collect(Collectors.joining("\n"));
        EmbedBuilder builder = new EmbedBuilder()
                .setTitle(verdict.blocked()
                        ? "This message contains filtered words and would be deleted."
                        : "This message would be allowed.")
                .addField("Stage", verdict.stage().name(), true)
                .addField("Matched term", verdict.term() == null ? "None" : "||" + verdict.term() + "||", true)
                .addField("Normalized", "`" + registry.filterFor(guild.getId()).preprocess(message) + "` ", false)
                .addField("Substitutions", substitutions.isEmpty() ? "None" : substitutions, false)
                .setColor(verdict.blocked() ? 0xEF4444 : 0x22C55E);
        event.replyEmbeds(builder.build()).setEphemeral(true).queue();
    }

    private void handleAllowedChannel(SlashCommandInteractionEvent event, Guild guild, boolean allow) {
        GuildChannel channel = Objects.requireNonNull(event.getOption("channel")).getAsChannel();
        boolean present = registry.settings(guild.getId()).isAllowedChannel(channel.getId());
        if (allow == present) {
            event.reply(allow
                            ? "Swearing is already allowed in " + channel.getAsMention() + "."
                            : "Swearing is not allowed in " + channel.getAsMention() + ".")
                    .setEphemeral(true)
                    .queue();
            return;
        }
        registry.update(guild.getId(), data -> data.withAllowedChannels(allow
                ? GuildSwearData.union(data.allowedChannels(), List.of(channel.getId()))
                : GuildSwearData.without(data.allowedChannels(), List.of(channel.getId()))));
        event.reply(allow
                        ? "Swearing is now allowed in " + channel.getAsMention() + "."
                        : "Swearing is no longer allowed in " + channel.getAsMention() + ".")
                .setEphemeral(true)
                .queue();
    }

    private void handleImmuneRole(SlashCommandInteractionEvent event, Guild guild, boolean add) {
        Role role = Objects.requireNonNull(event.getOption("role")).getAsRole();
        boolean present = registry.settings(guild.getId()).immuneRoles().contains(role.getId());
        if (add == present) {
            event.reply(add
                            ? role.getName() + " is already in the immune roles list."
                            : role.getName() + " is not in the immune roles list.")
                    .setEphemeral(true)
                    .queue();
            return;
        }
        registry.update(guild.getId(), data -> data.withImmuneRoles(add
                ? GuildSwearData.union(data.immuneRoles(), List.of(role.getId()))
                : GuildSwearData.without(data.immuneRoles(), List.of(role.getId()))));
        event.reply(add
                        ? role.getName() + " has been added to the immune roles list."
                        : role.getName() + " has been removed from the immune roles list.")
                .setEphemeral(true)
                .queue();
    }

    private void handleSetLog(SlashCommandInteractionEvent event, Guild guild) {
        GuildChannel channel = Objects.requireNonNull(event.getOption("channel")).getAsChannel();
        if (!(channel instanceof GuildMessageChannel messageChannel) || !messageChannel.canTalk()) {
            event.reply("I can't send messages in that channel. Please choose another one.")
                    .setEphemeral(true)
                    .queue();
            return;
        }
        registry.update(guild.getId(), data -> data.withLogChannelId(channel.getId()));
        event.reply("Logging channel set to " + channel.getAsMention() + ".").setEphemeral(true).queue();
    }

    private void handleStrictMode(SlashCommandInteractionEvent event, Guild guild) {
        boolean enabled = Objects.requireNonNull(event.getOption("enabled")).getAsBoolean();
        registry.update(guild.getId(), data -> data.withStrictMode(enabled));
        event.reply("Strict mode is now " + (enabled ? "on" : "off") + ".").setEphemeral(true).queue();
    }

    private static SlashCommandData managed(SlashCommandData command) {
        return command.setDefaultPermissions(DefaultMemberPermissions.enabledFor(Permission.MANAGE_SERVER));
    }

    private boolean canManage(Member member) {
        return member != null && member.hasPermission(Permission.MANAGE_SERVER);
    }
}
