package com.swearguard.bot.listener;

import com.swearguard.bot.service.GuildFilterRegistry;
import com.swearguard.bot.service.GuildSwearData;
import com.swearguard.bot.service.SwearFilter;
import com.swearguard.bot.service.Verdict;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MessageModerationListener extends ListenerAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(MessageModerationListener.class);
    private static final int WARNING_LIFETIME_SECONDS = 10;
    private static final int MAX_FIELD_LENGTH = 1000;

    private final GuildFilterRegistry registry;

    public MessageModerationListener(GuildFilterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onMessageReceived(MessageReceivedEvent event) {
        Message message = event.getMessage();
        if (message.getAuthor().isBot() || event.isWebhookMessage() || !event.isFromGuild()) {
            return;
        }

        Member member = event.getMember();
        if (member == null || member.hasPermission(Permission.MESSAGE_MANAGE)) {
            return;
        }

        Guild guild = event.getGuild();
        GuildSwearData settings = registry.settings(guild.getId());
        List<String> roleIds = member.getRoles().stream().map(Role::getId).toList();
        if (settings.isImmune(roleIds) || settings.isAllowedChannel(event.getChannel().getId())) {
            return;
        }

        SwearFilter filter = registry.filterFor(guild.getId());
        String content = message.getContentRaw();
        Verdict verdict = filter.evaluate(content);
        if (!verdict.blocked()) {
            return;
        }

        LOGGER.info("Filtered message from {} in guild {} channel {} (stage {}, term {})",
                member.getId(), guild.getId(), event.getChannel().getId(), verdict.stage(), verdict.term());
        message.delete().queue(
                null,
                error -> LOGGER.warn("Could not delete message {}: {}", message.getId(), error.getMessage())
        );
        sendWarning(event.getChannel(), guild, member, settings);
        logFilteredMessage(guild, event.getChannel(), member, filter.censor(content), verdict, settings);
    }

    private void sendWarning(MessageChannel origin, Guild guild, Member member, GuildSwearData settings) {
        String allowed = settings.allowedChannels().stream()
                .map(id -> guild.getChannelById(GuildMessageChannel.class, id))
                .filter(channel -> channel != null)
                .map(GuildMessageChannel::getAsMention)
                .collect(Collectors.joining(" "));
        String warning = allowed.isEmpty()
                ? member.getAsMention() + ", your message was filtered. Swearing is not allowed here."
                : member.getAsMention() + ", your message was filtered. Swearing is only allowed in: " + allowed;
        origin.sendMessage(warning)
                .queue(sent -> sent.delete().queueAfter(WARNING_LIFETIME_SECONDS, TimeUnit.SECONDS));
    }

    private void logFilteredMessage(
            Guild guild,
            MessageChannel origin,
            Member member,
            String censored,
            Verdict verdict,
            GuildSwearData settings
    ) {
        if (settings.logChannelId() == null) {
            return;
        }
        GuildMessageChannel logChannel = guild.getChannelById(GuildMessageChannel.class, settings.logChannelId());
        if (logChannel == null) {
            LOGGER.warn("Log channel {} of guild {} no longer exists", settings.logChannelId(), guild.getId());
            return;
        }
        EmbedBuilder builder = new EmbedBuilder()
                .setTitle("Filtered message")
                .addField("User", member.getAsMention() + "\nID: " + member.getId(), true)
                .addField("Channel", origin.getAsMention(), true)
                .addField("Stage", verdict.stage().name(), true)
                .addField("Matched term", safeValue(verdict.term()), true)
                .addField("Message content", "```" + truncate(censored) + "```", false)
                .setTimestamp(Instant.now())
                .setColor(0xEF4444);
        logChannel.sendMessageEmbeds(builder.build()).queue();
    }

    private String truncate(String value) {
        if (value.isEmpty()) {
            return " ";
        }
        return value.length() > MAX_FIELD_LENGTH ? value.substring(0, MAX_FIELD_LENGTH) + "..." : value;
    }

    private String safeValue(String value) {
        return value == null || value.isBlank() ? "None" : value;
    }
}
