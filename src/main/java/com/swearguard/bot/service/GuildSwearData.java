package com.swearguard.bot.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/** Moderation settings of one guild as persisted by {@link SwearDataStore}. */
public record GuildSwearData(
        List<String> swearWords,
        List<String> allowedChannels,
        List<String> immuneRoles,
        String logChannelId,
        boolean strictMode
) {
    public GuildSwearData {
        swearWords = swearWords == null ? List.of() : List.copyOf(swearWords);
        allowedChannels = allowedChannels == null ? List.of() : List.copyOf(allowedChannels);
        immuneRoles = immuneRoles == null ? List.of() : List.copyOf(immuneRoles);
    }

    public static GuildSwearData empty() {
        return new GuildSwearData(List.of(), List.of(), List.of(), null, false);
    }

    public GuildSwearData withSwearWords(List<String> words) {
        return new GuildSwearData(words, allowedChannels, immuneRoles, logChannelId, strictMode);
    }

    public GuildSwearData withAllowedChannels(List<String> channels) {
        return new GuildSwearData(swearWords, channels, immuneRoles, logChannelId, strictMode);
    }

    public GuildSwearData withImmuneRoles(List<String> roles) {
        return new GuildSwearData(swearWords, allowedChannels, roles, logChannelId, strictMode);
    }

    public GuildSwearData withLogChannelId(String channelId) {
        return new GuildSwearData(swearWords, allowedChannels, immuneRoles, channelId, strictMode);
    }

    public GuildSwearData withStrictMode(boolean enabled) {
        return new GuildSwearData(swearWords, allowedChannels, immuneRoles, logChannelId, enabled);
    }

    public boolean isAllowedChannel(String channelId) {
        return channelId != null && allowedChannels.contains(channelId);
    }

    public boolean isImmune(Collection<String> roleIds) {
        return roleIds != null && roleIds.stream().anyMatch(immuneRoles::contains);
    }

    /** {@code base} followed by the entries of {@code added} it does not hold yet. */
    public static List<String> union(List<String> base, Collection<String> added) {
        LinkedHashSet<String> merged = new LinkedHashSet<>(base);
        merged.addAll(added);
        return new ArrayList<>(merged);
    }

    public static List<String> without(List<String> base, Collection<String> removed) {
        List<String> remaining = new ArrayList<>(base);
        remaining.removeAll(removed);
        return remaining;
    }
}
