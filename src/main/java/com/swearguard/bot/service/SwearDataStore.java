package com.swearguard.bot.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-guild moderation settings kept in one JSON file. Every update is written through; read and
 * write failures are logged and the in-memory state keeps serving.
 */
public class SwearDataStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(SwearDataStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path path;
    private final Map<String, GuildSwearData> guilds = new LinkedHashMap<>();

    public SwearDataStore(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    public synchronized void load() {
        guilds.clear();
        if (!Files.exists(path)) {
            return;
        }
        try (BufferedReader reader = Files.newBufferedReader(path)) {
            Map<String, GuildSwearData> stored = MAPPER.readValue(reader,
                    new TypeReference<LinkedHashMap<String, GuildSwearData>>() {});
            if (stored != null) {
                stored.forEach((guildId, data) -> {
                    if (guildId != null && data != null) {
                        guilds.put(guildId, data);
                    }
                });
            }
            LOGGER.info("Loaded swear data for {} guilds from {}", guilds.size(), path);
        } catch (IOException e) {
            LOGGER.error("Failed to read swear data from {}: {}", path, e.getMessage());
        }
    }

    public synchronized GuildSwearData get(String guildId) {
        return guilds.getOrDefault(guildId, GuildSwearData.empty());
    }

    /** Applies {@code change} to the guild's settings, persists and returns the new settings. */
    public synchronized GuildSwearData update(String guildId, UnaryOperator<GuildSwearData> change) {
        Objects.requireNonNull(guildId, "guildId");
        GuildSwearData updated = Objects.requireNonNull(change.apply(get(guildId)), "updated data");
        guilds.put(guildId, updated);
        persist();
        return updated;
    }

    public synchronized Map<String, GuildSwearData> snapshot() {
        return Map.copyOf(guilds);
    }

    private void persist() {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(path,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                MAPPER.writeValue(writer, guilds);
            }
        } catch (IOException e) {
            LOGGER.error("Failed to write swear data to {}: {}", path, e.getMessage());
        }
    }
}
