package com.voicetally.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;
import java.util.function.Function;

/**
 * Loads {@code ~/.voicetally/config.yaml}; environment variables win over file values.
 */
public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".voicetally", "config.yaml"
    );

    public static VoiceTallyConfig load() {
        return load(DEFAULT_PATH);
    }

    public static VoiceTallyConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    public static VoiceTallyConfig load(Path path, Function<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var discord = (Map<String, Object>) raw.getOrDefault("discord", Map.of());
        var tracking = (Map<String, Object>) raw.getOrDefault("tracking", Map.of());

        var cooldown = parseLong("REPORT_NOW_COOLDOWN_SECONDS",
            valueOf(env, "REPORT_NOW_COOLDOWN_SECONDS", tracking.get("report-now-cooldown-seconds"),
                String.valueOf(VoiceTallyConfig.DEFAULT_REPORT_NOW_COOLDOWN_SECONDS)));

        return new VoiceTallyConfig(
            required("DISCORD_TOKEN", valueOf(env, "DISCORD_TOKEN", discord.get("bot-token"), null)),
            requiredPositive("GUILD_ID", valueOf(env, "GUILD_ID", discord.get("guild-id"), null)),
            requiredPositive("TRACKED_VOICE_CHANNEL_ID",
                valueOf(env, "TRACKED_VOICE_CHANNEL_ID", discord.get("tracked-voice-channel-id"), null)),
            requiredPositive("REPORT_CHANNEL_ID",
                valueOf(env, "REPORT_CHANNEL_ID", discord.get("report-channel-id"), null)),
            zone("TIMEZONE", valueOf(env, "TIMEZONE", tracking.get("timezone"), null)),
            positive("REPORT_NOW_COOLDOWN_SECONDS", cooldown)
        );
    }

    private static String valueOf(Function<String, String> env, String name, Object fileValue, String fallback) {
        var val = env.apply(name);
        if (val != null && !val.isBlank()) return val.trim();
        if (fileValue != null) return String.valueOf(fileValue).trim();
        return fallback;
    }

    private static String required(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required setting: " + name);
        }
        return value;
    }

    private static long requiredPositive(String name, String value) {
        return positive(name, parseLong(name, required(name, value)));
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + name + " must be an integer", e);
        }
    }

    private static long positive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Setting " + name + " must be positive");
        }
        return value;
    }

    private static ZoneId zone(String name, String value) {
        var id = required(name, value);
        try {
            return ZoneId.of(id);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid timezone in " + name + ": " + id, e);
        }
    }
}
