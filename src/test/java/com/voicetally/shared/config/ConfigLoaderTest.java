package com.voicetally.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    private static final String FULL = """
        discord:
          bot-token: abc
          guild-id: 111111111111111111
          tracked-voice-channel-id: 222
          report-channel-id: 333
        tracking:
          timezone: Europe/Berlin
          report-now-cooldown-seconds: 600
        """;

    @TempDir
    Path tempDir;

    @Test
    void parsesFullConfig() throws IOException {
        var cfg = writeAndLoad(FULL, Map.of());
        assertEquals("abc", cfg.discordToken());
        assertEquals(111111111111111111L, cfg.guildId());
        assertEquals(222, cfg.trackedVoiceChannelId());
        assertEquals(333, cfg.reportChannelId());
        assertEquals(ZoneId.of("Europe/Berlin"), cfg.timezone());
        assertEquals(600, cfg.reportNowCooldownSeconds());
    }

    @Test
    void cooldownDefaultsWhenAbsent() throws IOException {
        var yaml = FULL.replace("  report-now-cooldown-seconds: 600\n", "");
        assertEquals(3600, writeAndLoad(yaml, Map.of()).reportNowCooldownSeconds());
    }

    @Test
    void environmentWins() throws IOException {
        var cfg = writeAndLoad(FULL, Map.of("TIMEZONE", "America/New_York", "GUILD_ID", " 5 "));
        assertEquals(ZoneId.of("America/New_York"), cfg.timezone());
        assertEquals(5, cfg.guildId());
    }

    @Test
    void environmentOnlyWithoutFile() {
        var env = Map.of(
            "DISCORD_TOKEN", "t",
            "GUILD_ID", "1",
            "TRACKED_VOICE_CHANNEL_ID", "2",
            "REPORT_CHANNEL_ID", "3",
            "TIMEZONE", "UTC");
        var cfg = ConfigLoader.load(tempDir.resolve("missing.yaml"), env::get);
        assertEquals("t", cfg.discordToken());
        assertEquals(3600, cfg.reportNowCooldownSeconds());
    }

    @Test
    void rejectsInvalidValues() {
        var missingToken = assertThrows(IllegalArgumentException.class,
            () -> writeAndLoad(FULL.replace("bot-token: abc", "bot-token: \"\""), Map.of()));
        assertTrue(missingToken.getMessage().contains("DISCORD_TOKEN"));

        var badZone = assertThrows(IllegalArgumentException.class,
            () -> writeAndLoad(FULL, Map.of("TIMEZONE", "Mars/Olympus")));
        assertTrue(badZone.getMessage().contains("Invalid timezone"));

        assertThrows(IllegalArgumentException.class,
            () -> writeAndLoad(FULL, Map.of("REPORT_CHANNEL_ID", "-4")));
        assertThrows(IllegalArgumentException.class,
            () -> writeAndLoad(FULL, Map.of("REPORT_NOW_COOLDOWN_SECONDS", "soon")));
    }

    @Test
    void tokenNotPrinted() throws IOException {
        assertFalse(writeAndLoad(FULL, Map.of()).toString().contains("abc"));
    }

    private VoiceTallyConfig writeAndLoad(String yaml, Map<String, String> env) throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return ConfigLoader.load(file, env::get);
    }
}
