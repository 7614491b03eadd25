package com.voicetally.shared.config;

import java.time.ZoneId;

public record VoiceTallyConfig(
    String discordToken,
    long guildId,
    long trackedVoiceChannelId,
    long reportChannelId,
    ZoneId timezone,
    long reportNowCooldownSeconds
) {
    public static final long DEFAULT_REPORT_NOW_COOLDOWN_SECONDS = 3600;

    @Override
    public String toString() {
        // keep the token out of logs
        return "VoiceTallyConfig[guildId=" + guildId
            + ", trackedVoiceChannelId=" + trackedVoiceChannelId
            + ", reportChannelId=" + reportChannelId
            + ", timezone=" + timezone
            + ", reportNowCooldownSeconds=" + reportNowCooldownSeconds + "]";
    }
}
