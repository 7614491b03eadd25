package com.voicetally.commands;

import com.voicetally.sessions.MetaStore;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Global cooldown for manual reports, persisted as an ISO timestamp in the meta table.
 */
public class ReportCooldown {

    static final String MANUAL_REPORT_META_KEY = "last_manual_report_at_utc";

    private final MetaStore meta;
    private final long cooldownSeconds;

    public ReportCooldown(MetaStore meta, long cooldownSeconds) {
        this.meta = meta;
        this.cooldownSeconds = cooldownSeconds;
    }

    public long remainingSeconds(Instant now) {
        return remainingSeconds(meta.get(MANUAL_REPORT_META_KEY).orElse(null), cooldownSeconds, now);
    }

    public void recordManualReport(Instant now) {
        meta.set(MANUAL_REPORT_META_KEY, now.toString());
    }

    public static long remainingSeconds(String lastRunIso, long cooldownSeconds, Instant now) {
        if (cooldownSeconds <= 0) return 0;
        var lastRun = parseIsoUtc(lastRunIso);
        if (lastRun == null) return 0;
        long elapsed = Duration.between(lastRun, now).getSeconds();
        return Math.max(0, cooldownSeconds - elapsed);
    }

    static Instant parseIsoUtc(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            // markers written without an offset are read as UTC
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        }
    }
}
