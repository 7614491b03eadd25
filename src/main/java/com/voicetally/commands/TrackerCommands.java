package com.voicetally.commands;

import com.voicetally.observability.MetricsConfig;
import com.voicetally.reporting.ReportTarget;
import com.voicetally.reporting.Reporter;
import com.voicetally.shared.config.VoiceTallyConfig;
import com.voicetally.tracking.LocalDays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Text side of the /status, /today and /report-now slash commands. Each method
 * returns the ephemeral reply.
 */
public class TrackerCommands {

    private static final Logger log = LoggerFactory.getLogger(TrackerCommands.class);

    public static final String STATUS = "status";
    public static final String TODAY = "today";
    public static final String REPORT_NOW = "report-now";

    private final VoiceTallyConfig config;
    private final LocalDays days;
    private final Reporter reporter;
    private final ReportCooldown cooldown;
    private final Supplier<Optional<ReportTarget>> target;
    private final MetricsConfig metrics;

    public TrackerCommands(VoiceTallyConfig config, LocalDays days, Reporter reporter, ReportCooldown cooldown,
                           Supplier<Optional<ReportTarget>> target, MetricsConfig metrics) {
        this.config = config;
        this.days = days;
        this.reporter = reporter;
        this.cooldown = cooldown;
        this.target = target;
        this.metrics = metrics;
    }

    public String handle(String name, Instant now) {
        return switch (name) {
            case STATUS -> status(now);
            case TODAY -> today(now);
            case REPORT_NOW -> reportNow(now);
            default -> "Unknown command: /" + name;
        };
    }

    public String status(Instant now) {
        var zone = days.zone();
        return String.join("\n",
                "Voice tracker status: online",
                "Guild ID: `" + config.guildId() + "`",
                "Tracked voice channel ID: `" + config.trackedVoiceChannelId() + "`",
                "Report channel ID: `" + config.reportChannelId() + "`",
                "Timezone: `" + zone.getId() + "`",
                "Current local time: `" + now.atZone(zone).toOffsetDateTime() + "`",
                "Next scheduled midnight check: `" + days.nextMidnightAfter(now).atZone(zone).toOffsetDateTime() + "`",
                "/report-now cooldown remaining: `" + Reporter.formatSeconds(cooldown.remainingSeconds(now)) + "`");
    }

    public String today(Instant now) {
        var resolved = target.get();
        if (resolved.isEmpty()) {
            return "Tracker is not ready yet.";
        }
        var day = days.localDay(now);
        var rows = reporter.buildRows(day, true, now, resolved.get().members());
        if (rows.isEmpty()) {
            return "No tracked activity for " + day + ".";
        }
        var sb = new StringBuilder("Today's totals (").append(day).append("):");
        for (var row : rows) {
            sb.append("\n- ").append(row.displayName()).append(": `")
                    .append(Reporter.formatSeconds(row.seconds())).append('`');
        }
        return sb.toString();
    }

    public String reportNow(Instant now) {
        long remaining = cooldown.remainingSeconds(now);
        if (remaining > 0) {
            return "Global cooldown active. Try again in `" + Reporter.formatSeconds(remaining) + "`.";
        }
        var resolved = target.get();
        if (resolved.isEmpty()) {
            return "Report channel is not available.";
        }

        var day = days.localDay(now);
        try {
            reporter.postReport(resolved.get(), day, true, now);
        } catch (RuntimeException e) {
            log.error("/report-now failed", e);
            return "Failed to send report: `" + e.getMessage() + "`";
        }
        cooldown.recordManualReport(now);
        metrics.reportsPosted().increment();
        return "Posted day-so-far report for `" + day + "` in <#" + config.reportChannelId() + ">.";
    }
}
