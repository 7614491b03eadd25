package com.voicetally.reporting;

import com.voicetally.shared.model.ReportRow;
import com.voicetally.tracking.TotalsReader;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

public class Reporter {

    private static final int DISCORD_MESSAGE_LIMIT = 2000;

    private final TotalsReader totals;

    public Reporter(TotalsReader totals) {
        this.totals = totals;
    }

    public static String formatSeconds(long totalSeconds) {
        long safe = Math.max(0, totalSeconds);
        return String.format("%02d:%02d:%02d", safe / 3600, (safe % 3600) / 60, safe % 60);
    }

    public List<ReportRow> buildRows(LocalDate day, boolean includeLive, Instant now, MemberDirectory members) {
        var rows = new ArrayList<ReportRow>();
        totals.getTotalsForDay(day, includeLive, now).forEach((userId, seconds) -> {
            if (seconds <= 0) return;
            // members who left the guild keep their raw id
            var name = members.displayName(userId).orElse("User " + userId);
            rows.add(new ReportRow(userId, name, seconds));
        });
        rows.sort(Comparator.comparingLong(ReportRow::seconds).reversed()
                .thenComparing(row -> row.displayName().toLowerCase(Locale.ROOT)));
        return rows;
    }

    public String buildReportContent(LocalDate day, String trackedChannelName, List<ReportRow> rows) {
        var sb = new StringBuilder();
        sb.append("**Daily Voice Activity - ").append(day).append("**\n");
        sb.append("Tracked channel: #").append(trackedChannelName).append('\n');
        if (rows.isEmpty()) {
            sb.append("No tracked activity for ").append(day).append('.');
            return sb.toString();
        }
        for (int i = 0; i < rows.size(); i++) {
            var row = rows.get(i);
            if (i > 0) sb.append('\n');
            sb.append("- ").append(row.displayName()).append(": `").append(formatSeconds(row.seconds())).append('`');
        }
        return sb.toString();
    }

    public void postReport(ReportTarget target, LocalDate day, boolean includeLive, Instant now) {
        var rows = buildRows(day, includeLive, now, target.members());
        var content = buildReportContent(day, target.trackedChannelName(), rows);
        for (var chunk : chunks(content)) {
            target.channel().send(chunk);
        }
    }

    static List<String> chunks(String content) {
        if (content.length() <= DISCORD_MESSAGE_LIMIT) return List.of(content);
        var parts = new ArrayList<String>();
        var current = new StringBuilder();
        for (var line : content.split("\n")) {
            if (current.length() > 0 && current.length() + 1 + line.length() > DISCORD_MESSAGE_LIMIT) {
                parts.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) current.append('\n');
            current.append(line);
        }
        if (current.length() > 0) parts.add(current.toString());
        return parts;
    }
}
