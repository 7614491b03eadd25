package com.voicetally.scheduler;

import com.voicetally.observability.MetricsConfig;
import com.voicetally.reporting.ReportTarget;
import com.voicetally.reporting.Reporter;
import com.voicetally.sessions.JdbcMetaStore;
import com.voicetally.sessions.JdbcTrackerStore;
import com.voicetally.sessions.SqliteTestSupport;
import com.voicetally.tracking.IntervalSplitter;
import com.voicetally.tracking.LocalDays;
import com.voicetally.tracking.SessionEngine;
import com.voicetally.tracking.TotalsReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MidnightReportSchedulerTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    // local midnight of 2026-02-02 in New York
    private static final Instant MIDNIGHT = Instant.parse("2026-02-02T05:00:00Z");

    @TempDir
    Path tempDir;

    private JdbcTrackerStore store;
    private JdbcMetaStore meta;
    private SessionEngine engine;
    private Reporter reporter;
    private MetricsConfig metrics;
    private final List<String> sent = new ArrayList<>();
    private boolean channelDown;

    @BeforeEach
    void setUp() {
        store = SqliteTestSupport.trackerStore(tempDir);
        meta = SqliteTestSupport.metaStore(tempDir);
        var splitter = new IntervalSplitter(NEW_YORK);
        engine = new SessionEngine(store, splitter);
        reporter = new Reporter(new TotalsReader(store, splitter));
        metrics = new MetricsConfig();
        engine.startSession("1", MIDNIGHT.minusSeconds(7200));
    }

    private MidnightReportScheduler scheduler(boolean ready) {
        var target = new ReportTarget(
                id -> Optional.ofNullable(Map.of("1", "Alice").get(id)),
                content -> {
                    if (channelDown) throw new IllegalStateException("Report channel not found: 9");
                    sent.add(content);
                },
                "focus-room");
        return new MidnightReportScheduler(engine, reporter, meta, new LocalDays(NEW_YORK),
                () -> ready ? Optional.of(target) : Optional.empty(), metrics);
    }

    @Test
    void postsPreviousDayOnceDuringMidnightMinute() {
        var scheduler = scheduler(true);

        assertFalse(scheduler.tick(MIDNIGHT.minusSeconds(30)));
        assertTrue(scheduler.tick(MIDNIGHT.plusSeconds(10)));
        assertFalse(scheduler.tick(MIDNIGHT.plusSeconds(40)));
        assertFalse(scheduler.tick(MIDNIGHT.plusSeconds(60)));

        assertEquals(1, sent.size());
        assertTrue(sent.get(0).startsWith("**Daily Voice Activity - 2026-02-01**"));
        assertTrue(sent.get(0).contains("- Alice: `02:00:00`"));
        assertEquals(Optional.of("2026-02-01"), meta.get(MidnightReportScheduler.AUTO_REPORT_META_KEY));
        assertEquals(MIDNIGHT, store.getOpenSession("1").orElseThrow().startedAt());
        assertEquals(1.0, metrics.reportsPosted().count());
    }

    @Test
    void failedPostLeavesMarkerUnsetAndRetries() {
        var scheduler = scheduler(true);
        channelDown = true;

        assertFalse(scheduler.tick(MIDNIGHT.plusSeconds(5)));
        assertTrue(meta.get(MidnightReportScheduler.AUTO_REPORT_META_KEY).isEmpty());

        channelDown = false;
        assertTrue(scheduler.tick(MIDNIGHT.plusSeconds(35)));
        // the retried rollover does not credit yesterday twice
        assertEquals(7200, store.listDailyTotals(LocalDate.of(2026, 2, 1)).get(0).seconds());
    }

    @Test
    void notReadyDoesNothing() {
        assertFalse(scheduler(false).tick(MIDNIGHT.plusSeconds(10)));
        assertTrue(store.listDailyTotals(LocalDate.of(2026, 2, 1)).isEmpty());
        assertEquals(MIDNIGHT.minusSeconds(7200), store.getOpenSession("1").orElseThrow().startedAt());
    }
}
