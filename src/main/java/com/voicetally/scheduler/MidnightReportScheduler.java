package com.voicetally.scheduler;

import com.voicetally.observability.MetricsConfig;
import com.voicetally.reporting.ReportTarget;
import com.voicetally.reporting.Reporter;
import com.voicetally.sessions.MetaStore;
import com.voicetally.tracking.LocalDays;
import com.voicetally.tracking.SessionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Rolls open sessions over at local midnight and posts the finished day's report,
 * at most once per day.
 */
public class MidnightReportScheduler {

    private static final Logger log = LoggerFactory.getLogger(MidnightReportScheduler.class);

    static final String AUTO_REPORT_META_KEY = "last_auto_report_day";
    private static final long CHECK_WINDOW_SECONDS = 60;
    private static final long TICK_SECONDS = 30;

    private final SessionEngine engine;
    private final Reporter reporter;
    private final MetaStore meta;
    private final LocalDays days;
    private final Supplier<Optional<ReportTarget>> target;
    private final MetricsConfig metrics;
    private ScheduledExecutorService executor;

    public MidnightReportScheduler(SessionEngine engine, Reporter reporter, MetaStore meta, LocalDays days,
                                   Supplier<Optional<ReportTarget>> target, MetricsConfig metrics) {
        this.engine = engine;
        this.reporter = reporter;
        this.meta = meta;
        this.days = days;
        this.target = target;
        this.metrics = metrics;
    }

    public void start(Clock clock) {
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "midnight-report");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleAtFixedRate(() -> {
            try {
                tick(clock.instant());
            } catch (Exception e) {
                log.error("Midnight report check failed", e);
            }
        }, TICK_SECONDS, TICK_SECONDS, TimeUnit.SECONDS);
        log.info("Midnight report scheduler started ({}s interval)", TICK_SECONDS);
    }

    public void stop() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /**
     * @return true if a report was posted by this tick
     */
    public boolean tick(Instant now) {
        var resolved = target.get();
        if (resolved.isEmpty()) return false;

        var today = days.localDay(now);
        var midnight = days.midnightOf(today);
        if (now.isBefore(midnight) || !now.isBefore(midnight.plusSeconds(CHECK_WINDOW_SECONDS))) {
            return false;
        }

        var targetDay = today.minusDays(1);
        if (meta.get(AUTO_REPORT_META_KEY).filter(targetDay.toString()::equals).isPresent()) {
            return false;
        }

        // close yesterday's slice for users still connected at midnight
        engine.rolloverOpenSessions(midnight);

        log.info("Posting midnight report for {}", targetDay);
        try {
            reporter.postReport(resolved.get(), targetDay, false, midnight);
        } catch (RuntimeException e) {
            log.error("Failed to post midnight report for {}", targetDay, e);
            return false;
        }
        meta.set(AUTO_REPORT_META_KEY, targetDay.toString());
        metrics.reportsPosted().increment();
        return true;
    }
}
