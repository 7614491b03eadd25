package com.voicetally.gateway;

import com.voicetally.channels.DiscordAdapter;
import com.voicetally.commands.ReportCooldown;
import com.voicetally.commands.TrackerCommands;
import com.voicetally.observability.MetricsConfig;
import com.voicetally.reporting.Reporter;
import com.voicetally.scheduler.MidnightReportScheduler;
import com.voicetally.sessions.JdbcMetaStore;
import com.voicetally.sessions.JdbcTrackerStore;
import com.voicetally.shared.config.ConfigLoader;
import com.voicetally.tracking.IntervalSplitter;
import com.voicetally.tracking.LocalDays;
import com.voicetally.tracking.PresenceTracker;
import com.voicetally.tracking.SessionEngine;
import com.voicetally.tracking.TotalsReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import javax.sql.DataSource;
import java.time.Clock;

@SpringBootApplication(scanBasePackages = "com.voicetally.gateway")
public class VoiceTallyApp {

    private static final Logger log = LoggerFactory.getLogger(VoiceTallyApp.class);

    public static void main(String[] args) {
        var ctx = SpringApplication.run(VoiceTallyApp.class, args);
        var config = ConfigLoader.load();
        log.info("Loaded {}", config);

        var clock = ctx.getBean(Clock.class);
        var dataSource = ctx.getBean(DataSource.class);
        var metrics = new MetricsConfig();

        // Store
        var trackerStore = new JdbcTrackerStore(dataSource);
        trackerStore.initSchema();
        var metaStore = new JdbcMetaStore(dataSource);
        metaStore.initSchema();

        // Tracking core
        var splitter = new IntervalSplitter(config.timezone());
        var days = new LocalDays(config.timezone());
        var engine = new SessionEngine(trackerStore, splitter);
        var reporter = new Reporter(new TotalsReader(trackerStore, splitter));
        var presence = new PresenceTracker(engine, metrics);

        // Discord + commands
        var discord = new DiscordAdapter(config, clock);
        var cooldown = new ReportCooldown(metaStore, config.reportNowCooldownSeconds());
        var commands = new TrackerCommands(config, days, reporter, cooldown, discord::reportTarget, metrics);
        try {
            discord.start(presence, commands);
        } catch (RuntimeException e) {
            log.error("Startup failed", e);
            ctx.close();
            System.exit(1);
            return;
        }

        // Midnight rollover + report
        var scheduler = new MidnightReportScheduler(engine, reporter, metaStore, days, discord::reportTarget, metrics);
        scheduler.start(clock);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.stop();
            discord.stop();
            ctx.close();
        }, "voicetally-close"));
    }
}
