package com.voicetally.tracking;

import com.voicetally.channels.PresenceSink;
import com.voicetally.observability.MetricsConfig;
import com.voicetally.shared.model.PresenceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;

/**
 * Feeds presence changes from the channel layer into the session engine.
 */
public class PresenceTracker implements PresenceSink {

    private static final Logger log = LoggerFactory.getLogger(PresenceTracker.class);

    private final SessionEngine engine;
    private final MetricsConfig metrics;

    public PresenceTracker(SessionEngine engine, MetricsConfig metrics) {
        this.engine = engine;
        this.metrics = metrics;
    }

    @Override
    public void accept(PresenceEvent event) {
        if (event.joined()) {
            if (engine.startSession(event.userId(), event.at())) {
                metrics.sessionsStarted().increment();
                log.info("Session started: user={}", event.userId());
            }
            return;
        }
        var tracked = engine.endSession(event.userId(), event.at());
        metrics.sessionsEnded().increment();
        metrics.secondsTracked().increment(tracked);
        log.info("Session ended: user={} tracked={}s", event.userId(), tracked);
    }

    @Override
    public void snapshot(Collection<String> presentUserIds, Instant at) {
        engine.reseedSessions(presentUserIds, at);
        log.info("Reseeded open sessions for {} active users", presentUserIds.size());
    }
}
