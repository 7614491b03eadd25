package com.voicetally.tracking;

import com.voicetally.sessions.TrackerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Owns the open/closed lifecycle of presence sessions and turns closed time into
 * daily-total increments. Mutations are serialized on this instance.
 */
public class SessionEngine {

    private static final Logger log = LoggerFactory.getLogger(SessionEngine.class);

    private final TrackerStore store;
    private final IntervalSplitter splitter;

    public SessionEngine(TrackerStore store, IntervalSplitter splitter) {
        this.store = store;
        this.splitter = splitter;
    }

    /**
     * @return false when the user already has an open session (duplicate join)
     */
    public synchronized boolean startSession(String userId, Instant startedAt) {
        if (store.getOpenSession(userId).isPresent()) {
            log.debug("Ignoring duplicate start for user {}", userId);
            return false;
        }
        store.upsertOpenSession(userId, startedAt);
        return true;
    }

    /**
     * @return seconds credited across all touched days, 0 when no session was open
     */
    public synchronized long endSession(String userId, Instant endedAt) {
        var session = store.getOpenSession(userId);
        if (session.isEmpty()) {
            log.debug("Ignoring stop for missing session user={}", userId);
            return 0;
        }
        var slices = splitter.split(session.get().startedAt(), endedAt);
        store.closeSession(userId, slices);
        return sum(slices);
    }

    public synchronized long accumulateInterval(String userId, Instant start, Instant end) {
        long total = 0;
        for (var slice : splitter.split(start, end)) {
            store.addDailySeconds(slice.day(), userId, slice.seconds());
            total += slice.seconds();
        }
        return total;
    }

    /**
     * Credits every session opened before {@code midnight} up to it and restarts the
     * session at {@code midnight}. Repeating the call for the same instant is a no-op.
     */
    public synchronized int rolloverOpenSessions(Instant midnight) {
        int rolled = 0;
        for (var session : store.listOpenSessions()) {
            if (!session.startedAt().isBefore(midnight)) continue;
            var slices = splitter.split(session.startedAt(), midnight);
            store.restartSession(session.userId(), slices, midnight);
            rolled++;
        }
        if (rolled > 0) {
            log.info("Rolled over {} open sessions at {}", rolled, midnight);
        }
        return rolled;
    }

    /**
     * Drops all open sessions and opens exactly one per user id at {@code startedAt}.
     * Time between the last snapshot and now is never credited.
     */
    public synchronized void reseedSessions(Collection<String> userIds, Instant startedAt) {
        store.replaceOpenSessions(userIds, startedAt);
    }

    private static long sum(List<DaySlice> slices) {
        long total = 0;
        for (var slice : slices) {
            total += slice.seconds();
        }
        return total;
    }
}
