package com.voicetally.tracking;

import com.voicetally.sessions.TrackerStore;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-side view of daily totals. Live time of open sessions is recomputed on
 * every call and never written back.
 */
public class TotalsReader {

    private final TrackerStore store;
    private final IntervalSplitter splitter;

    public TotalsReader(TrackerStore store, IntervalSplitter splitter) {
        this.store = store;
        this.splitter = splitter;
    }

    /**
     * @return user id to seconds, in the store's order (seconds desc, user id asc);
     *         users with only live time are appended
     */
    public Map<String, Long> getTotalsForDay(LocalDate day, boolean includeLive, Instant now) {
        var totals = new LinkedHashMap<String, Long>();
        for (var total : store.listDailyTotals(day)) {
            totals.put(total.userId(), total.seconds());
        }
        if (!includeLive) {
            return totals;
        }

        for (var session : store.listOpenSessions()) {
            for (var slice : splitter.split(session.startedAt(), now)) {
                if (slice.day().equals(day)) {
                    totals.merge(session.userId(), slice.seconds(), Long::sum);
                }
            }
        }
        return totals;
    }
}
